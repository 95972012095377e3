package com.williamcallahan.procaudit.domain.procedure;

/**
 * Ordered list marker families a sub-procedure can use.
 */
public enum MarkerType {
    /** Digit markers: 1. 2. 3. */
    NUMERIC,
    /** Single-letter markers: a. b. c. */
    ALPHABETIC
}
