package com.williamcallahan.procaudit.service.procedure;

/**
 * Ordered list marker styles recognized by the marker scanner.
 */
enum ListMarkerKind {
    NUMERIC,
    LETTER,
    CONTINUATION
}
