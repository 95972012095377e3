package com.williamcallahan.procaudit.domain.procedure;

/**
 * Surface syntax a procedure was written in.
 */
public enum ProcedureFormat {
    DIRECTIVE,
    ORDERED_LIST,
    NUMBERED_HEADINGS,
    YAML_STEPS
}
