package com.williamcallahan.procaudit.service.procedure;

/**
 * How inclusion references of a document are expanded, chosen from the document's own structure.
 */
enum IncludePolicy {
    /** No composable wrapper: every reference is expanded in place. */
    EXPAND_ALL,
    /** Conditional blocks present: references expand within the block that holds them. */
    CONDITIONAL_SCOPED,
    /** Composable wrapper without conditional blocks: references inside steps are expanded speculatively. */
    SPECULATIVE
}
