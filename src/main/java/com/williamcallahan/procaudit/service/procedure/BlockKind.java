package com.williamcallahan.procaudit.service.procedure;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of block kinds the scanner emits. Every consuming stage switches over all of them.
 */
enum BlockKind {
    COMPOSABLE("composable-tutorial"),
    PROCEDURE("procedure"),
    STEP("step"),
    LIST_ITEM(null),
    HEADING(null),
    CONDITIONAL("selected-content"),
    TAB_GROUP("tabs"),
    TAB("tab"),
    INCLUDE("include"),
    PROSE(null);

    private final String directiveName;

    BlockKind(String directiveName) {
        this.directiveName = directiveName;
    }

    /**
     * Returns the directive name that opens this kind, or null for non-directive kinds.
     */
    String directiveName() {
        return directiveName;
    }

    /**
     * Returns true for kinds that own child blocks.
     */
    boolean isContainer() {
        return switch (this) {
            case COMPOSABLE, PROCEDURE, STEP, LIST_ITEM, CONDITIONAL, TAB_GROUP, TAB -> true;
            case HEADING, INCLUDE, PROSE -> false;
        };
    }

    /**
     * Maps a directive name to its block kind; unknown directives are opaque prose.
     *
     * @param name directive name as written, e.g. {@code selected-content}
     * @return recognized kind, or empty for directives the scanner does not model
     */
    static Optional<BlockKind> forDirective(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String lowered = name.toLowerCase(Locale.ROOT);
        for (BlockKind kind : values()) {
            if (lowered.equals(kind.directiveName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
