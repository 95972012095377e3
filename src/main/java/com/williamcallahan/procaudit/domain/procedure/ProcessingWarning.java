package com.williamcallahan.procaudit.domain.procedure;

/**
 * A non-fatal problem found while parsing procedures.
 * Parsing continues; callers decide how to surface these.
 *
 * @param message human-readable description
 * @param type warning type
 * @param line 1-based line in {@code documentPath}, 0 when unknown
 * @param documentPath document the problem was found in
 */
public record ProcessingWarning(
    String message,
    WarningType type,
    int line,
    String documentPath
) {

    public ProcessingWarning {
        if (message == null || message.trim().isEmpty()) {
            throw new IllegalArgumentException("Warning message cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Warning type cannot be null");
        }
        if (line < 0) {
            throw new IllegalArgumentException("Warning line must be non-negative");
        }
        documentPath = documentPath == null ? "" : documentPath;
    }

    /**
     * Returns whether this warning is structural or a resolution failure.
     */
    public Category category() {
        return type.category();
    }

    /**
     * Broad classes of warnings.
     */
    public enum Category {
        /** Malformed markup, recovered locally. */
        STRUCTURAL,
        /** An inclusion reference that could not be expanded. */
        RESOLUTION
    }

    /**
     * Warning types for categorization.
     */
    public enum WarningType {
        /**
         * Container reached end of input without a body.
         */
        UNTERMINATED_CONTAINER(Category.STRUCTURAL),

        /**
         * Container is missing a required attribute such as {@code :tabid:}.
         */
        MISSING_ATTRIBUTE(Category.STRUCTURAL),

        /**
         * Container body dedented below its own indentation.
         */
        INCONSISTENT_INDENTATION(Category.STRUCTURAL),

        /**
         * List markers whose sequence cannot be established.
         */
        UNKNOWN_MARKER_SEQUENCE(Category.STRUCTURAL),

        /**
         * A YAML steps document could not be read.
         */
        MALFORMED_STEPS_FILE(Category.STRUCTURAL),

        /**
         * Inclusion target does not exist.
         */
        INCLUDE_NOT_FOUND(Category.RESOLUTION),

        /**
         * Inclusion chain refers back to a document already being expanded.
         */
        INCLUDE_CYCLE(Category.RESOLUTION),

        /**
         * Inclusion chain is deeper than the configured limit.
         */
        INCLUDE_DEPTH_EXCEEDED(Category.RESOLUTION);

        private final Category category;

        WarningType(Category category) {
            this.category = category;
        }

        public Category category() {
            return category;
        }
    }
}
