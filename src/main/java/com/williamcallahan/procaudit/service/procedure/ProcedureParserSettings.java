package com.williamcallahan.procaudit.service.procedure;

import com.williamcallahan.procaudit.support.TextNormalizer;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tuning knobs of the parsing pipeline.
 *
 * @param maxIncludeDepth longest inclusion chain followed, counted in references
 * @param shortHashLength length of the hash fragment exposed for disambiguation
 * @param genericHeadings headings (any case) that never name a procedure
 * @param procedureHeadings headings (any case) that introduce numbered-heading steps
 */
public record ProcedureParserSettings(
    int maxIncludeDepth,
    int shortHashLength,
    Set<String> genericHeadings,
    Set<String> procedureHeadings
) {

    public static final int DEFAULT_MAX_INCLUDE_DEPTH = 10;
    public static final int DEFAULT_SHORT_HASH_LENGTH = 6;

    public ProcedureParserSettings {
        if (maxIncludeDepth < 1) {
            throw new IllegalArgumentException("Include depth limit must be positive");
        }
        if (shortHashLength < 1) {
            throw new IllegalArgumentException("Short hash length must be positive");
        }
        genericHeadings = lowered(genericHeadings);
        procedureHeadings = lowered(procedureHeadings);
    }

    public static ProcedureParserSettings defaults() {
        return new ProcedureParserSettings(DEFAULT_MAX_INCLUDE_DEPTH, DEFAULT_SHORT_HASH_LENGTH,
            Set.of("overview"), Set.of("procedure", "steps"));
    }

    boolean isGenericHeading(String heading) {
        return genericHeadings.contains(TextNormalizer.toLowerAscii(heading.trim()));
    }

    boolean isProcedureHeading(String heading) {
        return procedureHeadings.contains(TextNormalizer.toLowerAscii(heading.trim()));
    }

    private static Set<String> lowered(Set<String> headings) {
        Set<String> normalized = new LinkedHashSet<>();
        if (headings != null) {
            for (String heading : headings) {
                if (heading != null && !heading.isBlank()) {
                    normalized.add(TextNormalizer.toLowerAscii(heading.trim()));
                }
            }
        }
        return Set.copyOf(normalized);
    }
}
