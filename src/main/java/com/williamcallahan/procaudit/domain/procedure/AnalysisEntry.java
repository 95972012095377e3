package com.williamcallahan.procaudit.domain.procedure;

import java.util.List;
import java.util.Objects;

/**
 * One logical procedure as the analysis report sees it: every procedure sharing a heading.
 *
 * @param heading shared heading
 * @param appearanceCount how many renderings the logical procedure has
 * @param labels sorted variation or tab labels across all members
 * @param maxNestingDepth deepest step nesting among members
 * @param stepCount step count of the first member
 * @param formats distinct surface syntaxes among members
 * @param hasSubSteps whether any member has sub-steps
 */
public record AnalysisEntry(
    String heading,
    int appearanceCount,
    List<String> labels,
    int maxNestingDepth,
    int stepCount,
    List<ProcedureFormat> formats,
    boolean hasSubSteps
) {

    public AnalysisEntry {
        Objects.requireNonNull(heading, "Heading cannot be null");
        if (appearanceCount < 1) {
            throw new IllegalArgumentException("Appearance count must be positive");
        }
        labels = labels == null ? List.of() : List.copyOf(labels);
        formats = formats == null ? List.of() : List.copyOf(formats);
    }
}
