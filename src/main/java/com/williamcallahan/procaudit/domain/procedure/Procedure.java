package com.williamcallahan.procaudit.domain.procedure;

import java.util.List;
import java.util.Objects;

/**
 * One realized procedure found in a document tree.
 *
 * <p>The heading is not unique. Two procedures with the same heading and the same hash are
 * content-identical; the same heading with a different hash marks a different realization of
 * the same logical slot.</p>
 *
 * @param heading section title immediately above the procedure, empty when there is none
 * @param format surface syntax the procedure was written in
 * @param steps ordered steps, never empty
 * @param variations procedure-level variation labels, sorted
 * @param tabSet tab set this procedure was realized from, or {@code null}
 * @param tabId tab identifier within {@link #tabSet()}, or {@code null}
 * @param composable composable wrapper around this procedure, or {@code null}
 * @param hash identity hash of steps and variation labels
 * @param line 1-based line where the procedure starts in its source document
 */
public record Procedure(
    String heading,
    ProcedureFormat format,
    List<Step> steps,
    List<String> variations,
    TabSet tabSet,
    String tabId,
    ComposableWrapper composable,
    String hash,
    int line
) {

    public Procedure {
        Objects.requireNonNull(heading, "Heading cannot be null");
        Objects.requireNonNull(format, "Format cannot be null");
        Objects.requireNonNull(hash, "Hash cannot be null");
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("A procedure needs at least one step");
        }
        if ((tabSet == null) != (tabId == null)) {
            throw new IllegalArgumentException("Tab set and tab id must be given together");
        }
        steps = List.copyOf(steps);
        variations = variations == null ? List.of() : List.copyOf(variations);
    }

    /**
     * Returns true when any step owns sub-procedures or a nested procedure.
     */
    public boolean hasSubSteps() {
        return steps.stream().anyMatch(Step::hasSubSteps);
    }

    /**
     * Returns the deepest step nesting, 1 for a flat procedure.
     */
    public int maxNestingDepth() {
        return steps.stream().mapToInt(Step::depth).max().orElse(1);
    }

    /**
     * Returns the first {@code length} characters of the hash for disambiguating names.
     */
    public String shortHash(int length) {
        return hash.substring(0, Math.min(length, hash.length()));
    }
}
