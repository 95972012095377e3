package com.williamcallahan.procaudit.domain.procedure;

import java.util.List;
import java.util.Objects;

/**
 * One instruction unit of a procedure.
 *
 * @param title trimmed step title
 * @param content normalized body content shared by every variation
 * @param subProcedures ordered lists inside the step
 * @param variations step-scoped variations sorted by label
 * @param nestedSteps steps of a procedure container nested inside this step; never promoted
 * @param line 1-based line where the step starts in its source document
 */
public record Step(
    String title,
    String content,
    List<SubProcedure> subProcedures,
    List<Variation> variations,
    List<Step> nestedSteps,
    int line
) {

    public Step {
        Objects.requireNonNull(title, "Step title cannot be null");
        Objects.requireNonNull(content, "Step content cannot be null");
        subProcedures = subProcedures == null ? List.of() : List.copyOf(subProcedures);
        variations = variations == null ? List.of() : List.copyOf(variations);
        nestedSteps = nestedSteps == null ? List.of() : List.copyOf(nestedSteps);
    }

    /**
     * Returns true when this step owns sub-procedures or a nested procedure.
     */
    public boolean hasSubSteps() {
        return !subProcedures.isEmpty() || !nestedSteps.isEmpty();
    }

    /**
     * Returns the nesting depth of this step, 1 for a step without sub-steps.
     */
    public int depth() {
        int deepest = 0;
        for (SubProcedure subProcedure : subProcedures) {
            deepest = Math.max(deepest, subProcedure.depth());
        }
        for (Step nested : nestedSteps) {
            deepest = Math.max(deepest, nested.depth());
        }
        return 1 + deepest;
    }
}
