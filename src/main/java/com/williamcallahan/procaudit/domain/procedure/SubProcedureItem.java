package com.williamcallahan.procaudit.domain.procedure;

import java.util.List;
import java.util.Objects;

/**
 * A single entry of a sub-procedure.
 *
 * @param label derived marker label ({@code 1}, {@code 2} or {@code a}, {@code b}); never {@code #}
 * @param text first-line text of the item
 * @param content normalized body below the first line, excluding nested lists
 * @param subProcedures ordered lists nested inside this item
 */
public record SubProcedureItem(String label, String text, String content, List<SubProcedure> subProcedures) {

    public SubProcedureItem {
        Objects.requireNonNull(label, "Item label cannot be null");
        Objects.requireNonNull(text, "Item text cannot be null");
        Objects.requireNonNull(content, "Item content cannot be null");
        subProcedures = subProcedures == null ? List.of() : List.copyOf(subProcedures);
    }
}
