package com.williamcallahan.procaudit.domain.procedure;

import java.util.List;
import java.util.Objects;

/**
 * An ordered list inside a step, typed by the marker family of its first item.
 *
 * @param markerType numeric or alphabetic
 * @param items entries in document order
 */
public record SubProcedure(MarkerType markerType, List<SubProcedureItem> items) {

    public SubProcedure {
        Objects.requireNonNull(markerType, "Marker type cannot be null");
        items = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * Returns how many list levels this sub-procedure spans, counting itself.
     */
    public int depth() {
        int deepest = 0;
        for (SubProcedureItem item : items) {
            for (SubProcedure nested : item.subProcedures()) {
                deepest = Math.max(deepest, nested.depth());
            }
        }
        return 1 + deepest;
    }
}
