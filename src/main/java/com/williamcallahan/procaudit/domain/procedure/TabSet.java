package com.williamcallahan.procaudit.domain.procedure;

import java.util.List;

/**
 * A top-level tab group whose tabs each hold a whole procedure.
 *
 * <p>Procedures produced from the tabs reference this instance and carry their own tab id.
 * The handle identifies the tab set within one parse result.</p>
 *
 * @param handle index of this tab set within its parse result
 * @param tabIds tab identifiers in document order, one per procedure produced
 */
public record TabSet(int handle, List<String> tabIds) {

    public TabSet {
        if (handle < 0) {
            throw new IllegalArgumentException("Tab set handle must be non-negative");
        }
        tabIds = tabIds == null ? List.of() : List.copyOf(tabIds);
    }
}
