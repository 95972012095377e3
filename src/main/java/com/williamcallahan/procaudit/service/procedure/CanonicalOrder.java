package com.williamcallahan.procaudit.service.procedure;

import com.williamcallahan.procaudit.domain.procedure.Variation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * The one place label collections are put in canonical order before they reach the hasher or a view.
 */
final class CanonicalOrder {

    private CanonicalOrder() {}

    /**
     * Returns the distinct non-blank labels in lexicographic order.
     */
    static List<String> labels(Collection<String> labels) {
        TreeSet<String> sorted = new TreeSet<>();
        for (String label : labels) {
            if (label != null && !label.isBlank()) {
                sorted.add(label);
            }
        }
        return List.copyOf(sorted);
    }

    /**
     * Returns variations sorted by label, keeping the first variation seen for a repeated label.
     */
    static List<Variation> variations(Collection<Variation> variations) {
        Map<String, Variation> byLabel = new LinkedHashMap<>();
        for (Variation variation : variations) {
            byLabel.putIfAbsent(variation.label(), variation);
        }
        List<Variation> sorted = new ArrayList<>(byLabel.values());
        sorted.sort(Comparator.comparing(Variation::label));
        return List.copyOf(sorted);
    }
}
