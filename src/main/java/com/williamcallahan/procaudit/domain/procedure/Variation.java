package com.williamcallahan.procaudit.domain.procedure;

import java.util.Objects;

/**
 * One labeled alternative rendering of a step's content.
 *
 * @param label selection label such as {@code driver=nodejs}, a bare tab id such as {@code python},
 *              or a combination such as {@code driver=nodejs; async}
 * @param content normalized content rendered for this label
 */
public record Variation(String label, String content) {

    public Variation {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Variation label is required");
        }
        Objects.requireNonNull(content, "Variation content cannot be null");
    }
}
