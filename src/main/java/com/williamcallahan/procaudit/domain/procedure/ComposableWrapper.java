package com.williamcallahan.procaudit.domain.procedure;

import java.util.List;

/**
 * Declared axes of a composable wrapper.
 *
 * @param options option (axis) names in declaration order, e.g. {@code interface, language}
 * @param defaults default selections as declared, e.g. {@code driver=nodejs}
 */
public record ComposableWrapper(List<String> options, List<String> defaults) {

    public ComposableWrapper {
        options = options == null ? List.of() : List.copyOf(options);
        defaults = defaults == null ? List.of() : List.copyOf(defaults);
    }
}
