package com.williamcallahan.procaudit.service.procedure;

import com.williamcallahan.procaudit.domain.procedure.ComposableWrapper;
import com.williamcallahan.procaudit.domain.procedure.Variation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Labels the variation axes a step or wrapper carries.
 *
 * <p>Conditional blocks are labeled by their selection list. Tabs inside a step are labeled by
 * their tab id; under a composable wrapper they combine with each of the step's selections, and
 * inside a conditional block with that block's selection only. Tab groups nested in a tab's own
 * content are not inspected.</p>
 */
final class VariationDetector {

    static final String OPTIONS_OPTION = "options";
    static final String DEFAULTS_OPTION = "defaults";
    static final String SELECTIONS_OPTION = "selections";
    static final String TAB_ID_OPTION = "tabid";

    private static final String SELECTION_JOINER = ", ";
    private static final String COMBINATION_JOINER = "; ";

    /**
     * Reads the axes a composable wrapper declares.
     */
    ComposableWrapper wrapper(Block composable) {
        return new ComposableWrapper(
            split(composable.option(OPTIONS_OPTION), ","),
            split(composable.option(DEFAULTS_OPTION), "[,;]"));
    }

    /**
     * Builds the label for a conditional block. Tokens already written as {@code axis=value}
     * are kept; bare tokens are paired with the wrapper's options by position when the counts match.
     *
     * @param conditional selected-content block
     * @param wrapper enclosing wrapper, or null
     * @return label such as {@code driver=nodejs, language=python}
     */
    String selectionLabel(Block conditional, ComposableWrapper wrapper) {
        List<String> tokens = split(conditional.option(SELECTIONS_OPTION), ",");
        boolean pairable = wrapper != null && wrapper.options().size() == tokens.size();
        List<String> parts = new ArrayList<>(tokens.size());
        for (int index = 0; index < tokens.size(); index++) {
            String token = tokens.get(index);
            if (token.indexOf('=') < 0 && pairable) {
                parts.add(wrapper.options().get(index) + "=" + token);
            } else {
                parts.add(token);
            }
        }
        return String.join(SELECTION_JOINER, parts);
    }

    String tabId(Block tab) {
        return tab.option(TAB_ID_OPTION);
    }

    /**
     * Detects the step-scoped variations among a step's direct children.
     *
     * @param children direct children of the step
     * @param wrapper enclosing composable wrapper, or null
     * @return variations sorted by label
     */
    List<Variation> stepVariations(List<Block> children, ComposableWrapper wrapper) {
        List<Variation> found = new ArrayList<>();
        List<String> selections = new ArrayList<>();
        for (Block child : children) {
            if (!child.is(BlockKind.CONDITIONAL)) {
                continue;
            }
            String label = selectionLabel(child, wrapper);
            if (label.isEmpty()) {
                continue;
            }
            selections.add(label);
            found.add(new Variation(label, BlockRenderer.normalized(child.children())));
            for (Block nested : child.children()) {
                if (nested.is(BlockKind.TAB_GROUP)) {
                    addTabs(found, nested, List.of(label));
                }
            }
        }
        for (Block child : children) {
            if (child.is(BlockKind.TAB_GROUP)) {
                addTabs(found, child, wrapper == null ? List.of() : selections);
            }
        }
        return CanonicalOrder.variations(found);
    }

    /**
     * Returns the labels that name a complete rendering: a label that only prefixes a combined
     * label (a selection whose tabs were combined with it) is not a rendering of its own.
     */
    static List<String> renderingLabels(Collection<Variation> variations) {
        List<String> labels = new ArrayList<>();
        for (Variation variation : variations) {
            String prefix = variation.label() + COMBINATION_JOINER;
            boolean combined = variations.stream().anyMatch(other -> other.label().startsWith(prefix));
            if (!combined) {
                labels.add(variation.label());
            }
        }
        return CanonicalOrder.labels(labels);
    }

    /**
     * Joins a selection label and a tab id into one combined label such as {@code driver=nodejs; async}.
     */
    static String combine(String selection, String tabId) {
        return selection + COMBINATION_JOINER + tabId;
    }

    private void addTabs(List<Variation> found, Block tabGroup, List<String> selections) {
        for (Block tab : tabGroup.children()) {
            if (!tab.is(BlockKind.TAB)) {
                continue;
            }
            String id = tabId(tab);
            String content = BlockRenderer.normalized(tab.children());
            if (selections.isEmpty()) {
                found.add(new Variation(id, content));
                continue;
            }
            for (String selection : selections) {
                found.add(new Variation(combine(selection, id), content));
            }
        }
    }

    private static List<String> split(String value, String separatorPattern) {
        List<String> tokens = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return tokens;
        }
        for (String token : value.split(separatorPattern)) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                tokens.add(trimmed);
            }
        }
        return tokens;
    }
}
