package com.williamcallahan.procaudit.service.procedure;

import com.williamcallahan.procaudit.domain.procedure.MarkerType;
import com.williamcallahan.procaudit.domain.procedure.ProcessingWarning.WarningType;
import com.williamcallahan.procaudit.domain.procedure.SubProcedure;
import com.williamcallahan.procaudit.domain.procedure.SubProcedureItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns runs of sibling list items into {@link SubProcedure}s.
 *
 * <p>A run is a maximal sequence of consecutive list items. Any other sibling ends it, and so
 * does an explicit marker of the other family (a letter after digits or the reverse). The first
 * item fixes the marker type; {@code #} continuations inherit it and advance the label. A run
 * that opens with {@code #} is numbered from 1 with a warning.</p>
 */
final class SubProcedureTracker {

    /**
     * One list item with its derived label.
     *
     * @param block list item block
     * @param label derived label, never {@code #}
     */
    record LabeledItem(Block block, String label) {}

    /**
     * A run of list items sharing one marker type.
     *
     * @param markerType marker family fixed by the first item
     * @param items items with derived labels
     */
    record ListRun(MarkerType markerType, List<LabeledItem> items) {
        ListRun {
            items = List.copyOf(items);
        }
    }

    /**
     * Builds sub-procedures from the list runs among {@code siblings}, recursing into items.
     *
     * @param siblings blocks sharing one parent
     * @param documentPath document path for warnings
     * @param warnings collector for this parse
     * @return sub-procedures in document order
     */
    List<SubProcedure> track(List<Block> siblings, String documentPath, WarningCollector warnings) {
        List<SubProcedure> subProcedures = new ArrayList<>();
        for (ListRun run : partition(siblings, documentPath, warnings)) {
            List<SubProcedureItem> items = new ArrayList<>(run.items().size());
            for (LabeledItem item : run.items()) {
                Block block = item.block();
                items.add(new SubProcedureItem(
                    item.label(),
                    block.argument(),
                    BlockRenderer.normalized(withoutListItems(block.children())),
                    track(block.children(), documentPath, warnings)));
            }
            subProcedures.add(new SubProcedure(run.markerType(), items));
        }
        return subProcedures;
    }

    /**
     * Splits siblings into maximal list runs and derives every item's label.
     */
    List<ListRun> partition(List<Block> siblings, String documentPath, WarningCollector warnings) {
        List<ListRun> runs = new ArrayList<>();
        List<LabeledItem> current = new ArrayList<>();
        MarkerType currentType = null;
        String lastLabel = null;

        for (Block sibling : siblings) {
            if (!sibling.is(BlockKind.LIST_ITEM)) {
                if (!current.isEmpty()) {
                    runs.add(new ListRun(currentType, current));
                    current = new ArrayList<>();
                }
                continue;
            }
            ListMarkerKind kind = markerKind(sibling);
            String value = markerValue(sibling);
            if (!current.isEmpty() && kind != ListMarkerKind.CONTINUATION && typeOf(kind) != currentType) {
                runs.add(new ListRun(currentType, current));
                current = new ArrayList<>();
            }
            String label;
            if (current.isEmpty()) {
                if (kind == ListMarkerKind.CONTINUATION) {
                    warnings.add(WarningType.UNKNOWN_MARKER_SEQUENCE,
                        "List starts with a continuation marker; numbering from 1", sibling.line(), documentPath);
                    currentType = MarkerType.NUMERIC;
                    label = "1";
                } else {
                    currentType = typeOf(kind);
                    label = value;
                }
            } else if (kind == ListMarkerKind.CONTINUATION) {
                label = next(lastLabel, currentType);
            } else {
                label = value;
            }
            current.add(new LabeledItem(sibling, label));
            lastLabel = label;
        }
        if (!current.isEmpty()) {
            runs.add(new ListRun(currentType, current));
        }
        return runs;
    }

    /**
     * Returns the label after {@code label}: numbers increment, letters advance a, b ... z, aa, ab
     * keeping their case.
     */
    static String next(String label, MarkerType type) {
        if (type == MarkerType.NUMERIC) {
            return Integer.toString(Integer.parseInt(label) + 1);
        }
        boolean upper = Character.isUpperCase(label.charAt(0));
        char[] letters = label.toLowerCase(Locale.ROOT).toCharArray();
        int index = letters.length - 1;
        while (index >= 0) {
            if (letters[index] != 'z') {
                letters[index]++;
                break;
            }
            letters[index] = 'a';
            index--;
        }
        String advanced = index < 0 ? "a" + new String(letters) : new String(letters);
        return upper ? advanced.toUpperCase(Locale.ROOT) : advanced;
    }

    static List<Block> withoutListItems(List<Block> blocks) {
        List<Block> kept = new ArrayList<>(blocks.size());
        for (Block block : blocks) {
            if (!block.is(BlockKind.LIST_ITEM)) {
                kept.add(block);
            }
        }
        return kept;
    }

    private static ListMarkerKind markerKind(Block item) {
        return OrderedMarkerScanner.scan(item.marker())
            .map(OrderedMarkerScanner.MarkerMatch::kind)
            .orElse(ListMarkerKind.CONTINUATION);
    }

    private static String markerValue(Block item) {
        String marker = item.marker();
        return marker.isEmpty() ? marker : marker.substring(0, marker.length() - 1);
    }

    private static MarkerType typeOf(ListMarkerKind kind) {
        return switch (kind) {
            case NUMERIC, CONTINUATION -> MarkerType.NUMERIC;
            case LETTER -> MarkerType.ALPHABETIC;
        };
    }
}
