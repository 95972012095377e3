package com.williamcallahan.procaudit.service.procedure;

import com.williamcallahan.procaudit.domain.procedure.ComposableWrapper;
import com.williamcallahan.procaudit.domain.procedure.Procedure;
import com.williamcallahan.procaudit.domain.procedure.ProcedureFormat;
import com.williamcallahan.procaudit.domain.procedure.Step;
import com.williamcallahan.procaudit.domain.procedure.TabSet;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks an expanded block tree and assembles {@link Procedure}s.
 *
 * <p>The walk tracks the most recent meaningful heading and recognizes four shapes: procedure
 * containers, runs of top-level list items, numbered headings below a "Procedure" or "Steps"
 * heading, and tab groups whose tabs each hold a procedure. Composable wrappers pass their axes
 * down; conditional blocks directly inside a wrapper produce one procedure per distinct
 * (heading, content) listing every selection it appears under.</p>
 */
final class ProcedureAssembler {

    private static final Pattern NUMBERED_TITLE = Pattern.compile("^(\\d+)\\.\\s*(\\S.*)$");

    private final ProcedureParserSettings settings;
    private final SubProcedureTracker tracker;
    private final VariationDetector detector;
    private final ContentHasher hasher;

    ProcedureAssembler(ProcedureParserSettings settings, SubProcedureTracker tracker,
                       VariationDetector detector, ContentHasher hasher) {
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
        this.tracker = Objects.requireNonNull(tracker, "Tracker cannot be null");
        this.detector = Objects.requireNonNull(detector, "Detector cannot be null");
        this.hasher = Objects.requireNonNull(hasher, "Hasher cannot be null");
    }

    /**
     * Procedures and tab sets assembled from one document tree.
     *
     * @param procedures procedures in document order
     * @param tabSets tab sets, indexed by handle
     */
    record Assembly(List<Procedure> procedures, List<TabSet> tabSets) {
        Assembly {
            procedures = List.copyOf(procedures);
            tabSets = List.copyOf(tabSets);
        }
    }

    /**
     * Assembles every procedure in the tree.
     *
     * @param documentPath root document path, used for warnings
     * @param blocks expanded blocks
     * @param warnings collector for this parse
     * @return assembled procedures and the tab sets they reference
     */
    Assembly assemble(String documentPath, List<Block> blocks, WarningCollector warnings) {
        AssemblyState state = new AssemblyState(documentPath, warnings);
        List<Procedure> procedures = new ArrayList<>();
        walk(blocks, new Scope("", null, List.of()), state, procedures);
        return withReferencedTabSets(procedures);
    }

    /**
     * Keeps only the tab sets some procedure points to and renumbers their handles in order of
     * first reference. A tab group repeated under several selections is assembled once per
     * selection, and merging keeps the first copy only.
     */
    private static Assembly withReferencedTabSets(List<Procedure> procedures) {
        Map<TabSet, TabSet> renumbered = new IdentityHashMap<>();
        List<TabSet> tabSets = new ArrayList<>();
        List<Procedure> rebuilt = new ArrayList<>(procedures.size());
        for (Procedure procedure : procedures) {
            if (procedure.tabSet() == null) {
                rebuilt.add(procedure);
                continue;
            }
            TabSet tabSet = renumbered.computeIfAbsent(procedure.tabSet(), original -> {
                TabSet compacted = new TabSet(tabSets.size(), original.tabIds());
                tabSets.add(compacted);
                return compacted;
            });
            rebuilt.add(new Procedure(procedure.heading(), procedure.format(), procedure.steps(),
                procedure.variations(), tabSet, procedure.tabId(), procedure.composable(), procedure.hash(),
                procedure.line()));
        }
        return new Assembly(rebuilt, tabSets);
    }

    static boolean isNumberedTitle(String title) {
        return NUMBERED_TITLE.matcher(title.trim()).matches();
    }

    static String stripNumber(String title) {
        Matcher matcher = NUMBERED_TITLE.matcher(title.trim());
        return matcher.matches() ? matcher.group(2).trim() : title.trim();
    }

    private void walk(List<Block> blocks, Scope scope, AssemblyState state, List<Procedure> out) {
        Scope current = scope;
        int index = 0;
        while (index < blocks.size()) {
            Block block = blocks.get(index);
            switch (block.kind()) {
                case HEADING -> {
                    if (settings.isProcedureHeading(block.argument())) {
                        int consumed = numberedHeadings(blocks, index, current, state, out);
                        if (consumed > index) {
                            index = consumed;
                            continue;
                        }
                    } else if (!settings.isGenericHeading(block.argument()) && !block.argument().isBlank()) {
                        current = current.withHeading(block.argument().trim());
                    }
                }
                case COMPOSABLE -> composable(block, current, state, out);
                case TAB_GROUP -> tabSet(block, current, state, out);
                case PROCEDURE -> directiveProcedure(block, current, state).ifPresent(out::add);
                case LIST_ITEM -> {
                    int end = index;
                    while (end < blocks.size() && blocks.get(end).is(BlockKind.LIST_ITEM)) {
                        end++;
                    }
                    orderedLists(blocks.subList(index, end), current, state, out);
                    index = end;
                    continue;
                }
                case CONDITIONAL -> {
                    String label = detector.selectionLabel(block, current.wrapper());
                    walk(block.children(), current.withLabel(label), state, out);
                }
                case TAB, STEP -> walk(block.children(), current, state, out);
                case INCLUDE, PROSE -> {
                    // Prose between procedures carries nothing to assemble
                }
            }
            index++;
        }
    }

    /**
     * Assembles numbered headings following a procedure heading. Each numbered heading not above the
     * procedure heading's level is a step that runs until the next heading at its own level or above; the
     * procedure ends at any other heading at that level.
     *
     * @return index of the first block after the procedure, or {@code headingIndex} when the
     *         heading is not followed by numbered headings
     */
    private int numberedHeadings(List<Block> blocks, int headingIndex, Scope scope, AssemblyState state,
                                 List<Procedure> out) {
        Block procedureHeading = blocks.get(headingIndex);
        List<Step> steps = new ArrayList<>();
        int cursor = headingIndex + 1;
        while (cursor < blocks.size()) {
            Block block = blocks.get(cursor);
            if (!block.is(BlockKind.HEADING)
                || block.level() < procedureHeading.level()
                || !isNumberedTitle(block.argument())) {
                break;
            }
            int end = cursor + 1;
            while (end < blocks.size()
                && !(blocks.get(end).is(BlockKind.HEADING) && blocks.get(end).level() <= block.level())) {
                end++;
            }
            steps.add(buildStep(stripNumber(block.argument()), block.line(), blocks.subList(cursor + 1, end),
                scope, state));
            cursor = end;
        }
        if (steps.isEmpty()) {
            return headingIndex;
        }
        String heading = scope.heading().isEmpty() ? procedureHeading.argument().trim() : scope.heading();
        out.add(procedure(heading, ProcedureFormat.NUMBERED_HEADINGS, steps, scope.labels(), scope.wrapper(),
            procedureHeading.line()));
        return cursor;
    }

    private void composable(Block composable, Scope scope, AssemblyState state, List<Procedure> out) {
        ComposableWrapper wrapper = detector.wrapper(composable);
        Scope inner = scope.withWrapper(wrapper);
        boolean wrapperLevelSelections = composable.children().stream().anyMatch(child -> child.is(BlockKind.CONDITIONAL));
        if (!wrapperLevelSelections) {
            walk(composable.children(), inner, state, out);
            return;
        }

        Map<String, SelectionGroup> groups = new LinkedHashMap<>();
        List<Block> shared = new ArrayList<>();
        for (Block child : composable.children()) {
            if (!child.is(BlockKind.CONDITIONAL)) {
                shared.add(child);
                continue;
            }
            walkShared(shared, inner, state, groups);
            String selection = detector.selectionLabel(child, wrapper);
            List<Procedure> found = new ArrayList<>();
            walk(child.children(), inner, state, found);
            for (Procedure procedure : found) {
                String key = procedure.heading() + "::" + procedure.hash();
                groups.computeIfAbsent(key, unused -> new SelectionGroup(procedure, true)).selections.add(selection);
            }
        }
        walkShared(shared, inner, state, groups);

        for (SelectionGroup group : groups.values()) {
            Procedure first = group.first;
            if (!group.merged) {
                out.add(first);
            } else if (first.tabSet() != null) {
                out.add(tabProcedureUnderSelections(first, group.selections, wrapper));
            } else {
                out.add(procedure(first.heading(), first.format(), first.steps(), group.selections, wrapper, first.line()));
            }
        }
    }

    /**
     * Assembles blocks sitting between conditional blocks of a wrapper. Headings among them still
     * name the procedures that follow, so their procedures keep their own slot in the output.
     */
    private void walkShared(List<Block> shared, Scope scope, AssemblyState state, Map<String, SelectionGroup> groups) {
        if (shared.isEmpty()) {
            return;
        }
        List<Procedure> found = new ArrayList<>();
        walk(shared, scope, state, found);
        for (Procedure procedure : found) {
            groups.put("shared::" + groups.size(), new SelectionGroup(procedure, false));
        }
        shared.clear();
    }

    /**
     * Relabels a tab-set member found under wrapper-level selections: each selection is combined
     * with the member's tab id, and the tab set reference is kept.
     */
    private Procedure tabProcedureUnderSelections(Procedure member, List<String> selections, ComposableWrapper wrapper) {
        List<String> labels = new ArrayList<>(selections.size());
        for (String selection : selections) {
            labels.add(VariationDetector.combine(selection, member.tabId()));
        }
        List<String> sorted = CanonicalOrder.labels(labels);
        return new Procedure(member.heading(), member.format(), member.steps(), sorted, member.tabSet(),
            member.tabId(), wrapper, hasher.procedureHash(member.steps(), sorted), member.line());
    }

    private void tabSet(Block tabGroup, Scope scope, AssemblyState state, List<Procedure> out) {
        List<String> tabIds = new ArrayList<>();
        List<Procedure> firsts = new ArrayList<>();
        for (Block tab : tabGroup.children()) {
            if (!tab.is(BlockKind.TAB)) {
                continue;
            }
            List<Block> content = new ArrayList<>();
            for (Block child : tab.children()) {
                if (!child.is(BlockKind.TAB_GROUP)) {
                    content.add(child);
                }
            }
            List<Procedure> found = new ArrayList<>();
            walk(content, scope, state, found);
            if (!found.isEmpty()) {
                tabIds.add(detector.tabId(tab));
                firsts.add(found.get(0));
            }
        }
        if (firsts.isEmpty()) {
            return;
        }
        TabSet tabSet = new TabSet(state.tabSets.size(), tabIds);
        state.tabSets.add(tabSet);
        for (int index = 0; index < firsts.size(); index++) {
            Procedure found = firsts.get(index);
            String tabId = tabIds.get(index);
            List<String> labels = List.of(tabId);
            out.add(new Procedure(scope.heading(), found.format(), found.steps(), labels, tabSet, tabId,
                found.composable(), hasher.procedureHash(found.steps(), labels), found.line()));
        }
    }

    private Optional<Procedure> directiveProcedure(Block container, Scope scope, AssemblyState state) {
        List<String> labels = new ArrayList<>(scope.labels());
        List<Step> steps = directiveSteps(container.children(), scope, state, labels);
        if (steps.isEmpty()) {
            return Optional.empty();
        }
        ProcedureFormat format = StepsYamlConverter.YAML_MARKER.equals(container.marker())
            ? ProcedureFormat.YAML_STEPS
            : ProcedureFormat.DIRECTIVE;
        return Optional.of(procedure(scope.heading(), format, steps, labels, scope.wrapper(), container.line()));
    }

    /**
     * Collects the steps of a procedure container. Conditional blocks holding steps are transparent
     * and contribute their selection to {@code labels}.
     */
    private List<Step> directiveSteps(List<Block> children, Scope scope, AssemblyState state, List<String> labels) {
        List<Step> steps = new ArrayList<>();
        for (Block child : children) {
            if (child.is(BlockKind.STEP)) {
                steps.add(buildStep(child.argument(), child.line(), child.children(), scope, state));
            } else if (child.is(BlockKind.CONDITIONAL)) {
                List<Step> conditionalSteps = directiveSteps(child.children(), scope, state, labels);
                if (!conditionalSteps.isEmpty()) {
                    labels.add(detector.selectionLabel(child, scope.wrapper()));
                    steps.addAll(conditionalSteps);
                }
            }
        }
        return steps;
    }

    private void orderedLists(List<Block> items, Scope scope, AssemblyState state, List<Procedure> out) {
        for (SubProcedureTracker.ListRun run : tracker.partition(items, state.documentPath, state.warnings)) {
            List<Step> steps = new ArrayList<>(run.items().size());
            for (SubProcedureTracker.LabeledItem item : run.items()) {
                Block block = item.block();
                steps.add(buildStep(block.argument(), block.line(), block.children(), scope, state));
            }
            out.add(procedure(scope.heading(), ProcedureFormat.ORDERED_LIST, steps, scope.labels(), scope.wrapper(),
                run.items().get(0).block().line()));
        }
    }

    private Step buildStep(String title, int line, List<Block> children, Scope scope, AssemblyState state) {
        List<Step> nested = new ArrayList<>();
        List<Block> body = new ArrayList<>();
        for (Block child : children) {
            switch (child.kind()) {
                case PROCEDURE -> nested.addAll(directiveSteps(child.children(), scope, state, new ArrayList<>()));
                case LIST_ITEM, TAB_GROUP, CONDITIONAL -> {
                    // Sub-procedures and variations are collected separately
                }
                case COMPOSABLE, STEP, HEADING, TAB, INCLUDE, PROSE -> body.add(child);
            }
        }
        return new Step(
            title.trim(),
            BlockRenderer.normalized(body),
            tracker.track(children, state.documentPath, state.warnings),
            detector.stepVariations(children, scope.wrapper()),
            nested,
            line);
    }

    private Procedure procedure(String heading, ProcedureFormat format, List<Step> steps, List<String> scopeLabels,
                                ComposableWrapper wrapper, int line) {
        List<String> labels = new ArrayList<>(scopeLabels);
        for (Step step : steps) {
            labels.addAll(VariationDetector.renderingLabels(step.variations()));
        }
        List<String> sorted = CanonicalOrder.labels(labels);
        return new Procedure(heading, format, steps, sorted, null, null, wrapper,
            hasher.procedureHash(steps, sorted), line);
    }

    /**
     * Heading, wrapper and inherited labels in effect at a point of the walk.
     */
    private record Scope(String heading, ComposableWrapper wrapper, List<String> labels) {

        Scope withHeading(String replacement) {
            return new Scope(replacement, wrapper, labels);
        }

        Scope withWrapper(ComposableWrapper replacement) {
            return new Scope(heading, replacement, labels);
        }

        Scope withLabel(String label) {
            if (label.isEmpty()) {
                return this;
            }
            List<String> extended = new ArrayList<>(labels);
            extended.add(label);
            return new Scope(heading, wrapper, List.copyOf(extended));
        }
    }

    /**
     * Procedures found under wrapper-level conditional blocks sharing one heading and hash.
     */
    private static final class SelectionGroup {
        private final Procedure first;
        private final boolean merged;
        private final List<String> selections = new ArrayList<>();

        SelectionGroup(Procedure first, boolean merged) {
            this.first = first;
            this.merged = merged;
        }
    }

    /**
     * Mutable state of one assembly pass.
     */
    private static final class AssemblyState {
        private final String documentPath;
        private final WarningCollector warnings;
        private final List<TabSet> tabSets = new ArrayList<>();

        AssemblyState(String documentPath, WarningCollector warnings) {
            this.documentPath = documentPath;
            this.warnings = warnings;
        }
    }
}
