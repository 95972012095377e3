package com.williamcallahan.procaudit.service.procedure;

import com.williamcallahan.procaudit.domain.procedure.AnalysisEntry;
import com.williamcallahan.procaudit.domain.procedure.ExtractionUnit;
import com.williamcallahan.procaudit.domain.procedure.Procedure;
import com.williamcallahan.procaudit.domain.procedure.ProcedureFormat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the two consumer views over assembled procedures.
 *
 * <p>The analysis view groups by heading only: every rendering of a logical procedure counts as
 * one appearance, so a tab set contributes one appearance per tab. The extraction view groups by
 * heading and hash: each distinct content body is written once, listing every selection it
 * serves. Both views keep first-appearance order.</p>
 */
final class GroupingEngine {

    private final int shortHashLength;

    GroupingEngine(int shortHashLength) {
        if (shortHashLength < 1) {
            throw new IllegalArgumentException("Short hash length must be positive");
        }
        this.shortHashLength = shortHashLength;
    }

    List<AnalysisEntry> analysis(List<Procedure> procedures) {
        Map<String, List<Procedure>> byHeading = new LinkedHashMap<>();
        for (Procedure procedure : procedures) {
            byHeading.computeIfAbsent(procedure.heading(), unused -> new ArrayList<>()).add(procedure);
        }
        List<AnalysisEntry> entries = new ArrayList<>(byHeading.size());
        for (Map.Entry<String, List<Procedure>> group : byHeading.entrySet()) {
            entries.add(analysisEntry(group.getKey(), group.getValue()));
        }
        return entries;
    }

    List<ExtractionUnit> extraction(List<Procedure> procedures) {
        Map<String, Procedure> firstByKey = new LinkedHashMap<>();
        Map<String, List<String>> selectionsByKey = new LinkedHashMap<>();
        for (Procedure procedure : procedures) {
            String key = procedure.heading() + '\u0000' + procedure.hash();
            firstByKey.putIfAbsent(key, procedure);
            selectionsByKey.computeIfAbsent(key, unused -> new ArrayList<>()).addAll(procedure.variations());
        }
        List<ExtractionUnit> units = new ArrayList<>(firstByKey.size());
        for (Map.Entry<String, Procedure> entry : firstByKey.entrySet()) {
            Procedure first = entry.getValue();
            units.add(new ExtractionUnit(
                first.heading(),
                first.hash(),
                first.shortHash(shortHashLength),
                first.steps(),
                CanonicalOrder.labels(selectionsByKey.get(entry.getKey()))));
        }
        return units;
    }

    private static AnalysisEntry analysisEntry(String heading, List<Procedure> members) {
        List<String> labels = new ArrayList<>();
        Set<ProcedureFormat> formats = new LinkedHashSet<>();
        int appearances = 0;
        int maxDepth = 1;
        boolean hasSubSteps = false;
        for (Procedure member : members) {
            labels.addAll(member.variations());
            formats.add(member.format());
            // Tab-set members carry only their tab id
            appearances += Math.max(1, member.variations().size());
            maxDepth = Math.max(maxDepth, member.maxNestingDepth());
            hasSubSteps |= member.hasSubSteps();
        }
        return new AnalysisEntry(
            heading,
            appearances,
            CanonicalOrder.labels(labels),
            maxDepth,
            members.get(0).steps().size(),
            List.copyOf(formats),
            hasSubSteps);
    }
}
