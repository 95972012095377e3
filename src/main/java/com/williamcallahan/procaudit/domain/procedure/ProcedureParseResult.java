package com.williamcallahan.procaudit.domain.procedure;

import java.util.List;
import java.util.Objects;

/**
 * Everything one parse pass produced for a document and its expanded includes.
 *
 * @param documentPath path of the parsed document
 * @param procedures procedures in document order
 * @param tabSets tab sets referenced by procedures, indexed by handle
 * @param warnings non-fatal structural and resolution warnings
 * @param analysis procedures grouped by heading
 * @param extraction procedures grouped by heading and hash
 * @param processingTimeMs time taken by the parse pass
 */
public record ProcedureParseResult(
    String documentPath,
    List<Procedure> procedures,
    List<TabSet> tabSets,
    List<ProcessingWarning> warnings,
    List<AnalysisEntry> analysis,
    List<ExtractionUnit> extraction,
    long processingTimeMs
) {

    public ProcedureParseResult {
        Objects.requireNonNull(documentPath, "Document path cannot be null");
        Objects.requireNonNull(procedures, "Procedures list cannot be null");
        Objects.requireNonNull(tabSets, "Tab sets list cannot be null");
        Objects.requireNonNull(warnings, "Warnings list cannot be null");
        Objects.requireNonNull(analysis, "Analysis list cannot be null");
        Objects.requireNonNull(extraction, "Extraction list cannot be null");
        procedures = List.copyOf(procedures);
        tabSets = List.copyOf(tabSets);
        warnings = List.copyOf(warnings);
        analysis = List.copyOf(analysis);
        extraction = List.copyOf(extraction);
    }

    /**
     * Checks if parsing completed without warnings.
     * @return true if no warnings were generated
     */
    public boolean isClean() {
        return warnings.isEmpty();
    }
}
