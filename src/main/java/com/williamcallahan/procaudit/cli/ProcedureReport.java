package com.williamcallahan.procaudit.cli;

import com.williamcallahan.procaudit.domain.procedure.AnalysisEntry;
import com.williamcallahan.procaudit.domain.procedure.ExtractionUnit;
import com.williamcallahan.procaudit.domain.procedure.ProcedureParseResult;
import com.williamcallahan.procaudit.domain.procedure.ProcessingWarning;

import java.util.List;

/**
 * JSON document printed for one parsed file.
 *
 * @param documentPath parsed document
 * @param analysis procedures grouped by heading
 * @param extraction distinct content bodies
 * @param warnings warnings raised while parsing
 */
public record ProcedureReport(
    String documentPath,
    List<AnalysisEntry> analysis,
    List<ExtractionUnit> extraction,
    List<ProcessingWarning> warnings
) {

    static ProcedureReport from(ProcedureParseResult result) {
        return new ProcedureReport(result.documentPath(), result.analysis(), result.extraction(), result.warnings());
    }
}
