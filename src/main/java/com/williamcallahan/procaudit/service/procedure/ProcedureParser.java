package com.williamcallahan.procaudit.service.procedure;

import com.williamcallahan.procaudit.domain.procedure.ProcedureParseResult;
import com.williamcallahan.procaudit.service.source.DocumentSource;
import com.williamcallahan.procaudit.service.source.PathResolver;

import java.util.List;
import java.util.Objects;

/**
 * Parses one document into procedures and their analysis and extraction views.
 *
 * <p>The pipeline runs scanner, include expander, assembler and grouping engine in order.
 * Every call owns its own state, so one parser can serve independent documents concurrently.
 * Nothing here logs; warnings travel in the result.</p>
 */
public final class ProcedureParser {

    private final BlockScanner scanner;
    private final IncludeExpander expander;
    private final ProcedureAssembler assembler;
    private final GroupingEngine groupingEngine;

    public ProcedureParser(DocumentSource documentSource, PathResolver pathResolver, ProcedureParserSettings settings) {
        Objects.requireNonNull(settings, "Settings cannot be null");
        this.scanner = new BlockScanner();
        this.expander = new IncludeExpander(scanner, documentSource, pathResolver, settings.maxIncludeDepth());
        this.assembler = new ProcedureAssembler(settings, new SubProcedureTracker(), new VariationDetector(),
            new ContentHasher());
        this.groupingEngine = new GroupingEngine(settings.shortHashLength());
    }

    /**
     * Parses a document.
     *
     * @param documentPath path of the document, the base for relative inclusion targets
     * @param text document text
     * @return procedures, tab sets, warnings and both views
     * @throws ProcedureParsingException when an included document cannot be read
     */
    public ProcedureParseResult parse(String documentPath, String text) {
        Objects.requireNonNull(documentPath, "Document path cannot be null");
        long startTime = System.currentTimeMillis();
        WarningCollector warnings = new WarningCollector();

        List<Block> scanned = scanner.scan(documentPath, text, warnings);
        IncludeExpander.ExpandedDocument expanded = expander.expand(documentPath, scanned, warnings);
        ProcedureAssembler.Assembly assembly = assembler.assemble(documentPath, expanded.blocks(), warnings);

        return new ProcedureParseResult(
            documentPath,
            assembly.procedures(),
            assembly.tabSets(),
            warnings.snapshot(),
            groupingEngine.analysis(assembly.procedures()),
            groupingEngine.extraction(assembly.procedures()),
            System.currentTimeMillis() - startTime);
    }
}
