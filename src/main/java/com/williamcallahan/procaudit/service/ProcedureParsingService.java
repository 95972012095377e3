package com.williamcallahan.procaudit.service;

import com.williamcallahan.procaudit.config.AppProperties;
import com.williamcallahan.procaudit.domain.procedure.ProcedureParseResult;
import com.williamcallahan.procaudit.domain.procedure.ProcessingWarning;
import com.williamcallahan.procaudit.service.procedure.ProcedureParser;
import com.williamcallahan.procaudit.service.source.DocumentSource;
import com.williamcallahan.procaudit.service.source.PathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Parses documentation files into procedures using the configured document source.
 * Warnings are logged here; the parser itself stays silent.
 */
@Service
public class ProcedureParsingService {
    private static final Logger log = LoggerFactory.getLogger(ProcedureParsingService.class);

    private final ProcedureParser parser;
    private final DocumentSource documentSource;
    private final Path sourceRoot;

    public ProcedureParsingService(DocumentSource documentSource, PathResolver pathResolver,
                                   AppProperties appProperties) {
        this.documentSource = documentSource;
        this.parser = new ProcedureParser(documentSource, pathResolver, appProperties.toParserSettings());
        this.sourceRoot = Path.of(appProperties.getProcedures().getSourceRoot()).toAbsolutePath().normalize();
    }

    /**
     * Parses document text that has already been read.
     *
     * @param documentPath path of the document, relative to the source root where possible
     * @param text document text
     * @return parse result with both views
     */
    public ProcedureParseResult parse(String documentPath, String text) {
        ProcedureParseResult result = parser.parse(documentPath, text);
        logWarnings(result);
        return result;
    }

    /**
     * Reads and parses a file. Files below the source root are addressed relative to it so that
     * inclusion targets resolve the way the documentation build resolves them.
     *
     * @param file file to parse
     * @return parse result with both views
     * @throws IOException if the file cannot be read
     */
    public ProcedureParseResult parseFile(Path file) throws IOException {
        String documentPath = documentPathFor(file);
        log.debug("Reading {}", documentPath);
        return parse(documentPath, documentSource.read(documentPath));
    }

    String documentPathFor(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        if (absolute.startsWith(sourceRoot)) {
            return sourceRoot.relativize(absolute).toString().replace('\\', '/');
        }
        return absolute.toString();
    }

    private void logWarnings(ProcedureParseResult result) {
        if (result.isClean()) {
            return;
        }
        for (ProcessingWarning warning : result.warnings()) {
            if (warning.category() == ProcessingWarning.Category.RESOLUTION) {
                log.warn("{}:{} {} - {}", warning.documentPath(), warning.line(), warning.type(), warning.message());
            } else {
                log.debug("{}:{} {} - {}", warning.documentPath(), warning.line(), warning.type(), warning.message());
            }
        }
    }
}
