package com.williamcallahan.procaudit.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.procaudit.domain.procedure.ProcedureParseResult;
import com.williamcallahan.procaudit.service.ProcedureParsingService;
import com.williamcallahan.procaudit.service.procedure.ProcedureParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parses the files named on the command line and prints one JSON report per file.
 * Arguments starting with {@code --} belong to Spring and are skipped.
 */
@Component
public class ProcedureAuditRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcedureAuditRunner.class);

    private final ProcedureParsingService parsingService;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    @Autowired
    public ProcedureAuditRunner(ProcedureParsingService parsingService, ObjectMapper objectMapper) {
        this(parsingService, objectMapper, System.out);
    }

    ProcedureAuditRunner(ProcedureParsingService parsingService, ObjectMapper objectMapper, PrintStream out) {
        this.parsingService = parsingService;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(String... args) throws Exception {
        int parsed = 0;
        int failed = 0;
        for (String arg : args) {
            if (arg.startsWith("--")) {
                continue;
            }
            Path file = Paths.get(arg);
            try {
                ProcedureParseResult result = parsingService.parseFile(file);
                out.println(objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(ProcedureReport.from(result)));
                parsed++;
                log.info("Parsed {}: {} procedures, {} extraction units in {}ms",
                    result.documentPath(), result.procedures().size(), result.extraction().size(),
                    result.processingTimeMs());
            } catch (IOException | ProcedureParsingException e) {
                failed++;
                log.error("Error parsing {}: {}", file, e.getMessage());
                log.debug("Stack trace:", e);
            }
        }
        if (parsed == 0 && failed == 0) {
            log.info("No documents given; pass one or more .rst files to parse");
            return;
        }
        log.info("Parsed {} documents, {} failed", parsed, failed);
    }
}
