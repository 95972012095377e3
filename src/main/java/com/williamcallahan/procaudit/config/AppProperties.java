package com.williamcallahan.procaudit.config;

import com.williamcallahan.procaudit.service.procedure.ProcedureParserSettings;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private static final String SOURCE_ROOT_KEY = "app.procedures.source-root";
    private static final String MAX_INCLUDE_DEPTH_KEY = "app.procedures.max-include-depth";
    private static final String SHORT_HASH_LENGTH_KEY = "app.procedures.short-hash-length";
    private static final int MIN_POSITIVE = 1;
    private static final int SHA256_HEX_LENGTH = 64;
    private static final String BLANK_TEXT_FMT = "%s must not be blank.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String MAX_FMT = "%s must not exceed %d.";

    private Procedures procedures = new Procedures();

    public Procedures getProcedures() {
        return procedures;
    }

    public void setProcedures(Procedures procedures) {
        this.procedures = procedures;
    }

    /**
     * Validates procedure parsing settings. Invoked once the properties are bound.
     */
    @PostConstruct
    public void validateConfiguration() {
        if (procedures.getSourceRoot() == null || procedures.getSourceRoot().isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_TEXT_FMT, SOURCE_ROOT_KEY));
        }
        if (procedures.getMaxIncludeDepth() < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, MAX_INCLUDE_DEPTH_KEY));
        }
        if (procedures.getShortHashLength() < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, SHORT_HASH_LENGTH_KEY));
        }
        if (procedures.getShortHashLength() > SHA256_HEX_LENGTH) {
            throw new IllegalArgumentException(
                String.format(Locale.ROOT, MAX_FMT, SHORT_HASH_LENGTH_KEY, SHA256_HEX_LENGTH));
        }
    }

    /**
     * Builds parser settings from the bound properties.
     */
    public ProcedureParserSettings toParserSettings() {
        return new ProcedureParserSettings(
            procedures.getMaxIncludeDepth(),
            procedures.getShortHashLength(),
            new LinkedHashSet<>(procedures.getGenericHeadings()),
            new LinkedHashSet<>(procedures.getProcedureHeadings()));
    }

    public static class Procedures {
        private String sourceRoot = ".";
        private int maxIncludeDepth = ProcedureParserSettings.DEFAULT_MAX_INCLUDE_DEPTH;
        private int shortHashLength = ProcedureParserSettings.DEFAULT_SHORT_HASH_LENGTH;
        private List<String> genericHeadings = new ArrayList<>(List.of("overview"));
        private List<String> procedureHeadings = new ArrayList<>(List.of("procedure", "steps"));

        public String getSourceRoot() { return sourceRoot; }
        public void setSourceRoot(String sourceRoot) { this.sourceRoot = sourceRoot; }

        public int getMaxIncludeDepth() { return maxIncludeDepth; }
        public void setMaxIncludeDepth(int maxIncludeDepth) { this.maxIncludeDepth = maxIncludeDepth; }

        public int getShortHashLength() { return shortHashLength; }
        public void setShortHashLength(int shortHashLength) { this.shortHashLength = shortHashLength; }

        public List<String> getGenericHeadings() { return genericHeadings; }
        public void setGenericHeadings(List<String> genericHeadings) { this.genericHeadings = genericHeadings; }

        public List<String> getProcedureHeadings() { return procedureHeadings; }
        public void setProcedureHeadings(List<String> procedureHeadings) { this.procedureHeadings = procedureHeadings; }
    }
}
