package com.williamcallahan.procaudit.config;

import com.williamcallahan.procaudit.service.source.DocumentSource;
import com.williamcallahan.procaudit.service.source.FileSystemDocumentSource;
import com.williamcallahan.procaudit.service.source.PathResolver;
import com.williamcallahan.procaudit.service.source.SourceRootPathResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the document source and path resolver the parser reads inclusion targets through.
 */
@Configuration
public class ProcedureSourceConfig {

    @Bean
    public DocumentSource documentSource(AppProperties appProperties) {
        return new FileSystemDocumentSource(sourceRoot(appProperties));
    }

    @Bean
    public PathResolver pathResolver() {
        return new SourceRootPathResolver();
    }

    static Path sourceRoot(AppProperties appProperties) {
        return Path.of(appProperties.getProcedures().getSourceRoot()).toAbsolutePath().normalize();
    }
}
