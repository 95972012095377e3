package com.williamcallahan.procaudit.service.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads UTF-8 documents below a source root. Relative paths resolve against the root; a path
 * without an extension that does not exist falls back to the same path with {@code .rst}.
 */
public class FileSystemDocumentSource implements DocumentSource {

    private static final String DEFAULT_EXTENSION = ".rst";

    private final Path sourceRoot;

    public FileSystemDocumentSource(Path sourceRoot) {
        this.sourceRoot = Objects.requireNonNull(sourceRoot, "Source root cannot be null");
    }

    @Override
    public String read(String path) throws IOException {
        Path candidate = locate(path);
        if (!Files.isRegularFile(candidate) && !hasExtension(candidate)) {
            Path withExtension = candidate.resolveSibling(candidate.getFileName() + DEFAULT_EXTENSION);
            if (Files.isRegularFile(withExtension)) {
                candidate = withExtension;
            }
        }
        if (!Files.isRegularFile(candidate)) {
            throw new NoSuchFileException(candidate.toString());
        }
        return Files.readString(candidate, StandardCharsets.UTF_8);
    }

    public Path getSourceRoot() {
        return sourceRoot;
    }

    private Path locate(String path) {
        Path requested = Path.of(path);
        return requested.isAbsolute() ? requested : sourceRoot.resolve(requested);
    }

    private static boolean hasExtension(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().lastIndexOf('.') > 0;
    }
}
