package com.williamcallahan.procaudit.service.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests reading documents below a source root.
 */
class FileSystemDocumentSourceTest {

    @TempDir
    Path root;

    @Test
    void read_relativePath_resolvesAgainstRoot() throws IOException {
        Files.createDirectories(root.resolve("includes"));
        Files.writeString(root.resolve("includes/intro.rst"), "Intro text.", StandardCharsets.UTF_8);

        assertEquals("Intro text.", new FileSystemDocumentSource(root).read("includes/intro.rst"));
    }

    @Test
    void read_pathWithoutExtension_fallsBackToRst() throws IOException {
        Files.writeString(root.resolve("note.rst"), "Note text.", StandardCharsets.UTF_8);

        assertEquals("Note text.", new FileSystemDocumentSource(root).read("note"));
    }

    @Test
    void read_missingDocument_throwsNoSuchFile() {
        FileSystemDocumentSource source = new FileSystemDocumentSource(root);

        assertThrows(NoSuchFileException.class, () -> source.read("missing.rst"));
        assertThrows(NoSuchFileException.class, () -> source.read("missing"));
    }
}
