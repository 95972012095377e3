package com.williamcallahan.procaudit.service.source;

import java.io.IOException;

/**
 * Reads document text by path.
 */
@FunctionalInterface
public interface DocumentSource {

    /**
     * Reads the whole document.
     *
     * @param path resolved document path
     * @return document text
     * @throws java.nio.file.NoSuchFileException when the document does not exist
     * @throws IOException for any other read failure
     */
    String read(String path) throws IOException;
}
