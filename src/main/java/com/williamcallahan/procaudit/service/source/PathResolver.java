package com.williamcallahan.procaudit.service.source;

/**
 * Resolves an inclusion target written in one document to a path the {@link DocumentSource}
 * can read.
 */
@FunctionalInterface
public interface PathResolver {

    /**
     * @param currentDocument path of the document containing the reference
     * @param target target as written after {@code include::}
     * @return resolved path
     */
    String resolve(String currentDocument, String target);
}
