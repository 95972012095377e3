package com.williamcallahan.procaudit.service.source;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves targets the way the documentation build does: a leading {@code /} anchors the target
 * at the source root, anything else is relative to the including document's directory.
 * Results use forward slashes with {@code .} and {@code ..} segments removed.
 */
public class SourceRootPathResolver implements PathResolver {

    @Override
    public String resolve(String currentDocument, String target) {
        String trimmed = target == null ? "" : target.trim();
        if (trimmed.startsWith("/")) {
            return toSlashes(Paths.get(trimmed.substring(1)).normalize());
        }
        Path current = Paths.get(currentDocument == null ? "" : currentDocument);
        Path parent = current.getParent();
        Path resolved = parent == null ? Paths.get(trimmed) : parent.resolve(trimmed);
        return toSlashes(resolved.normalize());
    }

    private static String toSlashes(Path path) {
        return path.toString().replace('\\', '/');
    }
}
