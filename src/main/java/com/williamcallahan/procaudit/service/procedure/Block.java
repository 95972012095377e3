package com.williamcallahan.procaudit.service.procedure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A typed, immutable node of a scanned document.
 *
 * @param kind block kind
 * @param line 1-based line of the block's first source line
 * @param argument directive argument, step title, list item text, heading text or include target
 * @param marker raw list marker with its delimiter ({@code 1.}, {@code b)}, {@code #.}),
 *               heading underline style, or empty
 * @param level heading level (1 is outermost), 0 for other kinds
 * @param options directive options in declaration order
 * @param children nested blocks
 * @param text dedented source text of prose blocks, empty otherwise
 */
record Block(
    BlockKind kind,
    int line,
    String argument,
    String marker,
    int level,
    Map<String, String> options,
    List<Block> children,
    String text
) {

    Block {
        Objects.requireNonNull(kind, "Block kind cannot be null");
        argument = argument == null ? "" : argument;
        marker = marker == null ? "" : marker;
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
        children = children == null ? List.of() : List.copyOf(children);
        text = text == null ? "" : text;
    }

    static Block prose(int line, String text) {
        return new Block(BlockKind.PROSE, line, "", "", 0, Map.of(), List.of(), text);
    }

    static Block heading(int line, String title, String style, int level) {
        return new Block(BlockKind.HEADING, line, title, style, level, Map.of(), List.of(), "");
    }

    static Block include(int line, String target) {
        return new Block(BlockKind.INCLUDE, line, target, "", 0, Map.of(), List.of(), "");
    }

    static Block listItem(int line, String marker, String text, List<Block> children) {
        return new Block(BlockKind.LIST_ITEM, line, text, marker, 0, Map.of(), children, "");
    }

    static Block container(BlockKind kind, int line, String argument, Map<String, String> options,
                           List<Block> children) {
        return new Block(kind, line, argument, "", 0, options, children, "");
    }

    /**
     * Returns a copy of this block with different children.
     */
    Block withChildren(List<Block> replacement) {
        return new Block(kind, line, argument, marker, level, options, replacement, text);
    }

    /**
     * Returns a copy of this block with a different marker.
     */
    Block withMarker(String replacement) {
        return new Block(kind, line, argument, replacement, level, options, children, text);
    }

    /**
     * Returns the trimmed option value, or empty string when absent.
     */
    String option(String name) {
        String value = options.get(name);
        return value == null ? "" : value.trim();
    }

    boolean is(BlockKind candidate) {
        return kind == candidate;
    }
}
