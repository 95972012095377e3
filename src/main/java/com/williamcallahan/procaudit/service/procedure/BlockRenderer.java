package com.williamcallahan.procaudit.service.procedure;

import com.williamcallahan.procaudit.support.TextNormalizer;

import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders blocks back to canonical reStructuredText. Containers are written with three-space
 * indentation regardless of the source, so rendered text is stable across formatting changes.
 */
final class BlockRenderer {

    private static final int INDENT = 3;

    private BlockRenderer() {}

    static String render(List<Block> blocks) {
        StringJoiner joined = new StringJoiner("\n\n");
        for (Block block : blocks) {
            String rendered = render(block);
            if (!rendered.isEmpty()) {
                joined.add(rendered);
            }
        }
        return joined.toString();
    }

    /**
     * Renders the blocks and collapses whitespace, producing the normalized body form used in
     * steps, variations and hashes.
     */
    static String normalized(List<Block> blocks) {
        return TextNormalizer.collapseWhitespace(render(blocks));
    }

    static String render(Block block) {
        return switch (block.kind()) {
            case PROSE -> block.text();
            case HEADING -> renderHeading(block);
            case INCLUDE -> ".. include:: " + block.argument();
            case LIST_ITEM -> withBody(block.marker() + " " + block.argument(), block.children());
            case COMPOSABLE, PROCEDURE, STEP, CONDITIONAL, TAB_GROUP, TAB -> renderDirective(block);
        };
    }

    private static String renderDirective(Block block) {
        StringBuilder head = new StringBuilder(".. ").append(block.kind().directiveName()).append("::");
        if (!block.argument().isEmpty()) {
            head.append(' ').append(block.argument());
        }
        for (Map.Entry<String, String> option : block.options().entrySet()) {
            head.append('\n').append(" ".repeat(INDENT)).append(':').append(option.getKey()).append(':');
            if (!option.getValue().isEmpty()) {
                head.append(' ').append(option.getValue());
            }
        }
        return withBody(head.toString(), block.children());
    }

    private static String withBody(String head, List<Block> children) {
        String body = render(children);
        return body.isEmpty() ? head : head + "\n\n" + TextNormalizer.indent(body, INDENT);
    }

    private static String renderHeading(Block heading) {
        String style = heading.marker();
        char character = style.isEmpty() ? '=' : style.charAt(style.length() - 1);
        String line = String.valueOf(character).repeat(Math.max(1, heading.argument().length()));
        String underlined = heading.argument() + "\n" + line;
        return style.startsWith("over") ? line + "\n" + underlined : underlined;
    }
}
