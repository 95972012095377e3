package com.williamcallahan.procaudit.service.procedure;

import com.williamcallahan.procaudit.domain.procedure.ProcessingWarning.WarningType;
import com.williamcallahan.procaudit.support.TextNormalizer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw reStructuredText into an ordered tree of typed {@link Block}s.
 *
 * <p>Nesting follows indentation: a directive or list item owns every following line that is
 * blank or indented deeper than itself. Leading {@code :name: value} lines of a directive body
 * are its options. Directives the pipeline does not model, comments and their bodies are kept
 * as opaque prose.</p>
 *
 * <p>Structural problems are recorded in the supplied {@link WarningCollector}; scanning never
 * fails.</p>
 */
final class BlockScanner {

    private static final Pattern DIRECTIVE = Pattern.compile("^\\.\\.\\s+([\\w:-]+?)::(?:\\s+(.*?))?\\s*$");
    private static final Pattern OPTION = Pattern.compile("^:([^:]+):(?:\\s+(.*)|$)");
    private static final String UNDERLINE_CHARS = "=-~`^\"'+*#";
    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final String TAB_ID_OPTION = "tabid";
    private static final String SELECTIONS_OPTION = "selections";

    /**
     * Scans a document.
     *
     * @param documentPath path used in warnings
     * @param text raw document text
     * @param warnings collector for structural warnings
     * @return top-level blocks in document order
     */
    List<Block> scan(String documentPath, String text, WarningCollector warnings) {
        String source = text == null ? "" : text;
        if (!source.isEmpty() && source.charAt(0) == BYTE_ORDER_MARK) {
            source = source.substring(1);
        }
        String[] lines = source.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);
        ScanState state = new ScanState(documentPath, lines, warnings);
        return state.parseRange(0, lines.length);
    }

    static boolean isUnderline(String stripped) {
        if (stripped.isEmpty() || UNDERLINE_CHARS.indexOf(stripped.charAt(0)) < 0) {
            return false;
        }
        char first = stripped.charAt(0);
        for (int index = 1; index < stripped.length(); index++) {
            if (stripped.charAt(index) != first) {
                return false;
            }
        }
        return true;
    }

    /**
     * Per-call scanning state: the split lines, heading styles seen so far and the collector.
     */
    private static final class ScanState {
        private final String documentPath;
        private final String[] lines;
        private final WarningCollector warnings;
        private final List<String> headingStyles = new ArrayList<>();
        private final int documentEnd;

        ScanState(String documentPath, String[] lines, WarningCollector warnings) {
            this.documentPath = documentPath;
            this.lines = lines;
            this.warnings = warnings;
            int lastContent = lines.length;
            while (lastContent > 0 && TextNormalizer.isBlank(lines[lastContent - 1])) {
                lastContent--;
            }
            this.documentEnd = lastContent;
        }

        List<Block> parseRange(int from, int to) {
            List<Block> blocks = new ArrayList<>();
            int cursor = from;
            while (cursor < to) {
                String line = lines[cursor];
                if (TextNormalizer.isBlank(line)) {
                    cursor++;
                    continue;
                }
                int headingEnd = tryHeading(cursor, to, blocks);
                if (headingEnd > cursor) {
                    cursor = headingEnd;
                    continue;
                }
                String stripped = line.strip();
                int indent = TextNormalizer.indentOf(line);
                Matcher directive = DIRECTIVE.matcher(stripped);
                if (directive.matches()) {
                    cursor = readDirective(cursor, to, indent, directive.group(1), directive.group(2), blocks);
                    continue;
                }
                Optional<OrderedMarkerScanner.MarkerMatch> marker = OrderedMarkerScanner.scan(stripped);
                if (marker.isPresent()) {
                    cursor = readListItem(cursor, to, indent, stripped, marker.get(), blocks);
                    continue;
                }
                if (isComment(stripped)) {
                    cursor = readOpaque(cursor, extentEnd(cursor, to, indent), blocks);
                    continue;
                }
                cursor = readParagraph(cursor, to, blocks);
            }
            return blocks;
        }

        private int tryHeading(int cursor, int to, List<Block> blocks) {
            String first = lines[cursor].strip();
            // Overlined title
            if (isUnderline(first) && cursor + 2 < to && !TextNormalizer.isBlank(lines[cursor + 1])) {
                String title = lines[cursor + 1].strip();
                String under = lines[cursor + 2].strip();
                if (under.equals(first) && under.length() >= title.length() && !isUnderline(title)) {
                    blocks.add(Block.heading(cursor + 2, title, "over" + first.charAt(0), levelFor("over" + first.charAt(0))));
                    return cursor + 3;
                }
            }
            if (cursor + 1 >= to || isUnderline(first) || DIRECTIVE.matcher(first).matches()) {
                return cursor;
            }
            String next = lines[cursor + 1];
            if (TextNormalizer.isBlank(next)) {
                return cursor;
            }
            String under = next.strip();
            if (isUnderline(under)
                && under.length() >= first.length()
                && TextNormalizer.indentOf(next) == TextNormalizer.indentOf(lines[cursor])) {
                String style = String.valueOf(under.charAt(0));
                blocks.add(Block.heading(cursor + 1, first, style, levelFor(style)));
                return cursor + 2;
            }
            return cursor;
        }

        private int levelFor(String style) {
            int index = headingStyles.indexOf(style);
            if (index < 0) {
                headingStyles.add(style);
                index = headingStyles.size() - 1;
            }
            return index + 1;
        }

        private int readDirective(int start, int to, int indent, String name, String argument, List<Block> blocks) {
            int end = extentEnd(start, to, indent);
            Optional<BlockKind> recognized = BlockKind.forDirective(name);
            if (recognized.isEmpty()) {
                return readOpaque(start, end, blocks);
            }
            BlockKind kind = recognized.get();
            int line = start + 1;
            String arg = argument == null ? "" : argument.strip();
            if (kind == BlockKind.INCLUDE) {
                blocks.add(Block.include(line, arg));
                return end;
            }

            Map<String, String> options = new LinkedHashMap<>();
            int bodyStart = start + 1;
            while (bodyStart < end) {
                String candidate = lines[bodyStart];
                if (TextNormalizer.isBlank(candidate)) {
                    bodyStart++;
                    continue;
                }
                Matcher option = OPTION.matcher(candidate.strip());
                if (!option.matches()) {
                    break;
                }
                String value = option.group(2) == null ? "" : option.group(2).strip();
                options.put(option.group(1).strip().toLowerCase(Locale.ROOT), value);
                bodyStart++;
            }

            int bodyEnd = closeAtDedent(bodyStart, end, name);
            List<Block> children = bodyStart < bodyEnd ? parseRange(bodyStart, bodyEnd) : List.of();

            if (bodyStart >= bodyEnd && bodyEnd >= documentEnd && reportsUnterminated(kind)) {
                warnings.add(WarningType.UNTERMINATED_CONTAINER,
                    String.format(Locale.ROOT, "'%s' reached end of input without a body", name),
                    line, documentPath);
            }

            if (kind == BlockKind.TAB && options.getOrDefault(TAB_ID_OPTION, "").isEmpty()) {
                warnings.add(WarningType.MISSING_ATTRIBUTE, "Tab without :tabid: ignored", line, documentPath);
                return bodyEnd;
            }
            if (kind == BlockKind.CONDITIONAL && options.getOrDefault(SELECTIONS_OPTION, "").isEmpty()) {
                warnings.add(WarningType.MISSING_ATTRIBUTE,
                    "selected-content without :selections: treated as unconditional content", line, documentPath);
                blocks.addAll(children);
                return bodyEnd;
            }
            blocks.add(Block.container(kind, line, arg, options, children));
            return bodyEnd;
        }

        /**
         * Returns where a directive body ends. A line dedented below the body's indentation
         * closes the container early with a warning.
         */
        private int closeAtDedent(int bodyStart, int end, String name) {
            int bodyIndent = -1;
            for (int index = bodyStart; index < end; index++) {
                String line = lines[index];
                if (TextNormalizer.isBlank(line)) {
                    continue;
                }
                int indent = TextNormalizer.indentOf(line);
                if (bodyIndent < 0) {
                    bodyIndent = indent;
                } else if (indent < bodyIndent) {
                    warnings.add(WarningType.INCONSISTENT_INDENTATION,
                        String.format(Locale.ROOT, "Line dedented below the body of '%s'; container closed", name),
                        index + 1, documentPath);
                    return index;
                }
            }
            return end;
        }

        private int readListItem(int start, int to, int indent, String stripped,
                                 OrderedMarkerScanner.MarkerMatch match, List<Block> blocks) {
            int end = extentEnd(start, to, indent);
            String text = stripped.substring(match.afterIndex()).strip();
            List<Block> children = parseRange(start + 1, end);
            blocks.add(Block.listItem(start + 1, match.marker(), text, children));
            return end;
        }

        private int readParagraph(int start, int to, List<Block> blocks) {
            int indent = TextNormalizer.indentOf(lines[start]);
            int end = start + 1;
            while (end < to
                && !TextNormalizer.isBlank(lines[end])
                && TextNormalizer.indentOf(lines[end]) >= indent
                && !startsConstruct(end, indent)) {
                end++;
            }
            if (lines[end - 1].strip().endsWith("::")) {
                end = extentEnd(end - 1, to, indent);
            }
            return readOpaque(start, end, blocks);
        }

        private boolean startsConstruct(int index, int paragraphIndent) {
            if (TextNormalizer.indentOf(lines[index]) != paragraphIndent) {
                return false;
            }
            String stripped = lines[index].strip();
            return DIRECTIVE.matcher(stripped).matches() || OrderedMarkerScanner.scan(stripped).isPresent();
        }

        private int readOpaque(int start, int end, List<Block> blocks) {
            List<String> dedented = TextNormalizer.dedent(Arrays.asList(lines).subList(start, end));
            blocks.add(Block.prose(start + 1, String.join("\n", dedented).strip()));
            return end;
        }

        /**
         * Returns the exclusive end of the block opened at {@code start}: the last following line
         * indented deeper than {@code indent}, skipping blank lines in between.
         */
        private int extentEnd(int start, int to, int indent) {
            int lastContent = start;
            for (int index = start + 1; index < to; index++) {
                String line = lines[index];
                if (TextNormalizer.isBlank(line)) {
                    continue;
                }
                if (TextNormalizer.indentOf(line) <= indent) {
                    break;
                }
                lastContent = index;
            }
            return lastContent + 1;
        }

        private static boolean isComment(String stripped) {
            return stripped.equals("..") || stripped.startsWith(".. ");
        }

        private static boolean reportsUnterminated(BlockKind kind) {
            return switch (kind) {
                case TAB_GROUP, TAB, CONDITIONAL, COMPOSABLE -> true;
                case PROCEDURE, STEP, LIST_ITEM, HEADING, INCLUDE, PROSE -> false;
            };
        }
    }
}
