package com.williamcallahan.procaudit.support;

import java.util.ArrayList;
import java.util.List;

/**
 * Locale-independent text helpers shared by the scanner, the hasher and the grouping views.
 *
 * <p>Case folding only touches ASCII letters so heading comparisons behave the same under
 * every default locale.</p>
 */
public final class TextNormalizer {

    private static final int CASE_OFFSET = 'a' - 'A';
    private static final int TAB_WIDTH = 4;

    private TextNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Converts ASCII uppercase letters to lowercase, leaving other characters unchanged.
     *
     * @param text the input text to normalize (may be null)
     * @return the normalized text with ASCII letters lowercased, or empty string if null
     */
    public static String toLowerAscii(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current >= 'A' && current <= 'Z') {
                normalized.append((char) (current + CASE_OFFSET));
            } else {
                normalized.append(current);
            }
        }
        return normalized.toString();
    }

    /**
     * Trims the text and collapses every internal whitespace run to a single space.
     *
     * @param text the input text (may be null)
     * @return collapsed text, or empty string if null
     */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder collapsed = new StringBuilder(text.length());
        boolean pendingSpace = false;
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (Character.isWhitespace(current)) {
                pendingSpace = collapsed.length() > 0;
                continue;
            }
            if (pendingSpace) {
                collapsed.append(' ');
                pendingSpace = false;
            }
            collapsed.append(current);
        }
        return collapsed.toString();
    }

    /**
     * Returns the indentation width of a line, counting a tab as four columns.
     */
    public static int indentOf(String line) {
        int width = 0;
        for (int index = 0; index < line.length(); index++) {
            char current = line.charAt(index);
            if (current == ' ') {
                width++;
            } else if (current == '\t') {
                width += TAB_WIDTH;
            } else {
                break;
            }
        }
        return width;
    }

    /**
     * Returns true when the line is empty or whitespace only.
     */
    public static boolean isBlank(String line) {
        return line == null || line.isBlank();
    }

    /**
     * Removes the common leading indentation of the non-blank lines.
     * Blank lines become empty strings.
     *
     * @param lines source lines
     * @return dedented copies
     */
    public static List<String> dedent(List<String> lines) {
        int minimum = Integer.MAX_VALUE;
        for (String line : lines) {
            if (!isBlank(line)) {
                minimum = Math.min(minimum, indentOf(line));
            }
        }
        List<String> dedented = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (isBlank(line)) {
                dedented.add("");
            } else {
                dedented.add(stripColumns(line, minimum));
            }
        }
        return dedented;
    }

    /**
     * Prefixes every non-blank line with the given number of spaces.
     */
    public static String indent(String text, int columns) {
        if (text.isEmpty()) {
            return text;
        }
        String prefix = " ".repeat(columns);
        StringBuilder indented = new StringBuilder(text.length() + columns * 4);
        String[] lines = text.split("\n", -1);
        for (int index = 0; index < lines.length; index++) {
            if (index > 0) {
                indented.append('\n');
            }
            if (!lines[index].isBlank()) {
                indented.append(prefix).append(lines[index]);
            }
        }
        return indented.toString();
    }

    private static String stripColumns(String line, int columns) {
        int width = 0;
        int index = 0;
        while (index < line.length() && width < columns) {
            char current = line.charAt(index);
            if (current == ' ') {
                width++;
            } else if (current == '\t') {
                width += TAB_WIDTH;
            } else {
                break;
            }
            index++;
        }
        String stripped = line.substring(index);
        // A tab that straddles the cut keeps its remaining columns.
        return width > columns ? " ".repeat(width - columns) + stripped : stripped;
    }
}
