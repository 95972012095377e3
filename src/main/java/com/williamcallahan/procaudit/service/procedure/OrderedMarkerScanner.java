package com.williamcallahan.procaudit.service.procedure;

import java.util.Optional;

/**
 * Scans for ordered list markers at the start of a trimmed line.
 *
 * <p>Supports:</p>
 * <ul>
 *   <li>Numeric markers: 1. 2. 3. or 1) 2) 3)</li>
 *   <li>Single-letter markers: a. b. or A) B)</li>
 *   <li>Continuation markers: #. or #)</li>
 * </ul>
 *
 * <p>A marker must be followed by whitespace or end the line, so "1.8" and "e.g." are prose.</p>
 */
final class OrderedMarkerScanner {

    private static final int MAX_NUMERIC_DIGITS = 3;

    private OrderedMarkerScanner() {}

    /**
     * Describes a detected ordered list marker.
     *
     * @param marker the marker token including its delimiter, e.g. {@code 12.}
     * @param afterIndex position after the marker and following whitespace (start of item text)
     * @param kind the type of ordered marker detected
     */
    record MarkerMatch(String marker, int afterIndex, ListMarkerKind kind) {

        /**
         * Returns the marker without its delimiter, e.g. {@code 12} or {@code b}.
         */
        String value() {
            return marker.substring(0, marker.length() - 1);
        }
    }

    /**
     * Strategy for reading a specific type of ordered marker.
     */
    @FunctionalInterface
    private interface MarkerStrategy {
        /**
         * Attempts to read the marker sequence starting at index 0.
         *
         * @param text source text
         * @return cursor position after the marker sequence, or -1 if not found
         */
        int readSequence(String text);
    }

    /**
     * Scans for an ordered marker at the start of the line, trying all marker types.
     *
     * @param trimmedLine line with leading whitespace already removed
     * @return marker match if found, empty otherwise
     */
    static Optional<MarkerMatch> scan(String trimmedLine) {
        if (trimmedLine == null || trimmedLine.isEmpty()) {
            return Optional.empty();
        }
        for (ListMarkerKind kind : ListMarkerKind.values()) {
            MarkerMatch match = tryReadMarker(trimmedLine, kind);
            if (match != null) {
                return Optional.of(match);
            }
        }
        return Optional.empty();
    }

    private static MarkerMatch tryReadMarker(String text, ListMarkerKind kind) {
        MarkerStrategy strategy = strategyFor(kind);
        int sequenceEnd = strategy.readSequence(text);
        if (sequenceEnd < 0) return null;

        return finalizeMarker(text, sequenceEnd, kind);
    }

    private static MarkerStrategy strategyFor(ListMarkerKind kind) {
        return switch (kind) {
            case NUMERIC -> OrderedMarkerScanner::readNumericSequence;
            case LETTER -> OrderedMarkerScanner::readLetterSequence;
            case CONTINUATION -> OrderedMarkerScanner::readContinuationSequence;
        };
    }

    private static MarkerMatch finalizeMarker(String text, int sequenceEnd, ListMarkerKind kind) {
        if (sequenceEnd >= text.length()) return null;

        char delimiter = text.charAt(sequenceEnd);
        if (delimiter != '.' && delimiter != ')') return null;

        int afterDelimiter = sequenceEnd + 1;
        // Whitespace (or end of line) must follow the delimiter
        if (afterDelimiter < text.length() && !Character.isWhitespace(text.charAt(afterDelimiter))) {
            return null;
        }

        int afterIndex = afterDelimiter;
        while (afterIndex < text.length() && Character.isWhitespace(text.charAt(afterIndex))) {
            afterIndex++;
        }

        return new MarkerMatch(text.substring(0, afterDelimiter), afterIndex, kind);
    }

    private static int readNumericSequence(String text) {
        int cursor = 0;
        int digitCount = 0;
        while (cursor < text.length() && Character.isDigit(text.charAt(cursor)) && digitCount < MAX_NUMERIC_DIGITS) {
            digitCount++;
            cursor++;
        }
        return digitCount > 0 ? cursor : -1;
    }

    private static int readLetterSequence(String text) {
        char letter = text.charAt(0);
        boolean ascii = (letter >= 'a' && letter <= 'z') || (letter >= 'A' && letter <= 'Z');
        return ascii ? 1 : -1;
    }

    private static int readContinuationSequence(String text) {
        return text.charAt(0) == '#' ? 1 : -1;
    }
}
