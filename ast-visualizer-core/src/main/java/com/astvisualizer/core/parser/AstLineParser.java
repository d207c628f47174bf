package com.astvisualizer.core.parser;

import com.astvisualizer.core.model.AstLine;

import java.util.Optional;

/**
 * Parses a single dump line of the form {@code <whitespace>*<kind>[':' <value>]}.
 *
 * <p>The depth is the number of leading whitespace characters. Tabs are not expanded; each
 * counts as one character. Unicode space separators such as U+00A0 count as whitespace.
 * The remainder is split on the first {@code ':'} only, so values may contain further colons
 * ({@code StringLiteral: a:b} has value {@code a:b}).
 */
public class AstLineParser {

    /** Separator between kind and value. */
    public static final char SEPARATOR = ':';

    /**
     * Parses one line.
     *
     * @param line raw line
     * @param lineNumber 1-based line number, kept for diagnostics
     * @return the parsed line, or empty when the line is blank
     */
    public Optional<AstLine> parse(String line, int lineNumber) {
        String content = trim(line);
        if (content.isEmpty()) {
            return Optional.empty();
        }

        int depth = leadingWhitespace(line);

        int separator = content.indexOf(SEPARATOR);
        if (separator < 0) {
            return Optional.of(new AstLine(content, "", depth, lineNumber));
        }

        String kind = trim(content.substring(0, separator));
        String value = trim(content.substring(separator + 1));
        return Optional.of(new AstLine(kind, value, depth, lineNumber));
    }

    /**
     * Checks whether a character is whitespace for indentation and trimming.
     *
     * @param c character to test
     * @return true for Java whitespace and Unicode space separators
     */
    static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    static int leadingWhitespace(String text) {
        int index = 0;
        while (index < text.length() && isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }

    static String trim(String text) {
        int start = leadingWhitespace(text);
        int end = text.length();
        while (end > start && isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }
}
