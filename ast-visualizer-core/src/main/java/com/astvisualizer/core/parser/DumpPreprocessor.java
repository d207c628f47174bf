package com.astvisualizer.core.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Locates the first content line of an AST dump.
 *
 * <p>Dumps written by the compiler start with a banner such as:
 * <pre>
 * === PiPiXia AST Output ===
 * Source: code/main.ppx
 *
 * Program
 *   ...
 * </pre>
 * The leading run of blank lines and header lines (trimmed text starting with {@code ===}
 * or {@code Source:}) is discarded. Discarding stops at the first other line; header-looking
 * lines further down are content.
 */
public class DumpPreprocessor {

    private static final Logger log = LoggerFactory.getLogger(DumpPreprocessor.class);

    /** Banner lines are made of a repeated delimiter. */
    public static final String DELIMITER_MARKER = "===";

    /** Provenance line naming the dumped source file. */
    public static final String SOURCE_MARKER = "Source:";

    /**
     * Returns the index of the first content line.
     *
     * @param lines raw input lines
     * @return index of the first line that is neither blank nor a header,
     *         or {@code lines.size()} when there is none
     */
    public int firstContentIndex(List<String> lines) {
        Objects.requireNonNull(lines, "lines must not be null");

        int index = 0;
        while (index < lines.size() && isSkippable(lines.get(index))) {
            index++;
        }
        if (index > 0) {
            log.debug("Skipped {} leading header/blank lines", index);
        }
        return index;
    }

    /**
     * Checks whether a line belongs to the leading header block.
     *
     * @param line raw line
     * @return true for blank lines and header lines
     */
    public boolean isSkippable(String line) {
        return isBlank(line) || isHeader(line);
    }

    /**
     * Checks whether a line is a header line.
     *
     * @param line raw line
     * @return true if the trimmed line starts with a header marker
     */
    public boolean isHeader(String line) {
        String stripped = AstLineParser.trim(line);
        return stripped.startsWith(DELIMITER_MARKER) || stripped.startsWith(SOURCE_MARKER);
    }

    public boolean isBlank(String line) {
        return AstLineParser.trim(line).isEmpty();
    }
}
