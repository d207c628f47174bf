package com.astvisualizer.core.renderer;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Output formats a rendered tree can be written in.
 */
public enum OutputFormat {
    /** Raster image rendered by Graphviz */
    PNG("png", "png"),

    /** Vector image rendered by Graphviz */
    SVG("svg", "svg"),

    /** PDF document rendered by Graphviz */
    PDF("pdf", "pdf"),

    /** Graphviz DOT source */
    DOT("dot", "dot"),

    /** Mermaid flowchart embedded in Markdown */
    MERMAID("mermaid", "md");

    private final String token;
    private final String extension;

    OutputFormat(String token, String extension) {
        this.token = token;
        this.extension = extension;
    }

    /**
     * Returns the command-line token for this format.
     *
     * @return lowercase token, e.g. {@code png}
     */
    public String token() {
        return token;
    }

    /**
     * Returns the file extension for this format.
     *
     * @return extension without leading dot
     */
    public String extension() {
        return extension;
    }

    /**
     * Resolves a format token, ignoring case.
     *
     * @param token format token such as {@code svg}
     * @return matching format, or empty if unknown
     */
    public static Optional<OutputFormat> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(f -> f.token.equals(normalized))
            .findFirst();
    }

    /**
     * Resolves a file extension, ignoring case.
     *
     * @param extension extension without leading dot, e.g. {@code md}
     * @return matching format, or empty if unknown
     */
    public static Optional<OutputFormat> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(f -> f.extension.equals(normalized))
            .findFirst();
    }
}
