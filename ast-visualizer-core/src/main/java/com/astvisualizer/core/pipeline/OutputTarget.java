package com.astvisualizer.core.pipeline;

import com.astvisualizer.core.renderer.OutputFormat;
import com.astvisualizer.core.util.FileUtils;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Where and in which format a tree is rendered.
 *
 * @param base output path without extension
 * @param format output format
 */
public record OutputTarget(
    Path base,
    OutputFormat format
) {
    /**
     * Compact constructor with validation.
     */
    public OutputTarget {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(format, "format must not be null");
    }

    /**
     * Returns the file the backend writes.
     *
     * @return base path with the format's extension
     */
    public Path file() {
        return FileUtils.withExtension(base, format.extension());
    }

    /**
     * Infers the output target from the optional second command-line argument.
     *
     * <ul>
     *   <li>absent: {@code defaultFormat}, next to the input ({@code main.ast} to {@code main.png})</li>
     *   <li>a format token ({@code png}, {@code svg}, {@code pdf}, {@code dot}, {@code mermaid}):
     *       that format, next to the input</li>
     *   <li>anything else is an output file path: its extension selects the format,
     *       {@code png} when it has none</li>
     * </ul>
     *
     * @param input input dump path
     * @param formatOrPath second argument, may be null
     * @param defaultFormat format used when the argument is absent
     * @return resolved target
     * @throws ConversionException with {@link ConversionError#RENDER_ERROR} for an unsupported extension
     *         or an output path without a file name
     */
    public static OutputTarget resolve(Path input, String formatOrPath, OutputFormat defaultFormat)
            throws ConversionException {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(defaultFormat, "defaultFormat must not be null");

        if (input.getFileName() == null) {
            throw new ConversionException(ConversionError.RENDER_ERROR, "Input path has no file name: " + input);
        }
        Path besideInput = FileUtils.stripExtension(input);
        if (formatOrPath == null || formatOrPath.isBlank()) {
            return new OutputTarget(besideInput, defaultFormat);
        }

        Optional<OutputFormat> token = OutputFormat.fromToken(formatOrPath);
        if (token.isPresent()) {
            return new OutputTarget(besideInput, token.get());
        }

        Path outputPath = Path.of(formatOrPath);
        if (outputPath.getFileName() == null) {
            throw new ConversionException(ConversionError.RENDER_ERROR,
                "Output path has no file name: " + formatOrPath);
        }
        String extension = FileUtils.getExtension(outputPath);
        if (extension.isEmpty()) {
            return new OutputTarget(outputPath, OutputFormat.PNG);
        }

        OutputFormat format = OutputFormat.fromExtension(extension)
            .orElseThrow(() -> new ConversionException(ConversionError.RENDER_ERROR,
                "Unsupported output format: " + extension));
        return new OutputTarget(FileUtils.stripExtension(outputPath), format);
    }
}
