package com.astvisualizer.core.report;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One Markdown report page.
 *
 * @param fileName file name relative to the report directory, e.g. {@code main.md}
 * @param content Markdown text
 */
public record ReportFile(
    String fileName,
    String content
) {
    /**
     * Compact constructor with validation.
     */
    public ReportFile {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (fileName.isBlank()) {
            throw new IllegalArgumentException("fileName must not be blank");
        }
        Path path = Path.of(fileName);
        if (path.isAbsolute() || path.normalize().startsWith("..")) {
            throw new IllegalArgumentException("fileName must stay inside the report directory: " + fileName);
        }
    }
}
