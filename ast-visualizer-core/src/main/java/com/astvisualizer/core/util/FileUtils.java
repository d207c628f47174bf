package com.astvisualizer.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file and path operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Lists regular files directly inside a directory whose names match a glob pattern,
     * sorted by file name.
     *
     * <p>Example pattern: {@code *.ast}.
     *
     * @param directory directory to list (not recursive)
     * @param globPattern glob pattern applied to the file name
     * @return sorted list of matching paths
     * @throws IOException if the directory cannot be listed
     */
    public static List<Path> listFiles(Path directory, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.list(directory)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(path.getFileName()))
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .toList();
        }
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return "";
        }
        String fileName = name.toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Removes the last extension from a path ({@code out/main.ast} becomes {@code out/main}).
     *
     * @param path file path
     * @return path without extension, or the path itself if it has none
     */
    public static Path stripExtension(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return path;
        }
        String fileName = name.toString();
        int lastDot = fileName.lastIndexOf('.');
        if (lastDot <= 0) {
            return path;
        }
        return path.resolveSibling(fileName.substring(0, lastDot));
    }

    /**
     * Appends an extension to a path ({@code out/main} + {@code png} is {@code out/main.png}).
     *
     * @param base path without extension
     * @param extension extension without dot
     * @return path with extension
     * @throws IllegalArgumentException if the path has no file name, such as a root directory
     */
    public static Path withExtension(Path base, String extension) {
        Path name = base.getFileName();
        if (name == null) {
            throw new IllegalArgumentException("Path has no file name: " + base);
        }
        return base.resolveSibling(name + "." + extension);
    }

    /**
     * Creates the parent directory of a file if it is missing.
     *
     * @param file file about to be written
     * @throws IOException if the directory cannot be created
     */
    public static void createParentDirectories(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
