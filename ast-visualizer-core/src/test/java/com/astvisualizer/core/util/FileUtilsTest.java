package com.astvisualizer.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void listFiles_withPattern_returnsSortedTopLevelMatches() throws IOException {
        Files.writeString(tempDir.resolve("loops.ast"), "test");
        Files.writeString(tempDir.resolve("main.ast"), "test");
        Files.writeString(tempDir.resolve("main.ppx"), "test");
        Files.createDirectories(tempDir.resolve("sub"));
        Files.writeString(tempDir.resolve("sub/nested.ast"), "test");

        List<Path> files = FileUtils.listFiles(tempDir, "*.ast");

        assertThat(files).containsExactly(tempDir.resolve("loops.ast"), tempDir.resolve("main.ast"));
    }

    @Test
    void listFiles_withNoMatches_returnsEmptyList() throws IOException {
        assertThat(FileUtils.listFiles(tempDir, "*.ast")).isEmpty();
    }

    @Test
    void getExtension_returnsExtension() {
        assertThat(FileUtils.getExtension(Path.of("code/main.ast"))).isEqualTo("ast");
        assertThat(FileUtils.getExtension(Path.of("archive.tar.gz"))).isEqualTo("gz");
        assertThat(FileUtils.getExtension(Path.of("Makefile"))).isEmpty();
        assertThat(FileUtils.getExtension(Path.of(".hidden"))).isEmpty();
    }

    @Test
    void stripExtension_removesLastExtensionOnly() {
        assertThat(FileUtils.stripExtension(Path.of("code/main.ast"))).isEqualTo(Path.of("code/main"));
        assertThat(FileUtils.stripExtension(Path.of("a.b.ast"))).isEqualTo(Path.of("a.b"));
        assertThat(FileUtils.stripExtension(Path.of("out/tree"))).isEqualTo(Path.of("out/tree"));
    }

    @Test
    void withExtension_appendsExtension() {
        assertThat(FileUtils.withExtension(Path.of("out/main"), "svg")).isEqualTo(Path.of("out/main.svg"));
        assertThat(FileUtils.withExtension(Path.of("v1.2"), "png")).isEqualTo(Path.of("v1.2.png"));
    }

    @Test
    void rootPath_hasNoFileName() {
        Path root = tempDir.getRoot();

        assertThat(FileUtils.getExtension(root)).isEmpty();
        assertThat(FileUtils.stripExtension(root)).isEqualTo(root);
        assertThatThrownBy(() -> FileUtils.withExtension(root, "png"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createParentDirectories_createsMissingDirectories() throws IOException {
        Path file = tempDir.resolve("a/b/c.png");

        FileUtils.createParentDirectories(file);

        assertThat(tempDir.resolve("a/b")).isDirectory();
        assertThat(file).doesNotExist();
    }
}
