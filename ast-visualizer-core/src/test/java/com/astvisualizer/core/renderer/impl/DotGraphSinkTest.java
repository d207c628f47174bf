package com.astvisualizer.core.renderer.impl;

import com.astvisualizer.core.renderer.GraphStyle;
import com.astvisualizer.core.renderer.OutputFormat;
import com.astvisualizer.core.renderer.RenderContext;
import com.astvisualizer.core.renderer.RenderException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Tests for {@link DotGraphSink}.
 *
 * <p>Image formats run a shell script configured as the Graphviz executable, so no Graphviz
 * installation is needed.
 */
class DotGraphSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void toDot_withDefaultStyle_writesGraphHeader() {
        DotGraphSink sink = new DotGraphSink(RenderContext.defaults());

        String dot = sink.toDot();

        assertThat(dot)
            .startsWith("// Abstract Syntax Tree\ndigraph AST {\n")
            .contains("  rankdir=TB;\n")
            .contains("  node [shape=box, style=\"rounded,filled\"];\n")
            .endsWith("}\n");
    }

    @Test
    void toDot_declarations_areEmittedInOrder() {
        DotGraphSink sink = new DotGraphSink(RenderContext.defaults());

        sink.declareNode("node_0", "Program", "#e1f5ff");
        sink.declareNode("node_1", "Function\nmain", "#fff9c4");
        sink.declareEdge("node_0", "node_1");

        assertThat(sink.toDot()).contains(
            "  node_0 [label=\"Program\", fillcolor=\"#e1f5ff\"];\n"
                + "  node_1 [label=\"Function\\nmain\", fillcolor=\"#fff9c4\"];\n"
                + "  node_0 -> node_1;\n");
    }

    @Test
    void toDot_customStyle_isApplied() {
        RenderContext context = new RenderContext(new GraphStyle("LR", "ellipse", "filled", ""), Map.of());
        DotGraphSink sink = new DotGraphSink(context);

        String dot = sink.toDot();

        assertThat(dot)
            .startsWith("digraph AST {")
            .contains("rankdir=LR;")
            .contains("node [shape=ellipse, style=\"filled\"];");
    }

    @Test
    void quote_escapesSpecialCharacters() {
        assertThat(DotGraphSink.quote("StringLiteral\n\"a\\b\""))
            .isEqualTo("\"StringLiteral\\n\\\"a\\\\b\\\"\"");
    }

    @Test
    void render_dotFormat_writesSourceFile() throws RenderException, IOException {
        DotGraphSink sink = new DotGraphSink(RenderContext.defaults());
        sink.declareNode("node_0", "Program", "#e1f5ff");

        Path written = sink.render(tempDir.resolve("nested/main"), OutputFormat.DOT);

        assertThat(written).isEqualTo(tempDir.resolve("nested/main.dot"));
        assertThat(Files.readString(written)).isEqualTo(sink.toDot());
    }

    @Test
    void render_missingExecutable_throwsRenderException() {
        RenderContext context = new RenderContext(GraphStyle.defaults(),
            Map.of(RenderContext.GRAPHVIZ_EXECUTABLE, tempDir.resolve("no-such-dot").toString()));
        DotGraphSink sink = new DotGraphSink(context);
        sink.declareNode("node_0", "Program", "#e1f5ff");

        assertThatThrownBy(() -> sink.render(tempDir.resolve("main"), OutputFormat.PNG))
            .isInstanceOf(RenderException.class)
            .hasMessageContaining("Graphviz executable not available");
        assertThat(tempDir.resolve("main.png")).doesNotExist();
    }

    @Test
    void render_mermaidFormat_isRejected() {
        DotGraphSink sink = new DotGraphSink(RenderContext.defaults());

        assertThatThrownBy(() -> sink.render(tempDir.resolve("main"), OutputFormat.MERMAID))
            .isInstanceOf(RenderException.class)
            .hasMessageContaining("mermaid");
    }

    @Test
    void render_svgFormat_pipesDotSourceToExecutable() throws RenderException, IOException {
        DotGraphSink sink = sinkWithScript("cat > \"$3\"", null);
        sink.declareNode("node_0", "Program", "#e1f5ff");

        Path written = sink.render(tempDir.resolve("out/main"), OutputFormat.SVG);

        assertThat(written).isEqualTo(tempDir.resolve("out/main.svg"));
        assertThat(Files.readString(written))
            .isEqualTo(sink.toDot())
            .startsWith("// Abstract Syntax Tree\ndigraph AST {");
    }

    @Test
    void render_executableFails_reportsExitCodeAndOutput() throws IOException {
        DotGraphSink sink = sinkWithScript(
            "cat > /dev/null\necho \"syntax error in line 1\" >&2\nexit 3", null);

        assertThatThrownBy(() -> sink.render(tempDir.resolve("main"), OutputFormat.PNG))
            .isInstanceOf(RenderException.class)
            .hasMessageContaining("Graphviz exited with code 3")
            .hasMessageContaining("syntax error in line 1");
    }

    @Test
    void render_executableHangs_isKilledAfterTimeout() throws IOException {
        DotGraphSink sink = sinkWithScript("exec sleep 30", "1");

        long start = System.nanoTime();
        assertThatThrownBy(() -> sink.render(tempDir.resolve("main"), OutputFormat.PDF))
            .isInstanceOf(RenderException.class)
            .hasMessageContaining("did not finish within 1 seconds");
        assertThat(System.nanoTime() - start).isLessThan(20_000_000_000L);
    }

    @Test
    void render_afterRun_deletesProcessLog() throws IOException, RenderException {
        assumeTrue(Files.isDirectory(Path.of("/proc/self/fd")), "needs /proc to locate the process log");
        Path logPathFile = tempDir.resolve("log-path.txt");
        DotGraphSink sink = sinkWithScript(
            "readlink /proc/$$/fd/1 > \"" + logPathFile + "\"\ncat > \"$3\"", null);

        sink.render(tempDir.resolve("main"), OutputFormat.SVG);

        Path processLog = Path.of(Files.readString(logPathFile).strip());
        assertThat(processLog.getFileName().toString()).startsWith("astviz-graphviz");
        assertThat(processLog).doesNotExist();
    }

    private DotGraphSink sinkWithScript(String body, String timeoutSeconds) throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"),
            "needs a POSIX file system");
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "needs /bin/sh");

        Path script = tempDir.resolve("fake-dot.sh");
        Files.writeString(script, "#!/bin/sh\n" + body + "\n");
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwx------"));

        Map<String, String> settings = timeoutSeconds == null
            ? Map.of(RenderContext.GRAPHVIZ_EXECUTABLE, script.toString())
            : Map.of(RenderContext.GRAPHVIZ_EXECUTABLE, script.toString(),
                RenderContext.GRAPHVIZ_TIMEOUT_SECONDS, timeoutSeconds);
        return new DotGraphSink(new RenderContext(GraphStyle.defaults(), settings));
    }
}
