package com.astvisualizer.core.renderer.impl;

import com.astvisualizer.core.renderer.GraphSink;
import com.astvisualizer.core.renderer.GraphStyle;
import com.astvisualizer.core.renderer.OutputFormat;
import com.astvisualizer.core.renderer.RenderContext;
import com.astvisualizer.core.renderer.RenderException;
import com.astvisualizer.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Accumulates a Graphviz {@code digraph} and renders it.
 *
 * <p>{@link OutputFormat#DOT} writes the DOT source itself. Image formats pipe the source into
 * {@code dot -T<format> -o <file>}; the intermediate source is not kept on disk.
 *
 * <p><b>Generated source:</b>
 * <pre>
 * // Abstract Syntax Tree
 * digraph AST {
 *   rankdir=TB;
 *   node [shape=box, style="rounded,filled"];
 *   node_0 [label="Program", fillcolor="#e1f5ff"];
 *   node_1 [label="Function\nmain", fillcolor="#fff9c4"];
 *   node_0 -&gt; node_1;
 * }
 * </pre>
 */
public class DotGraphSink implements GraphSink {

    private static final Logger log = LoggerFactory.getLogger(DotGraphSink.class);

    private static final String DEFAULT_EXECUTABLE = "dot";
    private static final long DEFAULT_TIMEOUT_SECONDS = 60;

    private static final String GRAPH_NAME = "AST";
    private static final String INDENT = "  ";
    private static final String NEWLINE = "\n";

    private final GraphStyle style;
    private final String executable;
    private final long timeoutSeconds;
    private final StringBuilder statements = new StringBuilder();
    private int nodeCount;
    private int edgeCount;

    public DotGraphSink(RenderContext context) {
        Objects.requireNonNull(context, "context must not be null");
        this.style = context.style();
        this.executable = context.getSettingOrDefault(RenderContext.GRAPHVIZ_EXECUTABLE, DEFAULT_EXECUTABLE);
        this.timeoutSeconds = parseTimeout(context.getSetting(RenderContext.GRAPHVIZ_TIMEOUT_SECONDS));
    }

    @Override
    public void declareNode(String id, String label, String color) {
        statements.append(INDENT).append(quoteId(id))
            .append(" [label=").append(quote(label))
            .append(", fillcolor=").append(quote(color))
            .append("];").append(NEWLINE);
        nodeCount++;
    }

    @Override
    public void declareEdge(String parentId, String childId) {
        statements.append(INDENT).append(quoteId(parentId))
            .append(" -> ").append(quoteId(childId))
            .append(";").append(NEWLINE);
        edgeCount++;
    }

    /**
     * Returns the DOT source of the declarations so far.
     *
     * @return complete {@code digraph} source
     */
    public String toDot() {
        StringBuilder sb = new StringBuilder();
        if (!style.comment().isEmpty()) {
            sb.append("// ").append(style.comment().replace('\n', ' ')).append(NEWLINE);
        }
        sb.append("digraph ").append(GRAPH_NAME).append(" {").append(NEWLINE);
        sb.append(INDENT).append("rankdir=").append(quoteId(style.rankDirection())).append(";").append(NEWLINE);
        sb.append(INDENT).append("node [shape=").append(quoteId(style.nodeShape()))
            .append(", style=").append(quote(style.nodeStyle())).append("];").append(NEWLINE);
        sb.append(statements);
        sb.append("}").append(NEWLINE);
        return sb.toString();
    }

    @Override
    public Path render(Path outputBase, OutputFormat format) throws RenderException {
        Objects.requireNonNull(outputBase, "outputBase must not be null");
        Objects.requireNonNull(format, "format must not be null");
        if (format == OutputFormat.MERMAID) {
            throw new RenderException("Graphviz backend cannot render format: " + format.token());
        }

        Path target = FileUtils.withExtension(outputBase, format.extension());
        log.debug("Rendering {} nodes and {} edges to {}", nodeCount, edgeCount, target);

        try {
            FileUtils.createParentDirectories(target);
        } catch (IOException e) {
            throw new RenderException("Failed to create output directory for: " + target, e);
        }

        String source = toDot();
        if (format == OutputFormat.DOT) {
            writeSource(source, target);
        } else {
            runGraphviz(source, target, format);
        }

        log.info("Wrote {} ({} nodes)", target, nodeCount);
        return target;
    }

    private void writeSource(String source, Path target) throws RenderException {
        try {
            Files.writeString(target, source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RenderException("Failed to write DOT file: " + target, e);
        }
    }

    private void runGraphviz(String source, Path target, OutputFormat format) throws RenderException {
        List<String> command = List.of(executable, "-T" + format.token(), "-o", target.toString());
        log.debug("Running: {}", String.join(" ", command));

        Path processLog;
        try {
            processLog = Files.createTempFile("astviz-graphviz", ".log");
        } catch (IOException e) {
            throw new RenderException("Failed to create Graphviz log file", e);
        }

        try {
            Process process = startProcess(command, processLog);
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(source.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                process.destroyForcibly();
                throw new RenderException("Failed to send graph to Graphviz: " + readLog(processLog), e);
            }

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new RenderException("Graphviz did not finish within " + timeoutSeconds + " seconds");
            }
            if (process.exitValue() != 0) {
                throw new RenderException("Graphviz exited with code " + process.exitValue()
                    + ": " + readLog(processLog));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderException("Interrupted while waiting for Graphviz", e);
        } finally {
            deleteLog(processLog);
        }
    }

    private Process startProcess(List<String> command, Path processLog) throws RenderException {
        try {
            return new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(processLog.toFile())
                .start();
        } catch (IOException e) {
            throw new RenderException("Graphviz executable not available: " + executable
                + " (install Graphviz or set " + RenderContext.GRAPHVIZ_EXECUTABLE + ")", e);
        }
    }

    private String readLog(Path processLog) {
        try {
            return Files.readString(processLog, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            log.debug("Could not read Graphviz output: {}", e.getMessage());
            return "(no output)";
        }
    }

    private void deleteLog(Path processLog) {
        try {
            Files.deleteIfExists(processLog);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", processLog, e.getMessage());
        }
    }

    private static long parseTimeout(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_TIMEOUT_SECONDS;
        }
        try {
            long parsed = Long.parseLong(value.strip());
            return parsed > 0 ? parsed : DEFAULT_TIMEOUT_SECONDS;
        } catch (NumberFormatException e) {
            log.warn("Invalid {} '{}', using {}", RenderContext.GRAPHVIZ_TIMEOUT_SECONDS, value,
                DEFAULT_TIMEOUT_SECONDS);
            return DEFAULT_TIMEOUT_SECONDS;
        }
    }

    /**
     * Quotes a DOT identifier unless it is a plain alphanumeric id.
     */
    private static String quoteId(String id) {
        return id.matches("[A-Za-z_][A-Za-z0-9_]*") ? id : quote(id);
    }

    /**
     * Quotes a DOT string, escaping backslashes, quotes and line breaks.
     */
    static String quote(String text) {
        String escaped = text
            .replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\r", "")
            .replace("\n", "\\n");
        return "\"" + escaped + "\"";
    }
}
