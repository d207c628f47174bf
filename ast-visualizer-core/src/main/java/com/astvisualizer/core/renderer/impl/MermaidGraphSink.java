package com.astvisualizer.core.renderer.impl;

import com.astvisualizer.core.renderer.GraphSink;
import com.astvisualizer.core.renderer.GraphStyle;
import com.astvisualizer.core.renderer.OutputFormat;
import com.astvisualizer.core.renderer.RenderException;
import com.astvisualizer.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Accumulates a Mermaid flowchart and writes it as Markdown.
 *
 * <p>Output is a Markdown file with an embedded {@code ```mermaid} code block, suitable for
 * rendering in GitHub, GitLab and the Mermaid Live Editor:
 * <pre>
 * # Abstract Syntax Tree
 *
 * ```mermaid
 * graph TB
 *   node_0["Program"]
 *   style node_0 fill:#e1f5ff
 *   node_1["Function&lt;br/&gt;main"]
 *   style node_1 fill:#fff9c4
 *   node_0 --&gt; node_1
 * ```
 * </pre>
 */
public class MermaidGraphSink implements GraphSink {

    private static final Logger log = LoggerFactory.getLogger(MermaidGraphSink.class);

    // Markdown formatting
    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String MARKDOWN_NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    private static final String GRAPH_KEYWORD = "graph ";
    private static final String LABEL_LINE_BREAK = "<br/>";
    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";
    private static final String NO_NODES_NODE = "  A[No nodes found]\n";

    private final GraphStyle style;
    private final StringBuilder statements = new StringBuilder();
    private int nodeCount;

    public MermaidGraphSink(GraphStyle style) {
        this.style = Objects.requireNonNull(style, "style must not be null");
    }

    @Override
    public void declareNode(String id, String label, String color) {
        String nodeId = sanitizeId(id);
        statements.append("  ").append(nodeId).append("[\"").append(escape(label)).append("\"]")
            .append(MARKDOWN_NEWLINE);
        statements.append("  style ").append(nodeId).append(" fill:").append(color)
            .append(MARKDOWN_NEWLINE);
        nodeCount++;
    }

    @Override
    public void declareEdge(String parentId, String childId) {
        statements.append("  ").append(sanitizeId(parentId)).append(" --> ").append(sanitizeId(childId))
            .append(MARKDOWN_NEWLINE);
    }

    /**
     * Returns the Markdown document for the declarations so far.
     *
     * @return Markdown with an embedded Mermaid flowchart
     */
    public String toMarkdown() {
        StringBuilder sb = new StringBuilder();
        String title = style.comment().isBlank() ? GraphStyle.DEFAULT_COMMENT : style.comment();
        sb.append(MARKDOWN_HEADER_PREFIX).append(title).append(MARKDOWN_NEWLINE.repeat(2));
        sb.append(CODE_BLOCK_START);
        sb.append(GRAPH_KEYWORD).append(style.rankDirection().toUpperCase(Locale.ROOT)).append(MARKDOWN_NEWLINE);
        if (nodeCount == 0) {
            sb.append(NO_NODES_NODE);
        } else {
            sb.append(statements);
        }
        sb.append(CODE_BLOCK_END);
        return sb.toString();
    }

    @Override
    public Path render(Path outputBase, OutputFormat format) throws RenderException {
        Objects.requireNonNull(outputBase, "outputBase must not be null");
        if (format != OutputFormat.MERMAID) {
            throw new RenderException("Mermaid backend cannot render format: " + format.token());
        }

        Path target = FileUtils.withExtension(outputBase, format.extension());
        try {
            FileUtils.createParentDirectories(target);
            Files.writeString(target, toMarkdown(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RenderException("Failed to write Mermaid file: " + target, e);
        }

        log.info("Wrote {} ({} nodes)", target, nodeCount);
        return target;
    }

    private String sanitizeId(String id) {
        if (id == null) {
            return "unknown";
        }
        return id.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }

    /**
     * Escapes label text for a quoted Mermaid label. Quotes and angle brackets become the
     * entity codes {@code #quot;}, {@code #lt;} and {@code #gt;}; line breaks become {@code <br/>}.
     */
    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text
            .replace("\"", "#quot;")
            .replace("<", "#lt;")
            .replace(">", "#gt;")
            .replace("\r", "")
            .replace("\n", LABEL_LINE_BREAK);
    }
}
