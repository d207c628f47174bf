package com.astvisualizer.core.emitter;

import com.astvisualizer.core.model.AstNode;
import com.astvisualizer.core.parser.IndentationTreeParser;
import com.astvisualizer.core.renderer.RecordingGraphSink.EdgeEvent;
import com.astvisualizer.core.renderer.RecordingGraphSink.NodeEvent;
import com.astvisualizer.core.renderer.RecordingGraphSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TreeEmitter}.
 */
class TreeEmitterTest {

    private TreeEmitter emitter;
    private IndentationTreeParser parser;

    @BeforeEach
    void setUp() {
        emitter = new TreeEmitter();
        parser = new IndentationTreeParser();
    }

    @Test
    void emit_assignsIdsInPreOrder() {
        AstNode root = parse(
            "Program",
            " Function: main",
            "  Block",
            " Function: helper");
        RecordingGraphSink sink = new RecordingGraphSink();

        EmissionSummary summary = emitter.emit(root, sink);

        assertThat(sink.nodes()).extracting(NodeEvent::id, NodeEvent::label).containsExactly(
            tuple("node_0", "Program"),
            tuple("node_1", "Function\nmain"),
            tuple("node_2", "Block"),
            tuple("node_3", "Function\nhelper"));
        assertThat(sink.edges()).containsExactly(
            new EdgeEvent("node_0", "node_1"),
            new EdgeEvent("node_1", "node_2"),
            new EdgeEvent("node_0", "node_3"));
        assertThat(summary).isEqualTo(new EmissionSummary(4, 3));
        assertThat(root.displayId()).isZero();
    }

    @Test
    void emit_declaresNodeBeforeItsIncomingEdge() {
        AstNode root = parse("Program", " Block");
        RecordingGraphSink sink = new RecordingGraphSink();

        emitter.emit(root, sink);

        assertThat(sink.events()).containsExactly(
            new NodeEvent("node_0", "Program", "#e1f5ff"),
            new NodeEvent("node_1", "Block", "#f3e5f5"),
            new EdgeEvent("node_0", "node_1"));
    }

    @Test
    void emit_unknownKind_usesDefaultColor() {
        RecordingGraphSink sink = new RecordingGraphSink();

        emitter.emit(parse("CallExpr: print"), sink);

        assertThat(sink.nodes()).containsExactly(
            new NodeEvent("node_0", "CallExpr\nprint", NodeColorScheme.DEFAULT_COLOR));
    }

    @Test
    void emit_customScheme_isUsed() {
        TreeEmitter custom = new TreeEmitter(
            NodeColorScheme.defaults().withOverrides(Map.of("Program", "#000000"), "#ffffff"));
        RecordingGraphSink sink = new RecordingGraphSink();

        custom.emit(parse("Program", " Unknown"), sink);

        assertThat(sink.nodes()).extracting(NodeEvent::color).containsExactly("#000000", "#ffffff");
    }

    @Test
    void emit_sameTreeTwice_producesSameEvents() {
        AstNode root = parse(
            "Program",
            " VarDecl: x",
            "  IntLiteral: 1",
            " ReturnStmt",
            "  Identifier: x");
        RecordingGraphSink first = new RecordingGraphSink();
        RecordingGraphSink second = new RecordingGraphSink();

        emitter.emit(root, first);
        emitter.emit(root, second);

        assertThat(second.events()).isEqualTo(first.events());
    }

    @Test
    void emit_veryDeepTree_doesNotOverflowStack() {
        AstNode root = new AstNode("Program", "", 0);
        AstNode current = root;
        for (int i = 1; i <= 100_000; i++) {
            AstNode child = new AstNode("Block", "", i);
            current.appendChild(child);
            current = child;
        }
        RecordingGraphSink sink = new RecordingGraphSink();

        EmissionSummary summary = emitter.emit(root, sink);

        assertThat(summary.nodeCount()).isEqualTo(100_001);
        assertThat(summary.edgeCount()).isEqualTo(100_000);
        assertThat(sink.edges().get(99_999)).isEqualTo(new EdgeEvent("node_99999", "node_100000"));
    }

    @Test
    void label_withoutValue_isKindOnly() {
        assertThat(TreeEmitter.label(new AstNode("Block", "", 0))).isEqualTo("Block");
        assertThat(TreeEmitter.label(new AstNode("IntLiteral", "42", 0))).isEqualTo("IntLiteral\n42");
    }

    @Test
    void displayId_beforeEmission_throws() {
        AstNode node = new AstNode("Block", null, 0);

        assertThatThrownBy(() -> TreeEmitter.displayId(node))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("not been emitted");
    }

    private AstNode parse(String... lines) {
        return parser.parse(List.of(lines)).orElseThrow();
    }
}
