package com.astvisualizer.core.parser;

import com.astvisualizer.core.model.AstNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link IndentationTreeParser}.
 */
class IndentationTreeParserTest {

    private IndentationTreeParser parser;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        parser = new IndentationTreeParser();
    }

    @Test
    void parse_linearChain_buildsSingleBranch() {
        AstNode root = parser.parse(List.of(
            "Program",
            " Function: main",
            "  Block",
            "   ReturnStmt")).orElseThrow();

        assertThat(root.kind()).isEqualTo("Program");
        AstNode function = single(root);
        assertThat(function.kind()).isEqualTo("Function");
        assertThat(function.value()).isEqualTo("main");
        AstNode block = single(function);
        assertThat(block.kind()).isEqualTo("Block");
        AstNode ret = single(block);
        assertThat(ret.kind()).isEqualTo("ReturnStmt");
        assertThat(ret.isLeaf()).isTrue();
        assertThat(List.of(root.depth(), function.depth(), block.depth(), ret.depth()))
            .containsExactly(0, 1, 2, 3);
    }

    @Test
    void parse_siblings_keepsInputOrder() {
        AstNode root = parser.parse(List.of(
            "Program",
            " VarDecl: x",
            " VarDecl: y")).orElseThrow();

        assertThat(root.children())
            .extracting(AstNode::kind, AstNode::value)
            .containsExactly(tuple("VarDecl", "x"), tuple("VarDecl", "y"));
    }

    @Test
    void parse_noBreakSpaceIndentedChild_attachesToRoot() {
        AstNode root = parser.parse(List.of(
            "Program",
            "\u00A0Block")).orElseThrow();

        assertThat(root.children()).extracting(AstNode::kind).containsExactly("Block");
    }

    @Test
    void parse_irregularDedent_attachesToNearestShallowerAncestor() {
        AstNode root = parser.parse(List.of(
            "Program",
            "    Block",
            " IfStmt")).orElseThrow();

        assertThat(root.children()).extracting(AstNode::kind).containsExactly("Block", "IfStmt");
        assertThat(root.children().get(0).isLeaf()).isTrue();
    }

    @Test
    void parse_indentedFirstLine_leavesShallowerLineDetached() {
        ParseOutcome outcome = parser.parseDetailed(List.of(
            "  Program",
            "Identifier: x"));

        AstNode root = outcome.root().orElseThrow();
        assertThat(root.kind()).isEqualTo("Program");
        assertThat(root.depth()).isEqualTo(2);
        assertThat(root.isLeaf()).isTrue();
        assertThat(outcome.recordCount()).isEqualTo(2);
        assertThat(outcome.detached()).extracting(AstNode::kind).containsExactly("Identifier");
    }

    @Test
    void parse_linesBelowDetachedNode_attachToItNotToRoot() {
        ParseOutcome outcome = parser.parseDetailed(List.of(
            " Program",
            "Orphan",
            "  Child"));

        assertThat(outcome.root().orElseThrow().isLeaf()).isTrue();
        assertThat(outcome.detached()).hasSize(1);
        assertThat(outcome.detached().get(0).children()).extracting(AstNode::kind).containsExactly("Child");
    }

    @Test
    void parse_withHeaderBanner_ignoresHeader() {
        AstNode root = parser.parse("""
            === PiPiXia AST Output ===
            Source: code/main.ppx

            Program
              Function: main
            """).orElseThrow();

        assertThat(root.kind()).isEqualTo("Program");
        assertThat(root.children()).extracting(AstNode::value).containsExactly("main");
    }

    @Test
    void parse_blankLinesBetweenContent_areSkipped() {
        AstNode root = parser.parse(List.of(
            "Program",
            "",
            "  VarDecl: a",
            "   ",
            "  VarDecl: b")).orElseThrow();

        assertThat(root.children()).extracting(AstNode::value).containsExactly("a", "b");
    }

    @Test
    void parse_lineWithoutSeparator_hasEmptyValue() {
        AstNode root = parser.parse(List.of("Program")).orElseThrow();

        assertThat(root.value()).isEmpty();
        assertThat(root.hasValue()).isFalse();
    }

    @Test
    void parse_emptyInput_returnsNoRoot() {
        assertThat(parser.parse(List.of())).isEmpty();
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parseDetailed(List.of("", "   ")).hasRoot()).isFalse();
    }

    @Test
    void parse_onlyHeader_returnsNoRoot() {
        assertThat(parser.parse(List.of("=== AST ===", "Source: x.ppx", ""))).isEmpty();
    }

    @Test
    void parse_tabIndentation_nestsByCharacterCount() {
        AstNode root = parser.parse(List.of(
            "Program",
            "\tBlock",
            "\t\tReturnStmt")).orElseThrow();

        assertThat(single(single(root)).kind()).isEqualTo("ReturnStmt");
    }

    @Test
    void parse_everyChildIsDeeperThanItsParent() {
        AstNode root = parser.parse(List.of(
            "Program",
            "   Function: f",
            "        Block",
            "     VarDecl: x",
            "       IntLiteral: 1",
            "  Function: g",
            "   Block")).orElseThrow();

        List<AstNode> pending = new ArrayList<>(List.of(root));
        while (!pending.isEmpty()) {
            AstNode node = pending.remove(pending.size() - 1);
            for (AstNode child : node.children()) {
                assertThat(child.depth()).isGreaterThan(node.depth());
                pending.add(child);
            }
        }
    }

    @Test
    void parse_sameInputTwice_producesSameShape() {
        List<String> lines = List.of(
            "Program",
            " Function: main",
            "  Block",
            "   IfStmt",
            "    BinaryOp: <",
            "     Identifier: i",
            "     IntLiteral: 10",
            " Function: helper");

        AstNode first = parser.parse(lines).orElseThrow();
        AstNode second = parser.parse(lines).orElseThrow();

        assertThat(shape(second)).isEqualTo(shape(first));
    }

    @Test
    void parseFile_readsUtf8Dump() throws IOException {
        Path dump = tempDir.resolve("main.ast");
        Files.writeString(dump, "Program\n  StringLiteral: héllo\n");

        ParseOutcome outcome = parser.parseFile(dump);

        assertThat(outcome.recordCount()).isEqualTo(2);
        assertThat(single(outcome.root().orElseThrow()).value()).isEqualTo("héllo");
    }

    private static AstNode single(AstNode node) {
        assertThat(node.children()).hasSize(1);
        return node.children().get(0);
    }

    private static String shape(AstNode node) {
        StringBuilder sb = new StringBuilder();
        sb.append('(').append(node.kind()).append(':').append(node.value());
        for (AstNode child : node.children()) {
            sb.append(shape(child));
        }
        return sb.append(')').toString();
    }
}
