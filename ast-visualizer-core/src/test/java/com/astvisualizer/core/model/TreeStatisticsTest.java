package com.astvisualizer.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TreeStatistics} and {@link AstNode}.
 */
class TreeStatisticsTest {

    @Test
    void of_singleNode_hasHeightOne() {
        TreeStatistics stats = TreeStatistics.of(new AstNode("Program", "", 0));

        assertThat(stats.nodeCount()).isEqualTo(1);
        assertThat(stats.height()).isEqualTo(1);
        assertThat(stats.leafCount()).isEqualTo(1);
        assertThat(stats.kindCounts()).containsExactly(entry("Program", 1));
    }

    @Test
    void of_branchingTree_countsKindsInPreOrder() {
        AstNode root = new AstNode("Program", "", 0);
        AstNode decl = new AstNode("VarDecl", "x", 1);
        decl.appendChild(new AstNode("IntLiteral", "1", 2));
        root.appendChild(decl);
        root.appendChild(new AstNode("VarDecl", "y", 1));

        TreeStatistics stats = TreeStatistics.of(root);

        assertThat(stats.nodeCount()).isEqualTo(4);
        assertThat(stats.height()).isEqualTo(3);
        assertThat(stats.leafCount()).isEqualTo(2);
        assertThat(stats.kindCounts()).containsExactly(
            entry("Program", 1), entry("VarDecl", 2), entry("IntLiteral", 1));
    }

    @Test
    void appendChild_self_isRejected() {
        AstNode node = new AstNode("Block", "", 0);

        assertThatThrownBy(() -> node.appendChild(node)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void children_areReadOnly() {
        AstNode node = new AstNode("Block", "", 0);

        assertThatThrownBy(() -> node.children().add(new AstNode("X", "", 1)))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void astLine_negativeDepth_isRejected() {
        assertThatThrownBy(() -> new AstLine("Block", "", -1, 1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
