package com.astvisualizer.core.model;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Shape metrics of a reconstructed tree.
 *
 * <p>Used in reports and verbose logging.
 *
 * @param nodeCount number of nodes reachable from the root
 * @param height number of levels (a single root has height 1)
 * @param leafCount number of nodes without children
 * @param kindCounts occurrences per kind, in order of first pre-order appearance
 */
public record TreeStatistics(
    int nodeCount,
    int height,
    int leafCount,
    Map<String, Integer> kindCounts
) {
    /**
     * Compact constructor with validation.
     */
    public TreeStatistics {
        if (kindCounts == null) {
            kindCounts = Map.of();
        }
        kindCounts = Collections.unmodifiableMap(new LinkedHashMap<>(kindCounts));
    }

    /**
     * Computes statistics for the tree below {@code root}.
     *
     * @param root root node
     * @return statistics of the tree
     */
    public static TreeStatistics of(AstNode root) {
        Objects.requireNonNull(root, "root must not be null");

        int nodes = 0;
        int leaves = 0;
        int height = 0;
        Map<String, Integer> kinds = new LinkedHashMap<>();

        Deque<Level> stack = new ArrayDeque<>();
        stack.push(new Level(root, 1));
        while (!stack.isEmpty()) {
            Level current = stack.pop();
            AstNode node = current.node();
            nodes++;
            height = Math.max(height, current.level());
            kinds.merge(node.kind(), 1, Integer::sum);
            if (node.isLeaf()) {
                leaves++;
            }
            for (int i = node.children().size() - 1; i >= 0; i--) {
                stack.push(new Level(node.children().get(i), current.level() + 1));
            }
        }
        return new TreeStatistics(nodes, height, leaves, kinds);
    }

    private record Level(AstNode node, int level) {
    }
}
