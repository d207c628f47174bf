package com.astvisualizer.core.parser;

import com.astvisualizer.core.model.AstNode;

import java.util.List;
import java.util.Optional;

/**
 * Result of reconstructing a tree from a dump.
 *
 * @param root the root node, empty when the dump had no content lines
 * @param recordCount number of content lines that produced a node
 * @param detached nodes that found no open ancestor and were left out of the tree,
 *                 together with everything later attached below them
 */
public record ParseOutcome(
    Optional<AstNode> root,
    int recordCount,
    List<AstNode> detached
) {
    /**
     * Compact constructor with validation.
     */
    public ParseOutcome {
        if (root == null) {
            root = Optional.empty();
        }
        detached = detached == null ? List.of() : List.copyOf(detached);
    }

    public static ParseOutcome empty() {
        return new ParseOutcome(Optional.empty(), 0, List.of());
    }

    public boolean hasRoot() {
        return root.isPresent();
    }
}
