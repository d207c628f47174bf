package com.astvisualizer.core.model;

import java.util.Objects;

/**
 * One parsed content line of an AST dump, before tree reconstruction.
 *
 * @param kind syntax-node category (text left of the first {@code ':'})
 * @param value optional payload (text right of the first {@code ':'}), empty when absent
 * @param depth count of leading whitespace characters; tabs count as one
 * @param lineNumber 1-based line number in the original input
 */
public record AstLine(
    String kind,
    String value,
    int depth,
    int lineNumber
) {
    /**
     * Compact constructor with validation.
     */
    public AstLine {
        Objects.requireNonNull(kind, "kind must not be null");
        if (value == null) {
            value = "";
        }
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative: " + depth);
        }
    }

    /**
     * Creates the tree node for this line.
     *
     * @return a new node with no children
     */
    public AstNode toNode() {
        return new AstNode(kind, value, depth);
    }
}
