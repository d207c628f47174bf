package com.astvisualizer.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of a reconstructed abstract syntax tree.
 *
 * <p>The tree is a strict hierarchy: every node is owned by exactly one parent (or by the
 * caller, for the root) and holds no reference back to it. Children are kept in the order
 * their lines appeared in the dump.
 *
 * <p>The structure is only built by the parser ({@link #appendChild(AstNode)}). The display id
 * is assigned by the emitter on every emission pass and is meaningful only within that pass.
 *
 * <p>An empty {@code kind} is accepted.
 */
public final class AstNode {

    /** Display id of a node that has not been emitted yet. */
    public static final int UNASSIGNED = -1;

    private final String kind;
    private final String value;
    private final int depth;
    private final List<AstNode> children = new ArrayList<>();
    private int displayId = UNASSIGNED;

    /**
     * Creates a node with an empty child list.
     *
     * @param kind syntax-node category
     * @param value payload, {@code null} or empty for none
     * @param depth leading whitespace count of the source line
     */
    public AstNode(String kind, String value, int depth) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.value = value == null ? "" : value;
        this.depth = depth;
    }

    public String kind() {
        return kind;
    }

    public String value() {
        return value;
    }

    public boolean hasValue() {
        return !value.isEmpty();
    }

    /**
     * Returns the leading whitespace count of the source line. Only used during construction.
     *
     * @return depth of the source line
     */
    public int depth() {
        return depth;
    }

    /**
     * Returns the children in source order.
     *
     * @return unmodifiable view of the children
     */
    public List<AstNode> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Appends a child as the last one.
     *
     * @param child node to append
     */
    public void appendChild(AstNode child) {
        Objects.requireNonNull(child, "child must not be null");
        if (child == this) {
            throw new IllegalArgumentException("node cannot be its own child");
        }
        children.add(child);
    }

    public int displayId() {
        return displayId;
    }

    public void assignDisplayId(int displayId) {
        this.displayId = displayId;
    }

    @Override
    public String toString() {
        return "AstNode(" + kind + ", " + value + ", depth=" + depth + ")";
    }
}
