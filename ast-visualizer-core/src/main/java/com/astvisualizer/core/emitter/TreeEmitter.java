package com.astvisualizer.core.emitter;

import com.astvisualizer.core.model.AstNode;
import com.astvisualizer.core.renderer.GraphSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Streams a tree into a {@link GraphSink} in pre-order.
 *
 * <p>For each visited node, in order:
 * <ol>
 *   <li>assign the next display id (0, 1, 2, ... in visitation order)</li>
 *   <li>build the label: the kind, or kind and value separated by a line break</li>
 *   <li>look up the fill color by kind</li>
 *   <li>declare the node</li>
 *   <li>declare the edge from the parent, unless the node is the root</li>
 * </ol>
 * A child's whole subtree is emitted before its next sibling.
 *
 * <p>The traversal uses an explicit stack so degenerate, very deep trees cannot overflow the
 * call stack. Ids restart at 0 on every call; emitting the same tree twice produces the same
 * events.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * GraphSink sink = backend.newSink(RenderContext.defaults());
 * new TreeEmitter(NodeColorScheme.defaults()).emit(root, sink);
 * sink.render(Path.of("out/main"), OutputFormat.SVG);
 * }</pre>
 */
public class TreeEmitter {

    private static final Logger log = LoggerFactory.getLogger(TreeEmitter.class);

    /** Prefix of the node ids handed to the sink. */
    public static final String ID_PREFIX = "node_";

    /** Separator between kind and value in labels. */
    public static final String LABEL_SEPARATOR = "\n";

    private final NodeColorScheme colorScheme;

    public TreeEmitter() {
        this(NodeColorScheme.defaults());
    }

    public TreeEmitter(NodeColorScheme colorScheme) {
        this.colorScheme = Objects.requireNonNull(colorScheme, "colorScheme must not be null");
    }

    /**
     * Emits every node and edge reachable from {@code root}.
     *
     * @param root tree root
     * @param sink receiver of the declarations
     * @return node and edge counts
     */
    public EmissionSummary emit(AstNode root, GraphSink sink) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(sink, "sink must not be null");

        int nextId = 0;
        int edges = 0;

        Deque<Visit> pending = new ArrayDeque<>();
        pending.push(new Visit(root, null));

        while (!pending.isEmpty()) {
            Visit visit = pending.pop();
            AstNode node = visit.node();

            node.assignDisplayId(nextId++);
            String id = displayId(node);

            sink.declareNode(id, label(node), colorScheme.colorFor(node.kind()));
            if (visit.parentId() != null) {
                sink.declareEdge(visit.parentId(), id);
                edges++;
            }

            List<AstNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(new Visit(children.get(i), id));
            }
        }

        log.debug("Emitted {} nodes and {} edges", nextId, edges);
        return new EmissionSummary(nextId, edges);
    }

    /**
     * Builds the display label of a node.
     *
     * @param node the node
     * @return kind alone, or kind and value joined by {@link #LABEL_SEPARATOR}
     */
    public static String label(AstNode node) {
        return node.hasValue() ? node.kind() + LABEL_SEPARATOR + node.value() : node.kind();
    }

    /**
     * Returns the sink id of an emitted node.
     *
     * @param node a node that has been emitted
     * @return id such as {@code node_3}
     */
    public static String displayId(AstNode node) {
        if (node.displayId() == AstNode.UNASSIGNED) {
            throw new IllegalStateException("Node has not been emitted: " + node);
        }
        return ID_PREFIX + node.displayId();
    }

    private record Visit(AstNode node, String parentId) {
    }
}
