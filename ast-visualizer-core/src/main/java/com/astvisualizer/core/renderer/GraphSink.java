package com.astvisualizer.core.renderer;

import java.nio.file.Path;

/**
 * Receives the node/edge stream of one tree and turns it into a graphic.
 *
 * <p>A sink accumulates declarations and renders them once. Sinks are created per emission by
 * a {@link GraphBackend} and are not reused.
 *
 * @see com.astvisualizer.core.emitter.TreeEmitter
 */
public interface GraphSink {

    /**
     * Declares a node.
     *
     * @param id unique node id within this graph
     * @param label display label, may contain {@code '\n'}
     * @param color fill color, e.g. {@code #e1f5ff}
     */
    void declareNode(String id, String label, String color);

    /**
     * Declares an edge from a parent to one of its children.
     *
     * @param parentId id of a previously declared node
     * @param childId id of a previously declared node
     */
    void declareEdge(String parentId, String childId);

    /**
     * Renders the accumulated graph.
     *
     * <p>The file extension of {@code format} is appended to {@code outputBase}; missing
     * parent directories are created.
     *
     * @param outputBase output path without extension
     * @param format output format
     * @return path of the written file
     * @throws RenderException if the format is not supported or the backend fails
     */
    Path render(Path outputBase, OutputFormat format) throws RenderException;
}
