package com.astvisualizer.core.renderer;

/**
 * Thrown when a backend cannot render a graph, e.g. because the Graphviz executable
 * is missing or the format is not supported.
 */
public class RenderException extends Exception {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
