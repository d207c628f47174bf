package com.astvisualizer.core.renderer;

/**
 * Graph-level layout and node defaults.
 *
 * @param rankDirection layout direction ({@code TB}, {@code LR}, ...)
 * @param nodeShape default node shape
 * @param nodeStyle default node style, e.g. {@code rounded,filled}
 * @param comment graph comment
 */
public record GraphStyle(
    String rankDirection,
    String nodeShape,
    String nodeStyle,
    String comment
) {
    public static final String DEFAULT_RANK_DIRECTION = "TB";
    public static final String DEFAULT_NODE_SHAPE = "box";
    public static final String DEFAULT_NODE_STYLE = "rounded,filled";
    public static final String DEFAULT_COMMENT = "Abstract Syntax Tree";

    /**
     * Compact constructor filling in defaults for missing values.
     */
    public GraphStyle {
        if (rankDirection == null || rankDirection.isBlank()) {
            rankDirection = DEFAULT_RANK_DIRECTION;
        }
        if (nodeShape == null || nodeShape.isBlank()) {
            nodeShape = DEFAULT_NODE_SHAPE;
        }
        if (nodeStyle == null || nodeStyle.isBlank()) {
            nodeStyle = DEFAULT_NODE_STYLE;
        }
        if (comment == null) {
            comment = DEFAULT_COMMENT;
        }
    }

    public static GraphStyle defaults() {
        return new GraphStyle(null, null, null, null);
    }
}
