package com.astvisualizer.core.emitter;

/**
 * Counts of one emission pass.
 *
 * @param nodeCount declared nodes
 * @param edgeCount declared edges
 */
public record EmissionSummary(
    int nodeCount,
    int edgeCount
) {
}
