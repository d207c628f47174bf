package com.astvisualizer.core.pipeline;

import com.astvisualizer.core.model.TreeStatistics;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of a successful conversion.
 *
 * @param input converted dump
 * @param output written file
 * @param statistics shape of the rendered tree
 * @param unreachableLines content lines left out of the tree because they had no enclosing node
 */
public record ConversionResult(
    Path input,
    Path output,
    TreeStatistics statistics,
    int unreachableLines
) {
    /**
     * Compact constructor with validation.
     */
    public ConversionResult {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(output, "output must not be null");
        Objects.requireNonNull(statistics, "statistics must not be null");
    }
}
