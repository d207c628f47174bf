package com.astvisualizer.core.renderer.impl;

import com.astvisualizer.core.renderer.GraphBackend;
import com.astvisualizer.core.renderer.GraphSink;
import com.astvisualizer.core.renderer.OutputFormat;
import com.astvisualizer.core.renderer.RenderContext;

import java.util.Set;

/**
 * Backend producing Graphviz DOT source, rendered to images by the {@code dot} executable.
 *
 * @see DotGraphSink
 */
public class GraphvizBackend implements GraphBackend {

    @Override
    public String getId() {
        return "graphviz";
    }

    @Override
    public String getDisplayName() {
        return "Graphviz Backend";
    }

    @Override
    public Set<OutputFormat> getSupportedFormats() {
        return Set.of(OutputFormat.PNG, OutputFormat.SVG, OutputFormat.PDF, OutputFormat.DOT);
    }

    @Override
    public GraphSink newSink(RenderContext context) {
        return new DotGraphSink(context);
    }
}
