package com.astvisualizer.core.renderer.impl;

import com.astvisualizer.core.renderer.GraphBackend;
import com.astvisualizer.core.renderer.GraphSink;
import com.astvisualizer.core.renderer.OutputFormat;
import com.astvisualizer.core.renderer.RenderContext;

import java.util.Set;

/**
 * Backend writing Mermaid flowcharts embedded in Markdown. Needs no external tools.
 *
 * @see MermaidGraphSink
 */
public class MermaidBackend implements GraphBackend {

    @Override
    public String getId() {
        return "mermaid";
    }

    @Override
    public String getDisplayName() {
        return "Mermaid Flowchart Backend";
    }

    @Override
    public Set<OutputFormat> getSupportedFormats() {
        return Set.of(OutputFormat.MERMAID);
    }

    @Override
    public GraphSink newSink(RenderContext context) {
        return new MermaidGraphSink(context.style());
    }
}
