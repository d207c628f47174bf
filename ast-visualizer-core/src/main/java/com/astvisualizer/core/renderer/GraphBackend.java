package com.astvisualizer.core.renderer;

import java.util.Set;

/**
 * Interface for rendering backends that turn emitted trees into graphics.
 *
 * <p>Backends are discovered via Java Service Provider Interface (SPI), see
 * {@link GraphBackends}. Each backend creates a fresh {@link GraphSink} per tree.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class MermaidBackend implements GraphBackend {
 *     @Override
 *     public String getId() {
 *         return "mermaid";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Mermaid Flowchart Backend";
 *     }
 *
 *     @Override
 *     public Set<OutputFormat> getSupportedFormats() {
 *         return Set.of(OutputFormat.MERMAID);
 *     }
 *
 *     @Override
 *     public GraphSink newSink(RenderContext context) {
 *         return new MermaidGraphSink(context.style());
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.astvisualizer.core.renderer.GraphBackend}
 *
 * @see GraphSink
 * @see RenderContext
 */
public interface GraphBackend {

    /**
     * Returns unique identifier for this backend.
     *
     * <p>Used for referencing the backend in configuration (e.g., "graphviz", "mermaid").
     *
     * @return unique backend identifier
     */
    String getId();

    /**
     * Returns human-readable display name, used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the formats this backend can render.
     *
     * @return supported formats
     */
    Set<OutputFormat> getSupportedFormats();

    /**
     * Creates a sink for one tree.
     *
     * @param context graph style and backend settings
     * @return a new, empty sink
     */
    GraphSink newSink(RenderContext context);

    default boolean supports(OutputFormat format) {
        return getSupportedFormats().contains(format);
    }
}
