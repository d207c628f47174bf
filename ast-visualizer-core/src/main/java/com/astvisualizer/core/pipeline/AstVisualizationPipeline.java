package com.astvisualizer.core.pipeline;

import com.astvisualizer.core.config.VisualizerConfig;
import com.astvisualizer.core.emitter.EmissionSummary;
import com.astvisualizer.core.emitter.TreeEmitter;
import com.astvisualizer.core.model.AstNode;
import com.astvisualizer.core.model.TreeStatistics;
import com.astvisualizer.core.parser.IndentationTreeParser;
import com.astvisualizer.core.parser.ParseOutcome;
import com.astvisualizer.core.renderer.GraphBackend;
import com.astvisualizer.core.renderer.GraphBackends;
import com.astvisualizer.core.renderer.GraphSink;
import com.astvisualizer.core.renderer.RenderContext;
import com.astvisualizer.core.renderer.RenderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Converts one AST dump file into a rendered graph.
 *
 * <p>Runs the stages in order, each consuming the previous stage's output:
 * <ol>
 *   <li>read the dump lines</li>
 *   <li>rebuild the tree ({@link IndentationTreeParser})</li>
 *   <li>stream it into a backend sink ({@link TreeEmitter})</li>
 *   <li>render the sink to the output target</li>
 * </ol>
 * Any failure ends the conversion with a {@link ConversionException}; nothing is retried and
 * no partial output is written by this class.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * AstVisualizationPipeline pipeline = new AstVisualizationPipeline(config);
 * OutputTarget target = OutputTarget.resolve(input, "svg", OutputFormat.PNG);
 * ConversionResult result = pipeline.convert(input, target);
 * }</pre>
 */
public class AstVisualizationPipeline {

    private static final Logger log = LoggerFactory.getLogger(AstVisualizationPipeline.class);

    private final IndentationTreeParser parser;
    private final TreeEmitter emitter;
    private final GraphBackends backends;
    private final RenderContext renderContext;
    private final String preferredBackend;

    /**
     * Creates a pipeline from configuration, discovering backends via SPI.
     *
     * @param config visualizer configuration
     */
    public AstVisualizationPipeline(VisualizerConfig config) {
        this(new IndentationTreeParser(),
            new TreeEmitter(config.colorScheme()),
            GraphBackends.discover(),
            config.renderContext(),
            config.render().backend());
    }

    public AstVisualizationPipeline(IndentationTreeParser parser,
                                    TreeEmitter emitter,
                                    GraphBackends backends,
                                    RenderContext renderContext,
                                    String preferredBackend) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.emitter = Objects.requireNonNull(emitter, "emitter must not be null");
        this.backends = Objects.requireNonNull(backends, "backends must not be null");
        this.renderContext = Objects.requireNonNull(renderContext, "renderContext must not be null");
        this.preferredBackend = preferredBackend;
    }

    /**
     * Converts a dump file.
     *
     * @param input dump file
     * @param target output location and format
     * @return conversion result
     * @throws ConversionException if the file is missing, empty, or cannot be rendered
     */
    public ConversionResult convert(Path input, OutputTarget target) throws ConversionException {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(target, "target must not be null");

        if (!Files.isRegularFile(input)) {
            throw new ConversionException(ConversionError.FILE_NOT_FOUND, "File not found: " + input);
        }

        log.info("Parsing AST file: {}", input);
        ParseOutcome outcome = parse(input);
        AstNode root = outcome.root().orElseThrow(() -> new ConversionException(
            ConversionError.EMPTY_OR_MALFORMED, "AST file is empty or malformed: " + input));

        TreeStatistics statistics = TreeStatistics.of(root);
        int unreachable = outcome.recordCount() - statistics.nodeCount();
        if (unreachable > 0) {
            log.warn("{}: {} lines have no enclosing node and are not rendered", input, unreachable);
        }
        log.debug("Tree of {}: {} nodes, height {}, {} leaves",
            input, statistics.nodeCount(), statistics.height(), statistics.leafCount());

        GraphBackend backend = selectBackend(target);
        GraphSink sink = backend.newSink(renderContext);
        EmissionSummary summary = emitter.emit(root, sink);
        log.debug("Emitted {} nodes and {} edges to {}", summary.nodeCount(), summary.edgeCount(),
            backend.getId());

        try {
            Path output = sink.render(target.base(), target.format());
            return new ConversionResult(input, output, statistics, unreachable);
        } catch (RenderException e) {
            throw new ConversionException(ConversionError.RENDER_ERROR,
                "Failed to render graph: " + e.getMessage(), e);
        }
    }

    private ParseOutcome parse(Path input) throws ConversionException {
        try {
            return parser.parseFile(input);
        } catch (CharacterCodingException e) {
            throw new ConversionException(ConversionError.EMPTY_OR_MALFORMED,
                "AST file is not valid UTF-8: " + input, e);
        } catch (IOException e) {
            throw new ConversionException(ConversionError.FILE_NOT_FOUND,
                "Cannot read file: " + input + " (" + e.getMessage() + ")", e);
        }
    }

    private GraphBackend selectBackend(OutputTarget target) throws ConversionException {
        try {
            GraphBackend backend = backends.select(preferredBackend, target.format());
            log.debug("Using backend {} for format {}", backend.getId(), target.format().token());
            return backend;
        } catch (IllegalArgumentException e) {
            throw new ConversionException(ConversionError.RENDER_ERROR, e.getMessage(), e);
        }
    }
}
