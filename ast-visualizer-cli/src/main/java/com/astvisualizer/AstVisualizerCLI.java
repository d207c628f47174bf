package com.astvisualizer;

import ch.qos.logback.classic.Level;
import com.astvisualizer.cli.BatchCommand;
import com.astvisualizer.cli.ListCommand;
import com.astvisualizer.cli.ReportCommand;
import com.astvisualizer.core.config.ConfigLoader;
import com.astvisualizer.core.config.VisualizerConfig;
import com.astvisualizer.core.pipeline.AstVisualizationPipeline;
import com.astvisualizer.core.pipeline.ConversionError;
import com.astvisualizer.core.pipeline.ConversionException;
import com.astvisualizer.core.pipeline.ConversionResult;
import com.astvisualizer.core.pipeline.OutputTarget;
import com.astvisualizer.core.renderer.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Main CLI entry point for the AST visualizer.
 *
 * <p>Converts an indentation-structured AST dump into a graph image.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code <file> [format|output]} - Convert one AST dump</li>
 *   <li>{@code batch} - Convert every {@code .ast} file of a directory</li>
 *   <li>{@code report} - Convert a directory and write Markdown reports</li>
 *   <li>{@code list} - List available rendering backends</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code -c, --config} - Configuration file (default: astviz.yaml)</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Render code/main.ast to code/main.png
 * astviz code/main.ast
 *
 * # Render as SVG next to the input
 * astviz code/main.ast svg
 *
 * # Render to an explicit file; the extension selects the format
 * astviz code/main.ast out/main.pdf
 * }</pre>
 *
 * <p><b>Exit codes:</b> 0 on success, otherwise {@link ConversionError#exitCode()}.
 */
@Command(
    name = "astviz",
    mixinStandardHelpOptions = true,
    version = "AST Visualizer 1.0.0-SNAPSHOT",
    description = "Renders indentation-structured AST dumps as graphs",
    subcommands = {
        BatchCommand.class,
        ReportCommand.class,
        ListCommand.class
    }
)
public class AstVisualizerCLI implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AstVisualizerCLI.class);

    @Parameters(index = "0", arity = "0..1", description = "AST dump file")
    private Path input;

    @Parameters(
        index = "1",
        arity = "0..1",
        description = "Output format (png, svg, pdf, dot, mermaid) or output file path"
    )
    private String formatOrOutput;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: astviz.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        configureLogging();

        try {
            if (input == null) {
                throw new ConversionException(ConversionError.MISSING_INPUT,
                    "Missing AST file. Usage: astviz <ast_file> [format|output_file]");
            }

            VisualizerConfig config = loadConfig();
            OutputTarget target = OutputTarget.resolve(input, formatOrOutput, defaultFormat(config));

            println("Parsing AST file: " + input);
            ConversionResult result = new AstVisualizationPipeline(config).convert(input, target);

            println("✓ AST parsed (" + result.statistics().nodeCount() + " nodes)");
            println("✓ Visualization written: " + result.output());
            return 0;
        } catch (ConversionException e) {
            return fail(e);
        }
    }

    /**
     * Reports a failed conversion.
     *
     * @param e the failure
     * @return exit code of the failure
     */
    public int fail(ConversionException e) {
        log.error("{} ({})", e.getMessage(), e.getError());
        System.err.println("✗ " + e.getMessage());
        if (log.isDebugEnabled() && e.getCause() != null) {
            log.debug("Cause", e.getCause());
        }
        return e.getError().exitCode();
    }

    /**
     * Configures logging level based on global options.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Loads the configuration named by {@code --config}, or defaults.
     *
     * @return configuration
     */
    public VisualizerConfig loadConfig() {
        return ConfigLoader.load(configPath);
    }

    /**
     * Resolves the configured default format, falling back to PNG.
     *
     * @param config configuration
     * @return default output format
     */
    public OutputFormat defaultFormat(VisualizerConfig config) {
        return config.render().defaultOutputFormat().orElseGet(() -> {
            log.warn("Unknown default format '{}', using png", config.render().defaultFormat());
            return OutputFormat.PNG;
        });
    }

    /**
     * Prints a progress line unless quiet mode is enabled.
     *
     * @param message line to print
     */
    public void println(String message) {
        if (!quiet) {
            System.out.println(message);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new AstVisualizerCLI()).execute(args);
        System.exit(exitCode);
    }
}
