package com.astvisualizer.cli;

import com.astvisualizer.AstVisualizerCLI;
import com.astvisualizer.core.config.VisualizerConfig;
import com.astvisualizer.core.pipeline.AstVisualizationPipeline;
import com.astvisualizer.core.pipeline.BatchConverter;
import com.astvisualizer.core.pipeline.BatchSummary;
import com.astvisualizer.core.pipeline.ConversionError;
import com.astvisualizer.core.pipeline.ConversionException;
import com.astvisualizer.core.renderer.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to convert every AST dump of a directory.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Convert code/*.ast to output/ast_visualized/*.png
 * astviz batch code
 *
 * # Convert to SVG in a custom directory
 * astviz batch code -f svg -o build/ast
 * }</pre>
 *
 * <p>Exits with 0 only when every file was converted.
 */
@Command(
    name = "batch",
    description = "Convert every .ast file of a directory",
    mixinStandardHelpOptions = true
)
public class BatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BatchCommand.class);

    @ParentCommand
    private AstVisualizerCLI parent;

    @Parameters(index = "0", description = "Directory containing .ast files")
    private Path inputDir;

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(names = {"-f", "--format"}, description = "Output format: png, svg, pdf, dot, mermaid")
    private String format;

    @Override
    public Integer call() {
        parent.configureLogging();

        try {
            VisualizerConfig config = parent.loadConfig();
            OutputFormat outputFormat = resolveFormat(config);
            Path target = outputDir != null ? outputDir : Paths.get(config.output().directory());
            log.debug("Batch conversion of {} to {} as {}", inputDir, target, outputFormat.token());

            BatchConverter converter = new BatchConverter(new AstVisualizationPipeline(config));
            int total = converter.findDumps(inputDir).size();
            if (total == 0) {
                parent.println("No .ast files found in " + inputDir);
                return 0;
            }

            parent.println("Converting " + total + " AST files from " + inputDir);
            parent.println("");

            int[] index = {0};
            BatchSummary summary = converter.convertDirectory(inputDir, target, outputFormat, entry -> {
                index[0]++;
                parent.println("[" + index[0] + "/" + total + "] " + entry.input().getFileName());
                parent.println(entry.isSuccess()
                    ? "  ✓ " + entry.result().output()
                    : "  ✗ " + entry.failure().getMessage());
            });

            printSummary(summary, target);
            return summary.allSucceeded() ? 0 : 1;
        } catch (ConversionException e) {
            return parent.fail(e);
        }
    }

    private OutputFormat resolveFormat(VisualizerConfig config) throws ConversionException {
        if (format == null) {
            return parent.defaultFormat(config);
        }
        return OutputFormat.fromToken(format).orElseThrow(() -> new ConversionException(
            ConversionError.RENDER_ERROR, "Unsupported output format: " + format));
    }

    private void printSummary(BatchSummary summary, Path target) {
        parent.println("");
        parent.println("Succeeded: " + summary.succeeded() + "  Failed: " + summary.failed()
            + "  Total: " + summary.total());
        parent.println("Output directory: " + target);
    }
}
