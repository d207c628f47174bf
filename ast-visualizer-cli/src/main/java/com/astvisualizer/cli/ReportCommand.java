package com.astvisualizer.cli;

import com.astvisualizer.AstVisualizerCLI;
import com.astvisualizer.core.config.VisualizerConfig;
import com.astvisualizer.core.pipeline.AstVisualizationPipeline;
import com.astvisualizer.core.pipeline.BatchConverter;
import com.astvisualizer.core.pipeline.BatchSummary;
import com.astvisualizer.core.pipeline.ConversionError;
import com.astvisualizer.core.pipeline.ConversionException;
import com.astvisualizer.core.renderer.OutputFormat;
import com.astvisualizer.core.report.AstReportGenerator;
import com.astvisualizer.core.report.ReportBundle;
import com.astvisualizer.core.report.ReportWriter;
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
 * Command to render a directory of AST dumps and write a Markdown report per dump.
 *
 * <p>Writes {@code <name>.md} for every dump and {@code 00_summary.md} linking all of them.
 * Reports are written even for dumps that failed to parse or render.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * astviz report code -o report/ast --images output/ast_visualized
 * }</pre>
 */
@Command(
    name = "report",
    description = "Render a directory of .ast files and write Markdown reports",
    mixinStandardHelpOptions = true
)
public class ReportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReportCommand.class);

    @ParentCommand
    private AstVisualizerCLI parent;

    @Parameters(index = "0", description = "Directory containing .ast files")
    private Path inputDir;

    @Option(names = {"-o", "--output"}, description = "Report directory (overrides config)")
    private Path reportDir;

    @Option(names = {"--images"}, description = "Image directory (overrides config)")
    private Path imageDir;

    @Option(names = {"-f", "--format"}, description = "Image format: png, svg, pdf, dot, mermaid")
    private String format;

    @Override
    public Integer call() {
        parent.configureLogging();

        try {
            VisualizerConfig config = parent.loadConfig();
            OutputFormat outputFormat = format == null
                ? parent.defaultFormat(config)
                : OutputFormat.fromToken(format).orElseThrow(() -> new ConversionException(
                    ConversionError.RENDER_ERROR, "Unsupported output format: " + format));
            Path reports = reportDir != null ? reportDir : Paths.get(config.output().reportDirectory());
            Path images = imageDir != null ? imageDir : Paths.get(config.output().directory());

            BatchConverter converter = new BatchConverter(new AstVisualizationPipeline(config));
            BatchSummary summary = converter.convertDirectory(inputDir, images, outputFormat, entry ->
                parent.println((entry.isSuccess() ? "✓ " : "⚠ ") + entry.input().getFileName()));

            ReportBundle bundle = new AstReportGenerator().generate(summary, reports);
            new ReportWriter().write(bundle, reports);
            log.debug("Wrote {} report pages to {}", bundle.size(), reports);

            parent.println("");
            parent.println("Total: " + summary.total() + " | Succeeded: " + summary.succeeded()
                + " | Failed: " + summary.failed());
            parent.println("Report directory: " + reports);
            parent.println("Summary: " + reports.resolve(AstReportGenerator.SUMMARY_FILE_NAME));
            return 0;
        } catch (ConversionException e) {
            return parent.fail(e);
        } catch (IllegalStateException e) {
            log.error("Writing reports failed", e);
            System.err.println("✗ " + e.getMessage());
            return 1;
        }
    }
}
