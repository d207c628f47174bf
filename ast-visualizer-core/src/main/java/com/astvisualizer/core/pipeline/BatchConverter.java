package com.astvisualizer.core.pipeline;

import com.astvisualizer.core.renderer.OutputFormat;
import com.astvisualizer.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Converts every {@code *.ast} file of a directory.
 *
 * <p>Files are processed sequentially in name order. A failing file is recorded and the run
 * continues with the next one. {@code <dir>/main.ast} is written to
 * {@code <outputDir>/main.<ext>}.
 */
public class BatchConverter {

    private static final Logger log = LoggerFactory.getLogger(BatchConverter.class);

    /** Glob selecting dump files. */
    public static final String AST_FILE_PATTERN = "*.ast";

    private final AstVisualizationPipeline pipeline;

    public BatchConverter(AstVisualizationPipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    /**
     * Lists the dump files of a directory.
     *
     * @param inputDir directory containing dump files
     * @return dump files sorted by name
     * @throws ConversionException with {@link ConversionError#FILE_NOT_FOUND} if the directory is missing
     */
    public List<Path> findDumps(Path inputDir) throws ConversionException {
        if (!Files.isDirectory(inputDir)) {
            throw new ConversionException(ConversionError.FILE_NOT_FOUND, "Directory not found: " + inputDir);
        }
        try {
            return FileUtils.listFiles(inputDir, AST_FILE_PATTERN);
        } catch (IOException e) {
            throw new ConversionException(ConversionError.FILE_NOT_FOUND,
                "Cannot list directory: " + inputDir, e);
        }
    }

    /**
     * Converts all dumps in {@code inputDir}.
     *
     * @param inputDir directory containing dump files
     * @param outputDir directory receiving rendered files
     * @param format output format
     * @param progress called after each file, e.g. to print progress
     * @return per-file outcomes
     * @throws ConversionException if the input directory cannot be listed
     */
    public BatchSummary convertDirectory(Path inputDir, Path outputDir, OutputFormat format,
                                         Consumer<BatchSummary.Entry> progress) throws ConversionException {
        Objects.requireNonNull(outputDir, "outputDir must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Consumer<BatchSummary.Entry> listener = progress != null ? progress : entry -> { };

        List<Path> dumps = findDumps(inputDir);
        log.info("Converting {} AST files from {} to {}", dumps.size(), inputDir, outputDir);

        List<BatchSummary.Entry> entries = new ArrayList<>();
        for (Path dump : dumps) {
            Path base = outputDir.resolve(FileUtils.stripExtension(dump.getFileName()));
            BatchSummary.Entry entry;
            try {
                entry = BatchSummary.Entry.success(pipeline.convert(dump, new OutputTarget(base, format)));
            } catch (ConversionException e) {
                log.warn("Conversion of {} failed: {}", dump.getFileName(), e.getMessage());
                entry = BatchSummary.Entry.failure(dump, e);
            }
            entries.add(entry);
            listener.accept(entry);
        }

        BatchSummary summary = new BatchSummary(entries);
        log.info("Batch finished: {} succeeded, {} failed, {} total",
            summary.succeeded(), summary.failed(), summary.total());
        return summary;
    }
}
