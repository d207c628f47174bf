package com.astvisualizer.core.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a {@link ReportBundle} to a report directory.
 *
 * <p>The directory is created if missing and existing pages are overwritten. The summary page
 * is written last, so its links always point at pages that already exist.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * ReportBundle bundle = new AstReportGenerator().generate(summary, reportDir);
 * new ReportWriter().write(bundle, reportDir);
 * // Creates: report/ast/main.md, report/ast/00_summary.md
 * }</pre>
 */
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    /**
     * Writes every page of the bundle below {@code reportDir}.
     *
     * @param bundle pages to write
     * @param reportDir target directory
     * @return paths of the written pages, summary last
     * @throws IllegalStateException if the directory or a page cannot be written
     */
    public List<Path> write(ReportBundle bundle, Path reportDir) {
        log.info("Writing {} report pages to: {}", bundle.size(), reportDir);

        try {
            Files.createDirectories(reportDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create report directory: " + reportDir, e);
        }

        List<Path> written = new ArrayList<>();
        for (ReportFile page : bundle.all()) {
            written.add(writePage(reportDir, page));
        }
        return written;
    }

    private Path writePage(Path reportDir, ReportFile page) {
        Path target = reportDir.resolve(page.fileName());
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, page.content(), StandardCharsets.UTF_8);
            log.debug("Wrote {} ({} chars)", target, page.content().length());
            return target;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write report page: " + target, e);
        }
    }
}
