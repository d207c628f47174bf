package com.astvisualizer.core.report;

import com.astvisualizer.core.model.AstNode;
import com.astvisualizer.core.model.TreeStatistics;
import com.astvisualizer.core.parser.IndentationTreeParser;
import com.astvisualizer.core.pipeline.BatchSummary;
import com.astvisualizer.core.pipeline.ConversionError;
import com.astvisualizer.core.pipeline.ConversionResult;
import com.astvisualizer.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Generates Markdown reports for a batch of converted AST dumps.
 *
 * <p>Produces one report per dump plus a summary page:
 * <pre>
 * report/ast/
 * ├── 00_summary.md     # Statistics and links to every report
 * ├── main.md           # Info table, AST text, image, node kinds
 * └── loops.md
 * </pre>
 *
 * <p>Parse status and tree statistics come from re-reading the dump, so a dump that parsed
 * but failed to render still gets its statistics. Image links are relative to the report
 * directory.
 */
public class AstReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(AstReportGenerator.class);

    /** File name of the summary page. */
    public static final String SUMMARY_FILE_NAME = "00_summary.md";

    private static final String REPORT_EXTENSION = ".md";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // Markdown formatting constants
    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String H3 = "### ";
    private static final String CODE = "`";
    private static final String PIPE = "|";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";

    private static final String SUCCESS = "✅ Success";
    private static final String FAILURE = "❌ Failed";
    private static final String SUCCESS_MARK = "✅";
    private static final String FAILURE_MARK = "❌";
    private static final String UNREADABLE = "(AST file could not be read)";

    private final IndentationTreeParser parser;
    private final Clock clock;

    public AstReportGenerator() {
        this(new IndentationTreeParser(), Clock.systemDefaultZone());
    }

    public AstReportGenerator(IndentationTreeParser parser, Clock clock) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Generates all reports of a batch.
     *
     * @param summary batch outcome
     * @param reportDir directory the reports will be written to
     * @return one report per entry followed by the summary page
     */
    public ReportBundle generate(BatchSummary summary, Path reportDir) {
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(reportDir, "reportDir must not be null");

        LocalDateTime generatedAt = LocalDateTime.now(clock);
        List<String> names = reportFileNames(summary.entries());
        List<ReportFile> reports = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            BatchSummary.Entry entry = summary.entries().get(i);
            reports.add(new ReportFile(names.get(i), generateFileReport(entry, reportDir, generatedAt)));
        }
        ReportBundle bundle = new ReportBundle(reports,
            new ReportFile(SUMMARY_FILE_NAME, generateSummary(summary, generatedAt)));

        log.info("Generated {} report files", bundle.size());
        return bundle;
    }

    /**
     * Generates the report of one dump.
     *
     * @param entry conversion outcome
     * @param reportDir directory the report will be written to
     * @param generatedAt timestamp shown in the report
     * @return Markdown report
     */
    public String generateFileReport(BatchSummary.Entry entry, Path reportDir, LocalDateTime generatedAt) {
        String name = baseName(entry.input());
        Optional<String> text = readText(entry.input());
        Optional<TreeStatistics> statistics = text.flatMap(this::statisticsOf);
        boolean parsed = statistics.isPresent();

        StringBuilder sb = new StringBuilder();
        sb.append(H1).append(name).append(" AST Report").append(DOUBLE_NEWLINE);

        sb.append(H2).append("Summary").append(DOUBLE_NEWLINE);
        appendTableHeader(sb, "Item", "Value");
        appendRow(sb, "**File**", code(entry.input().getFileName().toString()));
        appendRow(sb, "**Generated**", TIMESTAMP.format(generatedAt));
        appendRow(sb, "**Parsing**", parsed ? SUCCESS : FAILURE);
        statistics.ifPresent(stats -> {
            appendRow(sb, "**Nodes**", String.valueOf(stats.nodeCount()));
            appendRow(sb, "**Tree Height**", String.valueOf(stats.height()));
            appendRow(sb, "**Leaves**", String.valueOf(stats.leafCount()));
        });
        entry.resultIfPresent()
            .filter(result -> result.unreachableLines() > 0)
            .ifPresent(result -> appendRow(sb, "**Unrendered Lines**", String.valueOf(result.unreachableLines())));
        appendRow(sb, "**Visualization**", entry.isSuccess() ? SUCCESS : FAILURE);
        sb.append(NEWLINE);

        sb.append(H2).append("Abstract Syntax Tree").append(DOUBLE_NEWLINE);
        if (parsed) {
            sb.append(H3).append("Text Representation").append(DOUBLE_NEWLINE);
            appendCodeBlock(sb, text.get());
            sb.append(NEWLINE);
            appendVisualization(sb, entry, reportDir);
        } else {
            sb.append(FAILURE_MARK).append(" **AST could not be parsed**").append(DOUBLE_NEWLINE);
            appendCodeBlock(sb, failureMessage(entry).orElse(text.orElse(UNREADABLE)));
        }

        statistics.ifPresent(stats -> appendKindTable(sb, stats.kindCounts()));
        return sb.toString();
    }

    /**
     * Generates the summary page.
     *
     * @param summary batch outcome
     * @param generatedAt timestamp shown in the report
     * @return Markdown summary
     */
    public String generateSummary(BatchSummary summary, LocalDateTime generatedAt) {
        StringBuilder sb = new StringBuilder();
        sb.append(H1).append("AST Visualization Summary").append(DOUBLE_NEWLINE);
        sb.append("Generated: ").append(TIMESTAMP.format(generatedAt)).append(DOUBLE_NEWLINE);

        long parseFailures = summary.entries().stream().filter(this::isParseFailure).count();

        sb.append(H2).append("Statistics").append(DOUBLE_NEWLINE);
        appendTableHeader(sb, "Item", "Count");
        appendRow(sb, "Total Files", String.valueOf(summary.total()));
        appendRow(sb, "Parsed", String.valueOf(summary.total() - parseFailures));
        appendRow(sb, "Rendered", String.valueOf(summary.succeeded()));
        appendRow(sb, "Failed", String.valueOf(summary.failed()));
        sb.append(NEWLINE);

        sb.append(H2).append("Files").append(DOUBLE_NEWLINE);
        if (summary.entries().isEmpty()) {
            sb.append("No AST files found.").append(NEWLINE);
            return sb.toString();
        }

        appendTableHeader(sb, "#", "File", "AST", "Visualization");
        List<String> names = reportFileNames(summary.entries());
        for (int i = 0; i < names.size(); i++) {
            BatchSummary.Entry entry = summary.entries().get(i);
            String fileName = entry.input().getFileName().toString();
            String link = "[" + code(fileName) + "](./" + names.get(i) + ")";
            appendRow(sb, String.valueOf(i + 1), link,
                isParseFailure(entry) ? FAILURE_MARK : SUCCESS_MARK,
                entry.isSuccess() ? SUCCESS_MARK : FAILURE_MARK);
        }
        return sb.toString();
    }

    private void appendVisualization(StringBuilder sb, BatchSummary.Entry entry, Path reportDir) {
        Optional<ConversionResult> result = entry.resultIfPresent();
        if (result.isPresent()) {
            String link = relativeLink(reportDir, result.get().output());
            sb.append(H3).append("Visualization").append(DOUBLE_NEWLINE);
            sb.append("![AST Visualization](").append(link).append(")").append(DOUBLE_NEWLINE);
            sb.append("Image path: ").append(code(link)).append(NEWLINE);
        } else {
            sb.append(H3).append("Visualization").append(DOUBLE_NEWLINE);
            sb.append("⚠️ **Visualization failed**").append(NEWLINE);
            failureMessage(entry).ifPresent(message -> {
                sb.append(NEWLINE);
                appendCodeBlock(sb, message);
            });
        }
    }

    private void appendKindTable(StringBuilder sb, Map<String, Integer> kindCounts) {
        sb.append(NEWLINE).append(H2).append("Node Kinds").append(DOUBLE_NEWLINE);
        appendTableHeader(sb, "Kind", "Count");
        kindCounts.forEach((kind, count) -> appendRow(sb, code(kind), String.valueOf(count)));
    }

    private boolean isParseFailure(BatchSummary.Entry entry) {
        if (entry.isSuccess()) {
            return false;
        }
        ConversionError error = entry.failure().getError();
        return error == ConversionError.EMPTY_OR_MALFORMED || error == ConversionError.FILE_NOT_FOUND;
    }

    private Optional<String> failureMessage(BatchSummary.Entry entry) {
        return entry.isSuccess() ? Optional.empty() : Optional.ofNullable(entry.failure().getMessage());
    }

    private Optional<String> readText(Path input) {
        try {
            return Optional.of(Files.readString(input, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Cannot read {} for report: {}", input, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<TreeStatistics> statisticsOf(String text) {
        Optional<AstNode> root = parser.parse(text);
        return root.map(TreeStatistics::of);
    }

    private static String relativeLink(Path reportDir, Path target) {
        Path from = reportDir.toAbsolutePath().normalize();
        Path to = target.toAbsolutePath().normalize();
        return from.relativize(to).toString().replace('\\', '/');
    }

    /**
     * Assigns each entry a report page name, {@code <name>.md} unless that name is the summary
     * page or already taken, in which case {@code _ast}, {@code _ast2}, ... is appended to the stem.
     * Names are compared case-insensitively.
     *
     * @param entries batch entries in order
     * @return page names aligned with {@code entries}
     */
    static List<String> reportFileNames(List<BatchSummary.Entry> entries) {
        Set<String> taken = new HashSet<>();
        taken.add(SUMMARY_FILE_NAME.toLowerCase(Locale.ROOT));
        List<String> names = new ArrayList<>(entries.size());
        for (BatchSummary.Entry entry : entries) {
            String stem = baseName(entry.input());
            String name = stem + REPORT_EXTENSION;
            int attempt = 1;
            while (!taken.add(name.toLowerCase(Locale.ROOT))) {
                name = stem + "_ast" + (attempt == 1 ? "" : String.valueOf(attempt)) + REPORT_EXTENSION;
                attempt++;
            }
            names.add(name);
        }
        return names;
    }

    private static String baseName(Path input) {
        return FileUtils.stripExtension(input.getFileName()).toString();
    }

    private static void appendTableHeader(StringBuilder sb, String... headers) {
        appendRow(sb, headers);
        StringBuilder separator = new StringBuilder(PIPE);
        for (int i = 0; i < headers.length; i++) {
            separator.append("------").append(PIPE);
        }
        sb.append(separator).append(NEWLINE);
    }

    private static void appendRow(StringBuilder sb, String... cells) {
        sb.append(PIPE);
        for (String cell : cells) {
            sb.append(" ").append(escapeCell(cell)).append(" ").append(PIPE);
        }
        sb.append(NEWLINE);
    }

    private static void appendCodeBlock(StringBuilder sb, String content) {
        String fence = fenceFor(content);
        sb.append(fence).append(NEWLINE);
        sb.append(content.stripTrailing()).append(NEWLINE);
        sb.append(fence).append(NEWLINE);
    }

    /**
     * Returns a backtick fence longer than any backtick run in the content.
     */
    private static String fenceFor(String content) {
        int longest = 0;
        int current = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '`') {
                current++;
                longest = Math.max(longest, current);
            } else {
                current = 0;
            }
        }
        return "`".repeat(Math.max(3, longest + 1));
    }

    private static String code(String text) {
        return CODE + text + CODE;
    }

    private static String escapeCell(String text) {
        return text.replace(PIPE, "\\|").replace(NEWLINE, " ");
    }
}
