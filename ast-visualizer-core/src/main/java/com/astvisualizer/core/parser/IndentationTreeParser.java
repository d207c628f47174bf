package com.astvisualizer.core.parser;

import com.astvisualizer.core.model.AstLine;
import com.astvisualizer.core.model.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rebuilds an abstract syntax tree from an indentation-structured text dump.
 *
 * <p>Nesting is recovered from line indentation alone. A node's children are the
 * following lines indented deeper than it, up to the next line indented at most as deep.
 * Depths only need to be ordered; they need not grow by a fixed step.
 *
 * <h2>Algorithm</h2>
 * <p>A stack holds the open ancestors (the path from the root to the last placed node).
 * <ol>
 *   <li>The first record becomes the root, whatever its depth.</li>
 *   <li>For each following record, pop while the top's depth is {@code >=} the record's depth,
 *       append the record to the new top (if any), then push the record.</li>
 * </ol>
 * Each node is pushed once and popped at most once.
 *
 * <h2>Detached records</h2>
 * <p>A record indented at most as deep as every open node (including the root) pops the whole
 * stack. It is still pushed, so deeper lines below it attach to it, but it is never attached
 * to the tree and is not rendered. This is deliberate: such input is not an error.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IndentationTreeParser parser = new IndentationTreeParser();
 * Optional<AstNode> root = parser.parse(List.of(
 *     "Program",
 *     " Function: main",
 *     "  Block"));
 * }</pre>
 */
public class IndentationTreeParser {

    private static final Logger log = LoggerFactory.getLogger(IndentationTreeParser.class);

    private final DumpPreprocessor preprocessor;
    private final AstLineParser lineParser;

    public IndentationTreeParser() {
        this(new DumpPreprocessor(), new AstLineParser());
    }

    public IndentationTreeParser(DumpPreprocessor preprocessor, AstLineParser lineParser) {
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor must not be null");
        this.lineParser = Objects.requireNonNull(lineParser, "lineParser must not be null");
    }

    /**
     * Parses dump lines into a tree.
     *
     * @param lines raw lines, without line terminators
     * @return the root, or empty when there are no content lines
     */
    public Optional<AstNode> parse(List<String> lines) {
        return parseDetailed(lines).root();
    }

    /**
     * Parses dump text into a tree.
     *
     * @param text complete dump text
     * @return the root, or empty when there are no content lines
     */
    public Optional<AstNode> parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return parse(text.lines().toList());
    }

    /**
     * Reads and parses a dump file as UTF-8.
     *
     * @param file dump file
     * @return parse outcome including detached records
     * @throws IOException if the file cannot be read
     */
    public ParseOutcome parseFile(Path file) throws IOException {
        log.debug("Parsing AST dump: {}", file);
        return parseDetailed(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    /**
     * Parses dump lines and reports detached records as well.
     *
     * @param lines raw lines, without line terminators
     * @return parse outcome
     */
    public ParseOutcome parseDetailed(List<String> lines) {
        List<AstLine> records = parseLines(lines);
        log.debug("Found {} content lines", records.size());
        if (records.isEmpty()) {
            return ParseOutcome.empty();
        }
        return buildTree(records);
    }

    /**
     * Applies header stripping and the per-line grammar.
     *
     * @param lines raw lines
     * @return one record per non-blank content line, in input order
     */
    public List<AstLine> parseLines(List<String> lines) {
        Objects.requireNonNull(lines, "lines must not be null");

        List<AstLine> records = new ArrayList<>();
        for (int i = preprocessor.firstContentIndex(lines); i < lines.size(); i++) {
            lineParser.parse(lines.get(i), i + 1).ifPresent(records::add);
        }
        return records;
    }

    /**
     * Rebuilds the tree from parsed records.
     *
     * @param records parsed records in input order, not empty
     * @return parse outcome rooted at the first record
     */
    public ParseOutcome buildTree(List<AstLine> records) {
        if (records.isEmpty()) {
            return ParseOutcome.empty();
        }

        AstNode root = records.get(0).toNode();
        Deque<AstNode> open = new ArrayDeque<>();
        open.push(root);
        List<AstNode> detached = new ArrayList<>();

        for (int i = 1; i < records.size(); i++) {
            AstLine record = records.get(i);
            AstNode current = record.toNode();

            while (!open.isEmpty() && open.peek().depth() >= current.depth()) {
                open.pop();
            }

            if (open.isEmpty()) {
                log.debug("Line {} ({}) has no enclosing node at depth < {}; left out of the tree",
                    record.lineNumber(), record.kind(), record.depth());
                detached.add(current);
            } else {
                open.peek().appendChild(current);
            }

            open.push(current);
        }

        return new ParseOutcome(Optional.of(root), records.size(), detached);
    }
}
