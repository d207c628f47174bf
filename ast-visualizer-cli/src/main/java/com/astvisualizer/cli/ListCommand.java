package com.astvisualizer.cli;

import com.astvisualizer.core.renderer.GraphBackend;
import com.astvisualizer.core.renderer.GraphBackends;
import com.astvisualizer.core.renderer.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to list available rendering backends or output formats.
 *
 * <p>Discovers backends via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * astviz list backends
 * astviz list formats
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available rendering backends or output formats",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: backends or formats",
        defaultValue = "backends"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "backends", "backend" -> listBackends();
            case "formats", "format" -> listFormats();
            default -> {
                log.error("Unknown type: {}. Use: backends or formats", type);
                yield 1;
            }
        };
    }

    private int listBackends() {
        System.out.println("Available Backends:");
        System.out.println();

        List<GraphBackend> backends = GraphBackends.discover().all();
        for (GraphBackend backend : backends) {
            String formats = backend.getSupportedFormats().stream()
                .map(OutputFormat::token)
                .sorted()
                .collect(Collectors.joining(", "));
            System.out.printf("  • %s (ID: %s)%n", backend.getDisplayName(), backend.getId());
            System.out.printf("    Formats: %s%n", formats);
            System.out.println();
        }

        if (backends.isEmpty()) {
            System.out.println("  No backends found.");
        }

        return 0;
    }

    private int listFormats() {
        System.out.println("Output Formats:");
        System.out.println();
        for (OutputFormat format : OutputFormat.values()) {
            System.out.printf("  • %s (.%s)%n", format.token(), format.extension());
        }
        return 0;
    }
}
