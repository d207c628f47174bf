package com.astvisualizer.core.config;

import com.astvisualizer.core.emitter.NodeColorScheme;
import com.astvisualizer.core.renderer.GraphStyle;
import com.astvisualizer.core.renderer.OutputFormat;
import com.astvisualizer.core.renderer.RenderContext;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Root configuration of the visualizer.
 *
 * <p>Loaded from {@code astviz.yaml}. Every section and value is optional; missing ones take
 * the built-in defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * render:
 *   backend: graphviz
 *   defaultFormat: svg
 *   dotExecutable: /usr/local/bin/dot
 *   timeoutSeconds: 30
 *
 * style:
 *   rankdir: LR
 *   defaultColor: "#eeeeee"
 *   colors:
 *     CallExpr: "#ffe0b2"
 *
 * output:
 *   directory: "./output/ast_visualized"
 *   reportDirectory: "./report/ast"
 * }</pre>
 *
 * @param render backend and format settings
 * @param style graph style and node colors
 * @param output output directories for batch and report runs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VisualizerConfig(
    @JsonProperty("render") RenderSettings render,
    @JsonProperty("style") StyleSettings style,
    @JsonProperty("output") OutputSettings output
) {
    /**
     * Compact constructor replacing missing sections with defaults.
     */
    public VisualizerConfig {
        if (render == null) {
            render = RenderSettings.defaults();
        }
        if (style == null) {
            style = StyleSettings.defaults();
        }
        if (output == null) {
            output = OutputSettings.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static VisualizerConfig defaults() {
        return new VisualizerConfig(null, null, null);
    }

    /**
     * Builds the color scheme: the built-in table with the configured colors merged over it.
     *
     * @return immutable color scheme
     */
    public NodeColorScheme colorScheme() {
        return NodeColorScheme.defaults().withOverrides(style.colors(), style.defaultColor());
    }

    public GraphStyle graphStyle() {
        return new GraphStyle(style.rankdir(), style.nodeShape(), style.nodeStyle(), null);
    }

    /**
     * Builds the context handed to graph backends.
     *
     * @return render context with style and Graphviz settings
     */
    public RenderContext renderContext() {
        Map<String, String> settings = new HashMap<>();
        settings.put(RenderContext.GRAPHVIZ_EXECUTABLE, render.dotExecutable());
        settings.put(RenderContext.GRAPHVIZ_TIMEOUT_SECONDS, String.valueOf(render.timeoutSeconds()));
        return new RenderContext(graphStyle(), settings);
    }

    /**
     * Rendering settings.
     *
     * @param backend preferred backend id
     * @param defaultFormat format used when none is given on the command line
     * @param dotExecutable Graphviz {@code dot} executable
     * @param timeoutSeconds maximum run time of one Graphviz call
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RenderSettings(
        @JsonProperty("backend") String backend,
        @JsonProperty("defaultFormat") String defaultFormat,
        @JsonProperty("dotExecutable") String dotExecutable,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds
    ) {
        public RenderSettings {
            if (backend == null || backend.isBlank()) {
                backend = "graphviz";
            }
            if (defaultFormat == null || defaultFormat.isBlank()) {
                defaultFormat = OutputFormat.PNG.token();
            }
            if (dotExecutable == null || dotExecutable.isBlank()) {
                dotExecutable = "dot";
            }
            if (timeoutSeconds == null || timeoutSeconds <= 0) {
                timeoutSeconds = 60;
            }
        }

        public static RenderSettings defaults() {
            return new RenderSettings(null, null, null, null);
        }

        /**
         * Resolves the configured default format.
         *
         * @return the format, or empty if the configured token is unknown
         */
        public Optional<OutputFormat> defaultOutputFormat() {
            return OutputFormat.fromToken(defaultFormat);
        }
    }

    /**
     * Graph style settings.
     *
     * @param rankdir layout direction
     * @param nodeShape node shape
     * @param nodeStyle node style
     * @param defaultColor color for kinds without an entry
     * @param colors colors per kind, merged over the built-in table
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StyleSettings(
        @JsonProperty("rankdir") String rankdir,
        @JsonProperty("nodeShape") String nodeShape,
        @JsonProperty("nodeStyle") String nodeStyle,
        @JsonProperty("defaultColor") String defaultColor,
        @JsonProperty("colors") Map<String, String> colors
    ) {
        public StyleSettings {
            if (colors == null) {
                colors = Map.of();
            }
        }

        public static StyleSettings defaults() {
            return new StyleSettings(null, null, null, null, null);
        }
    }

    /**
     * Output settings.
     *
     * @param directory target directory of batch conversions
     * @param reportDirectory target directory of Markdown reports
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("reportDirectory") String reportDirectory
    ) {
        public OutputSettings {
            if (directory == null || directory.isBlank()) {
                directory = "./output/ast_visualized";
            }
            if (reportDirectory == null || reportDirectory.isBlank()) {
                reportDirectory = "./report/ast";
            }
        }

        public static OutputSettings defaults() {
            return new OutputSettings(null, null);
        }
    }
}
