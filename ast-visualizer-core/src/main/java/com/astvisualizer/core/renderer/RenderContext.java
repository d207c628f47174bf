package com.astvisualizer.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Context handed to backends when creating a sink.
 *
 * <p><b>Known settings:</b>
 * <ul>
 *   <li>{@code graphviz.executable} - path or name of the {@code dot} executable (default: "dot")</li>
 *   <li>{@code graphviz.timeoutSeconds} - maximum run time of one {@code dot} call (default: "60")</li>
 * </ul>
 *
 * @param style graph style
 * @param settings backend-specific settings
 */
public record RenderContext(
    GraphStyle style,
    Map<String, String> settings
) {
    public static final String GRAPHVIZ_EXECUTABLE = "graphviz.executable";
    public static final String GRAPHVIZ_TIMEOUT_SECONDS = "graphviz.timeoutSeconds";

    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(style, "style must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public static RenderContext defaults() {
        return new RenderContext(GraphStyle.defaults(), Map.of());
    }

    /**
     * Gets a setting value.
     *
     * @param key setting key
     * @return setting value or null
     */
    public String getSetting(String key) {
        return settings.get(key);
    }

    /**
     * Gets a setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @return setting value or default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
