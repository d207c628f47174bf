package com.astvisualizer.core.emitter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable mapping from node kind to fill color.
 *
 * <p>Lookup is by exact kind; kinds not in the table get the default color. The built-in
 * table groups the syntax categories of the PiPiXia compiler dumps:
 * <ul>
 *   <li>literals - green</li>
 *   <li>identifiers - salmon</li>
 *   <li>operators - orange</li>
 *   <li>declarations and assignments - teal</li>
 *   <li>control flow statements - lavender</li>
 * </ul>
 *
 * @param colors color per kind
 * @param defaultColor color for unknown kinds
 */
public record NodeColorScheme(
    Map<String, String> colors,
    String defaultColor
) {
    public static final String DEFAULT_COLOR = "#e0e0e0";

    private static final Map<String, String> BUILT_IN_COLORS = builtInColors();

    /**
     * Compact constructor with validation.
     */
    public NodeColorScheme {
        colors = colors == null ? Map.of() : Map.copyOf(colors);
        if (defaultColor == null || defaultColor.isBlank()) {
            defaultColor = DEFAULT_COLOR;
        }
    }

    /**
     * Creates the built-in scheme.
     *
     * @return built-in color table with {@link #DEFAULT_COLOR} as fallback
     */
    public static NodeColorScheme defaults() {
        return new NodeColorScheme(BUILT_IN_COLORS, DEFAULT_COLOR);
    }

    /**
     * Returns a scheme with additional or replaced entries.
     *
     * @param overrides colors per kind taking precedence over this table
     * @param overrideDefault new default color, or null to keep the current one
     * @return a new scheme
     */
    public NodeColorScheme withOverrides(Map<String, String> overrides, String overrideDefault) {
        Map<String, String> merged = new LinkedHashMap<>(colors);
        if (overrides != null) {
            overrides.forEach((kind, color) -> {
                if (kind != null && color != null) {
                    merged.put(kind, color);
                }
            });
        }
        return new NodeColorScheme(merged, overrideDefault != null ? overrideDefault : defaultColor);
    }

    /**
     * Resolves the color for a kind.
     *
     * @param kind node kind
     * @return configured color, or the default color
     */
    public String colorFor(String kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        return colors.getOrDefault(kind, defaultColor);
    }

    private static Map<String, String> builtInColors() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("Program", "#e1f5ff");
        table.put("Function", "#fff9c4");
        table.put("Block", "#f3e5f5");
        table.put("IntLiteral", "#c8e6c9");
        table.put("DoubleLiteral", "#c8e6c9");
        table.put("StringLiteral", "#c8e6c9");
        table.put("BoolLiteral", "#c8e6c9");
        table.put("Identifier", "#ffccbc");
        table.put("BinaryOp", "#ffe0b2");
        table.put("UnaryOp", "#ffe0b2");
        table.put("VarDecl", "#b2dfdb");
        table.put("Assignment", "#b2dfdb");
        table.put("IfStmt", "#d1c4e9");
        table.put("WhileStmt", "#d1c4e9");
        table.put("ForStmt", "#d1c4e9");
        table.put("ReturnStmt", "#d1c4e9");
        table.put("Type", "#cfd8dc");
        return Map.copyOf(table);
    }
}
