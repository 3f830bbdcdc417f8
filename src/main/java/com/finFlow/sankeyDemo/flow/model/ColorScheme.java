package com.finFlow.sankeyDemo.flow.model;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Named palettes resolving color classes to RGBA strings.
 */
@Slf4j
public enum ColorScheme {

    STANDARD("standard",
            "rgba(31, 119, 180, 0.6)",   // blue
            "rgba(255, 127, 14, 0.6)",   // orange
            "rgba(44, 160, 44, 0.6)",    // green
            "rgba(44, 160, 44, 0.6)",    // green
            "rgba(214, 39, 40, 0.6)",    // red
            "rgba(148, 103, 189, 0.6)",  // purple
            "rgba(140, 140, 140, 0.5)"), // gray

    PROFESSIONAL("professional",
            "rgba(52, 94, 141, 0.7)",    // navy
            "rgba(191, 129, 45, 0.7)",   // amber
            "rgba(39, 123, 69, 0.7)",    // forest green
            "rgba(65, 151, 151, 0.7)",   // teal
            "rgba(204, 80, 62, 0.7)",    // rust
            "rgba(142, 85, 153, 0.7)",   // violet
            "rgba(120, 120, 120, 0.5)"), // gray

    HIGH_CONTRAST("high_contrast",
            "rgba(0, 0, 205, 0.8)",      // medium blue
            "rgba(255, 140, 0, 0.8)",    // dark orange
            "rgba(50, 205, 50, 0.8)",    // lime green
            "rgba(0, 128, 0, 0.8)",      // bright green
            "rgba(220, 20, 60, 0.8)",    // crimson
            "rgba(138, 43, 226, 0.8)",   // blue violet
            "rgba(70, 70, 70, 0.7)");    // dark gray

    private final String schemeName;
    private final Map<ColorClass, String> colors;

    ColorScheme(String schemeName, String revenue, String expense, String profit,
                String positive, String negative, String tax, String neutral) {
        this.schemeName = schemeName;
        EnumMap<ColorClass, String> map = new EnumMap<>(ColorClass.class);
        map.put(ColorClass.REVENUE, revenue);
        map.put(ColorClass.EXPENSE, expense);
        map.put(ColorClass.PROFIT, profit);
        map.put(ColorClass.POSITIVE, positive);
        map.put(ColorClass.NEGATIVE, negative);
        map.put(ColorClass.TAX, tax);
        map.put(ColorClass.NEUTRAL, neutral);
        this.colors = Collections.unmodifiableMap(map);
    }

    public String getSchemeName() {
        return schemeName;
    }

    public String colorFor(ColorClass colorClass) {
        return colors.get(colorClass);
    }

    /**
     * Resolves a scheme by name, falling back to {@link #STANDARD} for unknown names.
     */
    public static ColorScheme fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (ColorScheme scheme : values()) {
                if (scheme.schemeName.equals(normalized)) {
                    return scheme;
                }
            }
        }
        log.warn("Unknown color scheme '{}', using standard", name);
        return STANDARD;
    }
}
