package com.finFlow.sankeyDemo.flow.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Semantic color class of a node or edge.
 */
public enum ColorClass {
    REVENUE,
    EXPENSE,
    PROFIT,
    POSITIVE,
    NEGATIVE,
    TAX,
    NEUTRAL;

    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
