package com.finFlow.sankeyDemo.extraction.util;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Utility class for normalizing numeric tokens with an optional unit suffix to millions.
 * 
 * Unit mapping: million / mn / m to x1, billion / bn / b to x1000 (case-insensitive);
 * no unit means the value is already in millions.
 */
@Slf4j
public class ValueParser {

    private static final Pattern NUMERIC_LITERAL = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)");

    private static final double MILLIONS = 1.0;
    private static final double BILLIONS = 1000.0;

    private ValueParser() {}

    /**
     * Parses a possibly comma-grouped numeric literal and scales it by its unit.
     *
     * @param literal Numeric literal, e.g. "1,234.5"
     * @param unit Unit token, e.g. "billion", or null
     * @return Value in millions, or empty if the literal is not numeric
     */
    public static OptionalDouble parse(String literal, String unit) {
        if (literal == null) {
            return OptionalDouble.empty();
        }

        String digits = literal.replace(",", "").trim();
        if (!NUMERIC_LITERAL.matcher(digits).matches()) {
            log.debug("Not a numeric literal: '{}'", literal);
            return OptionalDouble.empty();
        }

        return OptionalDouble.of(Double.parseDouble(digits) * unitMultiplier(unit));
    }

    /**
     * Parses a literal that carries no unit.
     */
    public static OptionalDouble parse(String literal) {
        return parse(literal, null);
    }

    /**
     * Multiplier that converts a value in the given unit to millions. Unknown units count as millions.
     */
    public static double unitMultiplier(String unit) {
        if (unit == null || unit.isBlank()) {
            return MILLIONS;
        }
        return switch (unit.trim().toLowerCase(Locale.ROOT)) {
            case "billion", "bn", "b" -> BILLIONS;
            case "million", "mn", "m" -> MILLIONS;
            default -> {
                log.debug("Unknown unit '{}', treating value as millions", unit);
                yield MILLIONS;
            }
        };
    }
}
