package com.finFlow.sankeyDemo.extraction.util;

import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for numeric literal parsing and unit scaling.
 */
class ValueParserTest {

    @Test
    void commaGroupedLiteralWithoutUnitIsMillions() {
        assertThat(ValueParser.parse("1,234.5")).hasValue(1234.5);
    }

    @Test
    void billionUnitsScaleByOneThousand() {
        assertThat(ValueParser.parse("2.5", "billion")).hasValue(2500.0);
        assertThat(ValueParser.parse("12", "B")).hasValue(12000.0);
        assertThat(ValueParser.parse("1.2", "bn")).hasValue(1200.0);
    }

    @Test
    void millionUnitsKeepTheValue() {
        assertThat(ValueParser.parse("300", "Million")).hasValue(300.0);
        assertThat(ValueParser.parse("300", "m")).hasValue(300.0);
        assertThat(ValueParser.parse("300", "MN")).hasValue(300.0);
    }

    /**
     * A literal made of separators only has no digits left to parse.
     */
    @Test
    void nonNumericLiteralsAreEmpty() {
        assertThat(ValueParser.parse(",")).isEmpty();
        assertThat(ValueParser.parse("n/a")).isEmpty();
        assertThat(ValueParser.parse((String) null)).isEmpty();
    }

    @Test
    void unknownUnitCountsAsMillions() {
        assertThat(ValueParser.unitMultiplier("thousand")).isEqualTo(1.0);
        assertThat(ValueParser.unitMultiplier(null)).isEqualTo(1.0);
        assertThat(ValueParser.unitMultiplier(" ")).isEqualTo(1.0);
    }

    @Test
    void signedAndFractionalLiteralsParse() {
        OptionalDouble negative = ValueParser.parse("-20");
        assertThat(negative).hasValue(-20.0);
        assertThat(ValueParser.parse(".5")).hasValue(0.5);
    }
}
