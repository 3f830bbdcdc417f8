package com.finFlow.sankeyDemo.extraction.util;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Utility class for preparing raw model output for JSON decoding.
 */
public class LlmResponseCleaner {

    private static final Pattern BOLD = Pattern.compile("\\*\\*(.*?)\\*\\*");
    private static final Pattern ITALIC = Pattern.compile("\\*(.*?)\\*");

    private LlmResponseCleaner() {}

    /**
     * Removes Markdown bold / italic markers and inline code ticks.
     */
    public static String stripMarkdown(String text) {
        if (text == null) {
            return "";
        }
        String stripped = BOLD.matcher(text).replaceAll("$1");
        stripped = ITALIC.matcher(stripped).replaceAll("$1");
        return stripped.replace("`", "");
    }

    /**
     * Returns the substring from the first '[' to the last ']' inclusive.
     *
     * @param text Cleaned response text
     * @return Candidate JSON array text, or empty if no bracket pair exists
     */
    public static Optional<String> extractJsonArray(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int start = text.indexOf('[');
        int end = text.lastIndexOf(']');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return Optional.of(text.substring(start, end + 1));
    }
}
