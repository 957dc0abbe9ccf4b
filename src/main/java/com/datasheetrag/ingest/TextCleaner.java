package com.datasheetrag.ingest;

import java.util.regex.Pattern;

/**
 * Best effort normalization of extracted datasheet text. Never throws.
 */
public class TextCleaner {
    private static final Pattern PAGE_HEADER_LINE = Pattern.compile("(?im)^[ \\t]*page[ \\t]+\\d+\\b.*$");
    private static final Pattern PAGE_NUMBER_LINE = Pattern.compile(
            "(?im)^[ \\t]*(?:-[ \\t]*\\d+[ \\t]*-|\\d+[ \\t]*(?:of|/)[ \\t]*\\d+)[ \\t]*$");
    private static final Pattern URL = Pattern.compile("(?i)(?:https?://|www\\.)\\S+");
    private static final Pattern DISALLOWED = Pattern.compile(
            "[^\\w\\s.,;:!?\\-()\\[\\]/+=<>@#$%^&*]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    public String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        // line based rules first, while line breaks still exist
        String cleaned = PAGE_HEADER_LINE.matcher(text).replaceAll("");
        cleaned = PAGE_NUMBER_LINE.matcher(cleaned).replaceAll("");
        cleaned = URL.matcher(cleaned).replaceAll(" ");
        cleaned = DISALLOWED.matcher(cleaned).replaceAll(" ");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").strip();
    }
}
