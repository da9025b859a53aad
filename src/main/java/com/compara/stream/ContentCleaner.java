package com.compara.stream;

import java.util.regex.Pattern;

/**
 * Light cleanup of a finished answer before it is stored.
 */
public final class ContentCleaner {

    private static final Pattern MATH_BLOCK = Pattern.compile("<math[^>]*>[\\s\\S]*?</math>", Pattern.CASE_INSENSITIVE);
    private static final Pattern MATHML_URL_TAG = Pattern.compile("https?://www\\.w3\\.org/\\d+/Math/MathML[^>\\s]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern MATHML_URL = Pattern.compile("www\\.w3\\.org/\\d+/Math/MathML", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\n{3,}");

    private ContentCleaner() {
    }

    public static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String cleaned = MATH_BLOCK.matcher(text).replaceAll("");
        cleaned = MATHML_URL_TAG.matcher(cleaned).replaceAll("");
        cleaned = MATHML_URL.matcher(cleaned).replaceAll("");
        cleaned = EXCESS_NEWLINES.matcher(cleaned).replaceAll("\n\n");
        return cleaned.strip();
    }
}
