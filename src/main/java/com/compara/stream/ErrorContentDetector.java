package com.compara.stream;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Detects answers that are really error text relayed by a provider as ordinary content.
 */
public final class ErrorContentDetector {

    static final int TAIL_WINDOW = 200;
    static final int SHORT_ERROR_LENGTH = 100;

    private static final List<Pattern> BACKEND_ERRORS = List.of(
            Pattern.compile("^Error:\\s*Timeout\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^Error:\\s*Rate\\s*limit", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^Error:\\s*Model\\s*not\\s*available", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^Error:\\s*Authentication\\s*failed", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^Error:\\s*\\d+", Pattern.CASE_INSENSITIVE));

    private ErrorContentDetector() {
    }

    public static boolean isErrorContent(String content) {
        if (content == null) {
            return false;
        }
        String trimmed = content.strip();
        if (trimmed.startsWith("Error:")) {
            if (matchesBackendError(trimmed)) {
                return true;
            }
            // A short sentence-less "Error: ..." line is not a real answer
            return trimmed.length() < SHORT_ERROR_LENGTH && !containsSentencePunctuation(trimmed);
        }
        if (trimmed.length() > TAIL_WINDOW) {
            int index = trimmed.toLowerCase(Locale.ROOT).lastIndexOf("error:");
            if (index >= 0 && index >= trimmed.length() - TAIL_WINDOW) {
                return matchesBackendError(trimmed.substring(index));
            }
        }
        return false;
    }

    private static boolean matchesBackendError(String text) {
        return BACKEND_ERRORS.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }

    private static boolean containsSentencePunctuation(String text) {
        return text.indexOf('.') >= 0 || text.indexOf('!') >= 0 || text.indexOf('?') >= 0;
    }
}
