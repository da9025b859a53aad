package com.compara.stream;

import com.compara.config.ComparaProperties;
import com.compara.exception.ProviderException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Turns a provider failure into the short {@code Error: ...} text shown in place of a model's answer.
 */
@Component
public class ProviderErrorClassifier {

    static final int MAX_MESSAGE_LENGTH = 200;

    static final String AUTHENTICATION_FAILED = "Error: Authentication failed";
    static final String RATE_LIMITED = "Error: Rate limited";
    static final String MODEL_NOT_AVAILABLE = "Error: Model not available";
    static final String CREDITS_OR_MAX_TOKENS = "Error: This request requires more credits or fewer max_tokens. "
            + "Please try with a shorter prompt or reduce the number of models.";

    private final ComparaProperties properties;

    public ProviderErrorClassifier(ComparaProperties properties) {
        this.properties = properties;
    }

    public String classify(Throwable failure, String modelId) {
        ProviderException providerError = findProviderException(failure);
        Integer status = providerError != null ? providerError.getStatusCode() : null;
        String message = messageOf(providerError != null ? providerError : failure);
        String rawDetail = providerError != null ? providerError.getProviderError() : null;
        String lower = message.toLowerCase(Locale.ROOT);

        // A status means the message was parsed from a provider error body
        boolean parsed = status != null;

        if (status != null && status == 400) {
            if (rawDetail != null && !rawDetail.isBlank()) {
                return "Error: " + truncate(rawDetail);
            }
            if (lower.contains("provider returned error")) {
                return "Error: " + truncate(message);
            }
            return "Error: Invalid request - " + truncate(message);
        }

        if (isStatus(status, 401) || lower.contains("unauthorized") || lower.contains("401")) {
            return AUTHENTICATION_FAILED;
        }

        if (isStatus(status, 404) || lower.contains("not found") || lower.contains("404")) {
            return modelNotAvailable(modelId, message, rawDetail, providerError, parsed);
        }

        if (isStatus(status, 429) || lower.contains("rate limit") || lower.contains("429")) {
            return RATE_LIMITED;
        }

        if (isTimeout(failure) || lower.contains("timeout") || lower.contains("timed out")) {
            return "Error: Timeout (" + properties.getStream().getProviderTimeout().toSeconds() + "s)";
        }

        if (isStatus(status, 402) || lower.contains("402") || lower.contains("payment required")
                || (lower.contains("requires more credits") && lower.contains("max_tokens"))) {
            return CREDITS_OR_MAX_TOKENS;
        }

        return "Error: " + truncate(message);
    }

    private String modelNotAvailable(String modelId, String message, String rawDetail,
                                     ProviderException providerError, boolean parsed) {
        String detail = rawDetail;
        if (detail == null && isUnroutable(message)) {
            detail = message;
        }
        if (detail != null && !detail.isBlank()) {
            if (isUnroutable(detail)) {
                String providerName = providerError != null ? providerError.getProviderName() : null;
                return "Error: Model '" + modelId + "' is not currently available. "
                        + (providerName != null
                        ? "The provider (" + providerName + ") may not have this model configured in their gateway. "
                        : "The provider may not have this model configured in their gateway. ")
                        + "Please try again later or use a different model.";
            }
            return MODEL_NOT_AVAILABLE + " - " + truncate(detail);
        }
        if (parsed && !message.isBlank()) {
            return MODEL_NOT_AVAILABLE + " - " + truncate(message);
        }
        return MODEL_NOT_AVAILABLE;
    }

    private static boolean isUnroutable(String text) {
        return text.contains("not configured in the Gateway") || text.contains("No matching route");
    }

    private static boolean isStatus(Integer status, int expected) {
        return status != null && status == expected;
    }

    private static ProviderException findProviderException(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof ProviderException) {
                return (ProviderException) current;
            }
            current = current.getCause();
        }
        return null;
    }

    private static boolean isTimeout(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof TimeoutException
                    || current.getClass().getSimpleName().contains("Timeout")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String messageOf(Throwable failure) {
        String message = failure.getMessage();
        return message != null ? message : failure.getClass().getSimpleName();
    }

    static String truncate(String message) {
        return message.length() > MAX_MESSAGE_LENGTH ? message.substring(0, MAX_MESSAGE_LENGTH) : message;
    }
}
