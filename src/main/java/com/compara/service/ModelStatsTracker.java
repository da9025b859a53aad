package com.compara.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide success and failure counters per model.
 */
@Component
public class ModelStatsTracker {

    private final Map<String, Counters> counters = new ConcurrentHashMap<>();

    public void recordSuccess(String modelId) {
        Counters c = counters.computeIfAbsent(modelId, id -> new Counters());
        c.success.incrementAndGet();
        c.lastSuccess.set(Instant.now());
    }

    public void recordFailure(String modelId) {
        Counters c = counters.computeIfAbsent(modelId, id -> new Counters());
        c.failure.incrementAndGet();
        c.lastError.set(Instant.now());
    }

    public ModelStats get(String modelId) {
        Counters c = counters.get(modelId);
        return c != null ? c.snapshot() : ModelStats.builder().build();
    }

    /**
     * Snapshot of all models seen so far, sorted by model id.
     */
    public Map<String, ModelStats> snapshot() {
        Map<String, ModelStats> result = new TreeMap<>();
        counters.forEach((modelId, c) -> result.put(modelId, c.snapshot()));
        return result;
    }

    private static final class Counters {
        private final AtomicLong success = new AtomicLong();
        private final AtomicLong failure = new AtomicLong();
        private final AtomicReference<Instant> lastSuccess = new AtomicReference<>();
        private final AtomicReference<Instant> lastError = new AtomicReference<>();

        private ModelStats snapshot() {
            return ModelStats.builder()
                    .success(success.get())
                    .failure(failure.get())
                    .lastSuccess(lastSuccess.get())
                    .lastError(lastError.get())
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ModelStats {

        @JsonProperty("success")
        private long success;

        @JsonProperty("failure")
        private long failure;

        @JsonProperty("last_success")
        private Instant lastSuccess;

        @JsonProperty("last_error")
        private Instant lastError;
    }
}
