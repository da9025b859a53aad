package com.compara.stream;

import com.compara.model.UsageResult;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.Objects;

/**
 * Per-model results of a multiplex run, in request order.
 */
@Data
@AllArgsConstructor
public class MultiplexOutcome {

    private List<WorkerResult> results;

    /**
     * True when the run stopped because the client went away.
     */
    private boolean cancelled;

    /**
     * Unexpected failure of the loop itself, or null.
     */
    private Throwable failure;

    public List<WorkerResult> getSuccessful() {
        return results.stream().filter(result -> !result.isError()).toList();
    }

    public int getSuccessCount() {
        return getSuccessful().size();
    }

    public int getFailureCount() {
        return results.size() - getSuccessCount();
    }

    public List<UsageResult> getSuccessfulUsage() {
        return getSuccessful().stream()
                .map(WorkerResult::getUsage)
                .filter(Objects::nonNull)
                .toList();
    }
}
