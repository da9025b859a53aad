package com.compara.stream;

import com.compara.model.ModelStreamState;

import java.util.concurrent.Future;

/**
 * Multiplexer-side bookkeeping for one model. Only the multiplexer loop thread touches it.
 */
public class ModelStreamTask {

    private final String modelId;
    private ModelStreamState state = ModelStreamState.PENDING;
    private Future<WorkerResult> future;
    private long lastActivityNanos;
    private long lastHeartbeatNanos;
    private WorkerResult result;

    public ModelStreamTask(String modelId) {
        this.modelId = modelId;
    }

    void start(Future<WorkerResult> future, long nowNanos) {
        transition(ModelStreamState.RUNNING);
        this.future = future;
        this.lastActivityNanos = nowNanos;
        this.lastHeartbeatNanos = nowNanos;
    }

    void recordActivity(long nowNanos) {
        lastActivityNanos = nowNanos;
    }

    void recordHeartbeat(long nowNanos) {
        lastHeartbeatNanos = nowNanos;
    }

    void finish(WorkerResult workerResult) {
        transition(workerResult.isError() ? ModelStreamState.ERRORED : ModelStreamState.DONE);
        this.result = workerResult;
    }

    /**
     * Cancel the worker without waiting for it to stop.
     */
    void timeOut(WorkerResult timeoutResult) {
        transition(ModelStreamState.TIMED_OUT);
        this.result = timeoutResult;
        if (future != null) {
            future.cancel(true);
        }
    }

    void abandon(WorkerResult abandonedResult) {
        transition(ModelStreamState.ERRORED);
        this.result = abandonedResult;
        if (future != null) {
            future.cancel(true);
        }
    }

    private void transition(ModelStreamState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Model " + modelId + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public String getModelId() {
        return modelId;
    }

    public ModelStreamState getState() {
        return state;
    }

    public WorkerResult getResult() {
        return result;
    }

    long getLastActivityNanos() {
        return lastActivityNanos;
    }

    long getLastHeartbeatNanos() {
        return lastHeartbeatNanos;
    }
}
