package com.compara.stream;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Message from a worker thread to the multiplexer loop.
 */
@Data
@AllArgsConstructor
public class WorkerSignal {

    public enum Kind {
        CHUNK,
        KEEPALIVE,
        FINISHED
    }

    private Kind kind;
    private String modelId;
    private String content;
    private WorkerResult result;

    public static WorkerSignal chunk(String modelId, String content) {
        return new WorkerSignal(Kind.CHUNK, modelId, content, null);
    }

    public static WorkerSignal keepalive(String modelId) {
        return new WorkerSignal(Kind.KEEPALIVE, modelId, null, null);
    }

    public static WorkerSignal finished(WorkerResult result) {
        return new WorkerSignal(Kind.FINISHED, result.getModelId(), null, result);
    }
}
