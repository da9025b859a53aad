package com.compara.stream;

import com.compara.model.UsageResult;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Terminal outcome of one model's worker. {@code usage} is null for failed models.
 */
@Data
@AllArgsConstructor
public class WorkerResult {

    private String modelId;
    private String content;
    private boolean error;
    private UsageResult usage;

    public static WorkerResult success(String modelId, String content, UsageResult usage) {
        return new WorkerResult(modelId, content, false, usage);
    }

    public static WorkerResult failure(String modelId, String errorContent) {
        return new WorkerResult(modelId, errorContent, true, null);
    }
}
