package com.compara.stream;

import com.compara.model.HistoryMessage;
import com.compara.model.UsageResult;
import com.compara.provider.FragmentSink;
import com.compara.provider.ProviderCall;
import com.compara.service.ProviderService;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;

/**
 * Runs one model's blocking provider stream on a pool thread and relays its
 * output to the multiplexer's channel. Never throws: every failure becomes an
 * {@code Error: ...} result.
 */
@Slf4j
public class ModelWorker implements Callable<WorkerResult> {

    private final ProviderCall call;
    private final ProviderService providerService;
    private final ProviderErrorClassifier errorClassifier;
    private final BlockingQueue<WorkerSignal> channel;

    public ModelWorker(ProviderCall call,
                       ProviderService providerService,
                       ProviderErrorClassifier errorClassifier,
                       BlockingQueue<WorkerSignal> channel) {
        this.call = call;
        this.providerService = providerService;
        this.errorClassifier = errorClassifier;
        this.channel = channel;
    }

    /**
     * User turns, plus assistant turns that are unattributed or came from this model.
     */
    public static List<HistoryMessage> filterHistory(List<HistoryMessage> history, String modelId) {
        if (history == null) {
            return List.of();
        }
        return history.stream()
                .filter(message -> message.isUser()
                        || (message.isAssistant() && (message.getModelId() == null || message.getModelId().equals(modelId))))
                .toList();
    }

    @Override
    public WorkerResult call() {
        String modelId = call.getModelId();
        FragmentClassifier classifier = new FragmentClassifier();
        log.debug("Worker started for {}", modelId);

        WorkerResult result;
        try {
            UsageResult usage = providerService.stream(call, new FragmentSink() {
                @Override
                public void onFragment(String fragment) {
                    if (classifier.accept(fragment)) {
                        publish(WorkerSignal.chunk(modelId, fragment));
                    } else {
                        publish(WorkerSignal.keepalive(modelId));
                    }
                }

                @Override
                public void onKeepalive() {
                    publish(WorkerSignal.keepalive(modelId));
                }
            });
            result = complete(modelId, classifier, usage);
        } catch (WorkerCancelledException e) {
            log.debug("Worker for {} cancelled", modelId);
            return WorkerResult.failure(modelId, "Error: Cancelled");
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                log.debug("Worker for {} interrupted: {}", modelId, e.getMessage());
                return WorkerResult.failure(modelId, "Error: Cancelled");
            }
            String errorText = errorClassifier.classify(e, modelId);
            log.warn("Model {} failed: {} ({})", modelId, errorText, e.getMessage());
            publishQuietly(WorkerSignal.chunk(modelId, errorText));
            result = WorkerResult.failure(modelId, errorText);
        }

        publishQuietly(WorkerSignal.finished(result));
        return result;
    }

    private WorkerResult complete(String modelId, FragmentClassifier classifier, UsageResult usage) {
        String content = ContentCleaner.clean(classifier.getContent());
        if (ErrorContentDetector.isErrorContent(content)) {
            log.warn("Model {} returned error text as content: {}", modelId,
                    ProviderErrorClassifier.truncate(content));
            return WorkerResult.failure(modelId, content);
        }
        log.info("Model {} finished: {} chunks, {} chars", modelId, classifier.getChunkCount(), content.length());
        return WorkerResult.success(modelId, content, usage);
    }

    private void publish(WorkerSignal signal) {
        try {
            channel.put(signal);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerCancelledException();
        }
    }

    /**
     * Final signals are best effort; a cancelled worker's output is no longer read.
     */
    private void publishQuietly(WorkerSignal signal) {
        if (Thread.currentThread().isInterrupted()) {
            return;
        }
        try {
            channel.put(signal);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Dropped {} signal for {} after cancellation", signal.getKind(), signal.getModelId());
        }
    }

    /**
     * Unwinds the provider stream when the worker is interrupted mid-publish.
     */
    static class WorkerCancelledException extends RuntimeException {
        WorkerCancelledException() {
            super("worker cancelled", null, false, false);
        }
    }
}
