package com.compara.stream;

import com.compara.config.ComparaProperties;
import com.compara.model.ChunkEvent;
import com.compara.provider.ProviderCall;
import com.compara.service.ProviderService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Fans one comparison out to a worker per model and merges their output into a
 * single event sequence.
 * <p>
 * The calling thread runs the loop and is the only consumer of the worker
 * channel. Per model it emits {@code start}, the model's chunks in order, and
 * exactly one {@code done}. Models silent for longer than the inactivity timeout
 * are cancelled and finished with an error; idle models get a heartbeat every
 * keepalive interval. Heartbeats do not count as activity.
 */
@Slf4j
@Component
public class StreamMultiplexer {

    private final ProviderService providerService;
    private final ProviderErrorClassifier errorClassifier;
    private final ComparaProperties properties;

    public StreamMultiplexer(ProviderService providerService,
                             ProviderErrorClassifier errorClassifier,
                             ComparaProperties properties) {
        this.providerService = providerService;
        this.errorClassifier = errorClassifier;
        this.properties = properties;
    }

    /**
     * Run all calls to completion, blocking the calling thread.
     *
     * @param calls     one call per requested model, in request order
     * @param emitter   receives every outgoing event
     * @param cancelled polled each iteration; true stops the run early
     */
    public MultiplexOutcome run(List<ProviderCall> calls, Consumer<ChunkEvent> emitter, BooleanSupplier cancelled) {
        ComparaProperties.StreamConfig config = properties.getStream();
        long inactivityNanos = config.getInactivityTimeout().toNanos();
        long keepaliveNanos = config.getKeepaliveInterval().toNanos();
        long pollMillis = Math.max(1, config.getPollInterval().toMillis());
        String timeoutText = timeoutText(config.getInactivityTimeout());

        BlockingQueue<WorkerSignal> channel = new ArrayBlockingQueue<>(config.getQueueCapacity());
        int poolSize = Math.max(1, Math.min(calls.size(), config.getMaxWorkers()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("model-worker-"));

        Map<String, ModelStreamTask> tasks = new LinkedHashMap<>();
        boolean stoppedByClient = false;
        Throwable failure = null;

        try {
            for (ProviderCall call : calls) {
                ModelStreamTask task = new ModelStreamTask(call.getModelId());
                tasks.put(call.getModelId(), task);
                emitter.accept(ChunkEvent.start(call.getModelId()));
                task.start(pool.submit(new ModelWorker(call, providerService, errorClassifier, channel)), System.nanoTime());
            }
            log.info("Started {} model workers on a pool of {}", tasks.size(), poolSize);

            while (hasActive(tasks)) {
                if (cancelled.getAsBoolean()) {
                    stoppedByClient = true;
                    log.info("Client disconnected, stopping {} active models", countActive(tasks));
                    break;
                }

                WorkerSignal signal = channel.poll(pollMillis, TimeUnit.MILLISECONDS);
                long now = System.nanoTime();
                if (signal != null) {
                    List<WorkerSignal> batch = new ArrayList<>();
                    batch.add(signal);
                    channel.drainTo(batch);
                    for (WorkerSignal next : batch) {
                        handle(next, tasks, emitter, now);
                    }
                }

                for (ModelStreamTask task : tasks.values()) {
                    if (task.isTerminal()) {
                        continue;
                    }
                    if (now - task.getLastActivityNanos() > inactivityNanos) {
                        log.warn("Model {} timed out after {}s of inactivity",
                                task.getModelId(), config.getInactivityTimeout().toSeconds());
                        task.timeOut(WorkerResult.failure(task.getModelId(), timeoutText));
                        emitter.accept(ChunkEvent.chunk(task.getModelId(), timeoutText));
                        emitter.accept(ChunkEvent.done(task.getModelId(), true));
                    } else if (now - Math.max(task.getLastActivityNanos(), task.getLastHeartbeatNanos()) >= keepaliveNanos) {
                        task.recordHeartbeat(now);
                        emitter.accept(ChunkEvent.keepalive(task.getModelId()));
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stoppedByClient = true;
            log.info("Multiplexer interrupted");
        } catch (RuntimeException e) {
            failure = e;
            log.error("Multiplexer loop failed", e);
        } finally {
            pool.shutdownNow();
        }

        reconcile(tasks, calls, emitter);

        List<WorkerResult> results = new ArrayList<>();
        for (ModelStreamTask task : tasks.values()) {
            results.add(task.getResult());
        }
        return new MultiplexOutcome(results, stoppedByClient, failure);
    }

    private void handle(WorkerSignal signal, Map<String, ModelStreamTask> tasks, Consumer<ChunkEvent> emitter, long now) {
        ModelStreamTask task = tasks.get(signal.getModelId());
        if (task == null || task.isTerminal()) {
            // Late output from a timed-out worker
            return;
        }
        switch (signal.getKind()) {
            case CHUNK -> {
                task.recordActivity(now);
                emitter.accept(ChunkEvent.chunk(signal.getModelId(), signal.getContent()));
            }
            case KEEPALIVE -> {
                task.recordActivity(now);
                task.recordHeartbeat(now);
                emitter.accept(ChunkEvent.keepalive(signal.getModelId()));
            }
            case FINISHED -> {
                task.finish(signal.getResult());
                emitter.accept(ChunkEvent.done(signal.getModelId(), signal.getResult().isError()));
            }
        }
    }

    /**
     * Every requested model gets exactly one {@code done}, whatever stopped the loop.
     */
    private void reconcile(Map<String, ModelStreamTask> tasks, List<ProviderCall> calls, Consumer<ChunkEvent> emitter) {
        for (ProviderCall call : calls) {
            String modelId = call.getModelId();
            ModelStreamTask task = tasks.computeIfAbsent(modelId, ModelStreamTask::new);
            if (task.isTerminal()) {
                continue;
            }
            log.debug("Finalizing unfinished model {}", modelId);
            task.abandon(WorkerResult.failure(modelId, "Error: Cancelled"));
            try {
                emitter.accept(ChunkEvent.done(modelId, true));
            } catch (RuntimeException e) {
                log.warn("Could not emit done for {}: {}", modelId, e.getMessage());
            }
        }
    }

    private static boolean hasActive(Map<String, ModelStreamTask> tasks) {
        return countActive(tasks) > 0;
    }

    private static long countActive(Map<String, ModelStreamTask> tasks) {
        return tasks.values().stream().filter(task -> !task.isTerminal()).count();
    }

    static String timeoutText(Duration inactivityTimeout) {
        return "Error: Timeout (" + inactivityTimeout.toSeconds() + "s)";
    }
}
