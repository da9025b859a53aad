package com.compara.service;

import com.compara.credit.AdmissionDecision;
import com.compara.credit.AdmissionGate;
import com.compara.credit.SettlementResult;
import com.compara.credit.UsageSettlement;
import com.compara.model.ChunkEvent;
import com.compara.model.ComparisonRequest;
import com.compara.model.CompletionMetadata;
import com.compara.model.Identity;
import com.compara.provider.ProviderCall;
import com.compara.stream.ModelWorker;
import com.compara.stream.MultiplexOutcome;
import com.compara.stream.StreamMultiplexer;
import com.compara.stream.WorkerResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Service running a multi-model comparison end to end: validation and admission
 * up front, then the multiplexed stream, then settlement and persistence.
 */
@Slf4j
@Service
public class ComparisonOrchestrator {

    private final ComparisonValidator validator;
    private final AdmissionGate admissionGate;
    private final StreamMultiplexer multiplexer;
    private final UsageSettlement settlement;
    private final OutputBudget outputBudget;
    private final ModelRegistry registry;
    private final ModelStatsTracker statsTracker;
    private final ComparisonRecorder recorder;

    public ComparisonOrchestrator(ComparisonValidator validator,
                                  AdmissionGate admissionGate,
                                  StreamMultiplexer multiplexer,
                                  UsageSettlement settlement,
                                  OutputBudget outputBudget,
                                  ModelRegistry registry,
                                  ModelStatsTracker statsTracker,
                                  ComparisonRecorder recorder) {
        this.validator = validator;
        this.admissionGate = admissionGate;
        this.multiplexer = multiplexer;
        this.settlement = settlement;
        this.outputBudget = outputBudget;
        this.registry = registry;
        this.statsTracker = statsTracker;
        this.recorder = recorder;
    }

    /**
     * Validate and admit. Nothing is streamed if this throws.
     *
     * @throws com.compara.exception.InputValidationException    invalid request
     * @throws com.compara.exception.ModelAccessDeniedException   model above the caller's tier
     * @throws com.compara.exception.InsufficientCreditsException no credits left
     */
    public PreparedComparison prepare(ComparisonRequest request, Identity identity) {
        validator.validate(request, identity.getTier());
        AdmissionDecision decision = admissionGate.admit(identity, request.getModels().size());
        long inputTokens = TokenEstimator.estimateInputTokens(request.getInputData(), request.getConversationHistory());
        log.info("Admitted comparison of {} models ({} credits remaining, ~{} input tokens)",
                request.getModels().size(), decision.getRemaining(), inputTokens);
        return new PreparedComparison(request, identity, decision, inputTokens);
    }

    /**
     * Cold stream of events; the comparison starts on subscription and runs on a
     * bounded-elastic thread. Cancelling the subscription stops the models.
     */
    public Flux<ChunkEvent> stream(PreparedComparison prepared) {
        return Flux.<ChunkEvent>create(sink -> {
                    AtomicBoolean disconnected = new AtomicBoolean();
                    sink.onCancel(() -> disconnected.set(true));
                    run(prepared, sink, disconnected);
                }, FluxSink.OverflowStrategy.BUFFER)
                .subscribeOn(Schedulers.boundedElastic());
    }

    void run(PreparedComparison prepared, FluxSink<ChunkEvent> sink, AtomicBoolean disconnected) {
        long startedAt = System.currentTimeMillis();
        ComparisonRequest request = prepared.getRequest();

        MultiplexOutcome outcome;
        try {
            outcome = multiplexer.run(buildCalls(prepared), sink::next, disconnected::get);
        } catch (RuntimeException e) {
            log.error("Comparison failed before streaming", e);
            sink.next(ChunkEvent.error("Error: " + e.getMessage()));
            sink.complete();
            return;
        }

        recordStats(outcome);

        SettlementResult settled = settlement.settle(prepared.getIdentity(), outcome.getSuccessfulUsage(),
                outcome.getSuccessCount(), prepared.getAdmission().getRemaining());
        long processingTimeMs = System.currentTimeMillis() - startedAt;

        if (outcome.getFailure() != null && outcome.getSuccessCount() == 0) {
            sink.next(ChunkEvent.error("Error: " + outcome.getFailure().getMessage()));
        } else {
            sink.next(ChunkEvent.complete(CompletionMetadata.builder()
                    .inputLength(request.getInputData().length())
                    .modelsRequested(request.getModels().size())
                    .modelsSuccessful(outcome.getSuccessCount())
                    .modelsFailed(outcome.getFailureCount())
                    .timestamp(Instant.now().toString())
                    .processingTimeMs(processingTimeMs)
                    .creditsUsed(settled.getCreditsCharged())
                    .creditsRemaining(settled.getCreditsRemaining())
                    .error(outcome.getFailure() != null ? "Stream ended early: " + outcome.getFailure().getMessage() : null)
                    .build()));
        }
        sink.complete();

        log.info("Comparison finished in {}ms: {}/{} models succeeded, {} credits charged{}",
                processingTimeMs, outcome.getSuccessCount(), request.getModels().size(),
                settled.getCreditsCharged(), outcome.isCancelled() ? " (client disconnected)" : "");

        recorder.recordAsync(ComparisonSummary.builder()
                .identity(prepared.getIdentity())
                .request(request)
                .outcome(outcome)
                .settlement(settled)
                .estimatedInputTokens(prepared.getEstimatedInputTokens())
                .processingTimeMs(processingTimeMs)
                .build());
    }

    List<ProviderCall> buildCalls(PreparedComparison prepared) {
        ComparisonRequest request = prepared.getRequest();
        Identity identity = prepared.getIdentity();
        int modelCount = request.getModels().size();
        String timezone = identity.getZone() != null ? identity.getZone().getId() : null;

        List<ProviderCall> calls = new ArrayList<>();
        for (String modelId : request.getModels()) {
            calls.add(ProviderCall.builder()
                    .modelId(modelId)
                    .prompt(request.getInputData())
                    .history(ModelWorker.filterHistory(request.getConversationHistory(), modelId))
                    .maxTokens(outputBudget.maxOutputTokens(modelId, prepared.getAdmission().getRemaining(),
                            modelCount, prepared.getEstimatedInputTokens()))
                    .temperature(request.getTemperature())
                    .webSearch(request.isWebSearchEnabled() && registry.supportsWebSearch(modelId))
                    .timezone(timezone)
                    .build());
        }
        return calls;
    }

    private void recordStats(MultiplexOutcome outcome) {
        for (WorkerResult result : outcome.getResults()) {
            if (result.isError()) {
                statsTracker.recordFailure(result.getModelId());
            } else {
                statsTracker.recordSuccess(result.getModelId());
            }
        }
    }
}
