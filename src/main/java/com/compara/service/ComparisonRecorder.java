package com.compara.service;

import com.compara.config.ComparaProperties;
import com.compara.entity.ConversationEntity;
import com.compara.entity.ConversationMessageEntity;
import com.compara.entity.UsageRecordEntity;
import com.compara.model.ComparisonRequest;
import com.compara.model.HistoryMessage;
import com.compara.model.Identity;
import com.compara.model.UsageResult;
import com.compara.repository.ConversationRepository;
import com.compara.repository.UsageRecordRepository;
import com.compara.stream.MultiplexOutcome;
import com.compara.stream.WorkerResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Service persisting usage records and conversation transcripts off the response path.
 * Failures are logged and never reach the caller.
 */
@Slf4j
@Service
public class ComparisonRecorder {

    static final int TITLE_LENGTH = 50;

    private final UsageRecordRepository usageRecordRepository;
    private final ConversationRepository conversationRepository;
    private final TransactionTemplate transactionTemplate;
    private final ComparaProperties properties;
    private final Scheduler scheduler;

    @Autowired
    public ComparisonRecorder(UsageRecordRepository usageRecordRepository,
                              ConversationRepository conversationRepository,
                              TransactionTemplate transactionTemplate,
                              ComparaProperties properties) {
        this(usageRecordRepository, conversationRepository, transactionTemplate, properties, Schedulers.boundedElastic());
    }

    ComparisonRecorder(UsageRecordRepository usageRecordRepository,
                       ConversationRepository conversationRepository,
                       TransactionTemplate transactionTemplate,
                       ComparaProperties properties,
                       Scheduler scheduler) {
        this.usageRecordRepository = usageRecordRepository;
        this.conversationRepository = conversationRepository;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    /**
     * Fire-and-forget: schedules the writes and returns immediately.
     */
    public void recordAsync(ComparisonSummary summary) {
        if (!properties.getPersistence().isEnabled()) {
            return;
        }
        scheduler.schedule(() -> {
            try {
                record(summary);
            } catch (RuntimeException e) {
                log.error("Failed to persist comparison for {}", describe(summary.getIdentity()), e);
            }
        });
    }

    void record(ComparisonSummary summary) {
        usageRecordRepository.save(toUsageRecord(summary));
        log.debug("Saved usage record for {}", describe(summary.getIdentity()));

        Identity identity = summary.getIdentity();
        if (!identity.isAnonymous() && summary.getOutcome().getSuccessCount() > 0) {
            transactionTemplate.executeWithoutResult(status -> saveConversation(summary));
        }
    }

    UsageRecordEntity toUsageRecord(ComparisonSummary summary) {
        Identity identity = summary.getIdentity();
        MultiplexOutcome outcome = summary.getOutcome();
        List<UsageResult> usage = outcome.getSuccessfulUsage();
        long input = usage.stream().mapToLong(UsageResult::getInputTokens).sum();
        long output = usage.stream().mapToLong(UsageResult::getOutputTokens).sum();

        return UsageRecordEntity.builder()
                .userId(identity.getUserId())
                .ipAddress(identity.getClientIp())
                .browserFingerprint(identity.hasFingerprint() ? DigestUtils.sha256Hex(identity.getFingerprint()) : null)
                .modelsUsed(summary.getRequest().getModels())
                .inputLength(summary.getRequest().getInputData().length())
                .modelsRequested(outcome.getResults().size())
                .modelsSuccessful(outcome.getSuccessCount())
                .modelsFailed(outcome.getFailureCount())
                .processingTimeMs(summary.getProcessingTimeMs())
                .inputTokens(input)
                .outputTokens(output)
                .totalTokens(input + output)
                .effectiveTokens(summary.getSettlement().getEffectiveTokens())
                .creditsUsed(summary.getSettlement().getCreditsCharged())
                .build();
    }

    private void saveConversation(ComparisonSummary summary) {
        String userId = summary.getIdentity().getUserId();
        ComparisonRequest request = summary.getRequest();

        ConversationEntity conversation = findExisting(userId, request)
                .orElseGet(() -> ConversationEntity.builder()
                        .userId(userId)
                        .title(title(request.getInputData()))
                        .inputData(request.getInputData())
                        .modelsUsed(request.getModels())
                        .build());

        conversation.addMessage(ConversationMessageEntity.builder()
                .role(HistoryMessage.ROLE_USER)
                .content(request.getInputData())
                .inputTokens(summary.getEstimatedInputTokens())
                .build());

        for (WorkerResult result : summary.getOutcome().getSuccessful()) {
            UsageResult usage = result.getUsage();
            conversation.addMessage(ConversationMessageEntity.builder()
                    .role(HistoryMessage.ROLE_ASSISTANT)
                    .content(result.getContent())
                    .modelId(result.getModelId())
                    .inputTokens(usage != null ? usage.getInputTokens() : null)
                    .outputTokens(usage != null ? usage.getOutputTokens() : null)
                    .processingTimeMs(summary.getProcessingTimeMs())
                    .build());
        }

        ConversationEntity saved = conversationRepository.save(conversation);
        log.debug("Saved conversation {} for user {}", saved.getId(), userId);

        trimConversations(userId, summary.getIdentity().getTier().getConversationLimit());
    }

    /**
     * Follow-ups continue the named conversation if the user owns it, else the newest
     * conversation that started with the same prompt and the same set of models.
     */
    Optional<ConversationEntity> findExisting(String userId, ComparisonRequest request) {
        if (!request.hasHistory()) {
            return Optional.empty();
        }
        if (request.getConversationId() != null) {
            Optional<ConversationEntity> named = conversationRepository.findByIdAndUserId(request.getConversationId(), userId);
            if (named.isPresent()) {
                return named;
            }
        }

        Optional<String> firstTurn = request.getConversationHistory().stream()
                .filter(HistoryMessage::isUser)
                .map(HistoryMessage::getContent)
                .filter(Objects::nonNull)
                .findFirst();
        if (firstTurn.isEmpty()) {
            return Optional.empty();
        }

        HashSet<String> models = new HashSet<>(request.getModels());
        return conversationRepository.findByUserIdAndInputDataOrderByUpdatedAtDesc(userId, firstTurn.get()).stream()
                .filter(candidate -> candidate.getModelsUsed() != null && models.equals(new HashSet<>(candidate.getModelsUsed())))
                .findFirst();
    }

    private void trimConversations(String userId, int limit) {
        List<ConversationEntity> conversations = conversationRepository.findByUserIdOrderByCreatedAtDesc(userId);
        if (conversations.size() <= limit) {
            return;
        }
        List<ConversationEntity> excess = conversations.subList(limit, conversations.size());
        conversationRepository.deleteAll(excess);
        log.info("Deleted {} oldest conversations for user {} (limit {})", excess.size(), userId, limit);
    }

    static String title(String input) {
        String singleLine = input.strip().replaceAll("\\s+", " ");
        return singleLine.length() > TITLE_LENGTH ? singleLine.substring(0, TITLE_LENGTH) + "..." : singleLine;
    }

    private static String describe(Identity identity) {
        return identity.isAnonymous() ? "anonymous " + identity.getClientIp() : "user " + identity.getUserId();
    }
}
