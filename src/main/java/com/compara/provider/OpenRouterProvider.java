package com.compara.provider;

import com.compara.config.ComparaProperties;
import com.compara.exception.ProviderException;
import com.compara.model.ChatCompletionChunk;
import com.compara.model.ChatCompletionRequest;
import com.compara.model.UsageResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;

/**
 * OpenRouter (OpenAI-compatible) streaming chat completion provider.
 * Serves any {@code vendor/model} identifier.
 */
@Slf4j
@Component
public class OpenRouterProvider extends AbstractModelProvider {

    static final String NAME = "openrouter";
    static final String DONE_MARKER = "[DONE]";
    static final int REDUCED_MAX_TOKENS_FLOOR = 2048;

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public OpenRouterProvider(WebClient webClient, ComparaProperties properties, ObjectMapper objectMapper) {
        super(properties, NAME);
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean supports(String modelId) {
        return modelId != null && modelId.contains("/");
    }

    @Override
    public UsageResult streamCompletion(ProviderCall call, FragmentSink sink) {
        if (!isEnabled()) {
            throw new ProviderException("OpenRouter provider is not enabled", null, null, NAME, null);
        }

        ChatCompletionRequest request = buildRequest(call);
        log.info("Streaming from OpenRouter: model={}, maxTokens={}", call.getModelId(), request.getMaxTokens());

        OutputTrackingSink tracked = new OutputTrackingSink(sink);
        try {
            return stream(call, request, tracked);
        } catch (ProviderException e) {
            // A 402 before any output usually means max_tokens exceeds the account's credit; retry once smaller.
            // Once text has reached the caller a retry would repeat it.
            Integer maxTokens = request.getMaxTokens();
            if (isPaymentRequired(e) && !tracked.hasOutput()
                    && maxTokens != null && maxTokens > REDUCED_MAX_TOKENS_FLOOR) {
                int reduced = Math.max(REDUCED_MAX_TOKENS_FLOOR, maxTokens / 2);
                log.warn("402 for {}, retrying with max_tokens {} -> {}", call.getModelId(), maxTokens, reduced);
                return stream(call, request.toBuilder().maxTokens(reduced).build(), sink);
            }
            throw e;
        }
    }

    ChatCompletionRequest buildRequest(ProviderCall call) {
        ChatCompletionRequest.ChatCompletionRequestBuilder builder = ChatCompletionRequest.builder()
                .model(call.getModelId())
                .messages(buildMessages(call))
                .stream(true)
                .streamOptions(Map.of("include_usage", true))
                .maxTokens(call.getMaxTokens())
                .temperature(call.getTemperature())
                .frequencyPenalty(0.7)
                .presencePenalty(0.5);

        if (call.isWebSearch()) {
            builder.plugins(List.of(Map.of("id", "web")));
        }
        return builder.build();
    }

    private UsageResult stream(ProviderCall call, ChatCompletionRequest request, FragmentSink sink) {
        Flux<ServerSentEvent<String>> events = webClient.post()
                .uri(config.getBaseUrl() + "/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .headers(headers -> {
                    if (config.getReferer() != null) {
                        headers.set("HTTP-Referer", config.getReferer());
                    }
                    if (config.getTitle() != null) {
                        headers.set("X-Title", config.getTitle());
                    }
                })
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(request)
                .retrieve()
                .bodyToFlux(SSE_TYPE);

        StringBuilder content = new StringBuilder();
        ChatCompletionChunk.Usage usage = null;

        try {
            for (ServerSentEvent<String> event : events.toIterable()) {
                String data = event.data();
                if (data == null || data.isBlank()) {
                    // ": OPENROUTER PROCESSING" comments keep the connection open
                    if (event.comment() != null) {
                        sink.onKeepalive();
                    }
                    continue;
                }
                if (DONE_MARKER.equals(data.trim())) {
                    break;
                }

                ChatCompletionChunk chunk = parseChunk(data);
                if (chunk.getError() != null) {
                    throw fromErrorBody(chunk.getError(), null, null);
                }

                String fragment = chunk.firstDeltaContent();
                if (fragment != null && !fragment.isEmpty()) {
                    content.append(fragment);
                    sink.onFragment(fragment);
                }
                if (chunk.getUsage() != null) {
                    usage = chunk.getUsage();
                }
            }
        } catch (WebClientResponseException e) {
            throw fromResponse(e);
        }

        if (usage == null || usage.getPromptTokens() == null || usage.getCompletionTokens() == null) {
            log.debug("No usage reported for {}, estimating", call.getModelId());
            return estimatedUsage(call, content.toString());
        }
        return usage(usage.getPromptTokens(), usage.getCompletionTokens());
    }

    private ChatCompletionChunk parseChunk(String data) {
        try {
            return objectMapper.readValue(data, ChatCompletionChunk.class);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Malformed response from provider: " + e.getOriginalMessage(), e);
        }
    }

    ProviderException fromResponse(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        String body = e.getResponseBodyAsString();
        try {
            ChatCompletionChunk parsed = objectMapper.readValue(body, ChatCompletionChunk.class);
            if (parsed.getError() != null) {
                return fromErrorBody(parsed.getError(), status, e);
            }
        } catch (JsonProcessingException parseError) {
            log.debug("Error body from provider is not JSON: {}", parseError.getOriginalMessage());
        }
        String message = body != null && !body.isBlank() ? body : e.getStatusText();
        return new ProviderException(message, status, null, NAME, e);
    }

    private ProviderException fromErrorBody(ChatCompletionChunk.ErrorBody error, Integer status, Throwable cause) {
        Integer statusCode = status;
        if (statusCode == null && error.getCode() instanceof Number) {
            statusCode = ((Number) error.getCode()).intValue();
        }
        String raw = null;
        String providerName = NAME;
        if (error.getMetadata() != null) {
            Object rawValue = error.getMetadata().get("raw");
            raw = rawValue != null ? String.valueOf(rawValue) : null;
            Object name = error.getMetadata().get("provider_name");
            providerName = name != null ? String.valueOf(name) : NAME;
        }
        String message = error.getMessage() != null ? error.getMessage() : "Provider returned error";
        return new ProviderException(message, statusCode, raw, providerName, cause);
    }

    private static boolean isPaymentRequired(ProviderException e) {
        return e.getStatusCode() != null && e.getStatusCode() == 402;
    }

    private static final class OutputTrackingSink implements FragmentSink {

        private final FragmentSink delegate;
        private boolean output;

        private OutputTrackingSink(FragmentSink delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onFragment(String fragment) {
            output = true;
            delegate.onFragment(fragment);
        }

        @Override
        public void onKeepalive() {
            delegate.onKeepalive();
        }

        boolean hasOutput() {
            return output;
        }
    }
}
