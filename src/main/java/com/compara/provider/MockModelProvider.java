package com.compara.provider;

import com.compara.config.ComparaProperties;
import com.compara.exception.ProviderException;
import com.compara.model.UsageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Canned-response provider for local development and demos. Serves every model
 * when enabled; streams a fixed answer in small chunks without any network call.
 */
@Slf4j
@Component
public class MockModelProvider extends AbstractModelProvider {

    static final String NAME = "mock";
    static final int CHUNK_SIZE = 50;
    static final long CHUNK_DELAY_MS = 20;

    static final String RESPONSE = "I'd be happy to help you with that question. Let me provide an answer "
            + "that addresses the key points.\n\n"
            + "First, it's important to understand the context and background of this topic. The fundamental "
            + "concepts involve several interconnected elements that work together to create a cohesive system.\n\n"
            + "1. **Primary Considerations**: The first aspect to consider involves understanding the basic "
            + "framework. This foundation establishes the parameters within which everything else operates.\n\n"
            + "2. **Practical Implementation**: When it comes to applying these concepts, start with small-scale "
            + "experiments before committing to larger implementations.\n\n"
            + "In conclusion, the answer involves a careful balance of multiple factors. I hope this helps clarify "
            + "things for you!";

    public MockModelProvider(ComparaProperties properties) {
        super(properties, NAME);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean supports(String modelId) {
        return modelId != null;
    }

    @Override
    public UsageResult streamCompletion(ProviderCall call, FragmentSink sink) {
        log.debug("Streaming mock response for {}", call.getModelId());
        for (int i = 0; i < RESPONSE.length(); i += CHUNK_SIZE) {
            sink.onFragment(RESPONSE.substring(i, Math.min(RESPONSE.length(), i + CHUNK_SIZE)));
            try {
                Thread.sleep(CHUNK_DELAY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderException("Mock stream interrupted", e);
            }
        }
        return estimatedUsage(call, RESPONSE);
    }
}
