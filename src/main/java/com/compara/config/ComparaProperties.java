package com.compara.config;

import com.compara.model.SubscriptionTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for Compara.
 */
@Data
@Component
@ConfigurationProperties(prefix = "compara")
public class ComparaProperties {

    private Map<String, ProviderConfig> providers = new HashMap<>();
    private StreamConfig stream = new StreamConfig();
    private CreditsConfig credits = new CreditsConfig();
    private List<ModelConfig> models = new ArrayList<>();
    private PersistenceConfig persistence = new PersistenceConfig();

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private String referer;
        private String title;
    }

    @Data
    public static class StreamConfig {
        /**
         * A model with no worker activity for this long is timed out.
         */
        private Duration inactivityTimeout = Duration.ofSeconds(55);
        private Duration keepaliveInterval = Duration.ofSeconds(10);
        private Duration pollInterval = Duration.ofMillis(50);
        private int maxWorkers = 12;
        private int queueCapacity = 4096;
        private Duration providerTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class CreditsConfig {
        private String storageType = "memory"; // memory, redis
        private double outputTokenWeight = 2.5;
        private long tokensPerCredit = 1000;
        private int minUsableOutputTokens = 300;
    }

    @Data
    public static class ModelConfig {
        private String id;
        private String name;
        private String provider;
        private long maxInputTokens = 128_000;
        private int maxOutputTokens = 8192;
        private SubscriptionTier minTier = SubscriptionTier.UNREGISTERED;
        private boolean supportsWebSearch;
    }

    @Data
    public static class PersistenceConfig {
        private boolean enabled = false;
    }
}
