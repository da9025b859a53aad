package com.compara.service;

import com.compara.config.ComparaProperties;
import com.compara.model.SubscriptionTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ModelRegistry.
 */
class ModelRegistryTest {

    private ModelRegistry registry;

    @BeforeEach
    void setUp() {
        ComparaProperties properties = TestModels.properties();
        properties.getModels().add(new ComparaProperties.ModelConfig());
        registry = new ModelRegistry(properties);
    }

    @Test
    void testEntriesWithoutIdIgnored() {
        assertEquals(4, registry.getAll().size());
    }

    @Test
    void testLimitsLookup() {
        assertEquals(1_000, registry.maxInputTokens("m/a"));
        assertEquals(8_192, registry.maxOutputTokens("m/b"));
        assertEquals(0, registry.maxOutputTokens("missing/model"));
        assertTrue(registry.supportsWebSearch("m/a"));
        assertFalse(registry.supportsWebSearch("m/b"));
    }

    @Test
    void testTierAvailability() {
        assertTrue(registry.isAvailableTo("m/a", SubscriptionTier.UNREGISTERED));
        assertFalse(registry.isAvailableTo("m/pro", SubscriptionTier.STARTER));
        assertTrue(registry.isAvailableTo("m/pro", SubscriptionTier.PRO));
        assertTrue(registry.isAvailableTo("m/pro", SubscriptionTier.PRO_PLUS));
        assertFalse(registry.isAvailableTo("missing/model", SubscriptionTier.PRO_PLUS));
    }
}
