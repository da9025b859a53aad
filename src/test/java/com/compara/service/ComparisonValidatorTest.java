package com.compara.service;

import com.compara.exception.InputValidationException;
import com.compara.exception.ModelAccessDeniedException;
import com.compara.model.ComparisonRequest;
import com.compara.model.HistoryMessage;
import com.compara.model.SubscriptionTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ComparisonValidator.
 */
class ComparisonValidatorTest {

    private ComparisonValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ComparisonValidator(new ModelRegistry(TestModels.properties()));
    }

    private static ComparisonRequest request(String input, String... models) {
        return ComparisonRequest.builder().inputData(input).models(List.of(models)).build();
    }

    @Test
    void testValidRequestPasses() {
        assertDoesNotThrow(() -> validator.validate(request("What is 2+2?", "m/a", "m/b"), SubscriptionTier.FREE));
    }

    @Test
    void testBlankInputRejected() {
        InputValidationException error = assertThrows(InputValidationException.class,
                () -> validator.validate(request("   ", "m/a"), SubscriptionTier.FREE));
        assertEquals("INVALID_INPUT", error.getErrorCode());
    }

    @Test
    void testNoModelsRejected() {
        assertThrows(InputValidationException.class,
                () -> validator.validate(request("hi"), SubscriptionTier.FREE));
    }

    @Test
    void testDuplicateModelsRejected() {
        InputValidationException error = assertThrows(InputValidationException.class,
                () -> validator.validate(request("hi", "m/a", "m/b", "m/a"), SubscriptionTier.FREE));
        assertEquals("Duplicate models selected: m/a", error.getMessage());
    }

    @Test
    void testUnknownModelRejected() {
        InputValidationException error = assertThrows(InputValidationException.class,
                () -> validator.validate(request("hi", "m/a", "x/unknown"), SubscriptionTier.FREE));
        assertEquals("Unknown models: x/unknown", error.getMessage());
    }

    @Test
    void testTemperatureRange() {
        ComparisonRequest hot = request("hi", "m/a");
        hot.setTemperature(2.5);
        assertThrows(InputValidationException.class, () -> validator.validate(hot, SubscriptionTier.FREE));

        ComparisonRequest edge = request("hi", "m/a");
        edge.setTemperature(2.0);
        assertDoesNotThrow(() -> validator.validate(edge, SubscriptionTier.FREE));
    }

    @Test
    void testModelAboveTierDenied() {
        ModelAccessDeniedException error = assertThrows(ModelAccessDeniedException.class,
                () -> validator.validate(request("hi", "m/a", "m/pro"), SubscriptionTier.STARTER));

        assertEquals(List.of("m/pro"), error.getRestrictedModels());
        assertTrue(error.getMessage().contains("not available for starter tier"), error.getMessage());
    }

    @Test
    void testModelLimitPerTier() {
        ModelRegistry wide = new ModelRegistry(wideCatalogue());
        ComparisonValidator wideValidator = new ComparisonValidator(wide);

        InputValidationException error = assertThrows(InputValidationException.class,
                () -> wideValidator.validate(request("hi", "w/1", "w/2", "w/3", "w/4"), SubscriptionTier.UNREGISTERED));

        assertTrue(error.getMessage().contains("allows maximum 3 models"), error.getMessage());
        assertTrue(error.getMessage().contains("Sign up for a free account"), error.getMessage());
        assertDoesNotThrow(() -> wideValidator.validate(request("hi", "w/1", "w/2", "w/3", "w/4"), SubscriptionTier.STARTER));
    }

    @Test
    void testInputTooLongNamesProblemModel() {
        // 400 chars -> 100 tokens, over m/c's 50-token window
        InputValidationException error = assertThrows(InputValidationException.class,
                () -> validator.validate(request("x".repeat(400), "m/a", "m/c"), SubscriptionTier.FREE));

        assertTrue(error.getMessage().contains("Problem model(s): c."), error.getMessage());
        assertTrue(error.getMessage().contains("approximately 200 characters"), error.getMessage());
    }

    @Test
    void testHistoryCountsTowardsContextWindow() {
        ComparisonRequest followUp = request("x".repeat(100), "m/c");
        followUp.setConversationHistory(List.of(
                new HistoryMessage("user", "y".repeat(80), null),
                new HistoryMessage("assistant", "z".repeat(80), "m/c")));

        // 25 + (20 + 4) + (20 + 4) = 73 tokens > 50
        assertThrows(InputValidationException.class, () -> validator.validate(followUp, SubscriptionTier.FREE));
    }

    private static com.compara.config.ComparaProperties wideCatalogue() {
        com.compara.config.ComparaProperties properties = new com.compara.config.ComparaProperties();
        for (int i = 1; i <= 4; i++) {
            properties.getModels().add(TestModels.model("w/" + i, 10_000, 1_000, SubscriptionTier.UNREGISTERED));
        }
        return properties;
    }
}
