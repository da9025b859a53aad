package com.compara.stream;

import com.compara.config.ComparaProperties;
import com.compara.exception.ProviderException;
import com.compara.model.ChunkEvent;
import com.compara.model.ChunkEventType;
import com.compara.model.UsageResult;
import com.compara.provider.ProviderCall;
import com.compara.provider.ScriptedModelProvider;
import com.compara.service.ModelRegistry;
import com.compara.service.ProviderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StreamMultiplexer with scripted providers and short timeouts.
 */
class StreamMultiplexerTest {

    private ComparaProperties properties;
    private ScriptedModelProvider provider;
    private StreamMultiplexer multiplexer;
    private List<ChunkEvent> events;

    @BeforeEach
    void setUp() {
        properties = new ComparaProperties();
        properties.getStream().setInactivityTimeout(Duration.ofSeconds(1));
        properties.getStream().setKeepaliveInterval(Duration.ofMillis(200));
        properties.getStream().setPollInterval(Duration.ofMillis(10));

        provider = new ScriptedModelProvider();
        ProviderService providerService = new ProviderService(List.of(provider), new ModelRegistry(properties));
        multiplexer = new StreamMultiplexer(providerService, new ProviderErrorClassifier(properties), properties);
        events = new CopyOnWriteArrayList<>();
    }

    private static List<ProviderCall> calls(String... modelIds) {
        return Arrays.stream(modelIds)
                .map(id -> ProviderCall.builder().modelId(id).prompt("What is 2+2?").build())
                .toList();
    }

    private List<ChunkEvent> eventsFor(String modelId) {
        return events.stream().filter(event -> modelId.equals(event.getModel())).toList();
    }

    private List<ChunkEvent> eventsOfType(String modelId, ChunkEventType type) {
        return eventsFor(modelId).stream().filter(event -> event.getType() == type).toList();
    }

    @Test
    void testAllModelsSucceed() {
        provider.answer("m/a", UsageResult.of(10, 10, 2.5), "Hel", "lo");
        provider.answer("m/b", UsageResult.of(20, 40, 2.5), "Four");

        MultiplexOutcome outcome = multiplexer.run(calls("m/a", "m/b"), events::add, () -> false);

        assertEquals(ChunkEvent.start("m/a"), events.get(0));
        assertEquals(ChunkEvent.start("m/b"), events.get(1));

        assertEquals(List.of("Hel", "lo"),
                eventsOfType("m/a", ChunkEventType.CHUNK).stream().map(ChunkEvent::getContent).toList());
        assertEquals(1, eventsOfType("m/a", ChunkEventType.DONE).size());
        assertEquals(1, eventsOfType("m/b", ChunkEventType.DONE).size());
        assertEquals(ChunkEvent.done("m/a", false), eventsFor("m/a").get(eventsFor("m/a").size() - 1));
        assertEquals(ChunkEvent.done("m/b", false), eventsFor("m/b").get(eventsFor("m/b").size() - 1));

        assertFalse(outcome.isCancelled());
        assertNull(outcome.getFailure());
        assertEquals(2, outcome.getSuccessCount());
        assertEquals(List.of("m/a", "m/b"), outcome.getResults().stream().map(WorkerResult::getModelId).toList());
        assertEquals(2, outcome.getSuccessfulUsage().size());
    }

    @Test
    void testOneModelFailsOtherSucceeds() {
        provider.answer("m/a", UsageResult.of(50, 70, 2.5), "Four.");
        provider.fail("m/b", new ProviderException("invalid key", 401, null, "scripted", null));

        MultiplexOutcome outcome = multiplexer.run(calls("m/a", "m/b"), events::add, () -> false);

        assertEquals(List.of(ChunkEvent.start("m/b"),
                        ChunkEvent.chunk("m/b", ProviderErrorClassifier.AUTHENTICATION_FAILED),
                        ChunkEvent.done("m/b", true)),
                eventsFor("m/b"));
        assertEquals(ChunkEvent.done("m/a", false), eventsFor("m/a").get(eventsFor("m/a").size() - 1));
        assertEquals(1, outcome.getSuccessCount());
        assertEquals(1, outcome.getFailureCount());
        assertEquals(225, outcome.getSuccessfulUsage().get(0).getEffectiveTokens());
    }

    @Test
    void testSilentModelTimesOutWithHeartbeats() throws InterruptedException {
        provider.answer("m/fast", UsageResult.of(1, 1, 2.5), "quick");
        provider.hang("m/slow");

        MultiplexOutcome outcome = multiplexer.run(calls("m/fast", "m/slow"), events::add, () -> false);

        List<ChunkEvent> slow = eventsFor("m/slow");
        assertEquals(ChunkEvent.start("m/slow"), slow.get(0));
        assertFalse(eventsOfType("m/slow", ChunkEventType.KEEPALIVE).isEmpty(), "Idle model should get heartbeats");
        assertEquals(ChunkEvent.chunk("m/slow", "Error: Timeout (1s)"), slow.get(slow.size() - 2));
        assertEquals(ChunkEvent.done("m/slow", true), slow.get(slow.size() - 1));
        assertEquals(1, eventsOfType("m/slow", ChunkEventType.DONE).size());

        assertEquals(1, outcome.getSuccessCount());
        assertEquals("Error: Timeout (1s)", outcome.getResults().get(1).getContent());

        long deadline = System.currentTimeMillis() + 2000;
        while (!provider.wasInterrupted("m/slow") && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(provider.wasInterrupted("m/slow"), "Timed-out worker should be interrupted");
    }

    @Test
    void testClientDisconnectFinishesEveryModel() {
        provider.hang("m/a");
        provider.hang("m/b");

        MultiplexOutcome outcome = multiplexer.run(calls("m/a", "m/b"), events::add, () -> true);

        assertTrue(outcome.isCancelled());
        assertEquals(List.of(ChunkEvent.start("m/a"), ChunkEvent.done("m/a", true)), eventsFor("m/a"));
        assertEquals(List.of(ChunkEvent.start("m/b"), ChunkEvent.done("m/b", true)), eventsFor("m/b"));
        assertTrue(outcome.getResults().stream().allMatch(result -> "Error: Cancelled".equals(result.getContent())));
        assertEquals(0, outcome.getSuccessCount());
    }

    @Test
    void testWorkerFillerBecomesKeepalive() {
        provider.answer("m/a", UsageResult.of(1, 1, 2.5), " ", "Hi");

        multiplexer.run(calls("m/a"), events::add, () -> false);

        assertEquals(List.of(ChunkEvent.start("m/a"),
                        ChunkEvent.keepalive("m/a"),
                        ChunkEvent.chunk("m/a", "Hi"),
                        ChunkEvent.done("m/a", false)),
                events);
    }

    @Test
    void testMoreModelsThanWorkers() {
        properties.getStream().setMaxWorkers(1);
        provider.answer("m/a", UsageResult.of(1, 1, 2.5), "A");
        provider.answer("m/b", UsageResult.of(1, 1, 2.5), "B");
        provider.answer("m/c", UsageResult.of(1, 1, 2.5), "C");

        MultiplexOutcome outcome = multiplexer.run(calls("m/a", "m/b", "m/c"), events::add, () -> false);

        assertEquals(3, outcome.getSuccessCount());
        assertEquals(3, events.stream().filter(event -> event.getType() == ChunkEventType.START).count());
        assertEquals(3, events.stream().filter(event -> event.getType() == ChunkEventType.DONE).count());
    }

    @Test
    void testEmitterFailureStillFinishesModels() {
        provider.answer("m/a", UsageResult.of(1, 1, 2.5), "A");

        MultiplexOutcome outcome = multiplexer.run(calls("m/a"), event -> {
            if (event.getType() == ChunkEventType.CHUNK) {
                throw new IllegalStateException("sink closed");
            }
            events.add(event);
        }, () -> false);

        assertNotNull(outcome.getFailure());
        assertEquals(ChunkEvent.done("m/a", true), events.get(events.size() - 1));
    }

    @Test
    void testTimeoutText() {
        assertEquals("Error: Timeout (55s)", StreamMultiplexer.timeoutText(Duration.ofSeconds(55)));
    }
}
