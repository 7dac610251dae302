package in.staysync.engine.batch;

import com.fasterxml.jackson.databind.node.ObjectNode;
import in.staysync.domain.event.EventEnvelope;
import in.staysync.domain.event.EventFixtures;
import in.staysync.domain.event.GuestEvent;
import in.staysync.util.Json;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Conflater.
 *
 * Tests:
 * - Updates to one entity collapse into one event with the last sequence number
 * - Nested metadata is merged field by field, later values win
 * - Distinct entities keep the position of their first occurrence
 * - Events without an entity id are never collapsed
 * - Byte counters reflect the savings
 */
class ConflaterTest {

    private final Conflater conflater = new Conflater(Json.MAPPER);

    @Test
    void testSameEntityCollapses() {
        List<EventEnvelope> batch = List.of(
            EventFixtures.envelope(1, EventFixtures.guest(1L, 10L, "g-1", Map.of("status", "pending", "room", "101"))),
            EventFixtures.envelope(2, EventFixtures.guest(1L, 10L, "g-1", Map.of("status", "checked_in")))
        );

        ConflationResult result = conflater.conflate(batch);

        assertEquals(2, result.inputCount());
        assertEquals(1, result.outputCount());
        EventEnvelope merged = result.envelopes().get(0);
        assertEquals(2L, merged.seq(), "Merged event carries the last sequence number");
        GuestEvent event = assertInstanceOf(GuestEvent.class, merged.event());
        assertEquals("checked_in", event.metadata().get("status"));
        assertEquals("101", event.metadata().get("room"), "Fields absent from the later event survive");
        assertEquals(batch.get(1).event().eventId(), event.eventId());
        assertTrue(result.bytesSaved() > 0);
        assertTrue(result.outputBytes() < result.inputBytes());
    }

    @Test
    void testFirstOccurrenceOrder() {
        List<EventEnvelope> batch = List.of(
            EventFixtures.envelope(1, EventFixtures.guest(1L, null, "a")),
            EventFixtures.envelope(2, EventFixtures.guest(1L, null, "b")),
            EventFixtures.envelope(3, EventFixtures.guest(1L, null, "a")),
            EventFixtures.envelope(4, EventFixtures.guest(1L, null, "c"))
        );

        List<EventEnvelope> out = conflater.conflate(batch).envelopes();

        assertEquals(List.of("a", "b", "c"), out.stream().map(e -> e.event().entityId()).toList());
        assertEquals(List.of(3L, 2L, 4L), out.stream().map(EventEnvelope::seq).toList());
    }

    @Test
    void testEventsWithoutEntityIdPassThrough() {
        List<EventEnvelope> batch = List.of(
            EventFixtures.envelope(1, EventFixtures.guest(1L, null, null)),
            EventFixtures.envelope(2, EventFixtures.guest(1L, null, null))
        );

        ConflationResult result = conflater.conflate(batch);

        assertEquals(2, result.outputCount());
        assertSame(batch.get(0), result.envelopes().get(0));
        assertSame(batch.get(1), result.envelopes().get(1));
        assertEquals(0, result.bytesSaved());
    }

    @Test
    void testOverlayMergesNestedObjects() throws Exception {
        ObjectNode target = (ObjectNode) Json.MAPPER.readTree("{\"a\":1,\"m\":{\"x\":1,\"y\":{\"k\":1}},\"l\":[1,2]}");
        ObjectNode update = (ObjectNode) Json.MAPPER.readTree("{\"a\":2,\"m\":{\"y\":{\"j\":2}},\"l\":[3]}");

        Conflater.overlay(target, update);

        assertEquals(Json.MAPPER.readTree("{\"a\":2,\"m\":{\"x\":1,\"y\":{\"k\":1,\"j\":2}},\"l\":[3]}"), target);
    }
}
