package in.staysync.engine.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.staysync.domain.event.DomainEvent;
import in.staysync.domain.event.EventEnvelope;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Collapses events for the same (entity type, entity id) within one batch into a single
 * last-write-wins record.
 *
 * The merge is a field-wise JSON overlay: nested objects merge recursively, anything else is
 * replaced by the later value. Events without an entity id are passed through untouched. Output
 * keeps the position of each entity's first occurrence and the sequence number of its last.
 */
public final class Conflater {

    private final ObjectMapper mapper;
    private final ObjectWriter eventWriter;

    public Conflater(ObjectMapper mapper) {
        this.mapper = mapper;
        this.eventWriter = mapper.writerFor(DomainEvent.class);
    }

    public ConflationResult conflate(List<EventEnvelope> batch) {
        List<Slot> slots = new ArrayList<>(batch.size());
        Map<String, Slot> byEntity = new HashMap<>();
        long inputBytes = 0;

        for (EventEnvelope env : batch) {
            byte[] json = toJson(env.event());
            ObjectNode tree = toTree(json);
            inputBytes += json.length;

            String key = keyOf(env.event());
            Slot slot = key == null ? null : byEntity.get(key);
            if (slot == null) {
                slot = new Slot(env, tree);
                slots.add(slot);
                if (key != null) {
                    byEntity.put(key, slot);
                }
            } else {
                overlay(slot.merged, tree);
                slot.last = env;
                slot.collapsed = true;
            }
        }

        List<EventEnvelope> out = new ArrayList<>(slots.size());
        long outputBytes = 0;
        for (Slot slot : slots) {
            outputBytes += sizeOf(slot.merged);
            if (slot.collapsed) {
                out.add(slot.last.withEvent(toEvent(slot.merged)));
            } else {
                out.add(slot.last);
            }
        }
        return new ConflationResult(out, batch.size(), out.size(), inputBytes, outputBytes);
    }

    /**
     * Overlay {@code update} onto {@code target} in place.
     */
    static void overlay(ObjectNode target, JsonNode update) {
        Iterator<Map.Entry<String, JsonNode>> fields = update.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                overlay((ObjectNode) existing, field.getValue());
            } else {
                target.set(field.getKey(), field.getValue().deepCopy());
            }
        }
    }

    private static String keyOf(DomainEvent event) {
        if (event.entityId() == null) {
            return null;
        }
        return event.entityType() + '\u0000' + event.entityId();
    }

    private DomainEvent toEvent(ObjectNode merged) {
        try {
            return mapper.treeToValue(merged, DomainEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Merged event is not a valid domain event: " + e.getOriginalMessage(), e);
        }
    }

    private byte[] toJson(DomainEvent event) {
        try {
            return eventWriter.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event " + event.eventId(), e);
        }
    }

    private ObjectNode toTree(byte[] json) {
        try {
            return (ObjectNode) mapper.readTree(json);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read event tree", e);
        }
    }

    private long sizeOf(JsonNode tree) {
        try {
            return mapper.writeValueAsBytes(tree).length;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event", e);
        }
    }

    private static final class Slot {
        private final ObjectNode merged;
        private EventEnvelope last;
        private boolean collapsed;

        Slot(EventEnvelope first, ObjectNode tree) {
            this.merged = tree;
            this.last = first;
        }
    }
}
