package com.ryuqq.integrity.core.realtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.integrity.core.json.JsonMappers;
import com.ryuqq.integrity.core.model.ChangeAction;
import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.model.FactoryId;

import java.time.Instant;
import java.util.List;

/**
 * JSON wire codec for {@link ChangeEvent}.
 *
 * <p><strong>Payload:</strong></p>
 * <pre>
 * {"type":"work_orders","id":"wo-1","factoryId":"A","action":"update",
 *  "changedKeys":["status"],"version":4,"ts":"2024-05-01T09:00:00Z","data":{"status":"done"}}
 * </pre>
 *
 * <p>{@code changedKeys} and {@code data} are optional. {@code version} is required: a
 * payload without it is rejected with {@link MalformedChangeEventException} and never
 * reaches a cache.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class ChangeEventCodec {

    private final ObjectMapper objectMapper;

    public ChangeEventCodec() {
        this(JsonMappers.shared());
    }

    /**
     * @param objectMapper mapper with the Java time module registered
     */
    public ChangeEventCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * Serializes an event.
     *
     * @param event the event
     * @return JSON payload
     */
    public String encode(ChangeEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        Payload payload = new Payload(
            event.type().getValue(),
            event.id().getValue(),
            event.factoryId().getValue(),
            event.action().wireName(),
            event.changedKeys().isEmpty() ? null : event.changedKeys(),
            event.version(),
            event.ts(),
            event.data()
        );
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode change event", e);
        }
    }

    /**
     * Parses a payload.
     *
     * @param json JSON payload
     * @return the event
     * @throws MalformedChangeEventException if the payload is not valid JSON, misses a
     *         required field (including {@code version}) or carries invalid values
     */
    public ChangeEvent decode(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedChangeEventException("payload cannot be null or blank");
        }
        Payload payload;
        try {
            payload = objectMapper.readValue(json, Payload.class);
        } catch (JsonProcessingException e) {
            throw new MalformedChangeEventException("Malformed change event: " + e.getOriginalMessage(), e);
        }
        if (payload.version() == null) {
            throw new MalformedChangeEventException("Change event without version: " + payload.type() + "/" + payload.id());
        }
        if (payload.ts() == null) {
            throw new MalformedChangeEventException("Change event without ts: " + payload.type() + "/" + payload.id());
        }
        try {
            return new ChangeEvent(
                EntityType.of(payload.type()),
                EntityId.of(payload.id()),
                FactoryId.of(payload.factoryId()),
                ChangeAction.fromWire(payload.action()),
                payload.changedKeys(),
                payload.version(),
                payload.ts(),
                payload.data()
            );
        } catch (IllegalArgumentException e) {
            throw new MalformedChangeEventException("Invalid change event: " + e.getMessage(), e);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Payload(
        String type,
        String id,
        String factoryId,
        String action,
        List<String> changedKeys,
        Long version,
        Instant ts,
        ObjectNode data
    ) {
    }
}
