package net.tickwork.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** Unit carried by the message bus, for both events and dispatch messages. */
public record Envelope(
        String id,
        String type,
        Instant timestamp,
        String correlationId,
        Map<String, Object> payload,
        int attempts
) {
    public Envelope {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static Envelope of(String type, Map<String, Object> payload, Instant at) {
        String id = UUID.randomUUID().toString();
        return new Envelope(id, type, at, id, payload, 0);
    }

    public Envelope withAttempts(int attempts) {
        return new Envelope(id, type, timestamp, correlationId, payload, attempts);
    }

    public String string(String key) {
        Object v = payload.get(key);
        return v == null ? null : v.toString();
    }
}
