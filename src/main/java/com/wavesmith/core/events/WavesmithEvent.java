package com.wavesmith.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while planning or executing an artifact graph, or while
 * coordinating workers.
 *
 * @param type       what happened
 * @param goalHash   hash of the goal this event belongs to (null for coordinator events)
 * @param artifactId the artifact this event relates to (nullable for goal-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record WavesmithEvent(
    EventType type,
    String goalHash,
    String artifactId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static WavesmithEvent of(EventType type, String goalHash, String artifactId, Map<String, Object> payload) {
        return new WavesmithEvent(type, goalHash, artifactId, payload, Instant.now());
    }

    public static WavesmithEvent coordinator(EventType type, Map<String, Object> payload) {
        return new WavesmithEvent(type, null, null, payload, Instant.now());
    }

    public String eventType() {
        return type.wireName();
    }
}
