/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.conclave.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A state change signalled by one component to any interested handler.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public final class SystemEvent {

    public static final String DEFAULT_PRIORITY = "normal";

    private final String eventId;
    private final EventType type;
    private final Instant timestamp;
    private final String source;
    private final Map<String, Object> data;
    private final String correlationId;
    private final String priority;

    public SystemEvent(String eventId, EventType type, Instant timestamp, String source,
                       Map<String, Object> data, String correlationId, String priority) {
        this.eventId = Objects.requireNonNull(eventId, "eventId");
        this.type = Objects.requireNonNull(type, "type");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.source = source;
        this.data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.correlationId = correlationId;
        this.priority = priority == null ? DEFAULT_PRIORITY : priority;
    }

    /**
     * Wire form published on {@code events.<type>}.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_id", eventId);
        payload.put("event_type", type.getValue());
        payload.put("timestamp", timestamp.toEpochMilli() / 1000.0);
        payload.put("source", source);
        payload.put("data", data);
        payload.put("correlation_id", correlationId);
        payload.put("priority", priority);
        return payload;
    }

    public String getEventId() {
        return eventId;
    }

    public EventType getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSource() {
        return source;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getPriority() {
        return priority;
    }

    @Override
    public String toString() {
        return "SystemEvent{eventId='" + eventId + "', type=" + type + ", source='" + source
                + "', correlationId='" + correlationId + "'}";
    }
}
