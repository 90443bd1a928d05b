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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans system events out to handlers registered per type and to wildcard handlers.
 *
 * <p>Handlers are invoked synchronously on the dispatching thread, type handlers first and
 * wildcard handlers after, each list in registration order. A failing handler is logged and
 * does not prevent the others from running. The most recent events are kept in a bounded
 * history.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public class EventDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    public static final int DEFAULT_HISTORY_SIZE = 1000;

    private final String agentId;
    private final Clock clock;
    private final int historySize;
    private final AtomicLong counter = new AtomicLong();
    private final Map<EventType, List<EventHandler>> handlers = new EnumMap<>(EventType.class);
    private final List<EventHandler> wildcardHandlers = new CopyOnWriteArrayList<>();
    private final Deque<SystemEvent> history = new ArrayDeque<>();

    private volatile EventPublisher publisher;

    public EventDispatcher(String agentId) {
        this(agentId, Clock.systemUTC(), DEFAULT_HISTORY_SIZE);
    }

    public EventDispatcher(String agentId, Clock clock, int historySize) {
        this.agentId = agentId;
        this.clock = clock;
        this.historySize = historySize;
        logger.info("Event dispatcher initialized for agent: {}", agentId);
    }

    public synchronized void registerHandler(EventType type, EventHandler handler) {
        handlers.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).add(handler);
        logger.debug("Handler registered for event type: {}", type);
    }

    public void registerWildcardHandler(EventHandler handler) {
        wildcardHandlers.add(handler);
        logger.debug("Wildcard event handler registered");
    }

    public void setPublisher(EventPublisher publisher) {
        this.publisher = publisher;
    }

    public SystemEvent create(EventType type, String source, Map<String, Object> data, String correlationId) {
        Instant now = Instant.ofEpochMilli(clock.millis());
        String eventId = agentId + "-event-" + counter.incrementAndGet() + "-" + now.toEpochMilli();
        return new SystemEvent(eventId, type, now, source, data, correlationId, SystemEvent.DEFAULT_PRIORITY);
    }

    /**
     * Records an event in the history and invokes every matching handler.
     */
    public void dispatch(SystemEvent event) {
        List<EventHandler> typed;
        synchronized (this) {
            history.addLast(event);
            while (history.size() > historySize) {
                history.removeFirst();
            }
            typed = handlers.getOrDefault(event.getType(), List.of());
        }
        logger.debug("Event dispatched: {} from {}", event.getType().getValue(), event.getSource());

        for (EventHandler handler : typed) {
            invoke(handler, event, "Event handler");
        }
        for (EventHandler handler : wildcardHandlers) {
            invoke(handler, event, "Wildcard event handler");
        }
    }

    /**
     * Creates an event originating from this agent, dispatches it locally and forwards it to the
     * publisher if one is set.
     */
    public SystemEvent publish(EventType type, Map<String, Object> data, String correlationId) {
        SystemEvent event = create(type, agentId, data, correlationId);
        dispatch(event);
        EventPublisher current = publisher;
        if (current != null) {
            try {
                current.publish(type.getValue(), event.toPayload());
            } catch (RuntimeException e) {
                logger.error("Failed to forward event {} to broker", event.getEventId(), e);
            }
        }
        return event;
    }

    public SystemEvent publishError(String message, Map<String, Object> details, String correlationId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", message);
        data.put("details", details == null ? Map.of() : details);
        return publish(EventType.ERROR_OCCURRED, data, correlationId);
    }

    /**
     * @param type filter, or {@code null} for every type
     * @return the most recent matching events, oldest first
     */
    public synchronized List<SystemEvent> getHistory(EventType type, int limit) {
        List<SystemEvent> filtered = new ArrayList<>();
        for (SystemEvent event : history) {
            if (type == null || event.getType() == type) {
                filtered.add(event);
            }
        }
        int from = Math.max(0, filtered.size() - limit);
        return List.copyOf(filtered.subList(from, filtered.size()));
    }

    public synchronized int count(EventType type) {
        if (type == null) {
            return history.size();
        }
        int count = 0;
        for (SystemEvent event : history) {
            if (event.getType() == type) {
                count++;
            }
        }
        return count;
    }

    public synchronized void clearHistory() {
        history.clear();
    }

    private static void invoke(EventHandler handler, SystemEvent event, String kind) {
        try {
            handler.handle(event);
        } catch (Exception e) {
            logger.error("{} failed for event {}", kind, event.getEventId(), e);
        }
    }
}
