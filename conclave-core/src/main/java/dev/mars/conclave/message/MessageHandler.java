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

package dev.mars.conclave.message;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Creates outbound messages and validates, deduplicates and dispatches inbound ones.
 *
 * <p>Sent and received messages are kept in memory keyed by message id. The received table
 * doubles as the duplicate filter, so callers should evict it with
 * {@link #clearOlderThan(Duration)} no faster than the broker's redelivery horizon.</p>
 *
 * <p>Processors run inline on the calling thread in registration order. A processor that
 * throws is logged and skipped; the remaining processors still run.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public class MessageHandler {

    private static final Logger logger = LoggerFactory.getLogger(MessageHandler.class);

    static final String DUPLICATE_PREFIX = "Duplicate message";

    private final String agentId;
    private final Clock clock;
    private final AtomicLong counter = new AtomicLong();
    private final Map<String, AgentMessage> sentMessages = new ConcurrentHashMap<>();
    private final Map<String, AgentMessage> receivedMessages = new ConcurrentHashMap<>();
    private final Map<MessageType, List<MessageProcessor>> processors =
            Collections.synchronizedMap(new EnumMap<>(MessageType.class));

    private volatile MessageProcessor fallbackHandler = this::replyWithError;
    private volatile Consumer<AgentMessage> replySink = reply -> { };

    public MessageHandler(String agentId) {
        this(agentId, Clock.systemUTC());
    }

    public MessageHandler(String agentId, Clock clock) {
        this.agentId = Objects.requireNonNull(agentId, "agentId");
        this.clock = clock;
        logger.info("Message handler initialized for agent: {}", agentId);
    }

    // ==================== Registration ====================

    public void registerProcessor(MessageType type, MessageProcessor processor) {
        if (!type.isRecognized()) {
            throw new IllegalArgumentException("Cannot register a processor for " + type);
        }
        processors.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).add(processor);
        logger.debug("Processor registered for message type: {}", type);
    }

    /**
     * Replaces the handler for messages no processor claims. The default replies with an ERROR message.
     */
    public void setFallbackHandler(MessageProcessor fallbackHandler) {
        this.fallbackHandler = Objects.requireNonNull(fallbackHandler);
    }

    /**
     * Sets where synthesized replies go, typically a publish back through the coordination service.
     */
    public void setReplySink(Consumer<AgentMessage> replySink) {
        this.replySink = Objects.requireNonNull(replySink);
    }

    // ==================== Creation ====================

    public AgentMessage create(String receiverId, String content, MessageType type,
                               MessagePriority priority, Map<String, Object> metadata) {
        Instant now = Instant.ofEpochMilli(clock.millis());
        String messageId = agentId + "-" + counter.incrementAndGet() + "-" + now.toEpochMilli();
        AgentMessage message = AgentMessage.builder()
                .messageId(messageId)
                .senderId(agentId)
                .receiverId(receiverId)
                .type(type)
                .content(content)
                .priority(priority)
                .timestamp(now)
                .metadata(metadata)
                .build();
        sentMessages.put(messageId, message);
        logger.debug("Message created: {}", messageId);
        return message;
    }

    public AgentMessage create(String receiverId, String content) {
        return create(receiverId, content, MessageType.TEXT, MessagePriority.NORMAL, null);
    }

    /**
     * Records a message prepared elsewhere (for example signed or encrypted) in the sent table.
     */
    public void recordSent(AgentMessage message) {
        sentMessages.put(message.getMessageId(), message);
    }

    public AgentMessage heartbeat() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timestamp", clock.millis() / 1000.0);
        metadata.put("status", "online");
        return create(AgentMessage.BROADCAST, "heartbeat", MessageType.HEARTBEAT, MessagePriority.LOW, metadata);
    }

    public AgentMessage statusUpdate(String status, Map<String, Object> metadata) {
        return create(AgentMessage.BROADCAST, status, MessageType.STATUS, MessagePriority.NORMAL, metadata);
    }

    public AgentMessage error(String receiverId, String error, String originalMessageId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (originalMessageId != null) {
            metadata.put("original_message_id", originalMessageId);
        }
        return create(receiverId, error, MessageType.ERROR, MessagePriority.HIGH, metadata);
    }

    // ==================== Inbound ====================

    /**
     * Checks an inbound message.
     *
     * @return the validation errors, empty if the message may be processed
     */
    public List<String> validate(AgentMessage message) {
        List<String> errors = new ArrayList<>();
        if (isBlank(message.getMessageId())) errors.add("Missing required field: message_id");
        if (isBlank(message.getSenderId())) errors.add("Missing required field: sender_id");
        if (isBlank(message.getReceiverId())) errors.add("Missing required field: receiver_id");
        if (message.getType() == null) errors.add("Missing required field: type");
        if (message.getContent() == null || message.getContent().isEmpty()) {
            errors.add("Missing required field: content");
        }
        if (message.getPriority() == null) errors.add("Missing required field: priority");
        if (message.getTimestamp() == null) errors.add("Missing required field: timestamp");

        if (message.getReceiverId() != null && !agentId.equals(message.getReceiverId()) && !message.isBroadcast()) {
            errors.add("Message not intended for this agent: " + message.getReceiverId());
        }
        if (message.getMessageId() != null && receivedMessages.containsKey(message.getMessageId())) {
            errors.add(DUPLICATE_PREFIX + ": " + message.getMessageId());
        }
        return errors;
    }

    /**
     * Validates a message, records it as received, then dispatches it to every processor registered
     * for its type. Unclaimed and unrecognized messages go to the fallback handler.
     */
    public ProcessingResult process(AgentMessage message) {
        List<String> errors = validate(message);
        if (!errors.isEmpty()) {
            logger.warn("Invalid message received: {} {}", message.getMessageId(), errors);
            return ProcessingResult.rejected(message.getMessageId(), errors);
        }

        receivedMessages.put(message.getMessageId(), message);
        logger.debug("Message received and stored: {}", message.getMessageId());

        List<MessageProcessor> registered = message.getType().isRecognized()
                ? processors.getOrDefault(message.getType(), List.of())
                : List.of();
        if (registered.isEmpty()) {
            logger.warn("No processor registered for message type: {} (message {})",
                    message.getType(), message.getMessageId());
            try {
                fallbackHandler.process(message);
            } catch (Exception e) {
                logger.error("Fallback handler failed for message {}", message.getMessageId(), e);
            }
            return ProcessingResult.fallback(message.getMessageId());
        }

        int failures = 0;
        for (MessageProcessor processor : registered) {
            try {
                processor.process(message);
            } catch (Exception e) {
                failures++;
                logger.error("Message processor failed for message {}", message.getMessageId(), e);
            }
        }
        return ProcessingResult.processed(message.getMessageId(), failures);
    }

    private void replyWithError(AgentMessage message) {
        if (message.getType() == MessageType.ERROR) {
            logger.warn("Unhandled error message {} from {}: {}", message.getMessageId(), message.getSenderId(),
                    message.getContent());
            return;
        }
        AgentMessage reply = error(message.getSenderId(),
                "Unknown message type: " + message.getType().getValue(), message.getMessageId());
        logger.debug("Error response created: {}", reply.getMessageId());
        replySink.accept(reply);
    }

    // ==================== Queries ====================

    public AgentMessage getMessageById(String messageId) {
        AgentMessage received = receivedMessages.get(messageId);
        return received != null ? received : sentMessages.get(messageId);
    }

    public boolean hasReceived(String messageId) {
        return receivedMessages.containsKey(messageId);
    }

    public List<AgentMessage> getSentMessages() {
        return List.copyOf(sentMessages.values());
    }

    public List<AgentMessage> getReceivedMessages() {
        return List.copyOf(receivedMessages.values());
    }

    public List<AgentMessage> getMessagesByType(MessageType type) {
        return Stream.concat(sentMessages.values().stream(), receivedMessages.values().stream())
                .filter(m -> m.getType() == type)
                .collect(Collectors.toList());
    }

    // ==================== Cleanup ====================

    /**
     * Evicts sent and received messages whose timestamp is older than {@code age}.
     *
     * @return number of messages removed
     */
    public int clearOlderThan(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        int before = sentMessages.size() + receivedMessages.size();
        sentMessages.values().removeIf(m -> m.getTimestamp().isBefore(cutoff));
        receivedMessages.values().removeIf(m -> m.getTimestamp().isBefore(cutoff));
        int removed = before - sentMessages.size() - receivedMessages.size();
        if (removed > 0) {
            logger.info("Cleared {} messages older than {}", removed, age);
        }
        return removed;
    }

    public void clearAll() {
        sentMessages.clear();
        receivedMessages.clear();
        logger.info("All messages cleared from storage");
    }

    public String getAgentId() {
        return agentId;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
