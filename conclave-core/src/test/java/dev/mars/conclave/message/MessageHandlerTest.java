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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MessageHandler creation, validation and dispatch.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
class MessageHandlerTest {

    private static final Instant NOW = Instant.parse("2026-03-04T10:00:00Z");

    private MessageHandler handler;
    private MessageHandler peer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        handler = new MessageHandler("bob", clock);
        peer = new MessageHandler("alice", clock);
    }

    @Test
    @DisplayName("Should assign unique ids from agent id, counter and time")
    void shouldAssignUniqueIds() {
        AgentMessage first = peer.create("bob", "one");
        AgentMessage second = peer.create("bob", "two");

        assertEquals("alice-1-" + NOW.toEpochMilli(), first.getMessageId());
        assertEquals("alice-2-" + NOW.toEpochMilli(), second.getMessageId());
        assertEquals(2, peer.getSentMessages().size());
    }

    @Test
    @DisplayName("Should accept the first delivery and reject a duplicate")
    void shouldRejectDuplicate() {
        AgentMessage message = peer.create("bob", "hello");
        List<AgentMessage> seen = new ArrayList<>();
        handler.registerProcessor(MessageType.TEXT, seen::add);

        ProcessingResult first = handler.process(message);
        ProcessingResult second = handler.process(message);

        assertEquals(ProcessingResult.Status.PROCESSED, first.getStatus());
        assertEquals(ProcessingResult.Status.REJECTED, second.getStatus());
        assertTrue(second.isDuplicate());
        assertEquals(1, seen.size());
        assertEquals(1, handler.validate(message).size());
    }

    @Test
    @DisplayName("Should reject messages addressed to another agent")
    void shouldRejectWrongReceiver() {
        AgentMessage message = peer.create("carol", "hello");

        List<String> errors = handler.validate(message);

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("carol"));
        assertFalse(handler.process(message).isAccepted());
        assertFalse(handler.hasReceived(message.getMessageId()));
    }

    @Test
    @DisplayName("Should accept broadcast messages")
    void shouldAcceptBroadcast() {
        assertTrue(handler.validate(peer.heartbeat()).isEmpty());
    }

    @Test
    @DisplayName("Should report missing fields")
    void shouldReportMissingFields() {
        AgentMessage message = AgentMessage.builder().receiverId("bob").content("").build();

        List<String> errors = handler.validate(message);

        assertTrue(errors.contains("Missing required field: message_id"));
        assertTrue(errors.contains("Missing required field: sender_id"));
        assertTrue(errors.contains("Missing required field: content"));
    }

    @Test
    @DisplayName("Should keep dispatching when one processor fails")
    void shouldIsolateProcessorFailures() {
        List<String> calls = new ArrayList<>();
        handler.registerProcessor(MessageType.TASK, m -> { throw new IllegalStateException("boom"); });
        handler.registerProcessor(MessageType.TASK, m -> calls.add(m.getContent()));
        AgentMessage task = peer.create("bob", "work", MessageType.TASK, MessagePriority.HIGH, Map.of());

        ProcessingResult result = handler.process(task);

        assertEquals(List.of("work"), calls);
        assertEquals(1, result.getFailedProcessors());
        assertTrue(handler.hasReceived(task.getMessageId()));
    }

    @Test
    @DisplayName("Should reply with an error when no processor is registered")
    void shouldReplyWithErrorForUnclaimedType() {
        List<AgentMessage> replies = new ArrayList<>();
        handler.setReplySink(replies::add);
        AgentMessage status = peer.statusUpdate("busy", Map.of());

        ProcessingResult result = handler.process(status);

        assertEquals(ProcessingResult.Status.FALLBACK, result.getStatus());
        assertEquals(1, replies.size());
        AgentMessage reply = replies.get(0);
        assertEquals(MessageType.ERROR, reply.getType());
        assertEquals("alice", reply.getReceiverId());
        assertEquals(status.getMessageId(), reply.getMetadata().get("original_message_id"));
        assertEquals(reply, handler.getMessageById(reply.getMessageId()));
    }

    @Test
    @DisplayName("Should not answer an unclaimed error with another error")
    void shouldNotReplyToErrors() {
        List<AgentMessage> replies = new ArrayList<>();
        handler.setReplySink(replies::add);

        ProcessingResult result = handler.process(peer.error("bob", "Unknown message type: task", "bob-1-1"));

        assertEquals(ProcessingResult.Status.FALLBACK, result.getStatus());
        assertTrue(replies.isEmpty());
    }

    @Test
    @DisplayName("Should send unrecognized types to the fallback handler")
    void shouldRouteUnrecognizedToFallback() {
        List<AgentMessage> fallback = new ArrayList<>();
        handler.setFallbackHandler(fallback::add);
        AgentMessage unknown = peer.create("bob", "??").toBuilder().type(MessageType.UNRECOGNIZED).build();

        assertEquals(ProcessingResult.Status.FALLBACK, handler.process(unknown).getStatus());
        assertEquals(1, fallback.size());
        assertThrows(IllegalArgumentException.class,
                () -> handler.registerProcessor(MessageType.UNRECOGNIZED, m -> { }));
    }

    @Test
    @DisplayName("Should evict messages older than the retention age")
    void shouldClearOlderThan() {
        AgentMessage old = AgentMessage.builder()
                .messageId("alice-old").senderId("alice").receiverId("bob").content("old")
                .timestamp(NOW.minus(Duration.ofHours(2))).build();
        AgentMessage recent = peer.create("bob", "new");
        handler.registerProcessor(MessageType.TEXT, m -> { });
        handler.process(old);
        handler.process(recent);
        handler.create("alice", "reply");

        int removed = handler.clearOlderThan(Duration.ofHours(1));

        assertEquals(1, removed);
        assertFalse(handler.hasReceived("alice-old"));
        assertTrue(handler.hasReceived(recent.getMessageId()));
        assertEquals(1, handler.getSentMessages().size());

        handler.clearAll();
        assertTrue(handler.getReceivedMessages().isEmpty());
        assertTrue(handler.getSentMessages().isEmpty());
    }

    @Test
    @DisplayName("Should filter stored messages by type")
    void shouldFilterByType() {
        handler.registerProcessor(MessageType.TEXT, m -> { });
        handler.heartbeat();
        handler.error("alice", "bad", "alice-1-1");
        handler.process(peer.create("bob", "hi"));

        assertEquals(1, handler.getMessagesByType(MessageType.HEARTBEAT).size());
        assertEquals(1, handler.getMessagesByType(MessageType.ERROR).size());
        assertEquals(1, handler.getMessagesByType(MessageType.TEXT).size());
    }
}
