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

package dev.mars.conclave.agent.service;

import dev.mars.conclave.agent.AgentTestSupport;
import dev.mars.conclave.coordination.Subscription;
import dev.mars.conclave.coordination.broker.InMemoryBroker;
import dev.mars.conclave.coordination.broker.InMemoryBrokerClient;
import dev.mars.conclave.coordination.registry.LivenessState;
import dev.mars.conclave.coordination.topology.Subjects;
import dev.mars.conclave.core.exceptions.CryptoException;
import dev.mars.conclave.event.EventType;
import dev.mars.conclave.identity.KeyPurpose;
import dev.mars.conclave.message.AgentMessage;
import dev.mars.conclave.message.MessageCodec;
import dev.mars.conclave.message.MessagePriority;
import dev.mars.conclave.message.MessageType;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;

import static dev.mars.conclave.agent.AgentTestSupport.WAIT;
import static dev.mars.conclave.agent.AgentTestSupport.result;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for SecureMessagingService over the in-memory broker.
 * Every node has a real identity on disk; nothing is mocked.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 */
@ExtendWith(VertxExtension.class)
class SecureMessagingServiceTest {

    @TempDir
    Path root;

    private InMemoryBroker broker;
    private InMemoryBrokerClient raw;
    private final List<TestNode> nodes = new ArrayList<>();

    @BeforeEach
    void setUp() {
        broker = new InMemoryBroker();
        raw = new InMemoryBrokerClient(broker);
    }

    @AfterEach
    void tearDown() throws Exception {
        raw.close();
        for (TestNode node : nodes) {
            node.close();
        }
        nodes.clear();
    }

    private TestNode registered(Vertx vertx, String agentId) throws Exception {
        TestNode node = TestNode.connected(vertx, broker, root, agentId);
        nodes.add(node);
        assertTrue(result(node.registration.register()));
        return node;
    }

    private void awaitMutualDiscovery() {
        await().atMost(WAIT).until(() -> nodes.stream().allMatch(observer -> nodes.stream()
                .allMatch(peer -> observer.coordination.getLivenessState(peer.id()) == LivenessState.ONLINE)));
    }

    private static SecureMessagingService messaging(TestNode node) {
        return new SecureMessagingService(node.coordination, node.config, node.channel, node.handler, node.events);
    }

    private static AgentMessage sealed(TestNode from, TestNode to, String content) throws Exception {
        AgentMessage message = from.handler.create(to.id(), content);
        byte[] key = from.channel.deriveSharedSecret(to.identity.publicKeyBytes(KeyPurpose.EXCHANGE));
        String ciphertext = from.channel.encrypt(content.getBytes(StandardCharsets.UTF_8), key).toBase64();
        return signed(from, message.withContent(ciphertext, true));
    }

    private static AgentMessage signed(TestNode from, AgentMessage message) throws CryptoException {
        byte[] signature = from.channel.sign(MessageCodec.signingPayload(message));
        return message.withSignature(Base64.getEncoder().encodeToString(signature));
    }

    private void publishRaw(TestNode from, TestNode to, AgentMessage wire) throws Exception {
        if (!raw.isConnected()) {
            raw.connect();
        }
        JsonObject envelope = new JsonObject()
                .put("sender_id", from.id())
                .put("receiver_id", to.id())
                .put("message", new JsonObject(MessageCodec.serialize(wire)))
                .put("timestamp", System.currentTimeMillis() / 1000.0);
        raw.publishDurable(Subjects.message(from.id(), to.id()), envelope.toBuffer().getBytes());
    }

    @Test
    @DisplayName("Should encrypt and sign on send, verify and decrypt on receive")
    void shouldDeliverProtectedMessage(Vertx vertx) throws Exception {
        TestNode alice = registered(vertx, "alice");
        TestNode bob = registered(vertx, "bob");
        awaitMutualDiscovery();
        List<AgentMessage> received = new CopyOnWriteArrayList<>();
        bob.handler.registerProcessor(MessageType.TEXT, received::add);
        Subscription inbox = result(messaging(bob).start());

        AgentMessage wire = result(messaging(alice).send("bob", "hello bob"));

        assertTrue(wire.isEncrypted());
        assertNotEquals("hello bob", wire.getContent());
        assertNotNull(wire.getSignature());
        await().atMost(WAIT).until(() -> received.size() == 1);
        AgentMessage delivered = received.get(0);
        assertEquals("hello bob", delivered.getContent());
        assertFalse(delivered.isEncrypted());
        assertEquals(wire.getMessageId(), delivered.getMessageId());
        assertEquals(1, bob.events.count(EventType.MESSAGE_RECEIVED));
        await().atMost(WAIT).until(() -> inbox.getAcked() == 1);
    }

    @Test
    @DisplayName("Should drop a message whose signed fields were altered")
    void shouldRejectTamperedMessage(Vertx vertx) throws Exception {
        TestNode alice = registered(vertx, "alice");
        TestNode bob = registered(vertx, "bob");
        awaitMutualDiscovery();
        List<AgentMessage> received = new CopyOnWriteArrayList<>();
        bob.handler.registerProcessor(MessageType.TEXT, received::add);
        SecureMessagingService bobMessaging = messaging(bob);
        Subscription inbox = result(bobMessaging.start());

        AgentMessage wire = sealed(alice, bob, "pay 10");
        publishRaw(alice, bob, wire.toBuilder().priority(MessagePriority.CRITICAL).build());

        await().atMost(WAIT).until(() -> bobMessaging.getRejectedCount() == 1);
        await().atMost(WAIT).until(() -> inbox.getAcked() == 1);
        assertTrue(received.isEmpty());
        assertEquals(0, inbox.getNaked());
    }

    @Test
    @DisplayName("Should drop a validly signed message whose ciphertext does not authenticate")
    void shouldRejectCorruptedCiphertext(Vertx vertx) throws Exception {
        TestNode alice = registered(vertx, "alice");
        TestNode bob = registered(vertx, "bob");
        awaitMutualDiscovery();
        List<AgentMessage> received = new CopyOnWriteArrayList<>();
        bob.handler.registerProcessor(MessageType.TEXT, received::add);
        SecureMessagingService bobMessaging = messaging(bob);
        result(bobMessaging.start());

        AgentMessage wire = sealed(alice, bob, "secret plans");
        byte[] envelope = Base64.getDecoder().decode(wire.getContent());
        envelope[envelope.length - 1] ^= 0x01;
        AgentMessage corrupted = signed(alice,
                wire.withContent(Base64.getEncoder().encodeToString(envelope), true).withSignature(null));
        publishRaw(alice, bob, corrupted);

        await().atMost(WAIT).until(() -> bobMessaging.getRejectedCount() == 1);
        assertTrue(received.isEmpty());
        assertFalse(bob.handler.hasReceived(wire.getMessageId()));
    }

    @Test
    @DisplayName("Should redeliver a message from an unregistered sender until max deliver")
    void shouldRetryUnknownSender(Vertx vertx) throws Exception {
        TestNode bob = registered(vertx, "bob");
        TestNode mallory = TestNode.connected(vertx, broker, root, "mallory");
        nodes.add(mallory);
        SecureMessagingService bobMessaging = messaging(bob);
        Subscription inbox = result(bobMessaging.start());

        publishRaw(mallory, bob, sealed(mallory, bob, "trust me"));

        await().atMost(WAIT).until(() -> inbox.getDeadLettered() == 1);
        assertEquals(2, inbox.getNaked());
        assertEquals(0, bobMessaging.getRejectedCount());
        assertTrue(bob.handler.getReceivedMessages().isEmpty());
    }

    @Test
    @DisplayName("Should fail to send to an agent with no registered exchange key")
    void shouldFailForUnknownReceiver(Vertx vertx) throws Exception {
        TestNode alice = registered(vertx, "alice");
        awaitMutualDiscovery();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> result(messaging(alice).send("nobody", "hello?")));

        assertInstanceOf(CryptoException.class, e.getCause());
    }

    @Test
    @DisplayName("Should process a redelivered message only once")
    void shouldDeduplicateRedelivery(Vertx vertx) throws Exception {
        TestNode alice = registered(vertx, "alice");
        TestNode bob = registered(vertx, "bob");
        awaitMutualDiscovery();
        List<AgentMessage> received = new CopyOnWriteArrayList<>();
        bob.handler.registerProcessor(MessageType.TEXT, received::add);
        Subscription inbox = result(messaging(bob).start());

        AgentMessage wire = sealed(alice, bob, "once only");
        publishRaw(alice, bob, wire);
        publishRaw(alice, bob, wire);

        await().atMost(WAIT).until(() -> inbox.getAcked() == 2);
        assertEquals(1, received.size());
        assertEquals(1, bob.handler.getReceivedMessages().size());
    }

    @Test
    @DisplayName("Should answer an unhandled message type with an error reply")
    void shouldReplyWithErrorForUnhandledType(Vertx vertx) throws Exception {
        TestNode alice = registered(vertx, "alice");
        TestNode bob = registered(vertx, "bob");
        awaitMutualDiscovery();
        List<AgentMessage> errors = new CopyOnWriteArrayList<>();
        alice.handler.registerProcessor(MessageType.ERROR, errors::add);
        SecureMessagingService aliceMessaging = messaging(alice);
        result(aliceMessaging.start());
        result(messaging(bob).start());

        AgentMessage sent = result(aliceMessaging.send("bob", "do something", MessageType.TASK,
                MessagePriority.HIGH, Map.of()));

        await().atMost(WAIT).until(() -> errors.size() == 1);
        AgentMessage reply = errors.get(0);
        assertEquals("bob", reply.getSenderId());
        assertEquals(MessagePriority.HIGH, reply.getPriority());
        assertEquals(sent.getMessageId(), reply.getMetadata().get("original_message_id"));
        assertTrue(reply.getContent().contains("task"));
    }

    @Test
    @DisplayName("Should copy a broadcast to every other online agent")
    void shouldCopyBroadcastToEachPeer(Vertx vertx) throws Exception {
        TestNode alice = registered(vertx, "alice");
        TestNode bob = registered(vertx, "bob");
        TestNode carol = registered(vertx, "carol");
        awaitMutualDiscovery();
        List<String> receivers = new CopyOnWriteArrayList<>();
        for (TestNode node : List.of(bob, carol)) {
            node.handler.registerProcessor(MessageType.TEXT, m -> receivers.add(node.id() + ":" + m.getContent()));
            result(messaging(node).start());
        }

        result(messaging(alice).send(AgentMessage.BROADCAST, "all hands"));

        await().atMost(WAIT).until(() -> receivers.size() == 2);
        assertTrue(receivers.containsAll(List.of("bob:all hands", "carol:all hands")));
    }

    @Test
    @DisplayName("Should carry plaintext unsigned messages when protection is disabled")
    void shouldSendPlaintextWhenDisabled(Vertx vertx) throws Exception {
        List<TestNode> pair = new ArrayList<>();
        for (String id : List.of("alice", "bob")) {
            TestNode node = TestNode.connected(vertx, broker, AgentTestSupport.configuration(id, root)
                    .encryptionEnabled(false)
                    .signingEnabled(false)
                    .build());
            nodes.add(node);
            assertTrue(result(node.registration.register()));
            pair.add(node);
        }
        awaitMutualDiscovery();
        List<AgentMessage> received = new CopyOnWriteArrayList<>();
        pair.get(1).handler.registerProcessor(MessageType.TEXT, received::add);
        result(messaging(pair.get(1)).start());

        AgentMessage wire = result(messaging(pair.get(0)).send("bob", "in the clear"));

        assertFalse(wire.isEncrypted());
        assertNull(wire.getSignature());
        await().atMost(WAIT).until(() -> received.size() == 1);
        assertEquals("in the clear", received.get(0).getContent());
    }
}
