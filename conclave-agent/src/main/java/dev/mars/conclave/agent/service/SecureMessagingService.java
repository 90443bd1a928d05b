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

import dev.mars.conclave.agent.config.AgentConfiguration;
import dev.mars.conclave.coordination.CoordinationService;
import dev.mars.conclave.coordination.Delivery;
import dev.mars.conclave.coordination.Subscription;
import dev.mars.conclave.coordination.registry.PeerInfo;
import dev.mars.conclave.coordination.registry.PeerRegistration;
import dev.mars.conclave.core.exceptions.CryptoException;
import dev.mars.conclave.core.exceptions.DeliveryException;
import dev.mars.conclave.core.exceptions.MalformedMessageException;
import dev.mars.conclave.crypto.EncryptedEnvelope;
import dev.mars.conclave.crypto.EncryptionChannel;
import dev.mars.conclave.crypto.SharedSecretCache;
import dev.mars.conclave.event.EventDispatcher;
import dev.mars.conclave.event.EventType;
import dev.mars.conclave.identity.KeyEncoding;
import dev.mars.conclave.message.AgentMessage;
import dev.mars.conclave.message.MessageCodec;
import dev.mars.conclave.message.MessageHandler;
import dev.mars.conclave.message.MessagePriority;
import dev.mars.conclave.message.MessageType;
import dev.mars.conclave.message.ProcessingResult;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * End-to-end protection for agent messages carried by the coordination service.
 *
 * <p>Outbound, a message is optionally encrypted for the receiver's exchange key, signed over its
 * canonical payload and published durably. Broadcasts are copied to every online peer, each copy
 * encrypted for that peer. Inbound, the signature is checked against the sender's registered
 * signing key, the content is decrypted and the message goes to the {@link MessageHandler}.</p>
 *
 * <p>A delivery that fails verification or decryption is acknowledged and dropped: it cannot
 * become valid on redelivery. A delivery from a sender not yet in the registry is refused so the
 * broker redelivers it once the registration has arrived.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class SecureMessagingService {

    private static final Logger logger = LoggerFactory.getLogger(SecureMessagingService.class);

    private final CoordinationService coordination;
    private final AgentConfiguration config;
    private final EncryptionChannel channel;
    private final SharedSecretCache secrets;
    private final MessageHandler handler;
    private final EventDispatcher events;

    private final AtomicLong rejected = new AtomicLong();
    private volatile Subscription subscription;

    public SecureMessagingService(CoordinationService coordination, AgentConfiguration config,
                                  EncryptionChannel channel, MessageHandler handler, EventDispatcher events) {
        this.coordination = coordination;
        this.config = config;
        this.channel = channel;
        this.secrets = new SharedSecretCache(channel);
        this.handler = handler;
        this.events = events;
        handler.setReplySink(reply -> dispatch(reply)
                .onFailure(e -> logger.error("Failed to send reply {}: {}", reply.getMessageId(), e.getMessage())));
    }

    // ==================== Lifecycle ====================

    public Future<Subscription> start() {
        return coordination.subscribeToMessages(config.getAgentId(), this::onDelivery)
                .onSuccess(s -> {
                    subscription = s;
                    logger.info("Secure messaging started for agent {} (encryption={}, signing={})",
                            config.getAgentId(), config.isEncryptionEnabled(), config.isSigningEnabled());
                });
    }

    public Future<Void> stop() {
        Subscription current = subscription;
        subscription = null;
        clearSecrets();
        return current == null ? Future.succeededFuture() : current.cancel();
    }

    // ==================== Outbound ====================

    public Future<AgentMessage> send(String receiverId, String content) {
        return send(receiverId, content, MessageType.TEXT, MessagePriority.NORMAL, null);
    }

    public Future<AgentMessage> send(String receiverId, String content, MessageType type,
                                     MessagePriority priority, Map<String, Object> metadata) {
        return dispatch(handler.create(receiverId, content, type, priority, metadata));
    }

    /**
     * Protects and publishes a message already created by the handler.
     *
     * @return the message as it went on the wire for the first receiver
     */
    public Future<AgentMessage> dispatch(AgentMessage message) {
        List<String> receivers;
        if (message.isBroadcast()) {
            receivers = coordination.getOnlineAgents().stream()
                    .map(PeerRegistration::getAgentId)
                    .filter(id -> !id.equals(config.getAgentId()))
                    .collect(Collectors.toList());
            if (receivers.isEmpty()) {
                logger.debug("No online peers for broadcast {}", message.getMessageId());
                return Future.succeededFuture(message);
            }
        } else {
            receivers = List.of(message.getReceiverId());
        }

        List<Future<AgentMessage>> sends = new ArrayList<>();
        for (String receiver : receivers) {
            AgentMessage wire;
            try {
                wire = protect(message, receiver);
            } catch (CryptoException e) {
                if (message.isBroadcast()) {
                    logger.warn("Skipping broadcast copy of {} for {}: {}", message.getMessageId(), receiver,
                            e.getMessage());
                    continue;
                }
                return Future.failedFuture(e);
            }
            sends.add(coordination.sendMessage(config.getAgentId(), receiver,
                    new JsonObject(MessageCodec.serialize(wire))).map(v -> wire));
        }
        if (sends.isEmpty()) {
            return Future.succeededFuture(message);
        }
        return Future.all(sends).map(all -> {
            logger.debug("Message {} sent to {}", message.getMessageId(), receivers);
            return sends.get(0).result();
        });
    }

    private AgentMessage protect(AgentMessage message, String receiverId) throws CryptoException {
        AgentMessage wire = message;
        if (config.isEncryptionEnabled()) {
            byte[] key = secrets.secretFor(exchangeKeyOf(receiverId));
            EncryptedEnvelope envelope = channel.encrypt(message.getContent().getBytes(StandardCharsets.UTF_8), key);
            wire = wire.withContent(envelope.toBase64(), true);
        }
        if (config.isSigningEnabled()) {
            byte[] signature = channel.sign(MessageCodec.signingPayload(wire));
            wire = wire.withSignature(Base64.getEncoder().encodeToString(signature));
        }
        return wire;
    }

    // ==================== Inbound ====================

    /**
     * Handles one delivery from this agent's inbox. A failed future asks the broker to redeliver.
     */
    Future<Void> onDelivery(Delivery delivery) {
        JsonObject body = delivery.getBody().getJsonObject("message");
        if (body == null) {
            reject(delivery, "envelope has no message");
            return Future.succeededFuture();
        }

        AgentMessage message;
        try {
            message = MessageCodec.deserializeLenient(body.encode());
        } catch (MalformedMessageException e) {
            reject(delivery, e.getMessage());
            return Future.succeededFuture();
        }

        PeerInfo sender = coordination.getAgentInfo(message.getSenderId()).orElse(null);
        if (sender == null && (config.isSigningEnabled() || message.isEncrypted())) {
            return Future.failedFuture(new DeliveryException(delivery.getSubject(),
                    "Sender " + message.getSenderId() + " is not registered", null));
        }

        AgentMessage opened;
        try {
            if (config.isSigningEnabled()) {
                verifySignature(message, sender);
            }
            opened = message.isEncrypted() ? decrypt(message, sender) : message;
        } catch (CryptoException e) {
            reject(delivery, e.getMessage());
            return Future.succeededFuture();
        }

        try {
            ProcessingResult result = handler.process(opened);
            if (result.isAccepted() && events != null) {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("message_id", opened.getMessageId());
                data.put("sender_id", opened.getSenderId());
                data.put("type", opened.getType().getValue());
                events.dispatch(events.create(EventType.forMessageType(opened.getType()), opened.getSenderId(),
                        data, opened.getMessageId()));
            }
            return Future.succeededFuture();
        } catch (RuntimeException e) {
            return Future.failedFuture(new DeliveryException(delivery.getSubject(),
                    "Message handler failed for " + opened.getMessageId(), e));
        }
    }

    private void verifySignature(AgentMessage message, PeerInfo sender) throws CryptoException {
        if (message.getSignature() == null) {
            throw new CryptoException("Message " + message.getMessageId() + " is not signed");
        }
        if (sender.getSigningPublicKey() == null) {
            throw new CryptoException("No signing key registered for " + sender.getAgentId());
        }
        byte[] signature;
        try {
            signature = Base64.getDecoder().decode(message.getSignature());
        } catch (IllegalArgumentException e) {
            throw new CryptoException("Signature is not valid base64", e);
        }
        byte[] signerKey = KeyEncoding.fromHex(sender.getSigningPublicKey());
        if (!channel.verify(MessageCodec.signingPayload(message), signature, signerKey)) {
            throw new CryptoException("Signature verification failed for message " + message.getMessageId());
        }
    }

    private AgentMessage decrypt(AgentMessage message, PeerInfo sender) throws CryptoException {
        if (sender.getExchangePublicKey() == null) {
            throw new CryptoException("No exchange key registered for " + sender.getAgentId());
        }
        byte[] key = secrets.secretFor(KeyEncoding.fromHex(sender.getExchangePublicKey()));
        byte[] plaintext = channel.decrypt(EncryptedEnvelope.fromBase64(message.getContent()), key);
        return message.withContent(new String(plaintext, StandardCharsets.UTF_8), false);
    }

    private byte[] exchangeKeyOf(String agentId) throws CryptoException {
        PeerInfo peer = coordination.getAgentInfo(agentId)
                .orElseThrow(() -> new CryptoException("Unknown receiver " + agentId));
        if (peer.getExchangePublicKey() == null) {
            throw new CryptoException("No exchange key registered for " + agentId);
        }
        return KeyEncoding.fromHex(peer.getExchangePublicKey());
    }

    private void reject(Delivery delivery, String reason) {
        rejected.incrementAndGet();
        logger.warn("Rejected message on {} (delivery {}): {}", delivery.getSubject(),
                delivery.getDeliveryCount(), reason);
    }

    /**
     * Drops cached shared secrets. Secrets for a regenerated identity are never served from the
     * cache, this only releases the memory held by retired entries.
     */
    public void clearSecrets() {
        secrets.clear();
    }

    public long getRejectedCount() {
        return rejected.get();
    }

    public MessageHandler getHandler() {
        return handler;
    }
}
