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

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A message exchanged between two agents, or broadcast to all of them.
 *
 * <p>Instances are immutable. Signing and encryption produce new instances through
 * {@link #withSignature(String)} and {@link #withContent(String, boolean)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public final class AgentMessage {

    public static final String BROADCAST = "broadcast";

    private final String messageId;
    private final String senderId;
    private final String receiverId;
    private final MessageType type;
    private final String content;
    private final MessagePriority priority;
    private final Instant timestamp;
    private final Map<String, Object> metadata;
    private final String signature;
    private final boolean encrypted;

    private AgentMessage(Builder builder) {
        this.messageId = builder.messageId;
        this.senderId = builder.senderId;
        this.receiverId = builder.receiverId;
        this.type = builder.type;
        this.content = builder.content;
        this.priority = builder.priority;
        this.timestamp = builder.timestamp;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.signature = builder.signature;
        this.encrypted = builder.encrypted;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .messageId(messageId)
                .senderId(senderId)
                .receiverId(receiverId)
                .type(type)
                .content(content)
                .priority(priority)
                .timestamp(timestamp)
                .metadata(metadata)
                .signature(signature)
                .encrypted(encrypted);
    }

    public AgentMessage withSignature(String signature) {
        return toBuilder().signature(signature).build();
    }

    public AgentMessage withContent(String content, boolean encrypted) {
        return toBuilder().content(content).encrypted(encrypted).build();
    }

    public boolean isBroadcast() {
        return BROADCAST.equals(receiverId);
    }

    public String getMessageId() {
        return messageId;
    }

    public String getSenderId() {
        return senderId;
    }

    public String getReceiverId() {
        return receiverId;
    }

    public MessageType getType() {
        return type;
    }

    public String getContent() {
        return content;
    }

    public MessagePriority getPriority() {
        return priority;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public String getSignature() {
        return signature;
    }

    public boolean isEncrypted() {
        return encrypted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AgentMessage that = (AgentMessage) o;
        return encrypted == that.encrypted
                && Objects.equals(messageId, that.messageId)
                && Objects.equals(senderId, that.senderId)
                && Objects.equals(receiverId, that.receiverId)
                && type == that.type
                && Objects.equals(content, that.content)
                && priority == that.priority
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(metadata, that.metadata)
                && Objects.equals(signature, that.signature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageId, senderId, receiverId, type, content, priority, timestamp, metadata,
                signature, encrypted);
    }

    @Override
    public String toString() {
        return "AgentMessage{" +
                "messageId='" + messageId + '\'' +
                ", senderId='" + senderId + '\'' +
                ", receiverId='" + receiverId + '\'' +
                ", type=" + type +
                ", priority=" + priority +
                ", timestamp=" + timestamp +
                ", signed=" + (signature != null) +
                ", encrypted=" + encrypted +
                '}';
    }

    public static class Builder {
        private String messageId;
        private String senderId;
        private String receiverId;
        private MessageType type = MessageType.TEXT;
        private String content;
        private MessagePriority priority = MessagePriority.NORMAL;
        private Instant timestamp = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        private Map<String, Object> metadata = new LinkedHashMap<>();
        private String signature;
        private boolean encrypted;

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder senderId(String senderId) {
            this.senderId = senderId;
            return this;
        }

        public Builder receiverId(String receiverId) {
            this.receiverId = receiverId;
            return this;
        }

        public Builder type(MessageType type) {
            this.type = type;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder priority(MessagePriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder signature(String signature) {
            this.signature = signature;
            return this;
        }

        public Builder encrypted(boolean encrypted) {
            this.encrypted = encrypted;
            return this;
        }

        public AgentMessage build() {
            return new AgentMessage(this);
        }
    }
}
