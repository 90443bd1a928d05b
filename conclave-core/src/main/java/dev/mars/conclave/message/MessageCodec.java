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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.conclave.core.exceptions.MalformedMessageException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON wire codec for {@link AgentMessage}.
 *
 * <p>Field names are snake_case. The timestamp travels as fractional epoch seconds with
 * millisecond precision. Enum values travel in lower case.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public final class MessageCodec {

    static final List<String> REQUIRED_FIELDS = List.of(
            "message_id", "sender_id", "receiver_id", "type", "content", "priority", "timestamp");

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private MessageCodec() {
    }

    public static String serialize(AgentMessage message) {
        ObjectNode node = toNode(message);
        node.put("signature", message.getSignature());
        node.put("encrypted", message.isEncrypted());
        return write(node);
    }

    public static byte[] serializeToBytes(AgentMessage message) {
        return serialize(message).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Canonical bytes covered by a message signature: every field in a fixed order except
     * the signature itself.
     */
    public static byte[] signingPayload(AgentMessage message) {
        ObjectNode node = toNode(message);
        node.put("encrypted", message.isEncrypted());
        return write(node).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Parses a wire message strictly.
     *
     * @throws MalformedMessageException on invalid JSON, a missing required field or an unknown enum value
     */
    public static AgentMessage deserialize(String json) throws MalformedMessageException {
        return parse(json, true);
    }

    public static AgentMessage deserialize(byte[] json) throws MalformedMessageException {
        return parse(new String(json, StandardCharsets.UTF_8), true);
    }

    /**
     * Parses a wire message, mapping an unknown type to {@link MessageType#UNRECOGNIZED} instead
     * of failing. Missing fields and unknown priorities are still rejected.
     */
    public static AgentMessage deserializeLenient(String json) throws MalformedMessageException {
        return parse(json, false);
    }

    private static AgentMessage parse(String json, boolean strict) throws MalformedMessageException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Message is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException("Message must be a JSON object");
        }
        for (String field : REQUIRED_FIELDS) {
            JsonNode value = root.get(field);
            if (value == null || value.isNull()) {
                throw new MalformedMessageException("Missing required field: " + field);
            }
        }

        String typeValue = root.get("type").asText();
        MessageType type = MessageType.fromValue(typeValue);
        if (strict && !type.isRecognized()) {
            throw new MalformedMessageException("Unknown message type: " + typeValue);
        }
        String priorityValue = root.get("priority").asText();
        MessagePriority priority = MessagePriority.fromValue(priorityValue);
        if (priority == null) {
            throw new MalformedMessageException("Unknown message priority: " + priorityValue);
        }
        JsonNode timestamp = root.get("timestamp");
        if (!timestamp.isNumber()) {
            throw new MalformedMessageException("Timestamp must be epoch seconds");
        }

        Map<String, Object> metadata = Map.of();
        JsonNode metadataNode = root.get("metadata");
        if (metadataNode != null && !metadataNode.isNull()) {
            if (!metadataNode.isObject()) {
                throw new MalformedMessageException("Metadata must be a JSON object");
            }
            metadata = MAPPER.convertValue(metadataNode, METADATA_TYPE);
        }
        JsonNode signature = root.get("signature");
        JsonNode encrypted = root.get("encrypted");

        return AgentMessage.builder()
                .messageId(root.get("message_id").asText())
                .senderId(root.get("sender_id").asText())
                .receiverId(root.get("receiver_id").asText())
                .type(type)
                .content(root.get("content").asText())
                .priority(priority)
                .timestamp(Instant.ofEpochMilli(Math.round(timestamp.asDouble() * 1000)))
                .metadata(metadata)
                .signature(signature == null || signature.isNull() ? null : signature.asText())
                .encrypted(encrypted != null && encrypted.asBoolean(false))
                .build();
    }

    private static ObjectNode toNode(AgentMessage message) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("message_id", message.getMessageId());
        node.put("sender_id", message.getSenderId());
        node.put("receiver_id", message.getReceiverId());
        node.put("type", message.getType().getValue());
        node.put("content", message.getContent());
        node.put("priority", message.getPriority().getValue());
        node.put("timestamp", message.getTimestamp().toEpochMilli() / 1000.0);
        node.set("metadata", MAPPER.valueToTree(message.getMetadata()));
        return node;
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // metadata values come from JSON or plain Java values
            throw new IllegalArgumentException("Message is not serializable", e);
        }
    }
}
