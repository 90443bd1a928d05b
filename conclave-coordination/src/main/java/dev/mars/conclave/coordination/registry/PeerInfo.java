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

package dev.mars.conclave.coordination.registry;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What an agent advertises about itself when it registers.
 *
 * <p>The public keys are lowercase hex of the raw 32-byte keys, and are absent for agents
 * that do not take part in secure messaging.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-08
 * @version 1.0
 */
public final class PeerInfo {

    private final String agentId;
    private final String name;
    private final String role;
    private final List<String> capabilities;
    private final String signingPublicKey;
    private final String exchangePublicKey;
    private final JsonObject metadata;

    private PeerInfo(Builder builder) {
        this.agentId = Objects.requireNonNull(builder.agentId, "agentId");
        this.name = builder.name == null ? builder.agentId : builder.name;
        this.role = builder.role;
        this.capabilities = List.copyOf(builder.capabilities);
        this.signingPublicKey = builder.signingPublicKey;
        this.exchangePublicKey = builder.exchangePublicKey;
        this.metadata = builder.metadata.copy();
    }

    public static Builder builder(String agentId) {
        return new Builder().agentId(agentId);
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("agent_id", agentId)
                .put("name", name)
                .put("capabilities", new JsonArray(new ArrayList<>(capabilities)))
                .put("metadata", metadata.copy());
        if (role != null) json.put("role", role);
        if (signingPublicKey != null) json.put("signing_public_key", signingPublicKey);
        if (exchangePublicKey != null) json.put("exchange_public_key", exchangePublicKey);
        return json;
    }

    /**
     * @throws IllegalArgumentException if {@code agent_id} is missing
     */
    public static PeerInfo fromJson(JsonObject json) {
        String agentId = json.getString("agent_id");
        if (agentId == null || agentId.isEmpty()) {
            throw new IllegalArgumentException("Agent info has no agent_id");
        }
        Builder builder = builder(agentId)
                .name(json.getString("name"))
                .role(json.getString("role"))
                .signingPublicKey(json.getString("signing_public_key"))
                .exchangePublicKey(json.getString("exchange_public_key"));
        JsonArray capabilities = json.getJsonArray("capabilities");
        if (capabilities != null) {
            for (int i = 0; i < capabilities.size(); i++) {
                builder.capability(capabilities.getString(i));
            }
        }
        JsonObject metadata = json.getJsonObject("metadata");
        if (metadata != null) {
            builder.metadata(metadata.getMap());
        }
        return builder.build();
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    public String getAgentId() {
        return agentId;
    }

    public String getName() {
        return name;
    }

    public String getRole() {
        return role;
    }

    public List<String> getCapabilities() {
        return capabilities;
    }

    public String getSigningPublicKey() {
        return signingPublicKey;
    }

    public String getExchangePublicKey() {
        return exchangePublicKey;
    }

    public JsonObject getMetadata() {
        return metadata.copy();
    }

    @Override
    public String toString() {
        return "PeerInfo{agentId='" + agentId + "', name='" + name + "', capabilities=" + capabilities + "}";
    }

    public static class Builder {
        private String agentId;
        private String name;
        private String role;
        private final List<String> capabilities = new ArrayList<>();
        private String signingPublicKey;
        private String exchangePublicKey;
        private JsonObject metadata = new JsonObject();

        public Builder agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder capability(String capability) {
            this.capabilities.add(capability);
            return this;
        }

        public Builder capabilities(List<String> capabilities) {
            this.capabilities.addAll(capabilities);
            return this;
        }

        public Builder signingPublicKey(String signingPublicKey) {
            this.signingPublicKey = signingPublicKey;
            return this;
        }

        public Builder exchangePublicKey(String exchangePublicKey) {
            this.exchangePublicKey = exchangePublicKey;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = new JsonObject(new java.util.LinkedHashMap<>(metadata));
            return this;
        }

        public PeerInfo build() {
            return new PeerInfo(this);
        }
    }
}
