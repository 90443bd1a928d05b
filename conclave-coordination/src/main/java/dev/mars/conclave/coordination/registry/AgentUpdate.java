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

import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * Broadcast on {@code agents.updates} whenever the registry gains or loses a peer.
 */
public final class AgentUpdate {

    public static final String REGISTERED = "registered";
    public static final String UNREGISTERED = "unregistered";

    private final String agentId;
    private final String eventType;
    private final Instant timestamp;
    private final PeerInfo info;

    public AgentUpdate(String agentId, String eventType, Instant timestamp, PeerInfo info) {
        this.agentId = agentId;
        this.eventType = eventType;
        this.timestamp = timestamp;
        this.info = info;
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("agent_id", agentId)
                .put("event_type", eventType)
                .put("timestamp", timestamp.toEpochMilli() / 1000.0)
                .put("agent_info", info == null ? null : info.toJson());
    }

    public String getAgentId() {
        return agentId;
    }

    public String getEventType() {
        return eventType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public PeerInfo getInfo() {
        return info;
    }

    @Override
    public String toString() {
        return "AgentUpdate{agentId='" + agentId + "', eventType='" + eventType + "'}";
    }
}
