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

package dev.mars.conclave.coordination;

import io.vertx.core.json.JsonObject;

/**
 * Point-in-time view of the coordination service.
 */
public final class HealthSnapshot {

    private final boolean connected;
    private final int agentCount;
    private final int onlineAgents;
    private final int subscriptions;

    public HealthSnapshot(boolean connected, int agentCount, int onlineAgents, int subscriptions) {
        this.connected = connected;
        this.agentCount = agentCount;
        this.onlineAgents = onlineAgents;
        this.subscriptions = subscriptions;
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("connected", connected)
                .put("agent_count", agentCount)
                .put("online_agents", onlineAgents)
                .put("subscriptions", subscriptions);
    }

    public boolean isConnected() {
        return connected;
    }

    public int getAgentCount() {
        return agentCount;
    }

    public int getOnlineAgents() {
        return onlineAgents;
    }

    public int getSubscriptions() {
        return subscriptions;
    }

    @Override
    public String toString() {
        return toJson().encode();
    }
}
