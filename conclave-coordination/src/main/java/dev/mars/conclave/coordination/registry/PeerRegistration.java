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

import java.time.Instant;

/**
 * Registry entry for one peer. Mutated only by {@link PeerRegistry}.
 */
public final class PeerRegistration {

    private final PeerInfo info;
    private final Instant registeredAt;
    private volatile Instant lastSeen;

    PeerRegistration(PeerInfo info, Instant registeredAt) {
        this.info = info;
        this.registeredAt = registeredAt;
        this.lastSeen = registeredAt;
    }

    void touch(Instant now) {
        this.lastSeen = now;
    }

    public PeerInfo getInfo() {
        return info;
    }

    public String getAgentId() {
        return info.getAgentId();
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    @Override
    public String toString() {
        return "PeerRegistration{agentId='" + getAgentId() + "', lastSeen=" + lastSeen + "}";
    }
}
