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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Known peers and their liveness.
 *
 * <p>Writes are expected from a single owner (the coordination service's context). Reads may
 * come from any thread. Liveness is computed on read: a peer is ONLINE while its last
 * heartbeat is strictly less than one liveness window old.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-08
 * @version 1.0
 */
public class PeerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(PeerRegistry.class);

    private final Clock clock;
    private final Duration livenessWindow;
    private final Map<String, PeerRegistration> peers = new ConcurrentHashMap<>();

    public PeerRegistry(Clock clock, Duration livenessWindow) {
        this.clock = clock;
        this.livenessWindow = livenessWindow;
    }

    /**
     * Adds or replaces a peer and marks it seen now.
     */
    public PeerRegistration register(PeerInfo info) {
        LivenessState previous = state(info.getAgentId());
        PeerRegistration registration = new PeerRegistration(info, clock.instant());
        peers.put(info.getAgentId(), registration);
        if (previous == LivenessState.UNKNOWN) {
            logger.info("Agent registered: {}", info.getAgentId());
        } else {
            logger.info("Agent re-registered: {} ({} -> {})", info.getAgentId(), previous, LivenessState.ONLINE);
        }
        return registration;
    }

    /**
     * Refreshes a known peer.
     *
     * @return false if the peer is unknown, in which case nothing changes
     */
    public boolean heartbeat(String agentId) {
        PeerRegistration registration = agentId == null ? null : peers.get(agentId);
        if (registration == null) {
            logger.warn("Heartbeat received from unknown agent: {}", agentId);
            return false;
        }
        LivenessState previous = state(agentId);
        if (!previous.canTransitionTo(LivenessState.ONLINE)) {
            logger.warn("Ignoring heartbeat from {} in state {}", agentId, previous);
            return false;
        }
        registration.touch(clock.instant());
        if (previous == LivenessState.OFFLINE) {
            logger.info("Agent back online: {}", agentId);
        } else {
            logger.debug("Heartbeat received from agent: {}", agentId);
        }
        return true;
    }

    public Optional<PeerRegistration> unregister(String agentId) {
        LivenessState previous = state(agentId);
        if (!previous.canTransitionTo(LivenessState.UNKNOWN)) {
            logger.warn("Unregistration request for unknown agent: {}", agentId);
            return Optional.empty();
        }
        PeerRegistration removed = peers.remove(agentId);
        if (removed == null) {
            return Optional.empty();
        }
        logger.info("Agent unregistered: {} ({} -> {})", agentId, previous, LivenessState.UNKNOWN);
        return Optional.of(removed);
    }

    public LivenessState state(String agentId) {
        PeerRegistration registration = agentId == null ? null : peers.get(agentId);
        if (registration == null) {
            return LivenessState.UNKNOWN;
        }
        return isOnline(registration, clock.instant()) ? LivenessState.ONLINE : LivenessState.OFFLINE;
    }

    public Optional<PeerRegistration> get(String agentId) {
        return Optional.ofNullable(peers.get(agentId));
    }

    public List<PeerRegistration> online() {
        Instant now = clock.instant();
        return peers.values().stream()
                .filter(r -> isOnline(r, now))
                .collect(Collectors.toList());
    }

    public List<PeerRegistration> all() {
        return List.copyOf(peers.values());
    }

    public int size() {
        return peers.size();
    }

    public int onlineCount() {
        return online().size();
    }

    public Duration getLivenessWindow() {
        return livenessWindow;
    }

    private boolean isOnline(PeerRegistration registration, Instant now) {
        return Duration.between(registration.getLastSeen(), now).compareTo(livenessWindow) < 0;
    }
}
