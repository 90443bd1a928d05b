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

import dev.mars.conclave.coordination.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PeerRegistry liveness tracking.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-08
 */
class PeerRegistryTest {

    private MutableClock clock;
    private PeerRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-08T12:00:00Z"));
        registry = new PeerRegistry(clock, Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("Should report online at t=50 and offline at t=100 after heartbeats at 10 and 20")
    void shouldEvaluateLivenessLazily() {
        registry.register(PeerInfo.builder("worker").build());
        clock.advance(Duration.ofSeconds(10));
        assertTrue(registry.heartbeat("worker"));
        clock.advance(Duration.ofSeconds(10));
        assertTrue(registry.heartbeat("worker"));

        clock.advance(Duration.ofSeconds(30));
        assertEquals(LivenessState.ONLINE, registry.state("worker"));
        assertEquals(1, registry.onlineCount());

        clock.advance(Duration.ofSeconds(50));
        assertEquals(LivenessState.OFFLINE, registry.state("worker"));
        assertEquals(0, registry.onlineCount());
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("Should treat a heartbeat exactly one window old as offline")
    void shouldUseStrictWindow() {
        registry.register(PeerInfo.builder("worker").build());
        clock.advance(Duration.ofSeconds(60));

        assertEquals(LivenessState.OFFLINE, registry.state("worker"));
    }

    @Test
    @DisplayName("Should bring an offline peer back online on heartbeat")
    void shouldRecoverOnHeartbeat() {
        registry.register(PeerInfo.builder("worker").build());
        clock.advance(Duration.ofMinutes(5));
        assertEquals(LivenessState.OFFLINE, registry.state("worker"));

        registry.heartbeat("worker");

        assertEquals(LivenessState.ONLINE, registry.state("worker"));
    }

    @Test
    @DisplayName("Should drop heartbeats from unknown agents without registering them")
    void shouldDropUnknownHeartbeat() {
        assertFalse(registry.heartbeat("ghost"));
        assertEquals(LivenessState.UNKNOWN, registry.state("ghost"));
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Should return to unknown on unregistration")
    void shouldForgetOnUnregister() {
        registry.register(PeerInfo.builder("worker").capability("search").build());

        assertTrue(registry.unregister("worker").isPresent());
        assertEquals(LivenessState.UNKNOWN, registry.state("worker"));
        assertTrue(registry.unregister("worker").isEmpty());
    }

    @Test
    @DisplayName("Should unregister offline peers and ignore repeated unregistration")
    void shouldUnregisterOnlyKnownPeers() {
        registry.register(PeerInfo.builder("worker").build());
        clock.advance(Duration.ofSeconds(90));
        assertEquals(LivenessState.OFFLINE, registry.state("worker"));

        assertTrue(registry.unregister("worker").isPresent());
        assertFalse(registry.unregister("worker").isPresent());
        assertFalse(registry.unregister(null).isPresent());
        assertEquals(LivenessState.UNKNOWN, registry.state("worker"));
    }

    @Test
    @DisplayName("Should keep re-registration online and refresh last seen")
    void shouldReRegister() {
        registry.register(PeerInfo.builder("worker").build());
        clock.advance(Duration.ofSeconds(90));

        registry.register(PeerInfo.builder("worker").role("search").build());

        assertEquals(LivenessState.ONLINE, registry.state("worker"));
        assertEquals(1, registry.size());
        assertEquals("search", registry.get("worker").orElseThrow().getInfo().getRole());
    }

    @Test
    @DisplayName("Should round-trip peer info through its JSON form")
    void shouldConvertPeerInfo() {
        PeerInfo info = PeerInfo.builder("worker")
                .name("Worker")
                .capability("search")
                .signingPublicKey("aa")
                .exchangePublicKey("bb")
                .build();

        PeerInfo parsed = PeerInfo.fromJson(info.toJson());

        assertEquals("Worker", parsed.getName());
        assertTrue(parsed.hasCapability("search"));
        assertEquals("aa", parsed.getSigningPublicKey());
        assertEquals("bb", parsed.getExchangePublicKey());
        assertThrows(IllegalArgumentException.class,
                () -> PeerInfo.fromJson(new io.vertx.core.json.JsonObject().put("name", "x")));
    }
}
