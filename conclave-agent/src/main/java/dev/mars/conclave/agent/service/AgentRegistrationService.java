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
import dev.mars.conclave.coordination.registry.PeerInfo;
import dev.mars.conclave.identity.IdentityStore;
import dev.mars.conclave.identity.KeyPurpose;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Announces this agent on the discovery subjects, together with the public halves of its
 * signing and exchange keys, and withdraws it on shutdown.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class AgentRegistrationService {

    private static final Logger logger = LoggerFactory.getLogger(AgentRegistrationService.class);

    private final CoordinationService coordination;
    private final AgentConfiguration config;
    private final IdentityStore identityStore;

    private volatile boolean registered = false;

    public AgentRegistrationService(CoordinationService coordination, AgentConfiguration config,
                                    IdentityStore identityStore) {
        this.coordination = coordination;
        this.config = config;
        this.identityStore = identityStore;
    }

    /**
     * Publishes the registration.
     *
     * @return Future that completes with true if the registration was published, false otherwise
     */
    public Future<Boolean> register() {
        logger.info("Registering agent {} ({}) with capabilities {}",
                config.getAgentId(), config.getRole(), config.getCapabilities());

        PeerInfo info;
        try {
            info = createPeerInfo();
        } catch (IllegalStateException e) {
            logger.error("Cannot register agent {}: {}", config.getAgentId(), e.getMessage());
            return Future.succeededFuture(false);
        }

        return coordination.registerAgent(info)
            .map(v -> {
                registered = true;
                logger.info("Agent {} registered successfully", config.getAgentId());
                return true;
            })
            .recover(err -> {
                logger.error("Error registering agent {}: {}", config.getAgentId(), err.getMessage());
                return Future.succeededFuture(false);
            });
    }

    /**
     * Withdraws the registration. A no-op when the agent never registered.
     */
    public Future<Boolean> deregister() {
        if (!registered) {
            return Future.succeededFuture(true);
        }

        logger.info("Deregistering agent {}", config.getAgentId());
        return coordination.unregisterAgent(config.getAgentId())
            .map(v -> {
                registered = false;
                logger.info("Agent {} deregistered successfully", config.getAgentId());
                return true;
            })
            .recover(err -> {
                logger.error("Error deregistering agent {}: {}", config.getAgentId(), err.getMessage());
                return Future.succeededFuture(false);
            });
    }

    PeerInfo createPeerInfo() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("version", config.getVersion());
        metadata.put("hostname", hostname());
        return PeerInfo.builder(config.getAgentId())
                .name(config.getName())
                .role(config.getRole())
                .capabilities(config.getCapabilities())
                .signingPublicKey(identityStore.publicKeyHex(KeyPurpose.SIGNING))
                .exchangePublicKey(identityStore.publicKeyHex(KeyPurpose.EXCHANGE))
                .metadata(metadata)
                .build();
    }

    public boolean isRegistered() {
        return registered;
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown";
        }
    }
}
