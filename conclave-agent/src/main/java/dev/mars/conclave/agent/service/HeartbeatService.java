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
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps this agent online in every peer registry by publishing a heartbeat on a Vert.x
 * periodic timer.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class HeartbeatService {

    private static final Logger logger = LoggerFactory.getLogger(HeartbeatService.class);

    private final Vertx vertx;
    private final CoordinationService coordination;
    private final AgentConfiguration config;
    private final AgentRegistrationService registrationService;
    private final AtomicLong sequenceNumber = new AtomicLong(0);

    private long timerId = -1;

    public HeartbeatService(Vertx vertx, CoordinationService coordination, AgentConfiguration config,
                            AgentRegistrationService registrationService) {
        this.vertx = vertx;
        this.coordination = coordination;
        this.config = config;
        this.registrationService = registrationService;
    }

    public synchronized void start() {
        if (timerId != -1) {
            return;
        }
        timerId = vertx.setPeriodic(config.getHeartbeatInterval().toMillis(), id -> sendHeartbeat());
        logger.info("Heartbeat service started (interval: {}ms) [Vert.x timer ID: {}]",
                config.getHeartbeatInterval().toMillis(), timerId);
    }

    /**
     * Sends one heartbeat.
     *
     * @return Future that completes with true if the heartbeat was published, false otherwise
     */
    public Future<Boolean> sendHeartbeat() {
        if (!registrationService.isRegistered()) {
            logger.debug("Agent not registered, skipping heartbeat");
            return Future.succeededFuture(false);
        }

        return coordination.sendHeartbeat(config.getAgentId())
            .map(v -> {
                long sequence = sequenceNumber.incrementAndGet();
                logger.debug("Heartbeat {} sent for agent {}", sequence, config.getAgentId());
                return true;
            })
            .recover(err -> {
                logger.error("Error sending heartbeat for agent {}: {}", config.getAgentId(), err.getMessage());
                return Future.succeededFuture(false);
            });
    }

    public synchronized void stop() {
        if (timerId == -1) {
            return;
        }
        boolean cancelled = vertx.cancelTimer(timerId);
        logger.info("Heartbeat timer cancelled: {} [ID: {}]", cancelled, timerId);
        timerId = -1;
    }

    public synchronized boolean isRunning() {
        return timerId != -1;
    }

    public long getSentCount() {
        return sequenceNumber.get();
    }
}
