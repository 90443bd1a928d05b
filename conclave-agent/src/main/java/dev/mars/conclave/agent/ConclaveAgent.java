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

package dev.mars.conclave.agent;

import dev.mars.conclave.agent.config.AgentConfig;
import dev.mars.conclave.agent.config.AgentConfiguration;
import dev.mars.conclave.agent.service.AgentRegistrationService;
import dev.mars.conclave.agent.service.HeartbeatService;
import dev.mars.conclave.agent.service.SecureMessagingService;
import dev.mars.conclave.agent.service.TaskExecutor;
import dev.mars.conclave.agent.service.TaskIntakeService;
import dev.mars.conclave.coordination.CoordinationConfig;
import dev.mars.conclave.coordination.CoordinationService;
import dev.mars.conclave.coordination.broker.BrokerClient;
import dev.mars.conclave.coordination.broker.JetStreamBrokerClient;
import dev.mars.conclave.core.exceptions.ConnectionException;
import dev.mars.conclave.crypto.EncryptionChannel;
import dev.mars.conclave.event.EventDispatcher;
import dev.mars.conclave.event.EventType;
import dev.mars.conclave.identity.AgentIdentity;
import dev.mars.conclave.identity.IdentityStore;
import dev.mars.conclave.message.MessageHandler;
import dev.mars.conclave.message.MessageType;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main class for a Conclave agent node.
 *
 * <p>Start-up loads or generates the agent identity, connects to the broker, registers with both
 * public keys, and then runs heartbeats, secure messaging, task intake and periodic cleanup of the
 * message tables on Vert.x timers.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class ConclaveAgent {

    private static final Logger logger = LoggerFactory.getLogger(ConclaveAgent.class);

    private final Vertx vertx;
    private final AgentConfiguration config;
    private final IdentityStore identityStore;
    private final EventDispatcher events;
    private final MessageHandler messageHandler;
    private final CoordinationService coordination;
    private final AgentRegistrationService registrationService;
    private final HeartbeatService heartbeatService;
    private final SecureMessagingService messagingService;
    private final TaskIntakeService taskIntakeService;

    private long cleanupTimerId = -1;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean running = false;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private Future<Void> shutdownFuture;

    public ConclaveAgent(Vertx vertx, AgentConfiguration config, BrokerClient brokerClient, TaskExecutor taskExecutor) {
        this(vertx, config, config.toCoordinationConfig(), brokerClient, taskExecutor);
    }

    /**
     * Creates an agent with explicit coordination settings.
     *
     * @throws NullPointerException if any argument is null
     */
    public ConclaveAgent(Vertx vertx, AgentConfiguration config, CoordinationConfig coordinationConfig,
                         BrokerClient brokerClient, TaskExecutor taskExecutor) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.config = Objects.requireNonNull(config, "AgentConfiguration cannot be null");
        Objects.requireNonNull(coordinationConfig, "CoordinationConfig cannot be null");
        Objects.requireNonNull(brokerClient, "BrokerClient cannot be null");
        Objects.requireNonNull(taskExecutor, "TaskExecutor cannot be null");

        this.identityStore = new IdentityStore(config.getIdentityDirectory(), config.getAgentId());
        this.events = new EventDispatcher(config.getAgentId());
        this.messageHandler = new MessageHandler(config.getAgentId());
        this.coordination = new CoordinationService(vertx, brokerClient, coordinationConfig, Clock.systemUTC(), events);
        this.events.setPublisher(coordination.eventPublisher());

        this.registrationService = new AgentRegistrationService(coordination, config, identityStore);
        this.heartbeatService = new HeartbeatService(vertx, coordination, config, registrationService);
        this.messagingService = new SecureMessagingService(coordination, config,
                new EncryptionChannel(identityStore), messageHandler, events);
        this.taskIntakeService = new TaskIntakeService(coordination, config, taskExecutor, events);

        registerDefaultProcessors();
        logger.info("Conclave agent initialized: {}", config);
    }

    public static void main(String[] args) {
        logger.info("Starting Conclave Agent...");

        Vertx vertx = Vertx.vertx();

        try {
            AgentConfig.get().validate();
            AgentConfiguration config = AgentConfiguration.fromEnvironment();
            BrokerClient client = new JetStreamBrokerClient(config.getNatsUrl(),
                    "conclave-" + config.getAgentId(), config.getConnectTimeout());

            ConclaveAgent agent = new ConclaveAgent(vertx, config, client, ConclaveAgent::logTask);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received");
                try {
                    agent.shutdown().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
                } catch (Exception e) {
                    logger.error("Error during shutdown", e);
                }
                vertx.close().onComplete(ar -> {
                    if (ar.succeeded()) {
                        logger.info("Vert.x instance closed successfully");
                    } else {
                        logger.error("Error closing Vert.x instance", ar.cause());
                    }
                });
            }));

            agent.start().toCompletionStage().toCompletableFuture().get();

            agent.awaitShutdown();

        } catch (Exception e) {
            logger.error("Failed to start Conclave Agent", e);
            vertx.close();
            System.exit(1);
        }

        logger.info("Conclave Agent stopped");
    }

    /**
     * Brings the node up. Fails with {@link ConnectionException} when the broker cannot be reached.
     */
    public Future<Void> start() {
        if (closed.get()) {
            return Future.failedFuture(new IllegalStateException("Agent is closed, cannot start"));
        }

        logger.info("Starting Conclave Agent services...");
        running = true;

        return vertx.<AgentIdentity>executeBlocking(identityStore::loadOrGenerate, false)
            .onSuccess(identity -> logger.info("Identity ready: {}", identity))
            .compose(identity -> coordination.connect())
            .compose(v -> registrationService.register())
            .compose(registered -> registered
                    ? Future.<Void>succeededFuture()
                    : Future.<Void>failedFuture(new IllegalStateException("Failed to register agent " + config.getAgentId())))
            .compose(v -> {
                heartbeatService.start();
                return messagingService.start();
            })
            .compose(s -> taskIntakeService.start())
            .onSuccess(v -> {
                startCleanupTimer();
                events.publish(EventType.SYSTEM_READY, Map.of("agent_id", config.getAgentId()), null);
                logger.info("Conclave Agent {} started successfully", config.getAgentId());
            })
            .onFailure(e -> {
                running = false;
                logger.error("Conclave Agent {} failed to start: {}", config.getAgentId(), e.getMessage());
            });
    }

    /**
     * Stops timers and subscriptions, withdraws the registration and disconnects. Idempotent.
     */
    public synchronized Future<Void> shutdown() {
        if (closed.getAndSet(true)) {
            logger.info("Agent already closed, skipping shutdown");
            return shutdownFuture;
        }

        if (!running) {
            logger.info("Agent not running, performing cleanup only");
            shutdownFuture = coordination.disconnect().onComplete(ar -> shutdownLatch.countDown());
            return shutdownFuture;
        }

        logger.info("Shutting down Conclave Agent...");
        running = false;

        if (cleanupTimerId != -1) {
            boolean cancelled = vertx.cancelTimer(cleanupTimerId);
            logger.info("Cleanup timer cancelled: {} [ID: {}]", cancelled, cleanupTimerId);
            cleanupTimerId = -1;
        }
        heartbeatService.stop();
        events.publish(EventType.SYSTEM_SHUTDOWN, Map.of("agent_id", config.getAgentId()), null);

        shutdownFuture = Future.all(List.of(taskIntakeService.stop(), messagingService.stop()))
            .compose(v -> registrationService.deregister())
            .compose(v -> coordination.disconnect())
            .onSuccess(v -> logger.info("Conclave Agent shutdown complete"))
            .onFailure(e -> logger.error("Error during shutdown", e))
            .onComplete(ar -> shutdownLatch.countDown());
        return shutdownFuture;
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    private synchronized void startCleanupTimer() {
        cleanupTimerId = vertx.setPeriodic(config.getCleanupInterval().toMillis(), id -> {
            if (running) {
                int removed = messageHandler.clearOlderThan(config.getMessageRetention());
                logger.debug("Message cleanup removed {} entries", removed);
            }
        });
        logger.info("Message cleanup started (interval: {}ms, retention: {}ms) [Vert.x timer ID: {}]",
                config.getCleanupInterval().toMillis(), config.getMessageRetention().toMillis(), cleanupTimerId);
    }

    private void registerDefaultProcessors() {
        messageHandler.registerProcessor(MessageType.TEXT, message ->
                logger.info("Message from {}: {}", message.getSenderId(), message.getContent()));
        messageHandler.registerProcessor(MessageType.STATUS, message ->
                logger.info("Status from {}: {}", message.getSenderId(), message.getContent()));
        messageHandler.registerProcessor(MessageType.ERROR, message ->
                logger.warn("Error reported by {}: {}", message.getSenderId(), message.getContent()));
        messageHandler.registerProcessor(MessageType.HEARTBEAT, message ->
                logger.debug("Heartbeat message from {}", message.getSenderId()));
    }

    private static Future<JsonObject> logTask(JsonObject task) {
        logger.info("Task received: {}", task.encode());
        return Future.succeededFuture(new JsonObject().put("status", "completed"));
    }

    // ==================== Accessors ====================

    public boolean isRunning() {
        return running;
    }

    public AgentConfiguration getConfig() {
        return config;
    }

    public IdentityStore getIdentityStore() {
        return identityStore;
    }

    public EventDispatcher getEvents() {
        return events;
    }

    public MessageHandler getMessageHandler() {
        return messageHandler;
    }

    public CoordinationService getCoordination() {
        return coordination;
    }

    public AgentRegistrationService getRegistrationService() {
        return registrationService;
    }

    public SecureMessagingService getMessagingService() {
        return messagingService;
    }

    public TaskIntakeService getTaskIntakeService() {
        return taskIntakeService;
    }

    public HeartbeatService getHeartbeatService() {
        return heartbeatService;
    }
}
