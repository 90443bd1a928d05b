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

import dev.mars.conclave.coordination.broker.BrokerClient;
import dev.mars.conclave.coordination.broker.BrokerSubscription;
import dev.mars.conclave.coordination.broker.PullSubscription;
import dev.mars.conclave.coordination.registry.AgentUpdate;
import dev.mars.conclave.coordination.registry.LivenessState;
import dev.mars.conclave.coordination.registry.PeerInfo;
import dev.mars.conclave.coordination.registry.PeerRegistration;
import dev.mars.conclave.coordination.registry.PeerRegistry;
import dev.mars.conclave.coordination.topology.ConsumerSpec;
import dev.mars.conclave.coordination.topology.CoordinationTopology;
import dev.mars.conclave.coordination.topology.StreamSpec;
import dev.mars.conclave.coordination.topology.Subjects;
import dev.mars.conclave.core.exceptions.ConnectionException;
import dev.mars.conclave.core.exceptions.DeliveryException;
import dev.mars.conclave.event.EventDispatcher;
import dev.mars.conclave.event.EventPublisher;
import dev.mars.conclave.event.EventType;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Owns the broker connection and everything built on it: stream provisioning, the peer
 * registry, point-to-point messaging, task routing and system events.
 *
 * <p>The service is bound to the Vert.x context that creates it. Broker calls run on worker
 * threads through {@link Context#executeBlocking}; discovery messages hop back onto the
 * owning context before they touch the registry, so the registry has a single writer.</p>
 *
 * <p>Registration, heartbeat and unregistration are published on the discovery subjects and
 * applied when the subscription delivers them, including to the publishing node itself.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class CoordinationService {

    private static final Logger logger = LoggerFactory.getLogger(CoordinationService.class);

    private final Vertx vertx;
    private final Context context;
    private final BrokerClient client;
    private final CoordinationConfig config;
    private final Clock clock;
    private final PeerRegistry registry;
    private final EventDispatcher events;
    private final ConnectionRetry retry;

    private final List<BrokerSubscription> discoverySubscriptions = new CopyOnWriteArrayList<>();
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final List<Handler<AgentUpdate>> updateListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong subscriptionIds = new AtomicLong();

    private volatile boolean connected;
    private Future<Void> connecting;
    private Future<Void> disconnecting;

    public CoordinationService(Vertx vertx, BrokerClient client, CoordinationConfig config) {
        this(vertx, client, config, Clock.systemUTC(), null);
    }

    public CoordinationService(Vertx vertx, BrokerClient client, CoordinationConfig config,
                               Clock clock, EventDispatcher events) {
        this.vertx = vertx;
        this.context = vertx.getOrCreateContext();
        this.client = client;
        this.config = config;
        this.clock = clock;
        this.events = events;
        this.registry = new PeerRegistry(clock, config.getLivenessWindow());
        this.retry = new ConnectionRetry(vertx, config.getConnectAttempts(), config.getRetryDelay());
        logger.info("CoordinationService initialized: {}", config);
    }

    // ==================== Lifecycle ====================

    /**
     * Connects, provisions streams and consumers, and subscribes to the discovery subjects,
     * retrying the whole sequence up to the configured number of attempts. While a connection is
     * being established or held, repeated calls return the same future.
     *
     * @return fails with {@link ConnectionException} once the attempts are exhausted
     */
    public synchronized Future<Void> connect() {
        if (connecting != null) {
            return connecting;
        }
        Future<Void> previous = disconnecting == null
                ? Future.succeededFuture()
                : disconnecting.recover(e -> Future.succeededFuture());
        disconnecting = null;
        logger.info("Connecting to broker at {}", config.getNatsUrl());
        Future<Void> attempt = previous
                .compose(v -> retry.execute("Broker connection", this::connectOnce))
                .onSuccess(v -> {
                    connected = true;
                    logger.info("Coordination service connected");
                });
        connecting = attempt;
        attempt.onFailure(e -> clearConnecting(attempt));
        return attempt;
    }

    private synchronized void clearConnecting(Future<Void> attempt) {
        if (connecting == attempt) {
            connecting = null;
        }
    }

    private Future<Void> connectOnce() {
        return context.executeBlocking(() -> {
            try {
                closeDiscoverySubscriptions();
                client.close();
                client.connect();
                for (StreamSpec stream : CoordinationTopology.STREAMS) {
                    client.ensureStream(stream);
                }
                for (ConsumerSpec consumer : CoordinationTopology.CONSUMERS) {
                    client.ensureConsumer(consumer);
                }
                discoverySubscriptions.add(client.subscribe(Subjects.AGENTS_REGISTER,
                        msg -> onContext(msg.data(), this::onRegister)));
                discoverySubscriptions.add(client.subscribe(Subjects.AGENTS_HEARTBEAT,
                        msg -> onContext(msg.data(), this::onHeartbeat)));
                discoverySubscriptions.add(client.subscribe(Subjects.AGENTS_UNREGISTER,
                        msg -> onContext(msg.data(), this::onUnregister)));
                logger.info("Provisioned {} streams and {} consumers",
                        CoordinationTopology.STREAMS.size(), CoordinationTopology.CONSUMERS.size());
                return null;
            } catch (IOException e) {
                closeDiscoverySubscriptions();
                client.close();
                throw new ConnectionException("Cannot connect to " + config.getNatsUrl() + ": " + e.getMessage(), e);
            }
        }, false);
    }

    private void closeDiscoverySubscriptions() {
        for (BrokerSubscription subscription : discoverySubscriptions) {
            subscription.unsubscribe();
        }
        discoverySubscriptions.clear();
    }

    /**
     * Stops every pull loop, unsubscribes, drains and closes the connection. Idempotent until the
     * next {@link #connect()}.
     */
    public synchronized Future<Void> disconnect() {
        if (disconnecting != null) {
            return disconnecting;
        }
        logger.info("Disconnecting coordination service");
        Future<Void> pending = connecting == null
                ? Future.succeededFuture()
                : connecting.recover(e -> Future.succeededFuture());
        connecting = null;
        disconnecting = pending
                .compose(v -> {
                    connected = false;
                    List<Future<Void>> stops = subscriptions.values().stream()
                            .map(s -> s.loop().stop())
                            .collect(Collectors.toList());
                    return Future.all(stops);
                })
                .compose(v -> context.executeBlocking(() -> {
                    for (Subscription subscription : subscriptions.values()) {
                        subscription.loop().getSubscription().unsubscribe();
                    }
                    subscriptions.clear();
                    closeDiscoverySubscriptions();
                    try {
                        client.drain(config.getDrainTimeout());
                    } catch (IOException e) {
                        logger.warn("Drain did not complete cleanly: {}", e.getMessage());
                    } finally {
                        client.close();
                    }
                    return (Void) null;
                }, false))
                .onSuccess(v -> logger.info("Coordination service disconnected"));
        return disconnecting;
    }

    // ==================== Discovery ====================

    public Future<Void> registerAgent(PeerInfo info) {
        if (!Subjects.isValidAgentId(info.getAgentId())) {
            return invalidAgentId(info.getAgentId());
        }
        return publish(Subjects.AGENTS_REGISTER, info.toJson())
                .onSuccess(v -> logger.info("Agent registration published: {}", info.getAgentId()));
    }

    public Future<Void> sendHeartbeat(String agentId) {
        if (!Subjects.isValidAgentId(agentId)) {
            return invalidAgentId(agentId);
        }
        return publish(Subjects.AGENTS_HEARTBEAT, new JsonObject()
                .put("agent_id", agentId)
                .put("timestamp", now()));
    }

    public Future<Void> unregisterAgent(String agentId) {
        if (!Subjects.isValidAgentId(agentId)) {
            return invalidAgentId(agentId);
        }
        return publish(Subjects.AGENTS_UNREGISTER, new JsonObject().put("agent_id", agentId))
                .onSuccess(v -> logger.info("Agent unregistration published: {}", agentId));
    }

    public void addAgentUpdateListener(Handler<AgentUpdate> listener) {
        updateListeners.add(listener);
    }

    private void onRegister(JsonObject body) {
        PeerInfo info;
        try {
            info = PeerInfo.fromJson(body);
        } catch (IllegalArgumentException | ClassCastException e) {
            logger.warn("Ignoring malformed agent registration: {}", e.getMessage());
            return;
        }
        if (!Subjects.isValidAgentId(info.getAgentId())) {
            logger.warn("Ignoring registration with invalid agent id '{}'", info.getAgentId());
            return;
        }
        registry.register(info);
        broadcastUpdate(new AgentUpdate(info.getAgentId(), AgentUpdate.REGISTERED, clock.instant(), info));
        raise(EventType.AGENT_REGISTERED, info.getAgentId(), info.toJson());
    }

    private void onHeartbeat(JsonObject body) {
        registry.heartbeat(body.getString("agent_id"));
    }

    private void onUnregister(JsonObject body) {
        String agentId = body.getString("agent_id");
        registry.unregister(agentId).ifPresent(removed -> {
            broadcastUpdate(new AgentUpdate(agentId, AgentUpdate.UNREGISTERED, clock.instant(), removed.getInfo()));
            raise(EventType.AGENT_UNREGISTERED, agentId, new JsonObject().put("agent_id", agentId));
        });
    }

    private void broadcastUpdate(AgentUpdate update) {
        for (Handler<AgentUpdate> listener : updateListeners) {
            try {
                listener.handle(update);
            } catch (RuntimeException e) {
                logger.error("Agent update listener failed for {}", update, e);
            }
        }
        publish(Subjects.AGENTS_UPDATES, update.toJson())
                .onSuccess(v -> logger.debug("Agent update broadcast: {} - {}",
                        update.getAgentId(), update.getEventType()))
                .onFailure(e -> logger.error("Failed to broadcast agent update {}: {}", update, e.getMessage()));
    }

    private void raise(EventType type, String source, JsonObject data) {
        if (events != null) {
            events.dispatch(events.create(type, source, data.getMap(), null));
        }
    }

    private void onContext(byte[] data, Consumer<JsonObject> handler) {
        context.runOnContext(v -> {
            JsonObject body;
            try {
                body = new JsonObject(Buffer.buffer(data));
            } catch (DecodeException e) {
                logger.warn("Ignoring unparseable discovery message: {}", e.getMessage());
                return;
            }
            handler.accept(body);
        });
    }

    // ==================== Messaging ====================

    /**
     * Durably publishes a message on {@code messages.<sender>.<receiver>}.
     *
     * @return fails with {@link DeliveryException} if the broker did not store the message, or with
     *         {@link IllegalArgumentException} if either id is not a valid agent id
     */
    public Future<Void> sendMessage(String senderId, String receiverId, JsonObject message) {
        if (!Subjects.isValidAgentId(senderId)) {
            return invalidAgentId(senderId);
        }
        if (!Subjects.isValidAgentId(receiverId)) {
            return invalidAgentId(receiverId);
        }
        String subject = Subjects.message(senderId, receiverId);
        JsonObject payload = new JsonObject()
                .put("sender_id", senderId)
                .put("receiver_id", receiverId)
                .put("message", message)
                .put("timestamp", now());
        return publishDurable(subject, payload)
                .onSuccess(v -> logger.debug("Message sent from {} to {}", senderId, receiverId));
    }

    /**
     * Routes a task to each named agent, or to the shared work queue when no targets are given.
     */
    public Future<Void> routeTask(JsonObject task, List<String> targetAgents) {
        boolean targeted = targetAgents != null && !targetAgents.isEmpty();
        if (targeted) {
            for (String agentId : targetAgents) {
                if (!Subjects.isValidAgentId(agentId)) {
                    return invalidAgentId(agentId);
                }
            }
        }
        List<String> subjects = targeted
                ? targetAgents.stream().map(Subjects::task).collect(Collectors.toList())
                : List.of(Subjects.TASKS_AVAILABLE);
        JsonObject payload = new JsonObject()
                .put("task", task)
                .put("timestamp", now())
                .put("target_agents", targeted ? new JsonArray(new ArrayList<>(targetAgents)) : null);
        Future<Void> chain = requireConnected();
        for (String subject : subjects) {
            chain = chain.compose(v -> publishDurable(subject, payload));
        }
        return chain.onSuccess(v -> logger.debug("Task {} routed to {}", task.getValue("task_id"), subjects));
    }

    /**
     * Fire-and-forget publish on {@code events.<type>}. Failures are logged, not retried.
     */
    public Future<Void> publishEvent(String eventType, JsonObject data) {
        String subject;
        try {
            subject = Subjects.event(eventType);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        JsonObject payload = new JsonObject()
                .put("event_type", eventType)
                .put("data", data)
                .put("timestamp", now());
        return publish(subject, payload)
                .onSuccess(v -> logger.debug("Event published: {}", eventType))
                .onFailure(e -> logger.error("Failed to publish event {}: {}", eventType, e.getMessage()));
    }

    /**
     * Adapts this service into the publisher hook of an {@link EventDispatcher}.
     */
    public EventPublisher eventPublisher() {
        return (type, payload) -> publishEvent(type, new JsonObject(payload));
    }

    // ==================== Subscriptions ====================

    /**
     * Pulls messages addressed to {@code agentId} from its durable consumer.
     */
    public Future<Subscription> subscribeToMessages(String agentId, DeliveryCallback callback) {
        if (!Subjects.isValidAgentId(agentId)) {
            return invalidAgentId(agentId);
        }
        return openPull(CoordinationTopology.messageConsumer(agentId, config.getMessageMaxDeliver()), callback);
    }

    /**
     * Pulls tasks routed to {@code agentId} by name.
     */
    public Future<Subscription> subscribeToTasks(String agentId, DeliveryCallback callback) {
        if (!Subjects.isValidAgentId(agentId)) {
            return invalidAgentId(agentId);
        }
        return openPull(CoordinationTopology.taskConsumer(agentId, config.getTaskMaxDeliver()), callback);
    }

    /**
     * Joins the competing consumers of the shared work queue.
     */
    public Future<Subscription> subscribeToWorkQueue(DeliveryCallback callback) {
        return openPull(CoordinationTopology.WORK_QUEUE_CONSUMER, callback);
    }

    private Future<Subscription> openPull(ConsumerSpec spec, DeliveryCallback callback) {
        return requireConnected()
                .compose(v -> context.executeBlocking(() -> client.pullSubscribe(spec), false))
                .map(pull -> {
                    String id = spec.getDurableName() + "#" + subscriptionIds.incrementAndGet();
                    PullConsumerLoop loop = new PullConsumerLoop(context, pull, spec, callback, config);
                    Subscription subscription = new Subscription(id, loop, this);
                    subscriptions.put(id, subscription);
                    loop.start();
                    logger.info("Subscribed to consumer {} ({})", spec.getDurableName(), spec.getFilterSubject());
                    return subscription;
                });
    }

    Future<Void> cancel(Subscription subscription) {
        if (subscriptions.remove(subscription.getId()) == null) {
            return Future.succeededFuture();
        }
        PullSubscription pull = subscription.loop().getSubscription();
        return subscription.loop().stop()
                .compose(v -> context.executeBlocking(() -> {
                    pull.unsubscribe();
                    return (Void) null;
                }, false))
                .onSuccess(v -> logger.info("Subscription {} cancelled", subscription.getId()));
    }

    // ==================== Queries ====================

    /**
     * Pure read of the service state.
     */
    public HealthSnapshot healthCheck() {
        return new HealthSnapshot(connected && client.isConnected(), registry.size(), registry.onlineCount(),
                subscriptions.size());
    }

    public Optional<PeerInfo> getAgentInfo(String agentId) {
        return registry.get(agentId).map(PeerRegistration::getInfo);
    }

    public List<PeerRegistration> getOnlineAgents() {
        return registry.online();
    }

    public LivenessState getLivenessState(String agentId) {
        return registry.state(agentId);
    }

    public boolean isConnected() {
        return connected;
    }

    public CoordinationConfig getConfig() {
        return config;
    }

    public Vertx getVertx() {
        return vertx;
    }

    // ==================== Private Helpers ====================

    private Future<Void> publish(String subject, JsonObject payload) {
        byte[] data = payload.toBuffer().getBytes();
        return requireConnected().compose(v -> context.executeBlocking(() -> {
            client.publish(subject, data);
            return (Void) null;
        }, false));
    }

    private Future<Void> publishDurable(String subject, JsonObject payload) {
        byte[] data = payload.toBuffer().getBytes();
        return requireConnected().compose(v -> context.<Void>executeBlocking(() -> {
            try {
                client.publishDurable(subject, data);
                return null;
            } catch (IOException e) {
                throw new DeliveryException(subject, "Publish was not stored", e);
            }
        }, false));
    }

    private static <T> Future<T> invalidAgentId(String agentId) {
        return Future.failedFuture(new IllegalArgumentException("Invalid agent id: '" + agentId + "'"));
    }

    private Future<Void> requireConnected() {
        if (!connected) {
            return Future.failedFuture(new ConnectionException("Coordination service is not connected"));
        }
        return Future.succeededFuture();
    }

    private double now() {
        return clock.millis() / 1000.0;
    }
}
