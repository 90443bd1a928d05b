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
import dev.mars.conclave.coordination.Delivery;
import dev.mars.conclave.coordination.Subscription;
import dev.mars.conclave.core.exceptions.DeliveryException;
import dev.mars.conclave.event.EventDispatcher;
import dev.mars.conclave.event.EventType;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Takes tasks addressed to this agent, and optionally tasks from the shared work queue, and
 * hands them to a {@link TaskExecutor}.
 *
 * <p>Each subscription runs one task at a time, so a node executes at most two tasks at once:
 * one addressed to it and one from the work queue. The delivery is acknowledged only when the
 * executor's future succeeds. A failed task goes back to the broker for redelivery, possibly to
 * another agent on the work queue.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class TaskIntakeService {

    private static final Logger logger = LoggerFactory.getLogger(TaskIntakeService.class);

    private final CoordinationService coordination;
    private final AgentConfiguration config;
    private final TaskExecutor executor;
    private final EventDispatcher events;

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public TaskIntakeService(CoordinationService coordination, AgentConfiguration config,
                             TaskExecutor executor, EventDispatcher events) {
        this.coordination = coordination;
        this.config = config;
        this.executor = executor;
        this.events = events;
    }

    public Future<Void> start() {
        Future<Void> chain = coordination.subscribeToTasks(config.getAgentId(), this::onTask)
                .map(subscriptions::add)
                .mapEmpty();
        if (config.isWorkQueueEnabled()) {
            chain = chain.compose(v -> coordination.subscribeToWorkQueue(this::onTask))
                    .map(subscriptions::add)
                    .mapEmpty();
        }
        return chain.onSuccess(v -> logger.info("Task intake started for agent {} (work queue: {})",
                config.getAgentId(), config.isWorkQueueEnabled()));
    }

    public Future<Void> stop() {
        List<Future<Void>> cancels = new ArrayList<>();
        for (Subscription subscription : subscriptions) {
            cancels.add(subscription.cancel());
        }
        subscriptions.clear();
        return Future.all(cancels).mapEmpty();
    }

    Future<Void> onTask(Delivery delivery) {
        JsonObject task = delivery.getBody().getJsonObject("task");
        if (task == null) {
            logger.warn("Dropping task delivery without a task body on {}", delivery.getSubject());
            return Future.succeededFuture();
        }
        String taskId = task.getString("task_id", "unknown");

        active.incrementAndGet();
        logger.info("Executing task {} from {} (delivery {})", taskId, delivery.getSubject(),
                delivery.getDeliveryCount());
        raise(EventType.TASK_ASSIGNED, taskId, null);

        Future<JsonObject> execution;
        try {
            execution = executor.execute(task);
        } catch (RuntimeException e) {
            execution = Future.failedFuture(e);
        }
        return execution
                .onComplete(ar -> active.decrementAndGet())
                .onSuccess(result -> {
                    completed.incrementAndGet();
                    logger.info("Task {} completed", taskId);
                    raise(EventType.TASK_COMPLETED, taskId, result);
                })
                .recover(err -> {
                    failed.incrementAndGet();
                    logger.warn("Task {} failed: {}", taskId, err.getMessage());
                    raise(EventType.TASK_FAILED, taskId, new JsonObject().put("error", String.valueOf(err.getMessage())));
                    return Future.failedFuture(new DeliveryException(delivery.getSubject(),
                            "Task " + taskId + " failed", err));
                })
                .mapEmpty();
    }

    private void raise(EventType type, String taskId, JsonObject result) {
        if (events == null) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task_id", taskId);
        data.put("agent_id", config.getAgentId());
        if (result != null) {
            data.put("result", result.getMap());
        }
        events.publish(type, data, taskId);
    }

    public int getActiveCount() {
        return active.get();
    }

    public long getCompletedCount() {
        return completed.get();
    }

    public long getFailedCount() {
        return failed.get();
    }
}
