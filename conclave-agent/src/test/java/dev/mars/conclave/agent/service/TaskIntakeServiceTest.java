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

import dev.mars.conclave.agent.AgentTestSupport;
import dev.mars.conclave.coordination.broker.InMemoryBroker;
import dev.mars.conclave.event.EventType;
import dev.mars.conclave.event.SystemEvent;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static dev.mars.conclave.agent.AgentTestSupport.WAIT;
import static dev.mars.conclave.agent.AgentTestSupport.result;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TaskIntakeService.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 */
@ExtendWith(VertxExtension.class)
class TaskIntakeServiceTest {

    @TempDir
    Path root;

    private InMemoryBroker broker;
    private final List<TestNode> nodes = new ArrayList<>();

    @BeforeEach
    void setUp() {
        broker = new InMemoryBroker();
    }

    @AfterEach
    void tearDown() throws Exception {
        for (TestNode node : nodes) {
            node.close();
        }
        nodes.clear();
    }

    private TestNode node(Vertx vertx, String agentId, boolean workQueue) throws Exception {
        TestNode node = TestNode.connected(vertx, broker, AgentTestSupport.configuration(agentId, root)
                .workQueueEnabled(workQueue)
                .build());
        nodes.add(node);
        return node;
    }

    private static JsonObject task(String id) {
        return new JsonObject().put("task_id", id).put("action", "index");
    }

    @Test
    @DisplayName("Should execute a task routed by name and record completion")
    void shouldExecuteTargetedTask(Vertx vertx) throws Exception {
        TestNode worker = node(vertx, "worker", false);
        List<String> executed = new CopyOnWriteArrayList<>();
        TaskIntakeService intake = new TaskIntakeService(worker.coordination, worker.config, t -> {
            executed.add(t.getString("task_id"));
            return Future.succeededFuture(new JsonObject().put("indexed", 12));
        }, worker.events);
        result(intake.start());

        result(worker.coordination.routeTask(task("t-1"), List.of("worker")));

        await().atMost(WAIT).until(() -> intake.getCompletedCount() == 1);
        assertEquals(List.of("t-1"), executed);
        assertEquals(0, intake.getActiveCount());
        SystemEvent completed = worker.events.getHistory(EventType.TASK_COMPLETED, 10).get(0);
        assertEquals("t-1", completed.getCorrelationId());
        assertEquals(1, worker.events.count(EventType.TASK_ASSIGNED));
        await().atMost(WAIT).until(() -> broker.storedCount("SYSTEM_EVENTS") >= 2);
    }

    @Test
    @DisplayName("Should retry a failed task and succeed on redelivery")
    void shouldRetryFailedTask(Vertx vertx) throws Exception {
        TestNode worker = node(vertx, "worker", false);
        AtomicInteger attempts = new AtomicInteger();
        TaskIntakeService intake = new TaskIntakeService(worker.coordination, worker.config, t ->
                attempts.incrementAndGet() == 1
                        ? Future.failedFuture(new IllegalStateException("disk full"))
                        : Future.succeededFuture(new JsonObject()), worker.events);
        result(intake.start());

        result(worker.coordination.routeTask(task("t-2"), List.of("worker")));

        await().atMost(WAIT).until(() -> intake.getCompletedCount() == 1);
        assertEquals(2, attempts.get());
        assertEquals(1, intake.getFailedCount());
        assertEquals(1, worker.events.count(EventType.TASK_FAILED));
    }

    @Test
    @DisplayName("Should treat an executor that throws as a failed task")
    void shouldContainThrowingExecutor(Vertx vertx) throws Exception {
        TestNode worker = node(vertx, "worker", false);
        TaskIntakeService intake = new TaskIntakeService(worker.coordination, worker.config, t -> {
            throw new IllegalArgumentException("bad task");
        }, null);
        result(intake.start());

        result(worker.coordination.routeTask(task("t-3"), List.of("worker")));

        await().atMost(WAIT).until(() -> intake.getFailedCount() == worker.config.getTaskMaxDeliver());
        assertEquals(0, intake.getActiveCount());
    }

    @Test
    @DisplayName("Should hand a work-queue task to exactly one agent")
    void shouldShareWorkQueue(Vertx vertx) throws Exception {
        List<String> executedBy = new CopyOnWriteArrayList<>();
        List<TaskIntakeService> intakes = new ArrayList<>();
        for (String id : List.of("w1", "w2", "w3")) {
            TestNode worker = node(vertx, id, true);
            TaskIntakeService intake = new TaskIntakeService(worker.coordination, worker.config, t -> {
                executedBy.add(id);
                return Future.succeededFuture(new JsonObject());
            }, worker.events);
            result(intake.start());
            intakes.add(intake);
        }

        result(nodes.get(0).coordination.routeTask(task("t-4"), null));

        await().atMost(WAIT).until(() -> executedBy.size() == 1);
        Thread.sleep(300);
        assertEquals(1, executedBy.size());
        assertEquals(1, intakes.stream().mapToLong(TaskIntakeService::getCompletedCount).sum());
    }

    @Test
    @DisplayName("Should hold the next task until the current one settles")
    void shouldRunTasksOneAtATime(Vertx vertx) throws Exception {
        TestNode worker = node(vertx, "worker", false);
        Promise<JsonObject> blocker = Promise.promise();
        List<String> started = new CopyOnWriteArrayList<>();
        TaskIntakeService intake = new TaskIntakeService(worker.coordination, worker.config, t -> {
            started.add(t.getString("task_id"));
            return t.getString("task_id").equals("slow") ? blocker.future() : Future.succeededFuture(new JsonObject());
        }, worker.events);
        result(intake.start());

        result(worker.coordination.routeTask(task("slow"), List.of("worker")));
        result(worker.coordination.routeTask(task("fast"), List.of("worker")));
        await().atMost(WAIT).until(() -> intake.getActiveCount() == 1);

        Thread.sleep(200);
        assertEquals(List.of("slow"), started);
        vertx.runOnContext(v -> blocker.complete(new JsonObject()));
        await().atMost(WAIT).until(() -> intake.getCompletedCount() == 2);
        assertEquals(List.of("slow", "fast"), started);
        assertEquals(0, intake.getActiveCount());
    }
}
