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

import dev.mars.conclave.agent.config.AgentConfiguration;
import dev.mars.conclave.coordination.broker.InMemoryBroker;
import dev.mars.conclave.coordination.broker.InMemoryBrokerClient;
import dev.mars.conclave.coordination.registry.LivenessState;
import dev.mars.conclave.message.AgentMessage;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static dev.mars.conclave.agent.AgentTestSupport.WAIT;
import static dev.mars.conclave.agent.AgentTestSupport.result;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for ConclaveAgent with two agents sharing an in-memory broker.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 */
@ExtendWith(VertxExtension.class)
class ConclaveAgentTest {

    @TempDir
    Path root;

    private InMemoryBroker broker;
    private final List<ConclaveAgent> agents = new ArrayList<>();
    private final List<JsonObject> executed = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        broker = new InMemoryBroker();
    }

    @AfterEach
    void tearDown() throws Exception {
        for (ConclaveAgent agent : agents) {
            result(agent.shutdown());
        }
        agents.clear();
    }

    private ConclaveAgent agent(Vertx vertx, String agentId) {
        AgentConfiguration config = AgentTestSupport.configuration(agentId, root).build();
        ConclaveAgent agent = new ConclaveAgent(vertx, config, AgentTestSupport.coordinationConfig(config),
                new InMemoryBrokerClient(broker), task -> {
                    executed.add(task);
                    return Future.succeededFuture(new JsonObject().put("done", task.getString("task_id")));
                });
        agents.add(agent);
        return agent;
    }

    @Test
    @DisplayName("Should create identity files and register on start")
    void shouldStartAndRegister(Vertx vertx) throws Exception {
        ConclaveAgent alice = agent(vertx, "alice");

        result(alice.start());

        assertTrue(alice.isRunning());
        assertTrue(alice.getIdentityStore().hasIdentity());
        assertTrue(Files.isDirectory(root.resolve("alice")));
        assertTrue(alice.getRegistrationService().isRegistered());
        assertEquals(LivenessState.ONLINE, alice.getCoordination().getLivenessState("alice"));
    }

    @Test
    @DisplayName("Should reuse the stored identity across restarts")
    void shouldReuseIdentity(Vertx vertx) throws Exception {
        ConclaveAgent first = agent(vertx, "alice");
        result(first.start());
        byte[] signingKey = first.getIdentityStore().requireIdentity().signingPublicKey();
        result(first.shutdown());

        ConclaveAgent second = agent(vertx, "alice");
        result(second.start());

        assertArrayEquals(signingKey, second.getIdentityStore().requireIdentity().signingPublicKey());
    }

    @Test
    @DisplayName("Should see each other online and exchange protected messages")
    void shouldExchangeMessages(Vertx vertx) throws Exception {
        ConclaveAgent alice = agent(vertx, "alice");
        ConclaveAgent bob = agent(vertx, "bob");
        result(alice.start());
        result(bob.start());

        await().atMost(WAIT).until(() ->
                alice.getCoordination().getLivenessState("bob") == LivenessState.ONLINE
                        && bob.getCoordination().getLivenessState("alice") == LivenessState.ONLINE);

        AgentMessage sent = result(alice.getMessagingService().send("bob", "hello bob"));

        assertTrue(sent.isEncrypted());
        assertNotNull(sent.getSignature());
        await().atMost(WAIT).until(() -> bob.getMessageHandler().hasReceived(sent.getMessageId()));
        assertEquals("hello bob", bob.getMessageHandler().getMessageById(sent.getMessageId()).getContent());
    }

    @Test
    @DisplayName("Should execute tasks routed to an agent")
    void shouldExecuteRoutedTask(Vertx vertx) throws Exception {
        ConclaveAgent alice = agent(vertx, "alice");
        ConclaveAgent bob = agent(vertx, "bob");
        result(alice.start());
        result(bob.start());

        result(alice.getCoordination().routeTask(new JsonObject().put("task_id", "t-1"), List.of("bob")));

        await().atMost(WAIT).until(() -> bob.getTaskIntakeService().getCompletedCount() == 1);
        assertEquals(1, executed.size());
        assertEquals("t-1", executed.get(0).getString("task_id"));
    }

    @Test
    @DisplayName("Should shut down idempotently and withdraw the registration")
    void shouldShutDownIdempotently(Vertx vertx) throws Exception {
        ConclaveAgent alice = agent(vertx, "alice");
        ConclaveAgent bob = agent(vertx, "bob");
        result(alice.start());
        result(bob.start());
        await().atMost(WAIT).until(() -> alice.getCoordination().getLivenessState("bob") == LivenessState.ONLINE);

        Future<Void> first = bob.shutdown();
        Future<Void> second = bob.shutdown();
        result(first);

        assertSame(first, second);
        assertFalse(bob.isRunning());
        assertFalse(bob.getCoordination().isConnected());
        await().atMost(WAIT).until(() -> alice.getCoordination().getLivenessState("bob") == LivenessState.UNKNOWN);
    }

    @Test
    @DisplayName("Should refuse to start after shutdown")
    void shouldRefuseRestartAfterShutdown(Vertx vertx) throws Exception {
        ConclaveAgent alice = agent(vertx, "alice");
        result(alice.shutdown());

        Exception e = assertThrows(Exception.class, () -> result(alice.start()));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
