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

package dev.mars.conclave.coordination.topology;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for subject construction, token validation and wildcard matching.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
class SubjectsTest {

    @Test
    @DisplayName("Should build the documented subject layout")
    void shouldBuildSubjects() {
        assertEquals("messages.alice.bob", Subjects.message("alice", "bob"));
        assertEquals("messages.*.bob", Subjects.inbox("bob"));
        assertEquals("tasks.worker-1", Subjects.task("worker-1"));
        assertEquals("events.task_completed", Subjects.event("task_completed"));
        assertEquals("events.agent.joined", Subjects.event("agent.joined"));
    }

    @ParameterizedTest(name = "''{0}'' is not a valid agent id")
    @ValueSource(strings = {"", "a.b", "a*", "a>", "a b", "available"})
    @DisplayName("Should reject agent ids that would break the subject layout")
    void shouldRejectInvalidAgentIds(String agentId) {
        assertFalse(Subjects.isValidAgentId(agentId));
        assertThrows(IllegalArgumentException.class, () -> Subjects.task(agentId));
    }

    @Test
    @DisplayName("Should reject event types with wildcards or empty tokens")
    void shouldRejectInvalidEventTypes() {
        assertThrows(IllegalArgumentException.class, () -> Subjects.event("a.*"));
        assertThrows(IllegalArgumentException.class, () -> Subjects.event("a..b"));
        assertThrows(IllegalArgumentException.class, () -> Subjects.event(""));
    }

    @ParameterizedTest(name = "{0} vs {1} -> {2}")
    @CsvSource({
            "agents.>, agents.register, true",
            "agents.>, agents.a.b, true",
            "agents.>, agents, false",
            "messages.*.bob, messages.alice.bob, true",
            "messages.*.bob, messages.alice.carol, false",
            "messages.*.bob, messages.bob, false",
            "tasks.available, tasks.available, true",
            "tasks.available, tasks.worker, false",
            "tasks.*, tasks.available, true"
    })
    @DisplayName("Should match subjects against wildcard patterns")
    void shouldMatchWildcards(String pattern, String subject, boolean expected) {
        assertEquals(expected, Subjects.matches(pattern, subject));
    }

    @Test
    @DisplayName("Should map every subject to its stream")
    void shouldMapSubjectsToStreams() {
        assertEquals("AGENT_DISCOVERY", CoordinationTopology.streamFor("agents.updates").orElseThrow().getName());
        assertEquals("AGENT_MESSAGES", CoordinationTopology.streamFor("messages.a.b").orElseThrow().getName());
        assertEquals("TASK_ROUTING", CoordinationTopology.streamFor("tasks.available").orElseThrow().getName());
        assertEquals("SYSTEM_EVENTS", CoordinationTopology.streamFor("events.system_ready").orElseThrow().getName());
        assertTrue(CoordinationTopology.streamFor("other.subject").isEmpty());
    }

    @Test
    @DisplayName("Should name per-agent consumers after the agent")
    void shouldNamePerAgentConsumers() {
        ConsumerSpec messages = CoordinationTopology.messageConsumer("bob", 5);
        ConsumerSpec tasks = CoordinationTopology.taskConsumer("bob", 3);

        assertEquals("agent-bob-messages", messages.getDurableName());
        assertEquals("messages.*.bob", messages.getFilterSubject());
        assertEquals("agent-bob-tasks", tasks.getDurableName());
        assertEquals("tasks.bob", tasks.getFilterSubject());
        assertEquals(3, CoordinationTopology.WORK_QUEUE_CONSUMER.getMaxDeliver());
    }
}
