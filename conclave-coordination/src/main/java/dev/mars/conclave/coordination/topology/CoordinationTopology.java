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

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * The streams and consumers every node provisions on connect, and the per-agent consumers
 * created on subscription.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public final class CoordinationTopology {

    private static final long MB = 1024L * 1024L;

    public static final StreamSpec AGENT_DISCOVERY = new StreamSpec(
            "AGENT_DISCOVERY", List.of("agents.>"), 100 * MB, Duration.ofHours(24));
    public static final StreamSpec AGENT_MESSAGES = new StreamSpec(
            "AGENT_MESSAGES", List.of("messages.>"), 1000 * MB, Duration.ofDays(7));
    public static final StreamSpec TASK_ROUTING = new StreamSpec(
            "TASK_ROUTING", List.of("tasks.>"), 500 * MB, Duration.ofDays(3));
    public static final StreamSpec SYSTEM_EVENTS = new StreamSpec(
            "SYSTEM_EVENTS", List.of("events.>"), 200 * MB, Duration.ofDays(1));

    public static final List<StreamSpec> STREAMS = List.of(AGENT_DISCOVERY, AGENT_MESSAGES, TASK_ROUTING, SYSTEM_EVENTS);

    public static final ConsumerSpec DISCOVERY_CONSUMER = new ConsumerSpec(
            AGENT_DISCOVERY.getName(), "agent-discovery-consumer", "agents.>", 5);
    // Filtered to the work-queue subject so point-to-point tasks are not claimed by the pool
    public static final ConsumerSpec WORK_QUEUE_CONSUMER = new ConsumerSpec(
            TASK_ROUTING.getName(), "task-routing-consumer", Subjects.TASKS_AVAILABLE, 3);

    public static final List<ConsumerSpec> CONSUMERS = List.of(DISCOVERY_CONSUMER, WORK_QUEUE_CONSUMER);

    private CoordinationTopology() {
    }

    public static ConsumerSpec messageConsumer(String agentId, int maxDeliver) {
        return new ConsumerSpec(AGENT_MESSAGES.getName(), "agent-" + Subjects.requireAgentId(agentId) + "-messages",
                Subjects.inbox(agentId), maxDeliver);
    }

    public static ConsumerSpec taskConsumer(String agentId, int maxDeliver) {
        return new ConsumerSpec(TASK_ROUTING.getName(), "agent-" + Subjects.requireAgentId(agentId) + "-tasks",
                Subjects.task(agentId), maxDeliver);
    }

    public static Optional<StreamSpec> streamFor(String subject) {
        return STREAMS.stream().filter(s -> s.captures(subject)).findFirst();
    }
}
