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

package dev.mars.conclave.coordination.broker;

import dev.mars.conclave.coordination.topology.ConsumerSpec;
import dev.mars.conclave.coordination.topology.StreamSpec;

import java.io.IOException;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Blocking view of the message broker.
 *
 * <p>Every method may block on network I/O and must therefore be called from a worker thread.
 * Handlers passed to {@link #subscribe(String, Consumer)} run on a broker-owned thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public interface BrokerClient {

    void connect() throws IOException;

    boolean isConnected();

    /**
     * Creates the stream, or updates it to match the given configuration if it already exists.
     */
    void ensureStream(StreamSpec spec) throws IOException;

    /**
     * Creates the durable consumer, or updates it to match the given configuration if it already exists.
     */
    void ensureConsumer(ConsumerSpec spec) throws IOException;

    /**
     * Fire-and-forget publish. Still captured by any stream whose subjects match.
     */
    void publish(String subject, byte[] data) throws IOException;

    /**
     * Publishes and waits for the broker to confirm the message was stored.
     *
     * @throws IOException if no stream captures the subject or the broker does not confirm
     */
    void publishDurable(String subject, byte[] data) throws IOException;

    BrokerSubscription subscribe(String subject, Consumer<BrokerMessage> handler) throws IOException;

    /**
     * Ensures the consumer exists and binds a pull subscription to it. Several subscriptions
     * bound to the same durable compete for its messages.
     */
    PullSubscription pullSubscribe(ConsumerSpec spec) throws IOException;

    /**
     * Flushes pending publishes and subscriptions, then closes the connection.
     */
    void drain(Duration timeout) throws IOException;

    void close();
}
