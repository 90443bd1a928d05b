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
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * One connection to an {@link InMemoryBroker}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 * @version 1.0
 */
public class InMemoryBrokerClient implements BrokerClient {

    private final InMemoryBroker broker;
    private final List<Runnable> subscriptions = new CopyOnWriteArrayList<>();

    private volatile boolean connected;

    public InMemoryBrokerClient(InMemoryBroker broker) {
        this.broker = broker;
    }

    @Override
    public void connect() throws IOException {
        broker.connect();
        connected = true;
    }

    @Override
    public boolean isConnected() {
        return connected && broker.isAvailable();
    }

    @Override
    public void ensureStream(StreamSpec spec) throws IOException {
        requireConnected();
        broker.ensureStream(spec);
    }

    @Override
    public void ensureConsumer(ConsumerSpec spec) throws IOException {
        requireConnected();
        broker.ensureConsumer(spec);
    }

    @Override
    public void publish(String subject, byte[] data) throws IOException {
        requireConnected();
        broker.publish(subject, data, false);
    }

    @Override
    public void publishDurable(String subject, byte[] data) throws IOException {
        requireConnected();
        broker.publish(subject, data, true);
    }

    @Override
    public BrokerSubscription subscribe(String subject, Consumer<BrokerMessage> handler) throws IOException {
        requireConnected();
        Runnable remove = broker.subscribe(subject, message -> {
            if (connected) {
                handler.accept(message);
            }
        });
        subscriptions.add(remove);
        return () -> {
            subscriptions.remove(remove);
            remove.run();
        };
    }

    @Override
    public PullSubscription pullSubscribe(ConsumerSpec spec) throws IOException {
        ensureConsumer(spec);
        return new PullSubscription() {
            private volatile boolean active = true;

            @Override
            public List<BrokerMessage> fetch(int batch, Duration timeout) throws IOException {
                if (!active) {
                    throw new IOException("Subscription to " + spec.getDurableName() + " is closed");
                }
                requireConnected();
                return broker.fetch(spec, batch, timeout);
            }

            @Override
            public void unsubscribe() {
                active = false;
            }
        };
    }

    @Override
    public void drain(Duration timeout) {
        close();
    }

    @Override
    public void close() {
        connected = false;
        for (Runnable remove : subscriptions) {
            remove.run();
        }
        subscriptions.clear();
    }

    private void requireConnected() throws IOException {
        if (!connected) {
            throw new IOException("Not connected");
        }
        if (!broker.isAvailable()) {
            throw new IOException("Broker unavailable");
        }
    }
}
