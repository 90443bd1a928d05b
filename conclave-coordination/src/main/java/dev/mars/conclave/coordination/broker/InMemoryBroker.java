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
import dev.mars.conclave.coordination.topology.Subjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Broker that lives inside the JVM, shared by any number of {@link InMemoryBrokerClient}s.
 *
 * <p>It keeps the stream and durable-consumer semantics the coordination layer relies on:
 * limits-retained streams capture every publish whose subject they match, consumers start from
 * the first stored message, a message fetched from a durable goes to exactly one fetcher, and a
 * nak redelivers until the consumer's max-deliver is reached. Ack-wait expiry and size or age
 * limits are not simulated.</p>
 *
 * <p>Plain subscribers run synchronously on the publishing thread, outside the broker lock.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 * @version 1.0
 */
public class InMemoryBroker {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryBroker.class);

    private final Object lock = new Object();
    private final Map<String, StreamState> streams = new LinkedHashMap<>();
    private final Map<String, ConsumerState> consumers = new LinkedHashMap<>();
    private final List<CoreSubscriber> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger failingConnects = new AtomicInteger();

    private volatile boolean available = true;

    // ==================== Fault Injection ====================

    public void setAvailable(boolean available) {
        this.available = available;
        logger.info("In-memory broker availability set to {}", available);
    }

    public boolean isAvailable() {
        return available;
    }

    /**
     * Makes the next {@code count} connection attempts fail.
     */
    public void failNextConnects(int count) {
        failingConnects.set(count);
    }

    void connect() throws IOException {
        if (!available) {
            throw new IOException("Broker unavailable");
        }
        if (failingConnects.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IOException("Connection refused");
        }
    }

    // ==================== Topology ====================

    void ensureStream(StreamSpec spec) {
        synchronized (lock) {
            StreamState existing = streams.get(spec.getName());
            if (existing == null) {
                streams.put(spec.getName(), new StreamState(spec));
                logger.debug("Stream {} created", spec.getName());
            } else {
                existing.spec = spec;
            }
        }
    }

    void ensureConsumer(ConsumerSpec spec) throws IOException {
        synchronized (lock) {
            StreamState stream = streams.get(spec.getStream());
            if (stream == null) {
                throw new IOException("Stream not found: " + spec.getStream());
            }
            String key = consumerKey(spec.getStream(), spec.getDurableName());
            ConsumerState existing = consumers.get(key);
            if (existing != null) {
                existing.spec = spec;
                return;
            }
            ConsumerState created = new ConsumerState(spec);
            for (StoredMessage stored : stream.messages) {
                if (Subjects.matches(spec.getFilterSubject(), stored.subject)) {
                    created.ready.addLast(new Delivery(stored));
                }
            }
            consumers.put(key, created);
            logger.debug("Consumer {} created with {} pending", spec.getDurableName(), created.ready.size());
        }
    }

    public boolean hasStream(String name) {
        synchronized (lock) {
            return streams.containsKey(name);
        }
    }

    public boolean hasConsumer(String stream, String durableName) {
        synchronized (lock) {
            return consumers.containsKey(consumerKey(stream, durableName));
        }
    }

    public int storedCount(String stream) {
        synchronized (lock) {
            StreamState state = streams.get(stream);
            return state == null ? 0 : state.messages.size();
        }
    }

    public int pendingCount(String stream, String durableName) {
        synchronized (lock) {
            ConsumerState state = consumers.get(consumerKey(stream, durableName));
            return state == null ? 0 : state.ready.size();
        }
    }

    // ==================== Publish / Subscribe ====================

    void publish(String subject, byte[] data, boolean requireStream) throws IOException {
        if (!available) {
            throw new IOException("Broker unavailable");
        }
        synchronized (lock) {
            boolean stored = false;
            for (StreamState stream : streams.values()) {
                if (stream.spec.captures(subject)) {
                    store(stream, new StoredMessage(sequence.incrementAndGet(), subject, data.clone()));
                    stored = true;
                    break;
                }
            }
            if (requireStream && !stored) {
                throw new IOException("No stream captures subject " + subject);
            }
        }
        for (CoreSubscriber subscriber : subscribers) {
            if (Subjects.matches(subscriber.subject, subject)) {
                try {
                    subscriber.handler.accept(new CoreMessage(subject, data.clone()));
                } catch (RuntimeException e) {
                    logger.warn("Subscriber on {} failed: {}", subject, e.getMessage());
                }
            }
        }
    }

    Runnable subscribe(String subject, Consumer<BrokerMessage> handler) {
        CoreSubscriber subscriber = new CoreSubscriber(subject, handler);
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    List<BrokerMessage> fetch(ConsumerSpec spec, int batch, Duration timeout) throws IOException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            ConsumerState consumer = consumers.get(consumerKey(spec.getStream(), spec.getDurableName()));
            if (consumer == null) {
                throw new IOException("Consumer not found: " + spec.getDurableName());
            }
            try {
                long remaining;
                while (consumer.ready.isEmpty() && (remaining = deadline - System.nanoTime()) > 0) {
                    lock.wait(Math.max(1, remaining / 1_000_000), 0);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return List.of();
            }
            if (!available) {
                throw new IOException("Broker unavailable");
            }
            List<BrokerMessage> fetched = new ArrayList<>();
            while (!consumer.ready.isEmpty() && fetched.size() < batch) {
                Delivery delivery = consumer.ready.pollFirst();
                delivery.count++;
                fetched.add(new ConsumerMessage(consumer, delivery));
            }
            return fetched;
        }
    }

    private void store(StreamState stream, StoredMessage message) {
        stream.messages.add(message);
        for (ConsumerState consumer : consumers.values()) {
            if (consumer.spec.getStream().equals(stream.spec.getName())
                    && Subjects.matches(consumer.spec.getFilterSubject(), message.subject)) {
                consumer.ready.addLast(new Delivery(message));
            }
        }
        lock.notifyAll();
    }

    private void redeliver(ConsumerState consumer, Delivery delivery) {
        synchronized (lock) {
            if (delivery.count >= consumer.spec.getMaxDeliver()) {
                logger.debug("Message {} on {} reached max deliver", delivery.message.sequence,
                        consumer.spec.getDurableName());
                return;
            }
            consumer.ready.addFirst(delivery);
            lock.notifyAll();
        }
    }

    private static String consumerKey(String stream, String durableName) {
        return stream + "/" + durableName;
    }

    // ==================== State ====================

    private static final class StreamState {
        private StreamSpec spec;
        private final List<StoredMessage> messages = new ArrayList<>();

        StreamState(StreamSpec spec) {
            this.spec = spec;
        }
    }

    private static final class ConsumerState {
        private ConsumerSpec spec;
        private final Deque<Delivery> ready = new ArrayDeque<>();

        ConsumerState(ConsumerSpec spec) {
            this.spec = spec;
        }
    }

    private static final class StoredMessage {
        private final long sequence;
        private final String subject;
        private final byte[] data;

        StoredMessage(long sequence, String subject, byte[] data) {
            this.sequence = sequence;
            this.subject = subject;
            this.data = data;
        }
    }

    private static final class Delivery {
        private final StoredMessage message;
        private int count;

        Delivery(StoredMessage message) {
            this.message = message;
        }
    }

    private static final class CoreSubscriber {
        private final String subject;
        private final Consumer<BrokerMessage> handler;

        CoreSubscriber(String subject, Consumer<BrokerMessage> handler) {
            this.subject = subject;
            this.handler = handler;
        }
    }

    private static final class CoreMessage implements BrokerMessage {
        private final String subject;
        private final byte[] data;

        CoreMessage(String subject, byte[] data) {
            this.subject = subject;
            this.data = data;
        }

        @Override
        public String subject() {
            return subject;
        }

        @Override
        public byte[] data() {
            return data;
        }

        @Override
        public long deliveryCount() {
            return 1;
        }

        @Override
        public void ack() {
        }

        @Override
        public void nak() {
        }

        @Override
        public void term() {
        }
    }

    private final class ConsumerMessage implements BrokerMessage {
        private final ConsumerState consumer;
        private final Delivery delivery;
        private final int deliveredCount;
        private boolean settled;

        ConsumerMessage(ConsumerState consumer, Delivery delivery) {
            this.consumer = consumer;
            this.delivery = delivery;
            this.deliveredCount = delivery.count;
        }

        @Override
        public String subject() {
            return delivery.message.subject;
        }

        @Override
        public byte[] data() {
            return delivery.message.data.clone();
        }

        @Override
        public long deliveryCount() {
            return deliveredCount;
        }

        @Override
        public synchronized void ack() {
            settled = true;
        }

        @Override
        public synchronized void nak() {
            if (!settled) {
                settled = true;
                redeliver(consumer, delivery);
            }
        }

        @Override
        public synchronized void term() {
            settled = true;
        }
    }
}
