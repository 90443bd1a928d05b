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
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.Nats;
import io.nats.client.Options;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * {@link BrokerClient} backed by a NATS server with JetStream enabled.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public class JetStreamBrokerClient implements BrokerClient {

    private static final Logger logger = LoggerFactory.getLogger(JetStreamBrokerClient.class);

    private static final int NOT_FOUND = 404;

    private final String url;
    private final String connectionName;
    private final Duration connectTimeout;

    private volatile Connection connection;
    private volatile JetStream jetStream;
    private volatile JetStreamManagement management;

    public JetStreamBrokerClient(String url, String connectionName, Duration connectTimeout) {
        this.url = url;
        this.connectionName = connectionName;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public void connect() throws IOException {
        if (connection != null) {
            logger.info("Replacing existing NATS connection to {}", url);
            close();
        }
        Options options = new Options.Builder()
                .server(url)
                .connectionName(connectionName)
                .connectionTimeout(connectTimeout)
                .build();
        try {
            Connection opened = Nats.connect(options);
            this.management = opened.jetStreamManagement();
            this.jetStream = opened.jetStream();
            this.connection = opened;
            logger.info("Connected to NATS server {} as {}", url, connectionName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while connecting to " + url, e);
        }
    }

    @Override
    public boolean isConnected() {
        Connection current = connection;
        return current != null && current.getStatus() == Connection.Status.CONNECTED;
    }

    @Override
    public void ensureStream(StreamSpec spec) throws IOException {
        StreamConfiguration configuration = StreamConfiguration.builder()
                .name(spec.getName())
                .subjects(spec.getSubjects())
                .retentionPolicy(RetentionPolicy.Limits)
                .maxBytes(spec.getMaxBytes())
                .maxAge(spec.getMaxAge())
                .storageType(StorageType.File)
                .build();
        JetStreamManagement jsm = requireManagement();
        try {
            if (streamExists(jsm, spec.getName())) {
                jsm.updateStream(configuration);
                logger.debug("Stream {} updated", spec.getName());
            } else {
                jsm.addStream(configuration);
                logger.info("Stream {} created on {}", spec.getName(), spec.getSubjects());
            }
        } catch (JetStreamApiException e) {
            throw new IOException("Cannot provision stream " + spec.getName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void ensureConsumer(ConsumerSpec spec) throws IOException {
        ConsumerConfiguration configuration = ConsumerConfiguration.builder()
                .durable(spec.getDurableName())
                .filterSubject(spec.getFilterSubject())
                .ackPolicy(AckPolicy.Explicit)
                .deliverPolicy(DeliverPolicy.All)
                .maxDeliver(spec.getMaxDeliver())
                .ackWait(spec.getAckWait())
                .build();
        try {
            requireManagement().addOrUpdateConsumer(spec.getStream(), configuration);
            logger.debug("Consumer {} provisioned on {}", spec.getDurableName(), spec.getStream());
        } catch (JetStreamApiException e) {
            throw new IOException("Cannot provision consumer " + spec.getDurableName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void publish(String subject, byte[] data) throws IOException {
        requireConnection().publish(subject, data);
    }

    @Override
    public void publishDurable(String subject, byte[] data) throws IOException {
        requireConnection();
        try {
            jetStream.publish(subject, data);
        } catch (JetStreamApiException e) {
            throw new IOException("Publish to " + subject + " was not stored: " + e.getMessage(), e);
        }
    }

    @Override
    public BrokerSubscription subscribe(String subject, Consumer<BrokerMessage> handler) throws IOException {
        Connection current = requireConnection();
        Dispatcher dispatcher = current.createDispatcher(msg -> handler.accept(new NatsBrokerMessage(msg)));
        dispatcher.subscribe(subject);
        return () -> current.closeDispatcher(dispatcher);
    }

    @Override
    public PullSubscription pullSubscribe(ConsumerSpec spec) throws IOException {
        ensureConsumer(spec);
        requireConnection();
        JetStreamSubscription subscription;
        try {
            subscription = jetStream.subscribe(spec.getFilterSubject(),
                    PullSubscribeOptions.bind(spec.getStream(), spec.getDurableName()));
        } catch (JetStreamApiException e) {
            throw new IOException("Cannot bind to consumer " + spec.getDurableName() + ": " + e.getMessage(), e);
        }
        return new PullSubscription() {
            @Override
            public List<BrokerMessage> fetch(int batch, Duration timeout) {
                List<BrokerMessage> fetched = new ArrayList<>();
                for (Message message : subscription.fetch(batch, timeout)) {
                    fetched.add(new NatsBrokerMessage(message));
                }
                return fetched;
            }

            @Override
            public void unsubscribe() {
                if (subscription.isActive()) {
                    subscription.unsubscribe();
                }
            }
        };
    }

    @Override
    public void drain(Duration timeout) throws IOException {
        Connection current = connection;
        if (current == null) {
            return;
        }
        try {
            current.drain(timeout).get();
        } catch (TimeoutException e) {
            throw new IOException("Drain did not finish within " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while draining", e);
        } catch (java.util.concurrent.ExecutionException e) {
            throw new IOException("Drain failed", e.getCause());
        }
    }

    @Override
    public void close() {
        Connection current = connection;
        connection = null;
        if (current == null) {
            return;
        }
        try {
            current.close();
            logger.info("NATS connection to {} closed", url);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing NATS connection to {}", url);
        }
    }

    private static boolean streamExists(JetStreamManagement jsm, String name) throws IOException, JetStreamApiException {
        try {
            jsm.getStreamInfo(name);
            return true;
        } catch (JetStreamApiException e) {
            if (e.getErrorCode() == NOT_FOUND) {
                return false;
            }
            throw e;
        }
    }

    private Connection requireConnection() throws IOException {
        Connection current = connection;
        if (current == null) {
            throw new IOException("Not connected to " + url);
        }
        return current;
    }

    private JetStreamManagement requireManagement() throws IOException {
        requireConnection();
        return management;
    }

    private static final class NatsBrokerMessage implements BrokerMessage {

        private final Message message;

        NatsBrokerMessage(Message message) {
            this.message = message;
        }

        @Override
        public String subject() {
            return message.getSubject();
        }

        @Override
        public byte[] data() {
            return message.getData();
        }

        @Override
        public long deliveryCount() {
            return message.isJetStream() ? message.metaData().deliveredCount() : 1;
        }

        @Override
        public void ack() {
            if (message.isJetStream()) {
                message.ack();
            }
        }

        @Override
        public void nak() {
            if (message.isJetStream()) {
                message.nak();
            }
        }

        @Override
        public void term() {
            if (message.isJetStream()) {
                message.term();
            }
        }
    }
}
