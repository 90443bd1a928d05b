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

import dev.mars.conclave.coordination.broker.BrokerMessage;
import dev.mars.conclave.coordination.broker.PullSubscription;
import dev.mars.conclave.coordination.topology.ConsumerSpec;
import dev.mars.conclave.core.exceptions.DeliveryException;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fetch-and-process loop over one pull subscription.
 *
 * <p>Each cycle fetches a small batch on a worker thread, then hands the messages to the
 * callback one at a time on the owning context. A message is acknowledged only after its
 * callback future succeeds. A failed callback naks the message, or terminates it once it has
 * been delivered {@code maxDeliver} times.</p>
 *
 * <p>{@link #stop()} is cooperative: the flag is checked before every fetch and between
 * messages, so the message in hand is always settled before the loop exits. Messages fetched
 * but not yet handed out when the loop stops stay unacknowledged and are redelivered by the
 * broker after the ack wait.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class PullConsumerLoop {

    private static final Logger logger = LoggerFactory.getLogger(PullConsumerLoop.class);

    private final Context context;
    private final PullSubscription subscription;
    private final ConsumerSpec spec;
    private final DeliveryCallback callback;
    private final int batch;
    private final Duration fetchTimeout;
    private final Duration errorBackoff;
    private final Promise<Void> stopped = Promise.promise();

    private final AtomicLong acked = new AtomicLong();
    private final AtomicLong naked = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();

    private volatile boolean stopRequested;
    private volatile boolean running;

    public PullConsumerLoop(Context context, PullSubscription subscription, ConsumerSpec spec,
                            DeliveryCallback callback, CoordinationConfig config) {
        this.context = context;
        this.subscription = subscription;
        this.spec = spec;
        this.callback = callback;
        this.batch = config.getFetchBatch();
        this.fetchTimeout = config.getFetchTimeout();
        this.errorBackoff = config.getFetchErrorBackoff();
    }

    public void start() {
        running = true;
        logger.debug("Pull loop started for consumer {}", spec.getDurableName());
        context.runOnContext(v -> cycle());
    }

    /**
     * Requests the loop to stop.
     *
     * @return completes once the in-flight cycle has finished
     */
    public Future<Void> stop() {
        stopRequested = true;
        if (!running) {
            stopped.tryComplete();
        }
        return stopped.future();
    }

    private void cycle() {
        if (stopRequested) {
            finish();
            return;
        }
        context.executeBlocking(() -> subscription.fetch(batch, fetchTimeout), false)
                .onComplete(ar -> {
                    if (ar.failed()) {
                        if (stopRequested) {
                            finish();
                            return;
                        }
                        logger.warn("Fetch from {} failed: {}. Retrying in {} ms",
                                spec.getDurableName(), ar.cause().getMessage(), errorBackoff.toMillis());
                        context.owner().setTimer(Math.max(1, errorBackoff.toMillis()), id -> cycle());
                        return;
                    }
                    processFrom(ar.result(), 0).onComplete(v -> cycle());
                });
    }

    private Future<Void> processFrom(List<BrokerMessage> messages, int index) {
        if (index >= messages.size()) {
            return Future.succeededFuture();
        }
        if (stopRequested) {
            logger.debug("Consumer {} stopping with {} fetched messages left for redelivery",
                    spec.getDurableName(), messages.size() - index);
            return Future.succeededFuture();
        }
        return process(messages.get(index)).compose(v -> processFrom(messages, index + 1));
    }

    private Future<Void> process(BrokerMessage message) {
        JsonObject body;
        try {
            body = new JsonObject(Buffer.buffer(message.data()));
        } catch (DecodeException e) {
            logger.error("Dropping unparseable message on {} (consumer {}): {}",
                    message.subject(), spec.getDurableName(), e.getMessage());
            message.term();
            deadLettered.incrementAndGet();
            return Future.succeededFuture();
        }

        Delivery delivery = new Delivery(message.subject(), body, message.deliveryCount());
        Future<Void> outcome;
        try {
            outcome = callback.handle(delivery);
        } catch (RuntimeException e) {
            outcome = Future.failedFuture(e);
        }
        return outcome.transform(ar -> {
            if (ar.succeeded()) {
                message.ack();
                acked.incrementAndGet();
                logger.debug("Acked {} (delivery {})", message.subject(), delivery.getDeliveryCount());
            } else {
                settleFailure(message, delivery, ar.cause());
            }
            return Future.<Void>succeededFuture();
        });
    }

    private void settleFailure(BrokerMessage message, Delivery delivery, Throwable cause) {
        DeliveryException failure = new DeliveryException(message.subject(),
                "Callback failed on delivery " + delivery.getDeliveryCount(), cause);
        if (delivery.getDeliveryCount() >= spec.getMaxDeliver()) {
            message.term();
            deadLettered.incrementAndGet();
            logger.error("Dead-lettered message on {} after {} deliveries (consumer {})",
                    message.subject(), delivery.getDeliveryCount(), spec.getDurableName(), failure);
        } else {
            message.nak();
            naked.incrementAndGet();
            logger.warn("{}; requesting redelivery ({}/{})",
                    failure.getMessage(), delivery.getDeliveryCount(), spec.getMaxDeliver());
        }
    }

    private void finish() {
        running = false;
        logger.debug("Pull loop stopped for consumer {}", spec.getDurableName());
        stopped.tryComplete();
    }

    public ConsumerSpec getSpec() {
        return spec;
    }

    public PullSubscription getSubscription() {
        return subscription;
    }

    public boolean isRunning() {
        return running;
    }

    public long getAcked() {
        return acked.get();
    }

    public long getNaked() {
        return naked.get();
    }

    public long getDeadLettered() {
        return deadLettered.get();
    }
}
