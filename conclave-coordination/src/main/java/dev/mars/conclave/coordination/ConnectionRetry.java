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

import dev.mars.conclave.core.exceptions.ConnectionException;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries an asynchronous connection attempt with a fixed delay and a bounded number of attempts.
 *
 * <p>Once the attempts run out the returned future fails with a {@link ConnectionException}
 * carrying the attempt count and the last cause. The failure is never swallowed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class ConnectionRetry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRetry.class);

    private final Vertx vertx;
    private final int maxAttempts;
    private final Duration delay;

    public ConnectionRetry(Vertx vertx, int maxAttempts, Duration delay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.vertx = vertx;
        this.maxAttempts = maxAttempts;
        this.delay = delay;
    }

    public <T> Future<T> execute(String operation, Supplier<Future<T>> attempt) {
        Promise<T> promise = Promise.promise();
        attempt(operation, attempt, 1, promise);
        return promise.future();
    }

    private <T> void attempt(String operation, Supplier<Future<T>> attempt, int number, Promise<T> promise) {
        Future<T> result;
        try {
            result = attempt.get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        result.onComplete(ar -> {
            if (ar.succeeded()) {
                if (number > 1) {
                    logger.info("{} succeeded on attempt {}/{}", operation, number, maxAttempts);
                }
                promise.complete(ar.result());
                return;
            }
            if (number >= maxAttempts) {
                logger.error("{} failed after {} attempts: {}", operation, number, ar.cause().getMessage());
                promise.fail(new ConnectionException(operation + " failed after " + number + " attempts",
                        number, ar.cause()));
                return;
            }
            logger.warn("{} attempt {}/{} failed: {}. Retrying in {} ms",
                    operation, number, maxAttempts, ar.cause().getMessage(), delay.toMillis());
            if (delay.isZero()) {
                attempt(operation, attempt, number + 1, promise);
            } else {
                vertx.setTimer(delay.toMillis(), id -> attempt(operation, attempt, number + 1, promise));
            }
        });
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getDelay() {
        return delay;
    }
}
