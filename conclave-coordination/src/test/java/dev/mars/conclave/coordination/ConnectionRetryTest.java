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
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConnectionRetry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 */
@ExtendWith(VertxExtension.class)
class ConnectionRetryTest {

    @Test
    @DisplayName("Should return the first successful attempt")
    void shouldSucceedAfterFailures(Vertx vertx, VertxTestContext testContext) {
        ConnectionRetry retry = new ConnectionRetry(vertx, 5, Duration.ofMillis(10));
        AtomicInteger calls = new AtomicInteger();

        retry.execute("Connect", () -> calls.incrementAndGet() < 3
                        ? Future.failedFuture(new IOException("refused"))
                        : Future.succeededFuture("connected"))
                .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                    assertEquals("connected", result);
                    assertEquals(3, calls.get());
                    testContext.completeNow();
                })));
    }

    @Test
    @DisplayName("Should fail with the attempt count and last cause once attempts run out")
    void shouldFailAfterMaxAttempts(Vertx vertx, VertxTestContext testContext) {
        ConnectionRetry retry = new ConnectionRetry(vertx, 4, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();

        retry.<Void>execute("Connect", () -> {
            calls.incrementAndGet();
            return Future.failedFuture(new IOException("refused"));
        }).onComplete(testContext.failing(error -> testContext.verify(() -> {
            ConnectionException e = assertInstanceOf(ConnectionException.class, error);
            assertEquals(4, e.getAttempts());
            assertEquals(4, calls.get());
            assertInstanceOf(IOException.class, e.getCause());
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Should treat a thrown exception as a failed attempt")
    void shouldRetryThrownExceptions(Vertx vertx, VertxTestContext testContext) {
        ConnectionRetry retry = new ConnectionRetry(vertx, 2, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();

        retry.execute("Connect", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
            return Future.succeededFuture(calls.get());
        }).onComplete(testContext.succeeding(result -> testContext.verify(() -> {
            assertEquals(2, result);
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Should reject fewer than one attempt")
    void shouldRejectZeroAttempts(Vertx vertx) {
        assertThrows(IllegalArgumentException.class, () -> new ConnectionRetry(vertx, 0, Duration.ZERO));
    }
}
