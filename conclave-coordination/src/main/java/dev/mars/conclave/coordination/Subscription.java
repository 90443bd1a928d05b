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

import io.vertx.core.Future;

/**
 * Handle to an active durable subscription opened by {@link CoordinationService}.
 */
public final class Subscription {

    private final String id;
    private final PullConsumerLoop loop;
    private final CoordinationService owner;

    Subscription(String id, PullConsumerLoop loop, CoordinationService owner) {
        this.id = id;
        this.loop = loop;
        this.owner = owner;
    }

    public String getId() {
        return id;
    }

    public String getDurableName() {
        return loop.getSpec().getDurableName();
    }

    public boolean isActive() {
        return loop.isRunning();
    }

    public long getAcked() {
        return loop.getAcked();
    }

    public long getNaked() {
        return loop.getNaked();
    }

    public long getDeadLettered() {
        return loop.getDeadLettered();
    }

    /**
     * Stops the loop after its current message and unbinds from the consumer. The durable
     * consumer itself survives.
     */
    public Future<Void> cancel() {
        return owner.cancel(this);
    }

    PullConsumerLoop loop() {
        return loop;
    }

    @Override
    public String toString() {
        return "Subscription{id='" + id + "', durable='" + getDurableName() + "'}";
    }
}
