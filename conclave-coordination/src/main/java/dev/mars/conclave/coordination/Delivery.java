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

import io.vertx.core.json.JsonObject;

/**
 * A message handed to a {@link DeliveryCallback}.
 */
public final class Delivery {

    private final String subject;
    private final JsonObject body;
    private final long deliveryCount;

    public Delivery(String subject, JsonObject body, long deliveryCount) {
        this.subject = subject;
        this.body = body;
        this.deliveryCount = deliveryCount;
    }

    public String getSubject() {
        return subject;
    }

    public JsonObject getBody() {
        return body;
    }

    /**
     * @return 1 on first delivery, higher on redelivery
     */
    public long getDeliveryCount() {
        return deliveryCount;
    }

    public boolean isRedelivery() {
        return deliveryCount > 1;
    }

    @Override
    public String toString() {
        return "Delivery{subject='" + subject + "', deliveryCount=" + deliveryCount + "}";
    }
}
