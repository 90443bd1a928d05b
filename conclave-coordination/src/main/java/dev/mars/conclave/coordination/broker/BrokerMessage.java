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

/**
 * A message received from the broker.
 *
 * <p>Acknowledgment methods only have an effect on messages delivered through a durable
 * consumer; on plain subscriptions they are no-ops.</p>
 */
public interface BrokerMessage {

    String subject();

    byte[] data();

    /**
     * @return how many times this message has been delivered, starting at 1
     */
    long deliveryCount();

    void ack();

    /**
     * Requests redelivery, subject to the consumer's max-deliver limit.
     */
    void nak();

    /**
     * Stops redelivery of this message for good.
     */
    void term();
}
