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

package dev.mars.conclave.coordination.topology;

import java.time.Duration;
import java.util.Objects;

/**
 * Definition of a durable pull consumer with explicit acknowledgment.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public final class ConsumerSpec {

    public static final Duration DEFAULT_ACK_WAIT = Duration.ofSeconds(30);

    private final String stream;
    private final String durableName;
    private final String filterSubject;
    private final int maxDeliver;
    private final Duration ackWait;

    public ConsumerSpec(String stream, String durableName, String filterSubject, int maxDeliver) {
        this(stream, durableName, filterSubject, maxDeliver, DEFAULT_ACK_WAIT);
    }

    public ConsumerSpec(String stream, String durableName, String filterSubject, int maxDeliver, Duration ackWait) {
        if (maxDeliver < 1) {
            throw new IllegalArgumentException("maxDeliver must be at least 1");
        }
        this.stream = Objects.requireNonNull(stream, "stream");
        this.durableName = Objects.requireNonNull(durableName, "durableName");
        this.filterSubject = Objects.requireNonNull(filterSubject, "filterSubject");
        this.maxDeliver = maxDeliver;
        this.ackWait = Objects.requireNonNull(ackWait, "ackWait");
    }

    public String getStream() {
        return stream;
    }

    public String getDurableName() {
        return durableName;
    }

    public String getFilterSubject() {
        return filterSubject;
    }

    public int getMaxDeliver() {
        return maxDeliver;
    }

    public Duration getAckWait() {
        return ackWait;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConsumerSpec that = (ConsumerSpec) o;
        return maxDeliver == that.maxDeliver && stream.equals(that.stream) && durableName.equals(that.durableName)
                && filterSubject.equals(that.filterSubject) && ackWait.equals(that.ackWait);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stream, durableName, filterSubject, maxDeliver, ackWait);
    }

    @Override
    public String toString() {
        return "ConsumerSpec{stream='" + stream + "', durable='" + durableName + "', filter='" + filterSubject
                + "', maxDeliver=" + maxDeliver + "}";
    }
}
