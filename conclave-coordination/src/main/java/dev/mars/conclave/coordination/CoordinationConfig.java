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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable settings for {@link CoordinationService}. Built with {@link #builder()}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public final class CoordinationConfig {

    public static final String DEFAULT_NATS_URL = "nats://localhost:4222";

    private final String natsUrl;
    private final String connectionName;
    private final Duration connectTimeout;
    private final int connectAttempts;
    private final Duration retryDelay;
    private final Duration livenessWindow;
    private final int fetchBatch;
    private final Duration fetchTimeout;
    private final Duration fetchErrorBackoff;
    private final int messageMaxDeliver;
    private final int taskMaxDeliver;
    private final Duration drainTimeout;

    private CoordinationConfig(Builder builder) {
        this.natsUrl = builder.natsUrl;
        this.connectionName = builder.connectionName;
        this.connectTimeout = builder.connectTimeout;
        this.connectAttempts = builder.connectAttempts;
        this.retryDelay = builder.retryDelay;
        this.livenessWindow = builder.livenessWindow;
        this.fetchBatch = builder.fetchBatch;
        this.fetchTimeout = builder.fetchTimeout;
        this.fetchErrorBackoff = builder.fetchErrorBackoff;
        this.messageMaxDeliver = builder.messageMaxDeliver;
        this.taskMaxDeliver = builder.taskMaxDeliver;
        this.drainTimeout = builder.drainTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CoordinationConfig defaults() {
        return builder().build();
    }

    public String getNatsUrl() {
        return natsUrl;
    }

    public String getConnectionName() {
        return connectionName;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public int getConnectAttempts() {
        return connectAttempts;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public Duration getLivenessWindow() {
        return livenessWindow;
    }

    public int getFetchBatch() {
        return fetchBatch;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public Duration getFetchErrorBackoff() {
        return fetchErrorBackoff;
    }

    public int getMessageMaxDeliver() {
        return messageMaxDeliver;
    }

    public int getTaskMaxDeliver() {
        return taskMaxDeliver;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    @Override
    public String toString() {
        return "CoordinationConfig{" +
                "natsUrl='" + natsUrl + '\'' +
                ", connectAttempts=" + connectAttempts +
                ", retryDelay=" + retryDelay +
                ", livenessWindow=" + livenessWindow +
                ", fetchBatch=" + fetchBatch +
                ", fetchTimeout=" + fetchTimeout +
                ", messageMaxDeliver=" + messageMaxDeliver +
                '}';
    }

    public static class Builder {
        private String natsUrl = DEFAULT_NATS_URL;
        private String connectionName = "conclave";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private int connectAttempts = 5;
        private Duration retryDelay = Duration.ofSeconds(5);
        private Duration livenessWindow = Duration.ofSeconds(60);
        private int fetchBatch = 5;
        private Duration fetchTimeout = Duration.ofSeconds(1);
        private Duration fetchErrorBackoff = Duration.ofSeconds(1);
        private int messageMaxDeliver = 5;
        private int taskMaxDeliver = 3;
        private Duration drainTimeout = Duration.ofSeconds(5);

        public Builder natsUrl(String natsUrl) {
            this.natsUrl = natsUrl;
            return this;
        }

        public Builder connectionName(String connectionName) {
            this.connectionName = connectionName;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder connectAttempts(int connectAttempts) {
            this.connectAttempts = connectAttempts;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder livenessWindow(Duration livenessWindow) {
            this.livenessWindow = livenessWindow;
            return this;
        }

        public Builder fetchBatch(int fetchBatch) {
            this.fetchBatch = fetchBatch;
            return this;
        }

        public Builder fetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
            return this;
        }

        public Builder fetchErrorBackoff(Duration fetchErrorBackoff) {
            this.fetchErrorBackoff = fetchErrorBackoff;
            return this;
        }

        public Builder messageMaxDeliver(int messageMaxDeliver) {
            this.messageMaxDeliver = messageMaxDeliver;
            return this;
        }

        public Builder taskMaxDeliver(int taskMaxDeliver) {
            this.taskMaxDeliver = taskMaxDeliver;
            return this;
        }

        public Builder drainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        /**
         * @throws IllegalArgumentException listing every invalid setting
         */
        public CoordinationConfig build() {
            List<String> errors = new ArrayList<>();
            if (natsUrl == null || natsUrl.isBlank()) errors.add("natsUrl is required");
            if (connectAttempts < 1) errors.add("connectAttempts must be at least 1");
            if (fetchBatch < 1) errors.add("fetchBatch must be at least 1");
            if (messageMaxDeliver < 1) errors.add("messageMaxDeliver must be at least 1");
            if (taskMaxDeliver < 1) errors.add("taskMaxDeliver must be at least 1");
            requirePositive(errors, "retryDelay", retryDelay, true);
            requirePositive(errors, "connectTimeout", connectTimeout, false);
            requirePositive(errors, "livenessWindow", livenessWindow, false);
            requirePositive(errors, "fetchTimeout", fetchTimeout, false);
            requirePositive(errors, "fetchErrorBackoff", fetchErrorBackoff, true);
            requirePositive(errors, "drainTimeout", drainTimeout, false);
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException("Invalid coordination configuration: " + String.join("; ", errors));
            }
            return new CoordinationConfig(this);
        }

        private static void requirePositive(List<String> errors, String name, Duration value, boolean zeroAllowed) {
            if (Objects.isNull(value) || value.isNegative() || (!zeroAllowed && value.isZero())) {
                errors.add(name + " must be " + (zeroAllowed ? "non-negative" : "positive"));
            }
        }
    }
}
