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

package dev.mars.conclave.agent.config;

import dev.mars.conclave.coordination.CoordinationConfig;
import dev.mars.conclave.coordination.topology.Subjects;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable settings of one agent node, usually built from {@link AgentConfig}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 */
public class AgentConfiguration {

    private final String agentId;
    private final String name;
    private final String role;
    private final List<String> capabilities;
    private final Path identityDirectory;
    private final String version;
    private final String natsUrl;
    private final int connectAttempts;
    private final Duration retryDelay;
    private final Duration connectTimeout;
    private final Duration heartbeatInterval;
    private final Duration livenessWindow;
    private final Duration messageRetention;
    private final Duration cleanupInterval;
    private final boolean encryptionEnabled;
    private final boolean signingEnabled;
    private final int messageMaxDeliver;
    private final int taskMaxDeliver;
    private final boolean workQueueEnabled;

    private AgentConfiguration(Builder builder) {
        this.agentId = builder.agentId;
        this.name = builder.name != null ? builder.name : builder.agentId;
        this.role = builder.role;
        this.capabilities = List.copyOf(builder.capabilities);
        this.identityDirectory = builder.identityDirectory;
        this.version = builder.version;
        this.natsUrl = builder.natsUrl;
        this.connectAttempts = builder.connectAttempts;
        this.retryDelay = builder.retryDelay;
        this.connectTimeout = builder.connectTimeout;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.livenessWindow = builder.livenessWindow;
        this.messageRetention = builder.messageRetention;
        this.cleanupInterval = builder.cleanupInterval;
        this.encryptionEnabled = builder.encryptionEnabled;
        this.signingEnabled = builder.signingEnabled;
        this.messageMaxDeliver = builder.messageMaxDeliver;
        this.taskMaxDeliver = builder.taskMaxDeliver;
        this.workQueueEnabled = builder.workQueueEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Snapshot of the layered configuration. Identity material lives in a per-agent
     * subdirectory of the configured identity directory.
     */
    public static AgentConfiguration fromConfig(AgentConfig config) {
        String agentId = config.getAgentId();
        return builder()
                .agentId(agentId)
                .name(config.getAgentName())
                .role(config.getAgentRole())
                .capabilities(Arrays.stream(config.getCapabilities().split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .collect(Collectors.toList()))
                .identityDirectory(Paths.get(config.getIdentityDirectory()).resolve(agentId))
                .version(config.getVersion())
                .natsUrl(config.getNatsUrl())
                .connectAttempts(config.getConnectAttempts())
                .retryDelay(Duration.ofMillis(config.getRetryDelayMs()))
                .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .heartbeatInterval(Duration.ofMillis(config.getHeartbeatIntervalMs()))
                .livenessWindow(Duration.ofMillis(config.getLivenessWindowMs()))
                .messageRetention(Duration.ofMillis(config.getMessageRetentionMs()))
                .cleanupInterval(Duration.ofMillis(config.getCleanupIntervalMs()))
                .encryptionEnabled(config.isEncryptionEnabled())
                .signingEnabled(config.isSigningEnabled())
                .messageMaxDeliver(config.getMessageMaxDeliver())
                .taskMaxDeliver(config.getTaskMaxDeliver())
                .workQueueEnabled(config.isWorkQueueEnabled())
                .build();
    }

    public static AgentConfiguration fromEnvironment() {
        return fromConfig(AgentConfig.get());
    }

    /**
     * Coordination settings derived from this configuration.
     */
    public CoordinationConfig toCoordinationConfig() {
        return CoordinationConfig.builder()
                .natsUrl(natsUrl)
                .connectionName("conclave-" + agentId)
                .connectTimeout(connectTimeout)
                .connectAttempts(connectAttempts)
                .retryDelay(retryDelay)
                .livenessWindow(livenessWindow)
                .messageMaxDeliver(messageMaxDeliver)
                .taskMaxDeliver(taskMaxDeliver)
                .build();
    }

    public String getAgentId() { return agentId; }
    public String getName() { return name; }
    public String getRole() { return role; }
    public List<String> getCapabilities() { return capabilities; }
    public Path getIdentityDirectory() { return identityDirectory; }
    public String getVersion() { return version; }
    public String getNatsUrl() { return natsUrl; }
    public int getConnectAttempts() { return connectAttempts; }
    public Duration getRetryDelay() { return retryDelay; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public Duration getLivenessWindow() { return livenessWindow; }
    public Duration getMessageRetention() { return messageRetention; }
    public Duration getCleanupInterval() { return cleanupInterval; }
    public boolean isEncryptionEnabled() { return encryptionEnabled; }
    public boolean isSigningEnabled() { return signingEnabled; }
    public int getMessageMaxDeliver() { return messageMaxDeliver; }
    public int getTaskMaxDeliver() { return taskMaxDeliver; }
    public boolean isWorkQueueEnabled() { return workQueueEnabled; }

    @Override
    public String toString() {
        return "AgentConfiguration{agentId='" + agentId + "', role='" + role + "', capabilities=" + capabilities
                + ", natsUrl='" + natsUrl + "', encryption=" + encryptionEnabled + ", signing=" + signingEnabled + "}";
    }

    public static class Builder {
        private String agentId;
        private String name;
        private String role = "worker";
        private List<String> capabilities = new ArrayList<>();
        private Path identityDirectory;
        private String version = "1.0.0";
        private String natsUrl = CoordinationConfig.DEFAULT_NATS_URL;
        private int connectAttempts = 5;
        private Duration retryDelay = Duration.ofSeconds(5);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration livenessWindow = Duration.ofSeconds(60);
        private Duration messageRetention = Duration.ofHours(1);
        private Duration cleanupInterval = Duration.ofMinutes(5);
        private boolean encryptionEnabled = true;
        private boolean signingEnabled = true;
        private int messageMaxDeliver = 5;
        private int taskMaxDeliver = 3;
        private boolean workQueueEnabled = true;

        public Builder agentId(String agentId) { this.agentId = agentId; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder role(String role) { this.role = role; return this; }
        public Builder capabilities(List<String> capabilities) { this.capabilities = new ArrayList<>(capabilities); return this; }
        public Builder capability(String capability) { this.capabilities.add(capability); return this; }
        public Builder identityDirectory(Path identityDirectory) { this.identityDirectory = identityDirectory; return this; }
        public Builder version(String version) { this.version = version; return this; }
        public Builder natsUrl(String natsUrl) { this.natsUrl = natsUrl; return this; }
        public Builder connectAttempts(int connectAttempts) { this.connectAttempts = connectAttempts; return this; }
        public Builder retryDelay(Duration retryDelay) { this.retryDelay = retryDelay; return this; }
        public Builder connectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; return this; }
        public Builder heartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; return this; }
        public Builder livenessWindow(Duration livenessWindow) { this.livenessWindow = livenessWindow; return this; }
        public Builder messageRetention(Duration messageRetention) { this.messageRetention = messageRetention; return this; }
        public Builder cleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; return this; }
        public Builder encryptionEnabled(boolean encryptionEnabled) { this.encryptionEnabled = encryptionEnabled; return this; }
        public Builder signingEnabled(boolean signingEnabled) { this.signingEnabled = signingEnabled; return this; }
        public Builder messageMaxDeliver(int messageMaxDeliver) { this.messageMaxDeliver = messageMaxDeliver; return this; }
        public Builder taskMaxDeliver(int taskMaxDeliver) { this.taskMaxDeliver = taskMaxDeliver; return this; }
        public Builder workQueueEnabled(boolean workQueueEnabled) { this.workQueueEnabled = workQueueEnabled; return this; }

        public AgentConfiguration build() {
            if (agentId == null) throw new IllegalArgumentException("agentId is required");
            if (!Subjects.isValidAgentId(agentId)) throw new IllegalArgumentException("Invalid agentId: " + agentId);
            if (identityDirectory == null) throw new IllegalArgumentException("identityDirectory is required");
            if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
                throw new IllegalArgumentException("heartbeatInterval must be positive");
            }
            if (cleanupInterval.isZero() || cleanupInterval.isNegative()) {
                throw new IllegalArgumentException("cleanupInterval must be positive");
            }
            return new AgentConfiguration(this);
        }
    }
}
