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

import dev.mars.conclave.coordination.topology.Subjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Properties;

/**
 * Centralized configuration loader for a Conclave agent node.
 *
 * <p>Loads configuration from conclave.properties with environment variable and system property
 * override support. Environment variables use the upper-cased key with dots and dashes replaced
 * by underscores (CONCLAVE_AGENT_ID, CONCLAVE_NATS_URL, etc.).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 */
public final class AgentConfig {

    private static final Logger logger = LoggerFactory.getLogger(AgentConfig.class);
    private static final String CONFIG_FILE = "conclave.properties";
    private static final AgentConfig INSTANCE = new AgentConfig();

    private final Properties properties;

    private AgentConfig() {
        this.properties = new Properties();
        loadProperties();
        logConfiguration();
    }

    /**
     * Gets the singleton configuration instance.
     */
    public static AgentConfig get() {
        return INSTANCE;
    }

    // ==================== Agent Identity ====================

    /**
     * Gets the agent ID, derived from the hostname when not configured.
     */
    public String getAgentId() {
        String agentId = getString("conclave.agent.id", "");
        if (agentId.isEmpty()) {
            agentId = deriveAgentIdFromHostname();
            logger.debug("Agent ID not configured, derived from hostname: {}", agentId);
        }
        return agentId;
    }

    public String getAgentName() {
        return getString("conclave.agent.name", getAgentId());
    }

    public String getAgentRole() {
        return getString("conclave.agent.role", "worker");
    }

    public String getCapabilities() {
        return getString("conclave.agent.capabilities", "messaging");
    }

    public String getIdentityDirectory() {
        return getString("conclave.agent.identity.dir", ".conclave/identity");
    }

    public String getVersion() {
        return getString("conclave.agent.version", "1.0.0");
    }

    // ==================== Broker Connection ====================

    public String getNatsUrl() {
        return getString("conclave.nats.url", "nats://localhost:4222");
    }

    public int getConnectAttempts() {
        return getInt("conclave.nats.connect-attempts", 5);
    }

    public long getRetryDelayMs() {
        return getLong("conclave.nats.retry-delay-ms", 5000);
    }

    public long getConnectTimeoutMs() {
        return getLong("conclave.nats.connect-timeout-ms", 5000);
    }

    // ==================== Liveness ====================

    public long getHeartbeatIntervalMs() {
        return getLong("conclave.agent.heartbeat.interval-ms", 30000);
    }

    public long getLivenessWindowMs() {
        return getLong("conclave.registry.liveness-window-ms", 60000);
    }

    // ==================== Messaging ====================

    public boolean isEncryptionEnabled() {
        return getBoolean("conclave.messages.encryption.enabled", true);
    }

    public boolean isSigningEnabled() {
        return getBoolean("conclave.messages.signing.enabled", true);
    }

    public long getMessageRetentionMs() {
        return getLong("conclave.messages.retention-ms", 3600000);
    }

    public long getCleanupIntervalMs() {
        return getLong("conclave.messages.cleanup-interval-ms", 300000);
    }

    public int getMessageMaxDeliver() {
        return getInt("conclave.messages.max-deliver", 5);
    }

    // ==================== Tasks ====================

    public int getTaskMaxDeliver() {
        return getInt("conclave.tasks.max-deliver", 3);
    }

    public boolean isWorkQueueEnabled() {
        return getBoolean("conclave.tasks.work-queue.enabled", true);
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with layered resolution.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., CONCLAVE_NATS_URL)</li>
     *   <li>System property (e.g., -Dconclave.nats.url=...)</li>
     *   <li>Properties file (conclave.properties)</li>
     *   <li>Default value</li>
     * </ol>
     */
    public String getString(String key, String defaultValue) {
        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysProp = System.getProperty(key);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        return properties.getProperty(key, defaultValue);
    }

    /**
     * Validates that required configuration is present and values are sensible.
     * Called during startup to fail fast on misconfiguration.
     *
     * @throws IllegalStateException if required configuration is invalid
     */
    public void validate() {
        String agentId = getAgentId();
        if (!Subjects.isValidAgentId(agentId)) {
            throw new IllegalStateException(
                    "Agent ID must be a single subject token without '.', '*', '>' or whitespace, got: " + agentId);
        }

        String natsUrl = getNatsUrl();
        if (!natsUrl.startsWith("nats://") && !natsUrl.startsWith("tls://")) {
            throw new IllegalStateException("NATS URL must start with nats:// or tls://, got: " + natsUrl);
        }

        if (getConnectAttempts() < 1) {
            throw new IllegalStateException("Connect attempts must be at least 1, got: " + getConnectAttempts());
        }
        if (getHeartbeatIntervalMs() <= 0) {
            throw new IllegalStateException(
                    "Heartbeat interval must be positive, got: " + getHeartbeatIntervalMs());
        }
        if (getLivenessWindowMs() <= getHeartbeatIntervalMs()) {
            throw new IllegalStateException("Liveness window (" + getLivenessWindowMs()
                    + "ms) must be longer than the heartbeat interval (" + getHeartbeatIntervalMs() + "ms)");
        }
        if (getCleanupIntervalMs() <= 0) {
            throw new IllegalStateException("Cleanup interval must be positive, got: " + getCleanupIntervalMs());
        }

        logger.info("Agent configuration validated successfully");
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    // ==================== Private Helpers ====================

    private void loadProperties() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults and environment variables", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.debug("Stack trace", e);
        }
    }

    // Hostnames carry dots, which are subject separators
    private String deriveAgentIdFromHostname() {
        try {
            String host = InetAddress.getLocalHost().getHostName();
            return "agent-" + host.replaceAll("[.*>\\s]", "-");
        } catch (UnknownHostException e) {
            logger.warn("Could not determine hostname, using fallback agent ID");
            return "agent-" + ProcessHandle.current().pid();
        }
    }

    private void logConfiguration() {
        logger.info("=== Conclave Agent Configuration ===");
        logger.info("  Agent ID:             {}", getAgentId());
        logger.info("  Role:                 {}", getAgentRole());
        logger.info("  Capabilities:         {}", getCapabilities());
        logger.info("  Identity Directory:   {}", getIdentityDirectory());
        logger.info("  --- Broker ---");
        logger.info("  NATS URL:             {}", getNatsUrl());
        logger.info("  Connect Attempts:     {}", getConnectAttempts());
        logger.info("  Retry Delay:          {}ms", getRetryDelayMs());
        logger.info("  --- Liveness ---");
        logger.info("  Heartbeat Interval:   {}ms", getHeartbeatIntervalMs());
        logger.info("  Liveness Window:      {}ms", getLivenessWindowMs());
        logger.info("  --- Messaging ---");
        logger.info("  Encryption:           {}", isEncryptionEnabled());
        logger.info("  Signing:              {}", isSigningEnabled());
        logger.info("  Retention:            {}ms", getMessageRetentionMs());
        logger.info("  --- Tasks ---");
        logger.info("  Work Queue:           {}", isWorkQueueEnabled());
        logger.info("  Max Deliver:          {}", getTaskMaxDeliver());
        logger.info("====================================");
    }
}
