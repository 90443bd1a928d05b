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

package dev.mars.conclave.identity;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Small descriptor persisted next to the key files, recording key types and format version.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class IdentityManifest {

    public static final String CURRENT_VERSION = "1.0.0";

    @JsonProperty("version")
    private String version;

    @JsonProperty("agent_id")
    private String agentId;

    @JsonProperty("signing_key_type")
    private String signingKeyType;

    @JsonProperty("exchange_key_type")
    private String exchangeKeyType;

    @JsonProperty("created_at")
    private String createdAt;

    /**
     * Default constructor for JSON deserialization.
     */
    public IdentityManifest() {
    }

    public IdentityManifest(String agentId, String createdAt) {
        this.version = CURRENT_VERSION;
        this.agentId = agentId;
        this.signingKeyType = KeyPurpose.SIGNING.getAlgorithm();
        this.exchangeKeyType = KeyPurpose.EXCHANGE.getAlgorithm();
        this.createdAt = createdAt;
    }

    public String getVersion() {
        return version;
    }

    public String getAgentId() {
        return agentId;
    }

    public String getSigningKeyType() {
        return signingKeyType;
    }

    public String getExchangeKeyType() {
        return exchangeKeyType;
    }

    public String getCreatedAt() {
        return createdAt;
    }
}
