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

import java.security.KeyPair;
import java.util.Objects;

/**
 * An agent's loaded key material: one Ed25519 signing keypair and one independent
 * X25519 exchange keypair.
 *
 * <p>Instances never leave the owning process. Peers only ever see the public halves,
 * which are published at registration time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class AgentIdentity {

    private final String agentId;
    private final KeyPair signingKeyPair;
    private final KeyPair exchangeKeyPair;

    public AgentIdentity(String agentId, KeyPair signingKeyPair, KeyPair exchangeKeyPair) {
        this.agentId = Objects.requireNonNull(agentId, "agentId");
        this.signingKeyPair = Objects.requireNonNull(signingKeyPair, "signingKeyPair");
        this.exchangeKeyPair = Objects.requireNonNull(exchangeKeyPair, "exchangeKeyPair");
    }

    public String getAgentId() {
        return agentId;
    }

    public KeyPair getSigningKeyPair() {
        return signingKeyPair;
    }

    public KeyPair getExchangeKeyPair() {
        return exchangeKeyPair;
    }

    public KeyPair keyPair(KeyPurpose purpose) {
        return purpose == KeyPurpose.SIGNING ? signingKeyPair : exchangeKeyPair;
    }

    public byte[] signingPublicKey() {
        return KeyEncoding.rawPublicKey(signingKeyPair.getPublic());
    }

    public byte[] exchangePublicKey() {
        return KeyEncoding.rawPublicKey(exchangeKeyPair.getPublic());
    }

    @Override
    public String toString() {
        return "AgentIdentity{agentId='" + agentId + "', signingKey=" + KeyEncoding.toHex(signingPublicKey())
                + ", exchangeKey=" + KeyEncoding.toHex(exchangePublicKey()) + "}";
    }
}
