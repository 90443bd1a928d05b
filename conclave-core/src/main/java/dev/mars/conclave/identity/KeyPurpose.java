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

/**
 * The two independent keypairs held by every agent identity.
 *
 * <p>Each purpose knows its JCA algorithm name and the fixed DER prefixes used to wrap
 * a 32-byte raw key into X.509 (public) and PKCS#8 (private) encodings.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum KeyPurpose {

    /**
     * Ed25519 keypair used for message signatures.
     */
    SIGNING("Ed25519", "signing",
            new byte[] {0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70, 0x03, 0x21, 0x00},
            new byte[] {0x30, 0x2e, 0x02, 0x01, 0x00, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70,
                    0x04, 0x22, 0x04, 0x20}),

    /**
     * X25519 keypair used for shared secret derivation.
     */
    EXCHANGE("X25519", "exchange",
            new byte[] {0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x6e, 0x03, 0x21, 0x00},
            new byte[] {0x30, 0x2e, 0x02, 0x01, 0x00, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x6e,
                    0x04, 0x22, 0x04, 0x20});

    private final String algorithm;
    private final String filePrefix;
    private final byte[] publicDerPrefix;
    private final byte[] privateDerPrefix;

    KeyPurpose(String algorithm, String filePrefix, byte[] publicDerPrefix, byte[] privateDerPrefix) {
        this.algorithm = algorithm;
        this.filePrefix = filePrefix;
        this.publicDerPrefix = publicDerPrefix;
        this.privateDerPrefix = privateDerPrefix;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public String privateKeyFileName() {
        return filePrefix + "_private_key.pem";
    }

    public String publicKeyFileName() {
        return filePrefix + "_public_key.pem";
    }

    byte[] publicDerPrefix() {
        return publicDerPrefix.clone();
    }

    byte[] privateDerPrefix() {
        return privateDerPrefix.clone();
    }
}
