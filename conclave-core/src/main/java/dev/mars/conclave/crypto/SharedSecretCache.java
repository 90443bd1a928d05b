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

package dev.mars.conclave.crypto;

import dev.mars.conclave.core.exceptions.CryptoException;
import dev.mars.conclave.identity.KeyEncoding;
import dev.mars.conclave.identity.KeyPurpose;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caller-owned cache of derived shared secrets, keyed by our exchange public key together with
 * the peer's exchange public key.
 *
 * <p>A key rotation on either side produces a different key pair and therefore misses the cache.
 * Entries for retired keys stay until {@link #clear()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
public class SharedSecretCache {

    private final EncryptionChannel channel;
    private final Map<String, byte[]> secrets = new ConcurrentHashMap<>();

    public SharedSecretCache(EncryptionChannel channel) {
        this.channel = channel;
    }

    public byte[] secretFor(byte[] peerExchangePublic) throws CryptoException {
        String key = cacheKey(peerExchangePublic);
        byte[] cached = secrets.get(key);
        if (cached == null) {
            cached = channel.deriveSharedSecret(peerExchangePublic);
            secrets.put(key, cached);
        }
        return cached.clone();
    }

    public void evict(byte[] peerExchangePublic) {
        String suffix = ":" + KeyEncoding.toHex(peerExchangePublic);
        secrets.keySet().removeIf(key -> key.endsWith(suffix));
    }

    public void clear() {
        secrets.clear();
    }

    public int size() {
        return secrets.size();
    }

    private String cacheKey(byte[] peerExchangePublic) {
        return channel.getIdentityStore().publicKeyHex(KeyPurpose.EXCHANGE) + ":" + KeyEncoding.toHex(peerExchangePublic);
    }
}
