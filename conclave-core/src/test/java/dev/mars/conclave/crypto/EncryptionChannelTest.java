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
import dev.mars.conclave.core.exceptions.DecryptionException;
import dev.mars.conclave.identity.IdentityStore;
import dev.mars.conclave.identity.KeyPurpose;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.SecureRandom;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EncryptionChannel key agreement and authenticated encryption.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 */
class EncryptionChannelTest {

    @TempDir
    Path tempDir;

    private IdentityStore alice;
    private IdentityStore bob;
    private EncryptionChannel aliceChannel;
    private EncryptionChannel bobChannel;

    @BeforeEach
    void setUp() throws Exception {
        alice = new IdentityStore(tempDir.resolve("alice"), "alice");
        bob = new IdentityStore(tempDir.resolve("bob"), "bob");
        alice.generate();
        bob.generate();
        aliceChannel = new EncryptionChannel(alice);
        bobChannel = new EncryptionChannel(bob);
    }

    @Test
    @DisplayName("Should derive the same shared secret on both sides")
    void shouldDeriveSymmetricSharedSecret() throws Exception {
        byte[] aliceSide = aliceChannel.deriveSharedSecret(bob.publicKeyBytes(KeyPurpose.EXCHANGE));
        byte[] bobSide = bobChannel.deriveSharedSecret(alice.publicKeyBytes(KeyPurpose.EXCHANGE));

        assertEquals(32, aliceSide.length);
        assertArrayEquals(aliceSide, bobSide);
    }

    @Test
    @DisplayName("Should deliver Alice's message to Bob and reject a corrupted tag")
    void shouldExchangeSecureMessage() throws Exception {
        String original = "Hello, this is a secure message!";

        EncryptedEnvelope envelope = aliceChannel.encryptForPeer(
                original.getBytes(StandardCharsets.UTF_8), bob.publicKeyBytes(KeyPurpose.EXCHANGE));
        byte[] decrypted = bobChannel.decryptFromPeer(envelope, alice.publicKeyBytes(KeyPurpose.EXCHANGE));
        assertEquals(original, new String(decrypted, StandardCharsets.UTF_8));

        byte[] wire = envelope.toBytes();
        wire[EncryptedEnvelope.NONCE_LENGTH] ^= 0x01;
        EncryptedEnvelope corrupted = EncryptedEnvelope.fromBytes(wire);
        assertThrows(CryptoException.class,
                () -> bobChannel.decryptFromPeer(corrupted, alice.publicKeyBytes(KeyPurpose.EXCHANGE)));
    }

    @Test
    @DisplayName("Should lay out the wire form as nonce, tag, ciphertext")
    void shouldUseWireLayout() throws Exception {
        byte[] key = aliceChannel.deriveSharedSecret(bob.publicKeyBytes(KeyPurpose.EXCHANGE));
        byte[] plaintext = "twelve bytes".getBytes(StandardCharsets.UTF_8);

        EncryptedEnvelope envelope = aliceChannel.encrypt(plaintext, key);
        byte[] wire = envelope.toBytes();

        assertEquals(EncryptedEnvelope.HEADER_LENGTH + plaintext.length, wire.length);
        assertArrayEquals(plaintext, bobChannel.decrypt(wire, key));
    }

    @Test
    @DisplayName("Should use a fresh nonce for every encryption")
    void shouldUseFreshNonce() throws Exception {
        byte[] key = new byte[32];
        new SecureRandom().nextBytes(key);
        byte[] plaintext = "same".getBytes(StandardCharsets.UTF_8);

        EncryptedEnvelope first = aliceChannel.encrypt(plaintext, key);
        EncryptedEnvelope second = aliceChannel.encrypt(plaintext, key);

        assertFalse(java.util.Arrays.equals(first.getNonce(), second.getNonce()));
    }

    @ParameterizedTest(name = "flipping bit at byte {0} fails decryption")
    @ValueSource(ints = {0, 11, 12, 20, 27, 28, 40})
    @DisplayName("Should fail closed when any byte of the envelope changes")
    void shouldFailOnBitFlip(int position) throws Exception {
        byte[] key = new byte[32];
        new SecureRandom().nextBytes(key);
        byte[] wire = aliceChannel.encrypt("a payload that spans past byte forty".getBytes(StandardCharsets.UTF_8), key)
                .toBytes();
        wire[position] ^= 0x10;

        assertThrows(DecryptionException.class, () -> aliceChannel.decrypt(wire, key));
    }

    @Test
    @DisplayName("Should reject envelopes shorter than nonce plus tag")
    void shouldRejectShortEnvelope() {
        assertThrows(DecryptionException.class, () -> EncryptedEnvelope.fromBytes(new byte[27]));
    }

    @Test
    @DisplayName("Should reject a wrong key")
    void shouldRejectWrongKey() throws Exception {
        byte[] key = new byte[32];
        byte[] other = new byte[32];
        other[0] = 1;
        EncryptedEnvelope envelope = aliceChannel.encrypt("secret".getBytes(StandardCharsets.UTF_8), key);

        assertThrows(DecryptionException.class, () -> aliceChannel.decrypt(envelope, other));
        assertThrows(DecryptionException.class, () -> aliceChannel.decrypt(envelope, new byte[16]));
    }

    @Test
    @DisplayName("Should re-derive after the peer rotates its key")
    void shouldMissCacheAfterPeerRotation() throws Exception {
        SharedSecretCache cache = new SharedSecretCache(aliceChannel);
        byte[] before = cache.secretFor(bob.publicKeyBytes(KeyPurpose.EXCHANGE));
        assertArrayEquals(before, cache.secretFor(bob.publicKeyBytes(KeyPurpose.EXCHANGE)));
        assertEquals(1, cache.size());

        bob.regenerate();
        byte[] after = cache.secretFor(bob.publicKeyBytes(KeyPurpose.EXCHANGE));

        assertFalse(java.util.Arrays.equals(before, after));
        assertEquals(2, cache.size());
    }

    @Test
    @DisplayName("Should not serve secrets derived from a regenerated local identity")
    void shouldMissCacheAfterOwnRegeneration() throws Exception {
        SharedSecretCache cache = new SharedSecretCache(aliceChannel);
        byte[] bobKey = bob.publicKeyBytes(KeyPurpose.EXCHANGE);
        byte[] before = cache.secretFor(bobKey);

        alice.regenerate();
        byte[] after = cache.secretFor(bobKey);

        assertArrayEquals(aliceChannel.deriveSharedSecret(bobKey), after);
        assertFalse(java.util.Arrays.equals(before, after));
        assertArrayEquals(after, bobChannel.deriveSharedSecret(alice.publicKeyBytes(KeyPurpose.EXCHANGE)));
    }

    @Test
    @DisplayName("Should evict every cached secret for a peer")
    void shouldEvictPeer() throws Exception {
        SharedSecretCache cache = new SharedSecretCache(aliceChannel);
        byte[] bobKey = bob.publicKeyBytes(KeyPurpose.EXCHANGE);
        cache.secretFor(bobKey);
        alice.regenerate();
        cache.secretFor(bobKey);
        assertEquals(2, cache.size());

        cache.evict(bobKey);

        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("Should round-trip public keys through base64 transport encoding")
    void shouldEncodePublicKeys() throws Exception {
        byte[] raw = bob.publicKeyBytes(KeyPurpose.EXCHANGE);

        assertArrayEquals(raw, EncryptionChannel.decodePublicKey(EncryptionChannel.encodePublicKey(raw)));
        assertThrows(CryptoException.class, () -> EncryptionChannel.decodePublicKey("AAAA"));
    }
}
