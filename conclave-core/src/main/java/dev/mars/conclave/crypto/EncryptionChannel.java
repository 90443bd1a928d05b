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
import dev.mars.conclave.identity.KeyEncoding;
import dev.mars.conclave.identity.KeyPurpose;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.KeyAgreement;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Authenticated encryption between two agents.
 *
 * <p>A shared key is derived with X25519 and hashed once with SHA-256. Payloads are sealed
 * with AES-256-GCM under a fresh random nonce per call. Decryption fails closed: a tag
 * mismatch surfaces as {@link DecryptionException} and never as altered plaintext.</p>
 *
 * <p>The channel holds no long-term secrets of its own; it reads the current keys from the
 * bound {@link IdentityStore} on every call.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
public class EncryptionChannel {

    private static final Logger logger = LoggerFactory.getLogger(EncryptionChannel.class);

    public static final int KEY_LENGTH = 32;
    private static final String CIPHER = "AES/GCM/NoPadding";
    private static final String KEY_AGREEMENT = "XDH";
    private static final int TAG_BITS = EncryptedEnvelope.TAG_LENGTH * 8;

    private final IdentityStore identityStore;
    private final SecureRandom random;

    public EncryptionChannel(IdentityStore identityStore) {
        this(identityStore, new SecureRandom());
    }

    EncryptionChannel(IdentityStore identityStore, SecureRandom random) {
        this.identityStore = identityStore;
        this.random = random;
    }

    // ==================== Key Derivation ====================

    /**
     * Derives a 32-byte key from our exchange private key and the peer's raw exchange public key.
     * Both peers derive the same value.
     */
    public static byte[] deriveSharedSecret(PrivateKey ownExchangePrivate, byte[] peerExchangePublic)
            throws CryptoException {
        try {
            KeyAgreement agreement = KeyAgreement.getInstance(KEY_AGREEMENT);
            agreement.init(ownExchangePrivate);
            agreement.doPhase(KeyEncoding.publicKeyFromRaw(KeyPurpose.EXCHANGE, peerExchangePublic), true);
            byte[] shared = agreement.generateSecret();
            try {
                return MessageDigest.getInstance("SHA-256").digest(shared);
            } finally {
                Arrays.fill(shared, (byte) 0);
            }
        } catch (GeneralSecurityException | IllegalStateException e) {
            throw new CryptoException("Key agreement failed", e);
        }
    }

    public byte[] deriveSharedSecret(byte[] peerExchangePublic) throws CryptoException {
        return deriveSharedSecret(
                identityStore.requireIdentity().getExchangeKeyPair().getPrivate(), peerExchangePublic);
    }

    // ==================== Encrypt / Decrypt ====================

    public EncryptedEnvelope encrypt(byte[] plaintext, byte[] key) throws CryptoException {
        requireKey(key);
        byte[] nonce = new byte[EncryptedEnvelope.NONCE_LENGTH];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, nonce));
            // JCE appends the tag after the ciphertext
            byte[] sealed = cipher.doFinal(plaintext);
            int bodyLength = sealed.length - EncryptedEnvelope.TAG_LENGTH;
            return new EncryptedEnvelope(nonce,
                    Arrays.copyOfRange(sealed, bodyLength, sealed.length),
                    Arrays.copyOfRange(sealed, 0, bodyLength));
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Encryption failed", e);
        }
    }

    /**
     * Opens an envelope.
     *
     * @throws DecryptionException if authentication fails or the key is malformed
     */
    public byte[] decrypt(EncryptedEnvelope envelope, byte[] key) throws DecryptionException {
        if (key == null || key.length != KEY_LENGTH) {
            throw new DecryptionException("Key must be " + KEY_LENGTH + " bytes");
        }
        byte[] ciphertext = envelope.getCiphertext();
        byte[] sealed = Arrays.copyOf(ciphertext, ciphertext.length + EncryptedEnvelope.TAG_LENGTH);
        System.arraycopy(envelope.getTag(), 0, sealed, ciphertext.length, EncryptedEnvelope.TAG_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_BITS, envelope.getNonce()));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            logger.debug("Authentication tag mismatch on {}", envelope);
            throw new DecryptionException("Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Decryption failed", e);
        }
    }

    public byte[] decrypt(byte[] wire, byte[] key) throws DecryptionException {
        return decrypt(EncryptedEnvelope.fromBytes(wire), key);
    }

    public EncryptedEnvelope encryptForPeer(byte[] plaintext, byte[] peerExchangePublic) throws CryptoException {
        byte[] key = deriveSharedSecret(peerExchangePublic);
        try {
            return encrypt(plaintext, key);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    public byte[] decryptFromPeer(EncryptedEnvelope envelope, byte[] peerExchangePublic) throws CryptoException {
        byte[] key = deriveSharedSecret(peerExchangePublic);
        try {
            return decrypt(envelope, key);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    // ==================== Signing ====================

    public byte[] sign(byte[] payload) throws CryptoException {
        return identityStore.sign(payload);
    }

    public boolean verify(byte[] payload, byte[] signature, byte[] signerPublicKey) {
        return IdentityStore.verify(signerPublicKey, payload, signature);
    }

    // ==================== Key Transport ====================

    public static String encodePublicKey(byte[] raw) {
        return Base64.getEncoder().encodeToString(raw);
    }

    public static byte[] decodePublicKey(String encoded) throws CryptoException {
        try {
            byte[] raw = Base64.getDecoder().decode(encoded);
            if (raw.length != KeyEncoding.RAW_KEY_LENGTH) {
                throw new CryptoException("Public key must be " + KeyEncoding.RAW_KEY_LENGTH + " bytes");
            }
            return raw;
        } catch (IllegalArgumentException e) {
            throw new CryptoException("Public key is not valid base64", e);
        }
    }

    public IdentityStore getIdentityStore() {
        return identityStore;
    }

    private static void requireKey(byte[] key) throws CryptoException {
        if (key == null || key.length != KEY_LENGTH) {
            throw new CryptoException("Key must be " + KEY_LENGTH + " bytes");
        }
    }
}
