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

import dev.mars.conclave.core.exceptions.DecryptionException;

import java.util.Arrays;
import java.util.Base64;

/**
 * Authenticated ciphertext with its nonce and tag.
 *
 * <p>Wire layout is {@code nonce(12) || tag(16) || ciphertext}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
public final class EncryptedEnvelope {

    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;
    public static final int HEADER_LENGTH = NONCE_LENGTH + TAG_LENGTH;

    private final byte[] nonce;
    private final byte[] tag;
    private final byte[] ciphertext;

    public EncryptedEnvelope(byte[] nonce, byte[] tag, byte[] ciphertext) throws DecryptionException {
        if (nonce == null || nonce.length != NONCE_LENGTH) {
            throw new DecryptionException("Nonce must be " + NONCE_LENGTH + " bytes");
        }
        if (tag == null || tag.length != TAG_LENGTH) {
            throw new DecryptionException("Tag must be " + TAG_LENGTH + " bytes");
        }
        if (ciphertext == null) {
            throw new DecryptionException("Ciphertext is missing");
        }
        this.nonce = nonce.clone();
        this.tag = tag.clone();
        this.ciphertext = ciphertext.clone();
    }

    /**
     * Parses the wire layout.
     *
     * @throws DecryptionException if the input is shorter than nonce plus tag
     */
    public static EncryptedEnvelope fromBytes(byte[] wire) throws DecryptionException {
        if (wire == null || wire.length < HEADER_LENGTH) {
            throw new DecryptionException("Envelope too short: need at least " + HEADER_LENGTH + " bytes, got "
                    + (wire == null ? 0 : wire.length));
        }
        return new EncryptedEnvelope(
                Arrays.copyOfRange(wire, 0, NONCE_LENGTH),
                Arrays.copyOfRange(wire, NONCE_LENGTH, HEADER_LENGTH),
                Arrays.copyOfRange(wire, HEADER_LENGTH, wire.length));
    }

    public static EncryptedEnvelope fromBase64(String encoded) throws DecryptionException {
        try {
            return fromBytes(Base64.getDecoder().decode(encoded));
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Envelope is not valid base64", e);
        }
    }

    public byte[] toBytes() {
        byte[] out = new byte[HEADER_LENGTH + ciphertext.length];
        System.arraycopy(nonce, 0, out, 0, NONCE_LENGTH);
        System.arraycopy(tag, 0, out, NONCE_LENGTH, TAG_LENGTH);
        System.arraycopy(ciphertext, 0, out, HEADER_LENGTH, ciphertext.length);
        return out;
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(toBytes());
    }

    public byte[] getNonce() {
        return nonce.clone();
    }

    public byte[] getTag() {
        return tag.clone();
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    @Override
    public String toString() {
        return "EncryptedEnvelope{ciphertextLength=" + ciphertext.length + "}";
    }
}
