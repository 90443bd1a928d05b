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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mars.conclave.core.exceptions.CryptoException;
import dev.mars.conclave.core.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Generates, persists and loads the per-agent identity, and signs with it.
 *
 * <p>The store owns one directory holding four PEM files (private and public halves of the
 * signing and exchange keypairs) plus an {@code identity.json} manifest. Private key files
 * are written with owner-only permissions where the file system supports POSIX attributes.</p>
 *
 * <p>Exactly one identity exists per agent id. {@link #regenerate()} replaces it, which
 * invalidates every shared secret peers derived from the previous exchange key.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class IdentityStore {

    private static final Logger logger = LoggerFactory.getLogger(IdentityStore.class);

    public static final String MANIFEST_FILE = "identity.json";
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final Path directory;
    private final String agentId;
    private final ObjectMapper objectMapper;

    private volatile AgentIdentity identity;

    public IdentityStore(Path directory, String agentId) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.agentId = Objects.requireNonNull(agentId, "agentId");
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        logger.info("Identity store initialized for agent {} at {}", agentId, directory);
    }

    /**
     * Returns true if the key files of both keypairs exist on disk.
     */
    public boolean hasIdentity() {
        for (KeyPurpose purpose : KeyPurpose.values()) {
            if (!Files.exists(privateKeyPath(purpose)) || !Files.exists(publicKeyPath(purpose))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Creates fresh signing and exchange keypairs and persists them with the manifest.
     *
     * @return the new identity, which also becomes the store's current identity
     * @throws StorageException if the directory cannot be created or written
     */
    public AgentIdentity generate() throws StorageException {
        logger.info("Generating new identity for agent {}", agentId);

        KeyPair signing = generateKeyPair(KeyPurpose.SIGNING);
        KeyPair exchange = generateKeyPair(KeyPurpose.EXCHANGE);
        AgentIdentity generated = new AgentIdentity(agentId, signing, exchange);

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException(directory, "cannot create identity directory", e);
        }

        for (KeyPurpose purpose : KeyPurpose.values()) {
            KeyPair pair = generated.keyPair(purpose);
            try {
                writePrivate(privateKeyPath(purpose),
                        KeyEncoding.privateKeyToPem(purpose, KeyEncoding.rawPrivateKey(pair.getPrivate())));
            } catch (CryptoException e) {
                throw new StorageException(privateKeyPath(purpose), "generated key is not extractable", e);
            }
            write(publicKeyPath(purpose),
                    KeyEncoding.publicKeyToPem(purpose, KeyEncoding.rawPublicKey(pair.getPublic())));
        }
        writeManifest();

        this.identity = generated;
        logger.info("Identity generated for agent {} (signing key {})",
                agentId, KeyEncoding.toHex(generated.signingPublicKey()));
        return generated;
    }

    /**
     * Loads the identity persisted in the store directory.
     *
     * @throws StorageException if any key file is missing or unreadable
     */
    public AgentIdentity load() throws StorageException {
        if (!hasIdentity()) {
            throw new StorageException(directory, "no identity found for agent " + agentId);
        }
        KeyPair signing = readKeyPair(KeyPurpose.SIGNING);
        KeyPair exchange = readKeyPair(KeyPurpose.EXCHANGE);
        this.identity = new AgentIdentity(agentId, signing, exchange);
        logger.info("Identity loaded for agent {}", agentId);
        return identity;
    }

    /**
     * Loads the persisted identity, generating one on first run.
     */
    public AgentIdentity loadOrGenerate() throws StorageException {
        return hasIdentity() ? load() : generate();
    }

    /**
     * Deletes the current identity and generates a new one.
     * Every shared secret derived from the old exchange key becomes unusable.
     */
    public AgentIdentity regenerate() throws StorageException {
        logger.warn("Regenerating identity for agent {}; previously derived shared secrets are invalidated", agentId);
        delete();
        return generate();
    }

    /**
     * Removes all key files and the manifest.
     */
    public void delete() throws StorageException {
        for (Path path : allFiles()) {
            try {
                if (Files.deleteIfExists(path)) {
                    logger.debug("Deleted {}", path);
                }
            } catch (IOException e) {
                throw new StorageException(path, "cannot delete identity file", e);
            }
        }
        this.identity = null;
        logger.info("Identity deleted for agent {}", agentId);
    }

    /**
     * Replaces the signing keypair with one supplied as PEM blocks. The exchange keypair is kept
     * if present, otherwise a new one is generated.
     */
    public AgentIdentity importSigningKeys(String privateKeyPem, String publicKeyPem)
            throws StorageException, CryptoException {
        logger.info("Importing signing keypair for agent {}", agentId);
        byte[] privateRaw = KeyEncoding.privateKeyFromPem(KeyPurpose.SIGNING, privateKeyPem);
        byte[] publicRaw = KeyEncoding.publicKeyFromPem(KeyPurpose.SIGNING, publicKeyPem);
        KeyPair signing = new KeyPair(
                KeyEncoding.publicKeyFromRaw(KeyPurpose.SIGNING, publicRaw),
                KeyEncoding.privateKeyFromRaw(KeyPurpose.SIGNING, privateRaw));

        KeyPair exchange = Files.exists(privateKeyPath(KeyPurpose.EXCHANGE))
                ? readKeyPair(KeyPurpose.EXCHANGE)
                : generateKeyPair(KeyPurpose.EXCHANGE);
        AgentIdentity imported = new AgentIdentity(agentId, signing, exchange);

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException(directory, "cannot create identity directory", e);
        }
        writePrivate(privateKeyPath(KeyPurpose.SIGNING), KeyEncoding.privateKeyToPem(KeyPurpose.SIGNING, privateRaw));
        write(publicKeyPath(KeyPurpose.SIGNING), KeyEncoding.publicKeyToPem(KeyPurpose.SIGNING, publicRaw));
        writePrivate(privateKeyPath(KeyPurpose.EXCHANGE), KeyEncoding.privateKeyToPem(KeyPurpose.EXCHANGE,
                KeyEncoding.rawPrivateKey(exchange.getPrivate())));
        write(publicKeyPath(KeyPurpose.EXCHANGE), KeyEncoding.publicKeyToPem(KeyPurpose.EXCHANGE,
                KeyEncoding.rawPublicKey(exchange.getPublic())));
        writeManifest();

        this.identity = imported;
        return imported;
    }

    // ==================== Signing ====================

    /**
     * Signs a message with the current identity's Ed25519 key.
     *
     * @throws CryptoException if the signature cannot be produced
     * @throws IllegalStateException if no identity has been generated or loaded
     */
    public byte[] sign(byte[] message) throws CryptoException {
        PrivateKey key = requireIdentity().getSigningKeyPair().getPrivate();
        try {
            Signature signer = Signature.getInstance(KeyPurpose.SIGNING.getAlgorithm());
            signer.initSign(key);
            signer.update(message);
            return signer.sign();
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to sign message", e);
        }
    }

    /**
     * Verifies a signature against the current identity's public signing key.
     * Never throws; any failure yields {@code false}.
     */
    public boolean verify(byte[] message, byte[] signature) {
        AgentIdentity current = identity;
        if (current == null) {
            return false;
        }
        return verify(current.getSigningKeyPair().getPublic(), message, signature);
    }

    /**
     * Verifies a signature made by a peer, given the peer's raw 32-byte signing public key.
     * Never throws; any failure yields {@code false}.
     */
    public static boolean verify(byte[] signingPublicKey, byte[] message, byte[] signature) {
        try {
            return verify(KeyEncoding.publicKeyFromRaw(KeyPurpose.SIGNING, signingPublicKey), message, signature);
        } catch (CryptoException e) {
            logger.debug("Signature verification rejected malformed public key: {}", e.getMessage());
            return false;
        }
    }

    private static boolean verify(PublicKey key, byte[] message, byte[] signature) {
        if (message == null || signature == null) {
            return false;
        }
        try {
            Signature verifier = Signature.getInstance(KeyPurpose.SIGNING.getAlgorithm());
            verifier.initVerify(key);
            verifier.update(message);
            return verifier.verify(signature);
        } catch (GeneralSecurityException | RuntimeException e) {
            logger.debug("Signature verification failed: {}", e.getMessage());
            return false;
        }
    }

    // ==================== Export ====================

    public byte[] publicKeyBytes(KeyPurpose purpose) {
        return KeyEncoding.rawPublicKey(requireIdentity().keyPair(purpose).getPublic());
    }

    public String publicKeyHex(KeyPurpose purpose) {
        return KeyEncoding.toHex(publicKeyBytes(purpose));
    }

    public String publicKeyPem(KeyPurpose purpose) {
        return KeyEncoding.publicKeyToPem(purpose, publicKeyBytes(purpose));
    }

    /**
     * Exports raw private key bytes. This is an audited operation and is always logged.
     */
    public byte[] exportPrivateKeyBytes(KeyPurpose purpose) throws CryptoException {
        logger.warn("AUDIT: {} private key export requested for agent {}", purpose.getAlgorithm(), agentId);
        return KeyEncoding.rawPrivateKey(requireIdentity().keyPair(purpose).getPrivate());
    }

    public String exportPrivateKeyHex(KeyPurpose purpose) throws CryptoException {
        return KeyEncoding.toHex(exportPrivateKeyBytes(purpose));
    }

    public String exportPrivateKeyPem(KeyPurpose purpose) throws CryptoException {
        return KeyEncoding.privateKeyToPem(purpose, exportPrivateKeyBytes(purpose));
    }

    // ==================== Accessors ====================

    /**
     * Returns the current identity.
     *
     * @throws IllegalStateException if no identity has been generated or loaded
     */
    public AgentIdentity requireIdentity() {
        AgentIdentity current = identity;
        if (current == null) {
            throw new IllegalStateException("No identity loaded for agent " + agentId);
        }
        return current;
    }

    public IdentityManifest readManifest() throws StorageException {
        Path path = directory.resolve(MANIFEST_FILE);
        try {
            return objectMapper.readValue(path.toFile(), IdentityManifest.class);
        } catch (IOException e) {
            throw new StorageException(path, "cannot read identity manifest", e);
        }
    }

    public String getAgentId() {
        return agentId;
    }

    public Path getDirectory() {
        return directory;
    }

    Path privateKeyPath(KeyPurpose purpose) {
        return directory.resolve(purpose.privateKeyFileName());
    }

    Path publicKeyPath(KeyPurpose purpose) {
        return directory.resolve(purpose.publicKeyFileName());
    }

    // ==================== Private Helpers ====================

    private List<Path> allFiles() {
        return List.of(
                privateKeyPath(KeyPurpose.SIGNING), publicKeyPath(KeyPurpose.SIGNING),
                privateKeyPath(KeyPurpose.EXCHANGE), publicKeyPath(KeyPurpose.EXCHANGE),
                directory.resolve(MANIFEST_FILE));
    }

    private static KeyPair generateKeyPair(KeyPurpose purpose) {
        try {
            return KeyPairGenerator.getInstance(purpose.getAlgorithm()).generateKeyPair();
        } catch (GeneralSecurityException e) {
            // Ed25519 and X25519 ship with every JDK since 15
            throw new IllegalStateException(purpose.getAlgorithm() + " is not available", e);
        }
    }

    private KeyPair readKeyPair(KeyPurpose purpose) throws StorageException {
        String privatePem = read(privateKeyPath(purpose));
        String publicPem = read(publicKeyPath(purpose));
        try {
            byte[] privateRaw = KeyEncoding.privateKeyFromPem(purpose, privatePem);
            byte[] publicRaw = KeyEncoding.publicKeyFromPem(purpose, publicPem);
            return new KeyPair(KeyEncoding.publicKeyFromRaw(purpose, publicRaw),
                    KeyEncoding.privateKeyFromRaw(purpose, privateRaw));
        } catch (CryptoException e) {
            throw new StorageException(privateKeyPath(purpose), "stored key is corrupt", e);
        }
    }

    private void writeManifest() throws StorageException {
        Path path = directory.resolve(MANIFEST_FILE);
        try {
            objectMapper.writeValue(path.toFile(), new IdentityManifest(agentId, Instant.now().toString()));
        } catch (IOException e) {
            throw new StorageException(path, "cannot write identity manifest", e);
        }
    }

    private static String read(Path path) throws StorageException {
        try {
            return Files.readString(path, StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new StorageException(path, "cannot read key file", e);
        }
    }

    private static void write(Path path, String content) throws StorageException {
        try {
            Files.writeString(path, content, StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new StorageException(path, "cannot write key file", e);
        }
    }

    private static void writePrivate(Path path, String content) throws StorageException {
        write(path, content);
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            try {
                Files.setPosixFilePermissions(path, OWNER_ONLY);
            } catch (IOException e) {
                throw new StorageException(path, "cannot restrict private key permissions", e);
            }
        }
    }
}
