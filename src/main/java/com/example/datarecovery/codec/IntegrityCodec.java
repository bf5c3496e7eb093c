package com.example.datarecovery.codec;

import com.example.datarecovery.exception.DecryptionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Checksums and encrypts snapshot payloads.
 * <p>
 * Canonical form: compact JSON with the keys of every object sorted, array order kept.
 * Structurally equal payloads therefore serialize, and hash, identically.
 * <p>
 * Ciphertext layout: 12-byte random IV, then AES-GCM ciphertext with a 128-bit tag.
 * The key never leaves this instance.
 */
@Component
@Slf4j
public class IntegrityCodec {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final String DIGEST_ALGORITHM = "SHA-256";
    private static final int IV_LENGTH = 12;
    private static final int GCM_TAG_BITS = 128;

    private final SecretKey key;
    private final ObjectMapper canonicalMapper = new ObjectMapper();
    private final SecureRandom secureRandom = new SecureRandom();

    public IntegrityCodec(EncryptionKeySource keySource) {
        this.key = keySource.getKey();
    }

    // ==================== Canonical form & checksum ====================

    public byte[] canonicalBytes(JsonNode payload) {
        try {
            return canonicalMapper.writeValueAsBytes(canonicalize(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload cannot be serialized", e);
        }
    }

    /**
     * SHA-256 of the canonical serialization, as lowercase hex.
     */
    public String checksum(JsonNode payload) {
        return checksum(canonicalBytes(payload));
    }

    public String checksum(byte[] canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance(DIGEST_ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(canonical));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " not available", e);
        }
    }

    /**
     * Parse decrypted bytes back into a JSON tree.
     *
     * @throws DecryptionException if the bytes are not JSON
     */
    public JsonNode parse(byte[] plaintext) {
        try {
            return canonicalMapper.readTree(plaintext);
        } catch (IOException e) {
            throw new DecryptionException("Decrypted payload is not valid JSON", e);
        }
    }

    static JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            Map<String, JsonNode> sorted = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                sorted.put(field.getKey(), canonicalize(field.getValue()));
            }
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            for (Map.Entry<String, JsonNode> field : sorted.entrySet()) {
                result.set(field.getKey(), field.getValue());
            }
            return result;
        }
        if (node.isArray()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode(node.size());
            for (JsonNode element : node) {
                result.add(canonicalize(element));
            }
            return result;
        }
        return node;
    }

    // ==================== Encryption ====================

    public byte[] encrypt(byte[] plaintext) {
        byte[] iv = new byte[IV_LENGTH];
        secureRandom.nextBytes(iv);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext);

            log.trace("Encrypted {} bytes into {} bytes", plaintext.length, IV_LENGTH + ciphertext.length);
            return ByteBuffer.allocate(IV_LENGTH + ciphertext.length)
                .put(iv)
                .put(ciphertext)
                .array();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Snapshot encryption failed: " + e.getClass().getSimpleName(), e);
        }
    }

    /**
     * Inverse of {@link #encrypt}. Never returns unauthenticated bytes.
     *
     * @throws DecryptionException on truncated input, a modified ciphertext or the wrong key
     */
    public byte[] decrypt(byte[] ciphertext) {
        if (ciphertext == null || ciphertext.length < IV_LENGTH + GCM_TAG_BITS / 8) {
            throw new DecryptionException("Ciphertext is empty or truncated");
        }

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, ciphertext, 0, IV_LENGTH));
            return cipher.doFinal(ciphertext, IV_LENGTH, ciphertext.length - IV_LENGTH);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Authentication tag mismatch: ciphertext modified or wrong key", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Ciphertext could not be decrypted: " + e.getClass().getSimpleName(), e);
        }
    }
}
