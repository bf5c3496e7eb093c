package com.example.datarecovery.codec;

import com.example.datarecovery.exception.DecryptionException;
import com.example.datarecovery.exception.IntegrityException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for IntegrityCodec.
 * Covers canonical checksums and AES-GCM encryption of snapshot payloads.
 */
class IntegrityCodecTest {

    private static final String KEY = "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=";
    private static final String OTHER_KEY = "ZmVkY2JhOTg3NjU0MzIxMGZlZGNiYTk4NzY1NDMyMTA=";

    private final ObjectMapper mapper = new ObjectMapper();
    private IntegrityCodec codec;

    @BeforeEach
    void setUp() {
        codec = new IntegrityCodec(() -> PropertyEncryptionKeySource.decode(KEY));
    }

    @Test
    void testChecksumOfEmptyObject() {
        // SHA-256 of "{}"
        assertEquals("44136fa355b3678a1146ad16f7e8649e94fb4fc21fe77e8310c060f61caaff8a",
            codec.checksum(mapper.createObjectNode()));
    }

    @Test
    void testChecksumIgnoresKeyOrder() throws Exception {
        JsonNode first = mapper.readTree("{\"users\":[{\"b\":2,\"a\":{\"y\":1,\"x\":[3,4]}}],\"jobs\":[]}");
        JsonNode second = mapper.readTree("{\"jobs\":[],\"users\":[{\"a\":{\"x\":[3,4],\"y\":1},\"b\":2}]}");

        assertEquals(codec.checksum(first), codec.checksum(second));
        assertArrayEquals(codec.canonicalBytes(first), codec.canonicalBytes(second));
        assertEquals("{\"jobs\":[],\"users\":[{\"a\":{\"x\":[3,4],\"y\":1},\"b\":2}]}",
            new String(codec.canonicalBytes(first), StandardCharsets.UTF_8));
    }

    @Test
    void testChecksumDependsOnArrayOrder() throws Exception {
        JsonNode first = mapper.readTree("{\"users\":[{\"id\":1},{\"id\":2}]}");
        JsonNode second = mapper.readTree("{\"users\":[{\"id\":2},{\"id\":1}]}");

        assertNotEquals(codec.checksum(first), codec.checksum(second));
    }

    @Test
    void testEncryptDecryptRoundTrip() throws Exception {
        byte[] plaintext = codec.canonicalBytes(mapper.readTree("{\"users\":[{\"username\":\"alice\"}]}"));

        byte[] ciphertext = codec.encrypt(plaintext);

        assertArrayEquals(plaintext, codec.decrypt(ciphertext));
        assertEquals(plaintext.length + 12 + 16, ciphertext.length);
    }

    @Test
    void testEncryptUsesFreshIv() {
        byte[] plaintext = "{}".getBytes(StandardCharsets.UTF_8);

        byte[] first = codec.encrypt(plaintext);
        byte[] second = codec.encrypt(plaintext);

        assertFalse(Arrays.equals(first, second));
        assertFalse(Arrays.equals(Arrays.copyOf(first, 12), Arrays.copyOf(second, 12)));
    }

    @Test
    void testDecryptWithWrongKeyFails() {
        byte[] ciphertext = codec.encrypt("{\"secret\":true}".getBytes(StandardCharsets.UTF_8));
        IntegrityCodec otherCodec = new IntegrityCodec(() -> PropertyEncryptionKeySource.decode(OTHER_KEY));

        assertThrows(DecryptionException.class, () -> otherCodec.decrypt(ciphertext));
    }

    @Test
    void testDecryptDetectsModifiedCiphertext() {
        byte[] ciphertext = codec.encrypt("{\"users\":[]}".getBytes(StandardCharsets.UTF_8));
        ciphertext[ciphertext.length / 2] ^= 0x01;

        DecryptionException e = assertThrows(DecryptionException.class, () -> codec.decrypt(ciphertext));
        assertInstanceOf(IntegrityException.class, e);
    }

    @Test
    void testDecryptRejectsTruncatedInput() {
        assertThrows(DecryptionException.class, () -> codec.decrypt(new byte[0]));
        assertThrows(DecryptionException.class, () -> codec.decrypt(new byte[20]));
        assertThrows(DecryptionException.class, () -> codec.decrypt(null));
    }

    @Test
    void testParseRejectsNonJson() {
        assertThrows(DecryptionException.class,
            () -> codec.parse("not json {".getBytes(StandardCharsets.UTF_8)));
    }
}
