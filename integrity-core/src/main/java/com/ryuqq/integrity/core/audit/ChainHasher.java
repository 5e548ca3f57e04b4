package com.ryuqq.integrity.core.audit;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 hash chain primitives.
 *
 * <p>{@code next(previous, after) = SHA256(previous || utf8(canonical(after)))}. The first
 * record of a chain is hashed with an empty previous hash.</p>
 *
 * <p>{@link MessageDigest} is not thread-safe, so every call obtains its own instance.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class ChainHasher {

    /**
     * Previous hash of the first record in a chain.
     */
    public static final byte[] EMPTY = new byte[0];

    private static final HexFormat HEX = HexFormat.of();

    private ChainHasher() {
    }

    /**
     * Computes the hash of the next chain link.
     *
     * @param previousHash hash of the preceding record, or an empty array for the first
     * @param after the after-image being appended
     * @return 32-byte SHA-256 digest
     */
    public static byte[] next(byte[] previousHash, JsonNode after) {
        if (after == null) {
            throw new IllegalArgumentException("after cannot be null");
        }
        MessageDigest digest = sha256();
        if (previousHash != null) {
            digest.update(previousHash);
        }
        digest.update(CanonicalJson.canonicalBytes(after));
        return digest.digest();
    }

    /**
     * SHA-256 of a UTF-8 string.
     *
     * @param text input text
     * @return 32-byte digest
     */
    public static byte[] sha256(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        return sha256().digest(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String toHex(byte[] bytes) {
        return bytes == null ? "" : HEX.formatHex(bytes);
    }

    public static byte[] fromHex(String hex) {
        if (hex == null || hex.isEmpty()) {
            return EMPTY.clone();
        }
        return HEX.parseHex(hex);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm is not available", e);
        }
    }
}
