package com.libragraph.docmirror.util;

import org.apache.commons.codec.binary.Hex;

import java.util.Arrays;
import java.util.Objects;

/**
 * Represents a SHA-256 content hash (32 bytes).
 * Immutable value object that can be used as a map key.
 *
 * <p>The lowercase hex form (64 characters) is what gets persisted on document rows,
 * embedded in cache paths, and attached to remote documents as custom metadata.
 */
public record ContentHash(byte[] bytes) {
    private static final int HASH_LENGTH = 32; // 256 bits
    private static final int HEX_LENGTH = HASH_LENGTH * 2;

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException(
                "Content hash must be 32 bytes (SHA-256), got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Returns lowercase hex representation (64 characters).
     */
    public String toHex() {
        return Hex.encodeHexString(bytes);
    }

    /** First {@code length} hex characters, used for cache directory fan-out. */
    public String prefix(int length) {
        if (length < 1 || length > HEX_LENGTH) {
            throw new IllegalArgumentException("prefix length out of range: " + length);
        }
        return toHex().substring(0, length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
