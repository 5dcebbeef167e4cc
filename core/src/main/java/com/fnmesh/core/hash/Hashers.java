package com.fnmesh.core.hash;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Stable hash functions for consistent hashing.
 * <p>
 * Murmur3 is non-cryptographic but fast and well distributed. Ring positions
 * and lookup keys must always go through the same function.
 * </p>
 */
public final class Hashers {
    private Hashers() {
    }

    /**
     * Computes Murmur3 128-bit hash and returns the lower 64 bits as a long.
     *
     * @param data Input bytes
     * @return 64-bit hash value (signed long)
     */
    public static long murmur3Hash(byte[] data) {
        HashCode hash = Hashing.murmur3_128().hashBytes(data);
        return hash.asLong(); // lower 64 bits
    }

    /**
     * Computes Murmur3 hash of a UTF-8 string.
     *
     * @param str Input string
     * @return 64-bit hash value
     */
    public static long murmur3Hash(String str) {
        return murmur3Hash(str.getBytes(StandardCharsets.UTF_8));
    }
}
