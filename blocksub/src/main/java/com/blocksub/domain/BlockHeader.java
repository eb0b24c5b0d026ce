package com.blocksub.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Chain header as observed from either source. Immutable once observed and shared read-only with all subscribers.
 * {@code number} is an unsigned 64-bit value; compare it with {@link Long#compareUnsigned(long, long)}.
 * {@code payload} is the full JSON header object as received (opaque to this service).
 */
public record BlockHeader(long number, String hash, String parentHash, long timestamp, JsonNode payload) {

    public BlockHeader {
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("hash is required");
        }
        hash = hash.toLowerCase();
    }

    public static BlockHeader of(long number, String hash) {
        return new BlockHeader(number, hash, null, 0L, null);
    }

    /** True if this header is at least as high as {@code other} (unsigned comparison). */
    public boolean isAtOrAbove(BlockHeader other) {
        return Long.compareUnsigned(number, other.number) >= 0;
    }

    public String numberAsString() {
        return Long.toUnsignedString(number);
    }
}
