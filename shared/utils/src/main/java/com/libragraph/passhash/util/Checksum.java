package com.libragraph.passhash.util;

import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Decoded checksum bytes of a password hash.
 * Immutable value object; comparisons between stored and recomputed
 * checksums go through {@link #matches(Checksum)}.
 */
public record Checksum(byte[] bytes) {
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public Checksum {
        Objects.requireNonNull(bytes, "Checksum bytes cannot be null");
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public int size() {
        return bytes.length;
    }

    /**
     * Constant-time equality, independent of where the first differing byte is.
     */
    public boolean matches(Checksum other) {
        return other != null && MessageDigest.isEqual(bytes, other.bytes);
    }

    public static Checksum fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        try {
            return new Checksum(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    /**
     * Returns lowercase hex representation.
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Checksum other)) return false;
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
