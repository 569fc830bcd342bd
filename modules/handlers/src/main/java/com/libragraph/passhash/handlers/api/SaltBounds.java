package com.libragraph.passhash.handlers.api;

import java.nio.charset.StandardCharsets;

/**
 * Salt capability of a handler: size bounds in {@link SaltUnit units}, and for
 * character salts the accepted charset plus the charset random salts are drawn from.
 */
public record SaltBounds(
        int min,
        int defaultSize,
        int max,
        SaltUnit unit,
        String charset,
        String defaultCharset
) {
    public SaltBounds {
        if (unit == null) {
            throw new MisconfiguredHandlerException("salt unit is required");
        }
        if (min < 0 || min > defaultSize || defaultSize > max) {
            throw new MisconfiguredHandlerException(
                    "salt bounds must satisfy 0 <= min <= default <= max, got "
                            + min + "/" + defaultSize + "/" + max);
        }
        if (unit == SaltUnit.CHARS) {
            if (charset == null || charset.isEmpty()) {
                throw new MisconfiguredHandlerException("character salts need a charset");
            }
            if (!StandardCharsets.US_ASCII.newEncoder().canEncode(charset)) {
                throw new MisconfiguredHandlerException("salt charset must be ASCII");
            }
            if (defaultCharset == null) {
                defaultCharset = charset;
            }
            for (int i = 0; i < defaultCharset.length(); i++) {
                if (charset.indexOf(defaultCharset.charAt(i)) < 0) {
                    throw new MisconfiguredHandlerException(
                            "default salt charset is not a subset of the salt charset");
                }
            }
        } else if (charset != null || defaultCharset != null) {
            throw new MisconfiguredHandlerException("byte salts take no charset");
        }
    }

    public static SaltBounds bytes(int min, int defaultSize, int max) {
        return new SaltBounds(min, defaultSize, max, SaltUnit.BYTES, null, null);
    }

    public static SaltBounds fixedBytes(int size) {
        return bytes(size, size, size);
    }

    public static SaltBounds chars(int min, int defaultSize, int max, String charset) {
        return new SaltBounds(min, defaultSize, max, SaltUnit.CHARS, charset, null);
    }

    /**
     * True if every character of the salt belongs to the charset. Byte salts always pass.
     */
    public boolean acceptsAll(byte[] salt) {
        if (unit == SaltUnit.BYTES) {
            return true;
        }
        for (byte b : salt) {
            if (b < 0 || charset.indexOf((char) b) < 0) {
                return false;
            }
        }
        return true;
    }
}
