package com.libragraph.passhash.handlers.normalize;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/**
 * Source of random salt material.
 */
@FunctionalInterface
public interface SaltSource {

    void nextBytes(byte[] buffer);

    default byte[] bytes(int count) {
        byte[] buffer = new byte[count];
        nextBytes(buffer);
        return buffer;
    }

    /**
     * Draws characters uniformly from the charset, returned as ASCII bytes.
     */
    default byte[] chars(String charset, int count) {
        int n = charset.length();
        int limit = 256 - (256 % n);
        StringBuilder sb = new StringBuilder(count);
        byte[] one = new byte[1];
        while (sb.length() < count) {
            nextBytes(one);
            int v = one[0] & 0xff;
            if (v < limit) {
                sb.append(charset.charAt(v % n));
            }
        }
        return sb.toString().getBytes(StandardCharsets.US_ASCII);
    }

    static SaltSource secureRandom() {
        SecureRandom random = new SecureRandom();
        return random::nextBytes;
    }
}
