package com.libragraph.passhash.handlers.digest;

/**
 * Digest or key-derivation kernel behind a handler.
 */
@FunctionalInterface
public interface DigestProvider {

    /**
     * Derives {@code outputSize} bytes from the secret. Kernels without salt or
     * rounds ignore those arguments.
     */
    byte[] compute(byte[] secret, byte[] salt, long rounds, int outputSize);
}
