package com.libragraph.passhash.handlers.api;

import com.libragraph.passhash.util.Checksum;

/**
 * A password hashing scheme: reads and writes its own hash format and computes
 * checksums through a digest kernel.
 *
 * <p>Implementations are immutable and safe for concurrent use.
 */
public interface PasswordHandler {

    HandlerSpec spec();

    default String name() {
        return spec().name();
    }

    /**
     * True if the string is a well-formed hash or config string of this scheme.
     * Never throws for malformed input.
     */
    boolean identify(String hash);

    /**
     * Parses a hash or config string.
     *
     * @throws InvalidHashException if the text is malformed or belongs to another scheme
     */
    Settings parse(String hash);

    /**
     * Renders settings back to text; a config string when no checksum is present.
     */
    String render(Settings settings);

    Checksum computeChecksum(String secret, Settings settings);

    /**
     * Creates a config string from the request, filling in and normalizing
     * whatever it leaves unset.
     *
     * @throws SettingOutOfRangeException if a setting cannot be brought within bounds
     * @throws IllegalArgumentException if the request sets something this scheme does not accept
     */
    String generateConfig(ConfigRequest request);

    default String generateConfig() {
        return generateConfig(ConfigRequest.defaults());
    }

    /**
     * Hashes a secret under the settings of a config string (or of an existing hash,
     * whose checksum is ignored).
     */
    String generateHash(String secret, String config);

    /**
     * Recomputes the checksum and compares it in constant time.
     *
     * @throws InvalidHashException if the hash is malformed or lacks a checksum
     */
    boolean verify(String secret, String hash);

    default String encrypt(String secret) {
        return encrypt(secret, ConfigRequest.defaults());
    }

    default String encrypt(String secret, ConfigRequest request) {
        return generateHash(secret, generateConfig(request));
    }
}
