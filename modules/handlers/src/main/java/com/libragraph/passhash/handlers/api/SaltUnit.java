package com.libragraph.passhash.handlers.api;

/**
 * Whether a salt is measured in raw bytes or in characters drawn from a charset.
 */
public enum SaltUnit {
    BYTES,
    CHARS
}
