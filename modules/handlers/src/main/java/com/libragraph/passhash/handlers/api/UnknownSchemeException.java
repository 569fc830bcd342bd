package com.libragraph.passhash.handlers.api;

/**
 * Thrown when a scheme name is not registered, is not part of the active policy,
 * or when a hash cannot be matched to any scheme.
 */
public class UnknownSchemeException extends RuntimeException {

    private final String scheme;

    public UnknownSchemeException(String scheme) {
        super("Unknown scheme: " + scheme);
        this.scheme = scheme;
    }

    public UnknownSchemeException(String scheme, String message) {
        super(message);
        this.scheme = scheme;
    }

    /**
     * The offending scheme name, or null when a hash could not be identified.
     */
    public String scheme() {
        return scheme;
    }
}
