package com.libragraph.passhash.handlers.api;

/**
 * Thrown when a string is not a well-formed hash (or config string) of the scheme
 * that was asked to read it.
 */
public class InvalidHashException extends RuntimeException {

    private final String scheme;

    public InvalidHashException(String scheme, String message) {
        super(scheme + ": " + message);
        this.scheme = scheme;
    }

    public InvalidHashException(String scheme, String message, Throwable cause) {
        super(scheme + ": " + message, cause);
        this.scheme = scheme;
    }

    public String scheme() {
        return scheme;
    }
}
