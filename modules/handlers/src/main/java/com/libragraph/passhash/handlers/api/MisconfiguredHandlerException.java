package com.libragraph.passhash.handlers.api;

/**
 * Thrown at startup when a handler description is internally inconsistent.
 */
public class MisconfiguredHandlerException extends RuntimeException {

    public MisconfiguredHandlerException(String message) {
        super(message);
    }
}
