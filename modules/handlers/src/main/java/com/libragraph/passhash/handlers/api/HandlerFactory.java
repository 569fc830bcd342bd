package com.libragraph.passhash.handlers.api;

import java.util.List;

/**
 * Factory for password handlers.
 * Implementations are CDI beans discovered by the registry; they can also be
 * instantiated directly outside a container.
 */
public interface HandlerFactory {

    /**
     * Creates the handlers this factory contributes.
     */
    List<PasswordHandler> createHandlers();
}
