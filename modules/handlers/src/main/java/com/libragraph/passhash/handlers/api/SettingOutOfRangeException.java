package com.libragraph.passhash.handlers.api;

/**
 * Thrown when a salt or rounds setting falls outside a handler's bounds and
 * the caller asked for strict checking (or the violation cannot be corrected).
 */
public class SettingOutOfRangeException extends RuntimeException {

    private final String scheme;
    private final String setting;

    public SettingOutOfRangeException(String scheme, String setting, String message) {
        super(scheme + " " + setting + ": " + message);
        this.scheme = scheme;
        this.setting = setting;
    }

    public String scheme() {
        return scheme;
    }

    public String setting() {
        return setting;
    }
}
