package com.libragraph.passhash.handlers.grammar;

/**
 * When a grammar leaves the rounds field out of rendered text.
 */
public enum RoundsOmission {
    /** Rounds always written. */
    NEVER,
    /** Omitted only if equal to the implicit default and not explicitly requested ({@code $6$}). */
    WHEN_IMPLICIT_DEFAULT,
    /** Omitted whenever equal to the implicit default, leaving an empty field. */
    WHEN_DEFAULT_VALUE
}
