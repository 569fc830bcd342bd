package com.libragraph.passhash.handlers.grammar;

/**
 * Raw fields split out of a hash string, before any decoding.
 *
 * @param roundsToken the rounds text as written, or null when the field was absent or empty
 * @param checksum    the checksum text, or null for a config string
 */
public record ParsedFields(
        String ident,
        String roundsToken,
        Long rounds,
        boolean explicitRounds,
        String salt,
        String checksum
) {
    public boolean isConfig() {
        return checksum == null;
    }
}
