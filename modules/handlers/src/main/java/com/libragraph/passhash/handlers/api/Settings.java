package com.libragraph.passhash.handlers.api;

import com.libragraph.passhash.util.Checksum;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Parsed contents of a hash or config string.
 *
 * <p>Character salts are held as their ASCII bytes. {@code explicitRounds} records whether
 * the rounds field appears in the rendered text. A null checksum means a config string.
 */
public record Settings(
        byte[] salt,
        Long rounds,
        boolean explicitRounds,
        Checksum checksum
) {
    /** Settings of a scheme that has neither salt nor rounds. */
    public static final Settings NONE = new Settings(null, null, false, null);

    public Settings {
        salt = salt == null ? null : Arrays.copyOf(salt, salt.length);
    }

    @Override
    public byte[] salt() {
        return salt == null ? null : Arrays.copyOf(salt, salt.length);
    }

    public String saltText() {
        return salt == null ? null : new String(salt, StandardCharsets.US_ASCII);
    }

    public boolean isHash() {
        return checksum != null;
    }

    public Settings withChecksum(Checksum checksum) {
        return new Settings(salt, rounds, explicitRounds, checksum);
    }

    public Settings withoutChecksum() {
        return withChecksum(null);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Settings other)) return false;
        return Arrays.equals(salt, other.salt)
                && Objects.equals(rounds, other.rounds)
                && explicitRounds == other.explicitRounds
                && Objects.equals(checksum, other.checksum);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(salt), rounds, explicitRounds, checksum);
    }

    @Override
    public String toString() {
        return "Settings[salt=" + (salt == null ? "null" : salt.length + " bytes")
                + ", rounds=" + rounds
                + ", explicitRounds=" + explicitRounds
                + ", checksum=" + (checksum == null ? "none" : "present") + "]";
    }
}
