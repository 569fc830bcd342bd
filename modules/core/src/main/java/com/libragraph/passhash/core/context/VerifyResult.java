package com.libragraph.passhash.core.context;

import java.util.Optional;

/**
 * Outcome of {@link CryptContext#verifyAndUpdate}: whether the secret matched, and a
 * replacement hash when the stored one should be migrated.
 */
public record VerifyResult(boolean verified, String replacementHash) {

    static final VerifyResult FAILED = new VerifyResult(false, null);

    public Optional<String> replacement() {
        return Optional.ofNullable(replacementHash);
    }
}
