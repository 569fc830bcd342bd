package com.libragraph.passhash.handlers.pbkdf2;

import com.libragraph.passhash.handlers.api.HandlerSpec;
import com.libragraph.passhash.handlers.api.RoundsBounds;
import com.libragraph.passhash.handlers.api.SaltBounds;
import com.libragraph.passhash.handlers.digest.Pbkdf2Digest;
import com.libragraph.passhash.handlers.grammar.FieldEncoding;
import com.libragraph.passhash.handlers.grammar.FieldGrammar;
import com.libragraph.passhash.handlers.grammar.RoundsOmission;
import com.libragraph.passhash.util.Hash64Codec;

import static com.libragraph.passhash.types.SettingKeyword.ROUNDS;
import static com.libragraph.passhash.types.SettingKeyword.SALT;
import static com.libragraph.passhash.types.SettingKeyword.SALT_SIZE;

/**
 * One PBKDF2-based hash format: its description, grammar, field encodings and kernel.
 *
 * <p>{@code saltFromConfig} marks formats that feed the rendered config string,
 * rather than the raw salt, to PBKDF2 as its salt.
 */
public record Pbkdf2Variant(
        HandlerSpec spec,
        FieldGrammar grammar,
        FieldEncoding saltEncoding,
        FieldEncoding checksumEncoding,
        Pbkdf2Digest digest,
        boolean saltFromConfig
) {
    static final long MAX_ROUNDS = 0xFFFF_FFFFL;

    /**
     * Modular-crypt {@code $pbkdf2[-digest]$rounds$salt$checksum} with ab64 fields.
     */
    public static Pbkdf2Variant modular(Pbkdf2Digest digest) {
        String name = "pbkdf2_" + digest.label();
        String ident = digest == Pbkdf2Digest.SHA1 ? "$pbkdf2$" : "$pbkdf2-" + digest.label() + "$";
        HandlerSpec spec = HandlerSpec.builder(name)
                .ident(ident)
                .settings(SALT, SALT_SIZE, ROUNDS)
                .salt(SaltBounds.bytes(0, 16, 1024))
                .rounds(RoundsBounds.linear(1, 6400, MAX_ROUNDS))
                .checksumSize(digest.digestSize())
                .build();
        FieldGrammar grammar = FieldGrammar.builder(ident).rounds(10).build();
        return new Pbkdf2Variant(spec, grammar, FieldEncoding.AB64, FieldEncoding.AB64, digest, false);
    }

    /**
     * Cryptacular's {@code $p5k2$hexrounds$salt$checksum}, fields in padded {@code -_} base64.
     */
    public static Pbkdf2Variant cryptacular() {
        HandlerSpec spec = HandlerSpec.builder("cta_pbkdf2_sha1")
                .ident("$p5k2$")
                .settings(SALT, SALT_SIZE, ROUNDS)
                .salt(SaltBounds.bytes(0, 16, 1024))
                .rounds(RoundsBounds.linear(1, 10000, MAX_ROUNDS))
                .checksumSize(20)
                .build();
        FieldGrammar grammar = FieldGrammar.builder("$p5k2$").rounds(16).build();
        return new Pbkdf2Variant(spec, grammar, FieldEncoding.DASH_UNDERSCORE_B64,
                FieldEncoding.DASH_UNDERSCORE_B64, Pbkdf2Digest.SHA1, false);
    }

    /**
     * Dwayne Litzenberger's {@code $p5k2$[hexrounds]$salt$checksum}: hash64-charset salt,
     * empty rounds field meaning 400, and PBKDF2 keyed on the config string itself.
     */
    public static Pbkdf2Variant dlitz() {
        HandlerSpec spec = HandlerSpec.builder("dlitz_pbkdf2_sha1")
                .ident("$p5k2$")
                .settings(SALT, SALT_SIZE, ROUNDS)
                .salt(SaltBounds.chars(0, 16, 1024, Hash64Codec.HASH64_CHARS))
                .rounds(RoundsBounds.linear(1, 10000, MAX_ROUNDS))
                .checksumSize(24)
                .build();
        FieldGrammar grammar = FieldGrammar.builder("$p5k2$")
                .rounds(16)
                .implicitRounds(400, RoundsOmission.WHEN_DEFAULT_VALUE)
                .build();
        return new Pbkdf2Variant(spec, grammar, FieldEncoding.ASCII, FieldEncoding.AB64,
                Pbkdf2Digest.SHA1, true);
    }

    /**
     * GRUB2's {@code grub.pbkdf2.sha512.rounds.SALT.CHECKSUM} with upper-case hex fields.
     */
    public static Pbkdf2Variant grub() {
        String ident = "grub.pbkdf2.sha512.";
        HandlerSpec spec = HandlerSpec.builder("grub_pbkdf2_sha512")
                .ident(ident)
                .settings(SALT, SALT_SIZE, ROUNDS)
                .salt(SaltBounds.bytes(0, 64, 1024))
                .rounds(RoundsBounds.linear(1, 10000, MAX_ROUNDS))
                .checksumSize(64)
                .build();
        FieldGrammar grammar = FieldGrammar.builder(ident).separator('.').rounds(10).build();
        return new Pbkdf2Variant(spec, grammar, FieldEncoding.UPPER_HEX, FieldEncoding.UPPER_HEX,
                Pbkdf2Digest.SHA512, false);
    }
}
