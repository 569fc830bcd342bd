package com.libragraph.passhash.handlers.crypt;

import com.libragraph.passhash.handlers.api.HandlerSpec;
import com.libragraph.passhash.handlers.api.RoundsBounds;
import com.libragraph.passhash.handlers.api.SaltBounds;
import com.libragraph.passhash.handlers.digest.ShaCryptDigest;
import com.libragraph.passhash.handlers.grammar.FieldEncoding;
import com.libragraph.passhash.handlers.grammar.FieldGrammar;
import com.libragraph.passhash.handlers.grammar.GrammarHandler;
import com.libragraph.passhash.handlers.grammar.RoundsOmission;
import com.libragraph.passhash.handlers.normalize.SettingNormalizer;
import com.libragraph.passhash.util.Hash64Codec;

import static com.libragraph.passhash.types.SettingKeyword.IMPLICIT_ROUNDS;
import static com.libragraph.passhash.types.SettingKeyword.ROUNDS;
import static com.libragraph.passhash.types.SettingKeyword.SALT;
import static com.libragraph.passhash.types.SettingKeyword.SALT_SIZE;

/**
 * SHA-512-crypt, {@code $6$[rounds=N$]salt$checksum}.
 *
 * <p>A missing rounds field means 5000. New config strings leave it out for 5000 rounds
 * unless {@code implicit_rounds} is false. Config strings keep the trailing {@code $}.
 */
public class Sha512CryptHandler extends GrammarHandler {

    public static final String IDENT = "$6$";
    public static final int IMPLICIT_ROUNDS_VALUE = 5000;

    static final HandlerSpec SPEC = HandlerSpec.builder("sha512_crypt")
            .ident(IDENT)
            .settings(SALT, SALT_SIZE, ROUNDS, IMPLICIT_ROUNDS)
            .salt(SaltBounds.chars(0, 16, 16, Hash64Codec.HASH64_CHARS))
            .rounds(RoundsBounds.linear(1000, 40000, 999_999_999))
            .checksumSize(ShaCryptDigest.CHECKSUM_SIZE)
            .build();

    static final FieldGrammar GRAMMAR = FieldGrammar.builder(IDENT)
            .rounds(10)
            .roundsPrefix("rounds=")
            .implicitRounds(IMPLICIT_ROUNDS_VALUE, RoundsOmission.WHEN_IMPLICIT_DEFAULT)
            .configTrailingSeparator(true)
            .build();

    public Sha512CryptHandler(SettingNormalizer normalizer) {
        super(SPEC, GRAMMAR, FieldEncoding.ASCII, FieldEncoding.HASH64, new ShaCryptDigest(), normalizer);
    }
}
