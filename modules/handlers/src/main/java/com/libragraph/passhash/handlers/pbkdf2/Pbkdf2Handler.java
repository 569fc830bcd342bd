package com.libragraph.passhash.handlers.pbkdf2;

import com.libragraph.passhash.handlers.api.Settings;
import com.libragraph.passhash.handlers.grammar.GrammarHandler;
import com.libragraph.passhash.handlers.normalize.SettingNormalizer;

import java.nio.charset.StandardCharsets;

/**
 * PBKDF2 handler for any {@link Pbkdf2Variant}.
 */
public class Pbkdf2Handler extends GrammarHandler {

    private final Pbkdf2Variant variant;

    public Pbkdf2Handler(Pbkdf2Variant variant, SettingNormalizer normalizer) {
        super(variant.spec(), variant.grammar(), variant.saltEncoding(), variant.checksumEncoding(),
                variant.digest(), normalizer);
        this.variant = variant;
    }

    public Pbkdf2Variant variant() {
        return variant;
    }

    @Override
    protected byte[] digestSalt(Settings settings) {
        if (variant.saltFromConfig()) {
            return render(settings.withoutChecksum()).getBytes(StandardCharsets.US_ASCII);
        }
        return settings.salt();
    }
}
