package com.libragraph.passhash.handlers.grammar;

import com.libragraph.passhash.handlers.api.AbstractPasswordHandler;
import com.libragraph.passhash.handlers.api.ConfigRequest;
import com.libragraph.passhash.handlers.api.HandlerSpec;
import com.libragraph.passhash.handlers.api.InvalidHashException;
import com.libragraph.passhash.handlers.api.Settings;
import com.libragraph.passhash.handlers.digest.DigestProvider;
import com.libragraph.passhash.handlers.normalize.SettingNormalizer;
import com.libragraph.passhash.util.Checksum;

/**
 * Handler whose format is fully described by a {@link FieldGrammar} plus field encodings.
 */
public class GrammarHandler extends AbstractPasswordHandler {

    protected final FieldGrammar grammar;
    private final FieldEncoding saltEncoding;
    private final FieldEncoding checksumEncoding;
    private final DigestProvider digest;

    public GrammarHandler(HandlerSpec spec, FieldGrammar grammar, FieldEncoding saltEncoding,
                          FieldEncoding checksumEncoding, DigestProvider digest,
                          SettingNormalizer normalizer) {
        super(spec, normalizer);
        this.grammar = grammar;
        this.saltEncoding = saltEncoding;
        this.checksumEncoding = checksumEncoding;
        this.digest = digest;
    }

    @Override
    public Settings parse(String hash) {
        ParsedFields fields;
        byte[] salt;
        byte[] checksum;
        try {
            fields = grammar.parse(hash);
            salt = saltEncoding.decode(fields.salt());
            checksum = fields.isConfig() ? null : checksumEncoding.decode(fields.checksum());
        } catch (IllegalArgumentException e) {
            throw new InvalidHashException(name(), e.getMessage(), e);
        }
        Long rounds = fields.rounds();
        boolean explicit = rounds != null && grammar.rendersRounds(rounds, fields.explicitRounds());
        return checked(new Settings(salt, rounds, explicit,
                checksum == null ? null : decodeChecksum(checksum)));
    }

    @Override
    public String render(Settings settings) {
        Checksum checksum = settings.checksum();
        return grammar.render(settings.rounds(), settings.explicitRounds(),
                saltEncoding.encode(settings.salt()),
                checksum == null ? null : checksumEncoding.encode(checksum.bytes()));
    }

    @Override
    protected boolean rendersRounds(long rounds, ConfigRequest request) {
        return grammar.rendersRounds(rounds, Boolean.FALSE.equals(request.implicitRounds()));
    }

    @Override
    public Checksum computeChecksum(String secret, Settings settings) {
        return new Checksum(digest.compute(utf8(secret), digestSalt(settings), settings.rounds(),
                spec().checksumSize()));
    }

    /**
     * Salt handed to the digest kernel; the raw salt unless a scheme says otherwise.
     */
    protected byte[] digestSalt(Settings settings) {
        return settings.salt();
    }
}
