package com.libragraph.passhash.handlers.pbkdf2;

import com.libragraph.passhash.handlers.api.AbstractPasswordHandler;
import com.libragraph.passhash.handlers.api.HandlerSpec;
import com.libragraph.passhash.handlers.api.InvalidHashException;
import com.libragraph.passhash.handlers.api.SaltBounds;
import com.libragraph.passhash.handlers.api.Settings;
import com.libragraph.passhash.handlers.digest.Pbkdf2Digest;
import com.libragraph.passhash.handlers.normalize.SettingNormalizer;
import com.libragraph.passhash.types.SettingKeyword;
import com.libragraph.passhash.util.AltBase64;
import com.libragraph.passhash.util.Checksum;

import java.util.Arrays;

/**
 * Atlassian's {@code {PKCS5S2}} format: base64 of a 16-byte salt followed by a 32-byte
 * PBKDF2-HMAC-SHA1 key, at a fixed 10000 rounds. A config string carries only the salt.
 */
public class AtlassianPbkdf2Handler extends AbstractPasswordHandler {

    public static final String IDENT = "{PKCS5S2}";
    static final int SALT_SIZE = 16;
    static final int CHECKSUM_SIZE = 32;
    static final int ROUNDS = 10000;

    private static final HandlerSpec SPEC = HandlerSpec.builder("atlassian_pbkdf2_sha1")
            .ident(IDENT)
            .settings(SettingKeyword.SALT)
            .salt(SaltBounds.fixedBytes(SALT_SIZE))
            .checksumSize(CHECKSUM_SIZE)
            .build();

    public AtlassianPbkdf2Handler(SettingNormalizer normalizer) {
        super(SPEC, normalizer);
    }

    @Override
    public Settings parse(String hash) {
        if (hash == null || !hash.startsWith(IDENT)) {
            throw new InvalidHashException(name(), "missing " + IDENT + " prefix");
        }
        byte[] data;
        try {
            data = AltBase64.STANDARD.decode(hash.substring(IDENT.length()));
        } catch (IllegalArgumentException e) {
            throw new InvalidHashException(name(), e.getMessage(), e);
        }
        if (data.length == SALT_SIZE) {
            return checked(new Settings(data, null, false, null));
        }
        if (data.length != SALT_SIZE + CHECKSUM_SIZE) {
            throw new InvalidHashException(name(), "decoded payload has wrong size: " + data.length);
        }
        return checked(new Settings(Arrays.copyOf(data, SALT_SIZE), null, false,
                decodeChecksum(Arrays.copyOfRange(data, SALT_SIZE, data.length))));
    }

    @Override
    public String render(Settings settings) {
        byte[] salt = settings.salt();
        if (settings.checksum() == null) {
            return IDENT + AltBase64.STANDARD.encode(salt);
        }
        byte[] checksum = settings.checksum().bytes();
        byte[] data = Arrays.copyOf(salt, salt.length + checksum.length);
        System.arraycopy(checksum, 0, data, salt.length, checksum.length);
        return IDENT + AltBase64.STANDARD.encode(data);
    }

    @Override
    public Checksum computeChecksum(String secret, Settings settings) {
        return new Checksum(Pbkdf2Digest.SHA1.compute(utf8(secret), settings.salt(), ROUNDS, CHECKSUM_SIZE));
    }
}
