package com.libragraph.passhash.handlers.digests;

import com.libragraph.passhash.handlers.api.AbstractPasswordHandler;
import com.libragraph.passhash.handlers.api.HandlerSpec;
import com.libragraph.passhash.handlers.api.InvalidHashException;
import com.libragraph.passhash.handlers.api.Settings;
import com.libragraph.passhash.handlers.digest.PlainDigest;
import com.libragraph.passhash.handlers.normalize.SettingNormalizer;
import com.libragraph.passhash.util.Checksum;

import java.util.HexFormat;

/**
 * Unsalted hex digest such as {@code hex_sha256}. There is no prefix; a hash is
 * recognised by its length and hex alphabet. The only config string is the empty one.
 */
public class HexDigestHandler extends AbstractPasswordHandler {

    private final PlainDigest digest;

    public HexDigestHandler(PlainDigest digest, SettingNormalizer normalizer) {
        super(HandlerSpec.builder("hex_" + digest.label()).checksumSize(digest.digestSize()).build(), normalizer);
        this.digest = digest;
    }

    @Override
    protected boolean hasIdent(String hash) {
        return hash.length() == spec().checksumSize() * 2;
    }

    @Override
    public Settings parse(String hash) {
        if (hash == null) {
            throw new InvalidHashException(name(), "no hash specified");
        }
        if (hash.isEmpty()) {
            return Settings.NONE;
        }
        if (hash.length() != spec().checksumSize() * 2) {
            throw new InvalidHashException(name(), "expected " + spec().checksumSize() * 2 + " hex digits");
        }
        try {
            return Settings.NONE.withChecksum(new Checksum(HexFormat.of().parseHex(hash)));
        } catch (IllegalArgumentException e) {
            throw new InvalidHashException(name(), e.getMessage(), e);
        }
    }

    @Override
    public String render(Settings settings) {
        return settings.checksum() == null ? "" : settings.checksum().toHex();
    }

    @Override
    public Checksum computeChecksum(String secret, Settings settings) {
        return new Checksum(digest.compute(utf8(secret), null, 0, spec().checksumSize()));
    }
}
