package com.libragraph.passhash.handlers.api;

import com.libragraph.passhash.handlers.normalize.SettingNormalizer;
import com.libragraph.passhash.types.SettingKeyword;
import com.libragraph.passhash.util.Checksum;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Set;

/**
 * Base class for handlers. Implements the generate/verify lifecycle on top of
 * {@link #parse}, {@link #render} and {@link #computeChecksum}.
 */
public abstract class AbstractPasswordHandler implements PasswordHandler {

    protected final Logger log = Logger.getLogger(getClass());

    private final HandlerSpec spec;
    protected final SettingNormalizer normalizer;

    protected AbstractPasswordHandler(HandlerSpec spec, SettingNormalizer normalizer) {
        this.spec = Objects.requireNonNull(spec, "spec");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    @Override
    public HandlerSpec spec() {
        return spec;
    }

    @Override
    public boolean identify(String hash) {
        if (hash == null || hash.isEmpty() || !hasIdent(hash)) {
            return false;
        }
        try {
            parse(hash);
            return true;
        } catch (InvalidHashException e) {
            log.debugf("%s does not identify hash: %s", name(), e.getMessage());
            return false;
        }
    }

    /**
     * Cheap prefix check run before a full parse.
     */
    protected boolean hasIdent(String hash) {
        return spec.idents().stream().anyMatch(hash::startsWith);
    }

    @Override
    public String generateConfig(ConfigRequest request) {
        Set<SettingKeyword> unsupported = request.keywords();
        unsupported.removeAll(spec.settingKeywords());
        if (!unsupported.isEmpty()) {
            throw new IllegalArgumentException(name() + " does not accept settings " + unsupported);
        }
        return render(newSettings(request));
    }

    /**
     * Normalized settings for a new config string.
     */
    protected Settings newSettings(ConfigRequest request) {
        byte[] salt = spec.hasSalt()
                ? normalizer.normalizeSalt(name(), request.salt(), request.saltSize(), spec.salt(), request.strict())
                : null;
        Long rounds = spec.hasRounds()
                ? normalizer.normalizeRounds(name(), request.rounds(), spec.rounds(), request.strict())
                : null;
        return new Settings(salt, rounds, rounds != null && rendersRounds(rounds, request), null);
    }

    /**
     * Whether the rounds field will appear in the rendered text.
     */
    protected boolean rendersRounds(long rounds, ConfigRequest request) {
        return true;
    }

    @Override
    public String generateHash(String secret, String config) {
        Objects.requireNonNull(secret, "secret cannot be null");
        Settings settings = parse(config).withoutChecksum();
        return render(settings.withChecksum(computeChecksum(secret, settings)));
    }

    @Override
    public boolean verify(String secret, String hash) {
        Objects.requireNonNull(secret, "secret cannot be null");
        Settings settings = parse(hash);
        if (!settings.isHash()) {
            throw new InvalidHashException(name(), "expected a hash, got a config string");
        }
        return settings.checksum().matches(computeChecksum(secret, settings.withoutChecksum()));
    }

    /**
     * Applies the handler's bounds to parsed settings: strictly for hashes, relaxed for
     * config strings. A hash that fails is reported as invalid.
     */
    protected Settings checked(Settings parsed) {
        boolean strict = parsed.isHash();
        try {
            byte[] salt = spec.hasSalt()
                    ? normalizer.normalizeSalt(name(), parsed.salt(), null, spec.salt(), strict)
                    : parsed.salt();
            Long rounds = parsed.rounds();
            if (spec.hasRounds()) {
                rounds = normalizer.normalizeRounds(name(), rounds, spec.rounds(), strict);
            }
            return new Settings(salt, rounds, parsed.explicitRounds(), parsed.checksum());
        } catch (SettingOutOfRangeException e) {
            throw new InvalidHashException(name(), e.getMessage(), e);
        }
    }

    /**
     * Decodes a checksum field and checks its size.
     */
    protected Checksum decodeChecksum(byte[] raw) {
        if (raw.length != spec.checksumSize()) {
            throw new InvalidHashException(name(),
                    "checksum must be " + spec.checksumSize() + " bytes, got " + raw.length);
        }
        return new Checksum(raw);
    }

    protected static byte[] utf8(String secret) {
        return secret.getBytes(StandardCharsets.UTF_8);
    }
}
