package com.libragraph.passhash.handlers.wrap;

import com.libragraph.passhash.handlers.api.ConfigRequest;
import com.libragraph.passhash.handlers.api.HandlerSpec;
import com.libragraph.passhash.handlers.api.InvalidHashException;
import com.libragraph.passhash.handlers.api.PasswordHandler;
import com.libragraph.passhash.handlers.api.Settings;
import com.libragraph.passhash.util.Checksum;

import java.util.Objects;

/**
 * Exposes another handler's format under a different leading prefix, e.g.
 * {@code {PBKDF2}} in place of {@code $pbkdf2$}.
 */
public class PrefixWrapperHandler implements PasswordHandler {

    private final HandlerSpec spec;
    private final PasswordHandler wrapped;
    private final String originalPrefix;
    private final String prefix;

    public PrefixWrapperHandler(String name, PasswordHandler wrapped, String originalPrefix, String prefix) {
        this.wrapped = Objects.requireNonNull(wrapped, "wrapped");
        this.originalPrefix = Objects.requireNonNull(originalPrefix, "originalPrefix");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.spec = wrapped.spec().renamed(name, prefix);
    }

    public PasswordHandler wrapped() {
        return wrapped;
    }

    @Override
    public HandlerSpec spec() {
        return spec;
    }

    @Override
    public boolean identify(String hash) {
        return hash != null && hash.startsWith(prefix) && wrapped.identify(unwrap(hash));
    }

    @Override
    public Settings parse(String hash) {
        try {
            return wrapped.parse(unwrap(hash));
        } catch (InvalidHashException e) {
            throw new InvalidHashException(name(), e.getMessage(), e);
        }
    }

    @Override
    public String render(Settings settings) {
        return wrap(wrapped.render(settings));
    }

    @Override
    public Checksum computeChecksum(String secret, Settings settings) {
        return wrapped.computeChecksum(secret, settings);
    }

    @Override
    public String generateConfig(ConfigRequest request) {
        return wrap(wrapped.generateConfig(request));
    }

    @Override
    public String generateHash(String secret, String config) {
        return wrap(wrapped.generateHash(secret, unwrap(config)));
    }

    @Override
    public boolean verify(String secret, String hash) {
        try {
            return wrapped.verify(secret, unwrap(hash));
        } catch (InvalidHashException e) {
            throw new InvalidHashException(name(), e.getMessage(), e);
        }
    }

    private String unwrap(String hash) {
        if (hash == null || !hash.startsWith(prefix)) {
            throw new InvalidHashException(name(), "missing " + prefix + " prefix");
        }
        return originalPrefix + hash.substring(prefix.length());
    }

    private String wrap(String text) {
        if (!text.startsWith(originalPrefix)) {
            throw new IllegalStateException(wrapped.name() + " rendered text without prefix " + originalPrefix);
        }
        return prefix + text.substring(originalPrefix.length());
    }
}
