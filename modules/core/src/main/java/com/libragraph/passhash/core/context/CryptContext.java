package com.libragraph.passhash.core.context;

import com.libragraph.passhash.core.policy.Policy;
import com.libragraph.passhash.core.policy.SchemeOptions;
import com.libragraph.passhash.handlers.api.ConfigRequest;
import com.libragraph.passhash.handlers.api.InvalidHashException;
import com.libragraph.passhash.handlers.api.PasswordHandler;
import com.libragraph.passhash.handlers.api.RoundsBounds;
import com.libragraph.passhash.handlers.api.Settings;
import com.libragraph.passhash.handlers.api.UnknownSchemeException;
import com.libragraph.passhash.handlers.registry.HandlerRegistry;
import com.libragraph.passhash.types.SettingKeyword;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Hashes and verifies secrets under a {@link Policy}, dispatching to the handlers of
 * the policy's schemes.
 *
 * <p>Immutable; {@link #replace(Map)} returns a new context. Hash identification tries
 * schemes in policy order, so the first scheme listed wins when formats overlap. Without
 * a {@code default}, new hashes use the last scheme listed.
 */
public final class CryptContext {

    private static final Logger log = Logger.getLogger(CryptContext.class);

    private final Policy policy;
    private final HandlerRegistry registry;
    private final List<PasswordHandler> handlers;
    private final PasswordHandler defaultHandler;

    /**
     * @throws IllegalArgumentException if the policy names no schemes, or its default is deprecated
     * @throws UnknownSchemeException   if a scheme is not registered, or default/deprecated
     *                                  name a scheme outside the policy's list
     */
    public CryptContext(Policy policy, HandlerRegistry registry) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.registry = Objects.requireNonNull(registry, "registry");
        if (!policy.hasSchemes()) {
            throw new IllegalArgumentException("policy must list at least one scheme");
        }
        this.handlers = policy.schemes().stream().map(registry::require).toList();
        for (String name : policy.deprecated()) {
            if (!policy.schemes().contains(name)) {
                throw new UnknownSchemeException(name, "deprecated scheme '" + name + "' is not in the policy's schemes");
            }
        }
        String defaultName = policy.defaultScheme().orElse(policy.schemes().get(policy.schemes().size() - 1));
        if (!policy.schemes().contains(defaultName)) {
            throw new UnknownSchemeException(defaultName, "default scheme '" + defaultName + "' is not in the policy's schemes");
        }
        if (policy.handlerIsDeprecated(defaultName)) {
            throw new IllegalArgumentException("default scheme '" + defaultName + "' cannot be deprecated");
        }
        this.defaultHandler = registry.require(defaultName);
        log.infof("CryptContext ready: schemes=%s, default=%s, deprecated=%s",
                policy.schemes(), defaultName, policy.deprecated());
    }

    public Policy policy() {
        return policy;
    }

    public List<String> schemes() {
        return policy.schemes();
    }

    public String defaultScheme() {
        return defaultHandler.name();
    }

    /**
     * New context with the overlay layered over this context's policy.
     */
    public CryptContext replace(Map<String, ?> overlay) {
        return new CryptContext(policy.replace(overlay), registry);
    }

    public CryptContext replace(Policy overlay) {
        return new CryptContext(policy.replace(overlay), registry);
    }

    /**
     * Handler for a scheme of this policy; the default scheme when {@code scheme} is null.
     *
     * @throws UnknownSchemeException if the scheme is not part of the policy
     */
    public PasswordHandler handler(String scheme) {
        if (scheme == null) {
            return defaultHandler;
        }
        return handlers.stream()
                .filter(h -> h.name().equals(scheme))
                .findFirst()
                .orElseThrow(() -> new UnknownSchemeException(scheme));
    }

    public String genconfig() {
        return genconfig(null, null, Map.of());
    }

    public String genconfig(String scheme, String category, Map<String, ?> overrides) {
        PasswordHandler handler = handler(scheme);
        return handler.generateConfig(configRequest(handler, category, overrides));
    }

    /**
     * Hashes a secret under an existing config string; the scheme is identified
     * from the config when not given.
     */
    public String genhash(String secret, String config, String scheme) {
        PasswordHandler handler = scheme == null ? identifyRequired(config) : handler(scheme);
        return handler.generateHash(secret, config);
    }

    public String encrypt(String secret) {
        return encrypt(secret, null, null, Map.of());
    }

    public String encrypt(String secret, String scheme) {
        return encrypt(secret, scheme, null, Map.of());
    }

    public String encrypt(String secret, String scheme, Map<String, ?> overrides) {
        return encrypt(secret, scheme, null, overrides);
    }

    /**
     * Hashes a secret with a scheme of this policy (default when null), applying
     * the policy's options for the user category and any call-time overrides.
     */
    public String encrypt(String secret, String scheme, String category, Map<String, ?> overrides) {
        PasswordHandler handler = handler(scheme);
        return handler.encrypt(secret, configRequest(handler, category, overrides));
    }

    /**
     * Name of the first scheme, in policy order, that recognises the hash.
     * Empty for null, empty or unrecognised input.
     */
    public Optional<String> identify(String hash) {
        return identifyHandler(hash).map(PasswordHandler::name);
    }

    public Optional<PasswordHandler> identifyHandler(String hash) {
        if (hash == null || hash.isEmpty()) {
            return Optional.empty();
        }
        for (PasswordHandler handler : handlers) {
            if (handler.identify(hash)) {
                return Optional.of(handler);
            }
        }
        log.debugf("No scheme in %s identifies the hash", policy.schemes());
        return Optional.empty();
    }

    /**
     * @throws UnknownSchemeException if no scheme of the policy recognises the hash
     */
    public PasswordHandler identifyRequired(String hash) {
        return identifyHandler(hash).orElseThrow(() ->
                new UnknownSchemeException(null, "hash could not be identified by any of " + policy.schemes()));
    }

    /**
     * Checks a secret against a stored hash. A null or empty hash never verifies.
     *
     * @throws UnknownSchemeException if no scheme of the policy recognises the hash
     */
    public boolean verify(String secret, String hash) {
        if (hash == null || hash.isEmpty()) {
            return false;
        }
        return identifyRequired(hash).verify(secret, hash);
    }

    /**
     * Checks a secret against a hash that must belong to {@code scheme}.
     *
     * @throws InvalidHashException   if the hash is not a hash of that scheme
     * @throws UnknownSchemeException if the scheme is not part of the policy
     */
    public boolean verify(String secret, String hash, String scheme) {
        if (scheme == null) {
            return verify(secret, hash);
        }
        PasswordHandler handler = handler(scheme);
        if (hash == null || hash.isEmpty()) {
            return false;
        }
        if (!handler.identify(hash)) {
            throw new InvalidHashException(scheme, "hash is not a " + scheme + " hash");
        }
        return handler.verify(secret, hash);
    }

    public boolean handlerIsDeprecated(String scheme) {
        return policy.handlerIsDeprecated(scheme);
    }

    public boolean handlerIsDeprecated(PasswordHandler handler) {
        return policy.handlerIsDeprecated(handler.name());
    }

    /**
     * True if the hash should be replaced: its scheme is deprecated, or its rounds fall
     * outside the policy's min/max for that scheme.
     */
    public boolean needsUpdate(String hash) {
        return needsUpdate(hash, null);
    }

    public boolean needsUpdate(String hash, String category) {
        PasswordHandler handler = identifyRequired(hash);
        if (handlerIsDeprecated(handler)) {
            return true;
        }
        if (!handler.spec().hasRounds()) {
            return false;
        }
        Settings settings = handler.parse(hash);
        SchemeOptions options = policy.getOptions(handler.name(), category);
        long rounds = settings.rounds();
        return (options.minRounds() != null && rounds < options.minRounds())
                || (options.maxRounds() != null && rounds > options.maxRounds());
    }

    /**
     * Verifies, and when the secret matches a hash that {@link #needsUpdate needs updating},
     * also returns a fresh hash under the default scheme.
     */
    public VerifyResult verifyAndUpdate(String secret, String hash) {
        if (!verify(secret, hash)) {
            return VerifyResult.FAILED;
        }
        if (needsUpdate(hash)) {
            log.debugf("Rehashing %s hash under %s", identify(hash).orElse("unknown"), defaultScheme());
            return new VerifyResult(true, encrypt(secret));
        }
        return new VerifyResult(true, null);
    }

    private ConfigRequest configRequest(PasswordHandler handler, String category, Map<String, ?> overrides) {
        ConfigRequest request = ConfigRequest.fromMap(overrides == null ? Map.of() : overrides);
        SchemeOptions options = policy.getOptions(handler.name(), category);
        ConfigRequest.Builder builder = request.toBuilder();

        RoundsBounds bounds = handler.spec().rounds();
        if (bounds != null && handler.spec().accepts(SettingKeyword.ROUNDS)) {
            if (request.rounds() != null) {
                builder.rounds(clampToPolicy(handler, request.rounds(), options));
            } else if (options.rounds() != null) {
                builder.rounds(clampToPolicy(handler, options.rounds(), options));
            } else {
                long base = clampToPolicy(handler,
                        options.defaultRounds() != null ? options.defaultRounds() : bounds.defaultRounds(),
                        options);
                if (options.varyRounds() != null) {
                    base = vary(base, bounds, options);
                }
                builder.rounds(base);
            }
        }
        if (request.saltSize() == null && request.salt() == null && options.saltSize() != null
                && handler.spec().accepts(SettingKeyword.SALT_SIZE)) {
            builder.saltSize(options.saltSize());
        }
        return builder.build();
    }

    private long clampToPolicy(PasswordHandler handler, long rounds, SchemeOptions options) {
        if (options.minRounds() != null && rounds < options.minRounds()) {
            log.warnf("%s: rounds %d below policy min_rounds %d, using minimum",
                    handler.name(), rounds, options.minRounds());
            return options.minRounds();
        }
        if (options.maxRounds() != null && rounds > options.maxRounds()) {
            log.warnf("%s: rounds %d above policy max_rounds %d, using maximum",
                    handler.name(), rounds, options.maxRounds());
            return options.maxRounds();
        }
        return rounds;
    }

    private static long vary(long rounds, RoundsBounds bounds, SchemeOptions options) {
        long varied = options.varyRounds().apply(rounds, bounds.costFunction(), ThreadLocalRandom.current());
        long lower = Math.max(bounds.min(), options.minRounds() != null ? options.minRounds() : bounds.min());
        long upper = Math.min(bounds.max(), options.maxRounds() != null ? options.maxRounds() : bounds.max());
        return Math.max(lower, Math.min(upper, varied));
    }
}
