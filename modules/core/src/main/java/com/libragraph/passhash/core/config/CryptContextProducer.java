package com.libragraph.passhash.core.config;

import com.libragraph.passhash.core.context.CryptContext;
import com.libragraph.passhash.core.policy.Policy;
import com.libragraph.passhash.handlers.registry.HandlerRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Produces the application's {@link CryptContext}. The policy file named by
 * {@code passhash.policy.path} is applied first, then every other
 * {@code passhash.policy.*} property is layered over it.
 */
@ApplicationScoped
public class CryptContextProducer {

    private static final Logger log = Logger.getLogger(CryptContextProducer.class);

    static final String PREFIX = "passhash.policy.";
    static final String PATH_PROPERTY = PREFIX + "path";

    @ConfigProperty(name = PATH_PROPERTY)
    Optional<String> policyPath;

    @Inject
    Config config;

    @Inject
    HandlerRegistry registry;

    @Produces
    @Singleton
    public CryptContext cryptContext() {
        return new CryptContext(loadPolicy(), registry);
    }

    Policy loadPolicy() {
        List<Object> sources = new ArrayList<>();
        policyPath.filter(p -> !p.isBlank()).ifPresent(p -> {
            log.infof("Loading hashing policy from %s", p);
            sources.add(Path.of(p));
        });
        Map<String, String> inline = inlinePolicy();
        if (!inline.isEmpty()) {
            sources.add(inline);
        }
        if (sources.isEmpty()) {
            throw new IllegalStateException(
                    "No hashing policy configured: set " + PATH_PROPERTY + " or " + PREFIX + "* properties");
        }
        return Policy.fromSources(sources);
    }

    private Map<String, String> inlinePolicy() {
        Map<String, String> values = new TreeMap<>();
        for (String name : config.getPropertyNames()) {
            if (name.startsWith(PREFIX) && !name.equals(PATH_PROPERTY)) {
                config.getOptionalValue(name, String.class)
                        .ifPresent(value -> values.put(name.substring(PREFIX.length()), value));
            }
        }
        return values;
    }
}
