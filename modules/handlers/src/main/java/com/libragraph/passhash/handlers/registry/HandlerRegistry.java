package com.libragraph.passhash.handlers.registry;

import com.libragraph.passhash.handlers.api.HandlerFactory;
import com.libragraph.passhash.handlers.api.PasswordHandler;
import com.libragraph.passhash.handlers.api.UnknownSchemeException;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of password handlers by scheme name.
 * Inside a container all {@link HandlerFactory} beans are discovered via CDI;
 * elsewhere use {@link #of(HandlerFactory...)}.
 */
@ApplicationScoped
public class HandlerRegistry {

    private static final Logger log = Logger.getLogger(HandlerRegistry.class);

    @Inject
    Instance<HandlerFactory> factories;

    private final Map<String, PasswordHandler> registry = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        for (HandlerFactory factory : factories) {
            factory.createHandlers().forEach(this::register);
        }
        log.infof("HandlerRegistry initialized with %d schemes", registry.size());
    }

    public static HandlerRegistry of(HandlerFactory... factories) {
        HandlerRegistry registry = new HandlerRegistry();
        for (HandlerFactory factory : factories) {
            factory.createHandlers().forEach(registry::register);
        }
        return registry;
    }

    public synchronized void register(PasswordHandler handler) {
        String name = handler.name();
        PasswordHandler existing = registry.putIfAbsent(name, handler);
        if (existing != null) {
            throw new IllegalStateException(
                    "Duplicate scheme '" + name + "': " +
                            existing.getClass().getName() + " and " + handler.getClass().getName());
        }
        log.infof("Registered scheme: %s → %s", name, handler.getClass().getSimpleName());
    }

    public Optional<PasswordHandler> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(registry.get(name));
    }

    public PasswordHandler require(String name) {
        return lookup(name).orElseThrow(() -> new UnknownSchemeException(name));
    }

    public boolean contains(String name) {
        return name != null && registry.containsKey(name);
    }

    /**
     * All handlers, ordered by scheme name.
     */
    public List<PasswordHandler> handlers() {
        return registry.values().stream()
                .sorted(Comparator.comparing(PasswordHandler::name))
                .toList();
    }

    public int size() {
        return registry.size();
    }
}
