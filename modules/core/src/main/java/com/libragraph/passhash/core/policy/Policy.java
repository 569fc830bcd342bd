package com.libragraph.passhash.core.policy;

import com.libragraph.passhash.handlers.api.PasswordHandler;
import com.libragraph.passhash.handlers.registry.HandlerRegistry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable hashing policy: the ordered list of schemes, the default scheme,
 * deprecated schemes, and per-scope options.
 *
 * <p>Options are looked up per scheme with precedence scheme, then user category,
 * then {@code all}; a {@code category.scheme} scope overrides all three. Policies are layered
 * with {@link #replace(Map)}, which returns a new policy and leaves this one untouched.
 */
public final class Policy {

    public static final String SCHEMES = "schemes";
    public static final String DEFAULT = "default";
    public static final String DEPRECATED = "deprecated";

    private static final Policy EMPTY = new Policy(List.of(), null, Set.of(), Map.of());

    private final List<String> schemes;
    private final String defaultScheme;
    private final Set<String> deprecated;
    private final Map<PolicyKey, Object> options;

    private Policy(List<String> schemes, String defaultScheme, Set<String> deprecated,
                   Map<PolicyKey, Object> options) {
        this.schemes = List.copyOf(schemes);
        this.defaultScheme = defaultScheme;
        this.deprecated = Collections.unmodifiableSet(new LinkedHashSet<>(deprecated));
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static Policy empty() {
        return EMPTY;
    }

    /**
     * Builds a policy from keyword form: {@code schemes}, {@code default}, {@code deprecated}
     * and {@code scope.option} (or {@code scope__option}) keys.
     *
     * @throws IllegalArgumentException on unknown keys or malformed values
     */
    public static Policy of(Map<String, ?> values) {
        return EMPTY.replace(values);
    }

    public static Policy fromString(String text) {
        return of(PolicyText.parse(text));
    }

    public static Policy fromPath(Path path) throws IOException {
        return fromString(Files.readString(path));
    }

    /**
     * Accepts a {@link Policy} (returned as-is), a {@link Map}, a {@link Path}, or a string
     * holding either policy text or a file path.
     */
    public static Policy fromSource(Object source) {
        if (source instanceof Policy policy) {
            return policy;
        }
        return of(keywords(source));
    }

    /**
     * Folds sources left to right, each layered over the previous. Map and text sources are
     * applied as raw keywords, so null values and empty lists clear what earlier sources set.
     */
    public static Policy fromSources(List<?> sources) {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("at least one policy source is required");
        }
        Policy policy = fromSource(sources.get(0));
        for (Object source : sources.subList(1, sources.size())) {
            policy = source instanceof Policy overlay
                    ? policy.replace(overlay)
                    : policy.replace(keywords(source));
        }
        return policy;
    }

    public Policy replace(Policy overlay) {
        return replace(overlay.toMap());
    }

    public Policy replace(Map<String, ?> overlay) {
        List<String> newSchemes = schemes;
        String newDefault = defaultScheme;
        Set<String> newDeprecated = deprecated;
        Map<PolicyKey, Object> newOptions = new LinkedHashMap<>(options);

        for (Map.Entry<String, ?> entry : overlay.entrySet()) {
            String key = entry.getKey().trim();
            Object value = entry.getValue();
            switch (key) {
                case SCHEMES -> newSchemes = nameList(SCHEMES, value);
                case DEFAULT -> newDefault = value == null ? null : schemeName(value);
                case DEPRECATED -> newDeprecated = new LinkedHashSet<>(nameList(DEPRECATED, value));
                default -> {
                    PolicyKey policyKey = PolicyKey.parse(key);
                    if (value == null) {
                        newOptions.remove(policyKey);
                    } else {
                        newOptions.put(policyKey, policyKey.option().normalize(value));
                    }
                }
            }
        }
        return new Policy(newSchemes, newDefault, newDeprecated, newOptions);
    }

    public List<String> schemes() {
        return schemes;
    }

    public boolean hasSchemes() {
        return !schemes.isEmpty();
    }

    public Optional<String> defaultScheme() {
        return Optional.ofNullable(defaultScheme);
    }

    public Set<String> deprecated() {
        return deprecated;
    }

    public boolean handlerIsDeprecated(String scheme) {
        return deprecated.contains(scheme);
    }

    public SchemeOptions getOptions(String scheme) {
        return getOptions(scheme, null);
    }

    /**
     * Effective options for a scheme, optionally within a user category. Precedence:
     * {@code category.scheme}, scheme, category, {@code all}.
     */
    public SchemeOptions getOptions(String scheme, String category) {
        Map<PolicyOption, Object> resolved = new EnumMap<>(PolicyOption.class);
        for (PolicyOption option : PolicyOption.values()) {
            Object value = category == null ? null : lookup(category + "." + scheme, option);
            if (value == null) {
                value = lookup(scheme, option);
            }
            if (value == null && category != null) {
                value = lookup(category, option);
            }
            if (value == null) {
                value = lookup(PolicyKey.ALL, option);
            }
            if (value != null) {
                resolved.put(option, value);
            }
        }
        return resolved.isEmpty() ? SchemeOptions.EMPTY : SchemeOptions.of(resolved);
    }

    /**
     * Keyword form of this policy; feeding it to {@link #of(Map)} yields an equal policy.
     * Empty entries are omitted and option keys are written {@code scope.option}.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (!schemes.isEmpty()) map.put(SCHEMES, schemes);
        if (defaultScheme != null) map.put(DEFAULT, defaultScheme);
        if (!deprecated.isEmpty()) map.put(DEPRECATED, List.copyOf(new TreeSet<>(deprecated)));
        Map<String, Object> sorted = new TreeMap<>();
        options.forEach((key, value) ->
                sorted.put(key.toString(), value instanceof VaryRounds vary ? vary.toValue() : value));
        map.putAll(sorted);
        return map;
    }

    /**
     * Like {@link #toMap()} but with scheme names in {@code schemes} and {@code default}
     * replaced by the registry's handlers.
     *
     * @throws com.libragraph.passhash.handlers.api.UnknownSchemeException if a name is not registered
     */
    public Map<String, Object> toMap(HandlerRegistry registry) {
        Map<String, Object> map = toMap();
        if (!schemes.isEmpty()) {
            map.put(SCHEMES, schemes.stream().map(registry::require).toList());
        }
        if (defaultScheme != null) {
            map.put(DEFAULT, registry.require(defaultScheme));
        }
        return map;
    }

    public String toText() {
        return PolicyText.render(toMap());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Policy other)) return false;
        return schemes.equals(other.schemes)
                && Objects.equals(defaultScheme, other.defaultScheme)
                && deprecated.equals(other.deprecated)
                && options.equals(other.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemes, defaultScheme, deprecated, options);
    }

    @Override
    public String toString() {
        return "Policy" + toMap();
    }

    private Object lookup(String scope, PolicyOption option) {
        return options.get(new PolicyKey(scope, option));
    }

    private static List<String> nameList(String key, Object value) {
        if (value == null) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                names.add(schemeName(item));
            }
        } else {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    names.add(part.trim());
                }
            }
        }
        if (new LinkedHashSet<>(names).size() != names.size()) {
            throw new IllegalArgumentException(key + " lists a scheme more than once: " + names);
        }
        return names;
    }

    private static String schemeName(Object value) {
        String name = value instanceof PasswordHandler handler ? handler.name() : value.toString().trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("scheme name cannot be blank");
        }
        return name;
    }

    private static boolean looksLikeText(String source) {
        return source.contains("\n") || source.contains("=");
    }

    private static Map<String, ?> keywords(Object source) {
        if (source instanceof Map<?, ?> map) {
            return stringKeys(map);
        }
        try {
            if (source instanceof Path path) {
                return PolicyText.parse(Files.readString(path));
            }
            if (source instanceof String text) {
                return PolicyText.parse(looksLikeText(text) ? text : Files.readString(Path.of(text)));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read policy from " + source, e);
        }
        throw new IllegalArgumentException("Unsupported policy source: "
                + (source == null ? "null" : source.getClass().getName()));
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }
}
