package com.libragraph.passhash.core.policy;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options in effect for one scheme (and optionally one user category) after
 * resolving scheme, category and {@code all} scopes. Unset options are null.
 */
public record SchemeOptions(
        Integer saltSize,
        Integer rounds,
        Integer defaultRounds,
        Integer minRounds,
        Integer maxRounds,
        VaryRounds varyRounds
) {
    public static final SchemeOptions EMPTY = new SchemeOptions(null, null, null, null, null, null);

    static SchemeOptions of(Map<PolicyOption, Object> values) {
        return new SchemeOptions(
                (Integer) values.get(PolicyOption.SALT_SIZE),
                (Integer) values.get(PolicyOption.ROUNDS),
                (Integer) values.get(PolicyOption.DEFAULT_ROUNDS),
                (Integer) values.get(PolicyOption.MIN_ROUNDS),
                (Integer) values.get(PolicyOption.MAX_ROUNDS),
                (VaryRounds) values.get(PolicyOption.VARY_ROUNDS));
    }

    public boolean isEmpty() {
        return equals(EMPTY);
    }

    /**
     * Set options keyed by option name.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (saltSize != null) map.put(PolicyOption.SALT_SIZE.label(), saltSize);
        if (rounds != null) map.put(PolicyOption.ROUNDS.label(), rounds);
        if (defaultRounds != null) map.put(PolicyOption.DEFAULT_ROUNDS.label(), defaultRounds);
        if (minRounds != null) map.put(PolicyOption.MIN_ROUNDS.label(), minRounds);
        if (maxRounds != null) map.put(PolicyOption.MAX_ROUNDS.label(), maxRounds);
        if (varyRounds != null) map.put(PolicyOption.VARY_ROUNDS.label(), varyRounds.toValue());
        return map;
    }
}
