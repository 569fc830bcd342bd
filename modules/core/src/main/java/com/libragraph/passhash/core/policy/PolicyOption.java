package com.libragraph.passhash.core.policy;

/**
 * Per-scope options a policy can set.
 */
public enum PolicyOption {
    SALT_SIZE("salt_size"),
    ROUNDS("rounds"),
    DEFAULT_ROUNDS("default_rounds"),
    MIN_ROUNDS("min_rounds"),
    MAX_ROUNDS("max_rounds"),
    VARY_ROUNDS("vary_rounds");

    private final String label;

    PolicyOption(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static PolicyOption fromLabel(String label) {
        for (PolicyOption o : values()) {
            if (o.label.equals(label)) return o;
        }
        throw new IllegalArgumentException("Unknown policy option: " + label);
    }

    /**
     * Converts a raw value (number or text) to this option's value type:
     * {@link Integer}, or {@link VaryRounds} for {@code vary_rounds}.
     */
    Object normalize(Object raw) {
        if (this == VARY_ROUNDS) {
            return raw instanceof VaryRounds vary ? vary : VaryRounds.parse(raw);
        }
        int value;
        if (raw instanceof Number n) {
            value = n.intValue();
        } else {
            try {
                value = Integer.parseInt(raw.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(label + " must be an integer, got '" + raw + "'", e);
            }
        }
        if (value < 0) {
            throw new IllegalArgumentException(label + " must not be negative, got " + value);
        }
        return value;
    }
}
