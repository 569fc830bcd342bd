package com.libragraph.passhash.core.policy;

/**
 * A scoped option key. The scope is {@code all}, a user category, or a scheme name.
 * Written as {@code scope.option}; {@code scope__option} is accepted on input.
 */
public record PolicyKey(String scope, PolicyOption option) {

    public static final String ALL = "all";

    public PolicyKey {
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("policy key scope cannot be blank");
        }
        if (option == null) {
            throw new IllegalArgumentException("policy key option is required");
        }
    }

    public static PolicyKey parse(String key) {
        int split = key.lastIndexOf("__");
        int width = 2;
        if (split < 0) {
            split = key.lastIndexOf('.');
            width = 1;
        }
        if (split <= 0) {
            throw new IllegalArgumentException("Unknown policy key: " + key);
        }
        return new PolicyKey(key.substring(0, split).trim(), PolicyOption.fromLabel(key.substring(split + width).trim()));
    }

    @Override
    public String toString() {
        return scope + "." + option.label();
    }
}
