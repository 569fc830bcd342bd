package com.libragraph.passhash.types;

/**
 * Settings a handler may accept when generating a new config string.
 */
public enum SettingKeyword {
    SALT("salt"),
    SALT_SIZE("salt_size"),
    ROUNDS("rounds"),
    IMPLICIT_ROUNDS("implicit_rounds");

    private final String label;

    SettingKeyword(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static SettingKeyword fromLabel(String label) {
        for (SettingKeyword k : values()) {
            if (k.label.equals(label)) return k;
        }
        throw new IllegalArgumentException("Unknown setting keyword: " + label);
    }
}
