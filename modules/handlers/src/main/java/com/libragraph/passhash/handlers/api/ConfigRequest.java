package com.libragraph.passhash.handlers.api;

import com.libragraph.passhash.types.SettingKeyword;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Caller-supplied settings for a new config string. Unset values fall back to the
 * handler's defaults. In strict mode out-of-range values are errors instead of being
 * corrected.
 */
public record ConfigRequest(
        byte[] salt,
        Integer saltSize,
        Long rounds,
        Boolean implicitRounds,
        boolean strict
) {
    private static final ConfigRequest DEFAULTS = new ConfigRequest(null, null, null, null, false);

    public ConfigRequest {
        salt = salt == null ? null : Arrays.copyOf(salt, salt.length);
    }

    @Override
    public byte[] salt() {
        return salt == null ? null : Arrays.copyOf(salt, salt.length);
    }

    public static ConfigRequest defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a request from keyword form ({@code salt}, {@code salt_size}, {@code rounds},
     * {@code implicit_rounds}, plus {@code strict}).
     *
     * @throws IllegalArgumentException on an unknown keyword or a value of the wrong shape
     */
    public static ConfigRequest fromMap(Map<String, ?> values) {
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            if ("strict".equals(entry.getKey())) {
                builder.strict(toBoolean(entry.getKey(), value));
                continue;
            }
            switch (SettingKeyword.fromLabel(entry.getKey())) {
                case SALT -> {
                    if (value instanceof byte[] bytes) {
                        builder.salt(bytes);
                    } else {
                        builder.salt(value.toString());
                    }
                }
                case SALT_SIZE -> builder.saltSize(toInt(entry.getKey(), value));
                case ROUNDS -> builder.rounds(toLong(entry.getKey(), value));
                case IMPLICIT_ROUNDS -> builder.implicitRounds(toBoolean(entry.getKey(), value));
            }
        }
        return builder.build();
    }

    /**
     * Keywords this request sets, for checking against what a handler accepts.
     */
    public Set<SettingKeyword> keywords() {
        Set<SettingKeyword> set = EnumSet.noneOf(SettingKeyword.class);
        if (salt != null) set.add(SettingKeyword.SALT);
        if (saltSize != null) set.add(SettingKeyword.SALT_SIZE);
        if (rounds != null) set.add(SettingKeyword.ROUNDS);
        if (implicitRounds != null) set.add(SettingKeyword.IMPLICIT_ROUNDS);
        return set;
    }

    public Builder toBuilder() {
        return new Builder()
                .salt(salt)
                .saltSize(saltSize)
                .rounds(rounds)
                .implicitRounds(implicitRounds)
                .strict(strict);
    }

    private static int toInt(String key, Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static long toLong(String key, Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true")) return true;
        if (text.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
    }

    public static class Builder {
        private byte[] salt;
        private Integer saltSize;
        private Long rounds;
        private Boolean implicitRounds;
        private boolean strict;

        public Builder salt(byte[] salt) {
            this.salt = salt;
            return this;
        }

        /**
         * Character salt, stored as its ASCII bytes.
         */
        public Builder salt(String salt) {
            if (salt != null && !StandardCharsets.US_ASCII.newEncoder().canEncode(salt)) {
                throw new IllegalArgumentException("salt must be ASCII");
            }
            this.salt = salt == null ? null : salt.getBytes(StandardCharsets.US_ASCII);
            return this;
        }

        public Builder saltSize(Integer saltSize) {
            this.saltSize = saltSize;
            return this;
        }

        public Builder rounds(Long rounds) {
            this.rounds = rounds;
            return this;
        }

        public Builder rounds(long rounds) {
            this.rounds = rounds;
            return this;
        }

        public Builder implicitRounds(Boolean implicitRounds) {
            this.implicitRounds = implicitRounds;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public ConfigRequest build() {
            return new ConfigRequest(salt, saltSize, rounds, implicitRounds, strict);
        }
    }
}
