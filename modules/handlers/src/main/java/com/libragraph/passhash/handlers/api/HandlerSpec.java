package com.libragraph.passhash.handlers.api;

import com.libragraph.passhash.types.SettingKeyword;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Static description of a password hashing scheme.
 *
 * <p>{@code salt} and {@code rounds} are null when the scheme has no such setting.
 * Unprefixed formats (plain hex digests) have no idents and are recognised by shape.
 */
public record HandlerSpec(
        String name,
        List<String> idents,
        Set<SettingKeyword> settingKeywords,
        Set<String> contextKeywords,
        SaltBounds salt,
        RoundsBounds rounds,
        int checksumSize
) {
    public HandlerSpec {
        if (name == null || name.isBlank()) {
            throw new MisconfiguredHandlerException("handler name is required");
        }
        idents = idents == null ? List.of() : List.copyOf(idents);
        if (new HashSet<>(idents).size() != idents.size()
                || idents.stream().anyMatch(String::isBlank)) {
            throw new MisconfiguredHandlerException(name + ": idents must be unique and non-blank");
        }
        settingKeywords = settingKeywords == null || settingKeywords.isEmpty()
                ? Set.of() : Set.copyOf(EnumSet.copyOf(settingKeywords));
        contextKeywords = contextKeywords == null ? Set.of() : Set.copyOf(contextKeywords);
        if (settingKeywords.contains(SettingKeyword.SALT) && salt == null) {
            throw new MisconfiguredHandlerException(name + ": 'salt' setting declared without salt bounds");
        }
        if (settingKeywords.contains(SettingKeyword.SALT_SIZE) && salt == null) {
            throw new MisconfiguredHandlerException(name + ": 'salt_size' setting declared without salt bounds");
        }
        if (settingKeywords.contains(SettingKeyword.ROUNDS) && rounds == null) {
            throw new MisconfiguredHandlerException(name + ": 'rounds' setting declared without rounds bounds");
        }
        if (checksumSize <= 0) {
            throw new MisconfiguredHandlerException(name + ": checksum size must be positive");
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean hasSalt() {
        return salt != null;
    }

    public boolean hasRounds() {
        return rounds != null;
    }

    public boolean accepts(SettingKeyword keyword) {
        return settingKeywords.contains(keyword);
    }

    /**
     * The ident written when rendering; parsing accepts any of {@link #idents()}.
     */
    public String primaryIdent() {
        return idents.isEmpty() ? "" : idents.get(0);
    }

    /**
     * Same capabilities under a different name and ident, used by prefix wrappers.
     */
    public HandlerSpec renamed(String newName, String newIdent) {
        return new HandlerSpec(newName, List.of(newIdent), settingKeywords, contextKeywords,
                salt, rounds, checksumSize);
    }

    public static class Builder {
        private final String name;
        private final Set<String> idents = new LinkedHashSet<>();
        private final Set<SettingKeyword> settingKeywords = EnumSet.noneOf(SettingKeyword.class);
        private final Set<String> contextKeywords = new LinkedHashSet<>();
        private SaltBounds salt;
        private RoundsBounds rounds;
        private int checksumSize;

        private Builder(String name) {
            this.name = name;
        }

        public Builder ident(String ident) {
            this.idents.add(ident);
            return this;
        }

        public Builder settings(SettingKeyword... keywords) {
            this.settingKeywords.addAll(List.of(keywords));
            return this;
        }

        public Builder contextKeyword(String keyword) {
            this.contextKeywords.add(keyword);
            return this;
        }

        public Builder salt(SaltBounds salt) {
            this.salt = salt;
            return this;
        }

        public Builder rounds(RoundsBounds rounds) {
            this.rounds = rounds;
            return this;
        }

        public Builder checksumSize(int checksumSize) {
            this.checksumSize = checksumSize;
            return this;
        }

        public HandlerSpec build() {
            return new HandlerSpec(name, List.copyOf(idents), settingKeywords, contextKeywords,
                    salt, rounds, checksumSize);
        }
    }
}
