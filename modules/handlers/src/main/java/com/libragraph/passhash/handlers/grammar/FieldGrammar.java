package com.libragraph.passhash.handlers.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Splits and renders hash strings shaped
 * {@code ident [roundsPrefix rounds sep] salt [sep checksum]}.
 *
 * <p>Parsing only delimits fields; it does not validate salt or checksum contents.
 * Failures are reported as {@link IllegalArgumentException} and converted by the
 * owning handler.
 */
public final class FieldGrammar {

    private final List<String> idents;
    private final char separator;
    private final boolean hasRounds;
    private final String roundsPrefix;
    private final int roundsBase;
    private final Integer implicitRounds;
    private final RoundsOmission omission;
    private final boolean configTrailingSeparator;

    private FieldGrammar(Builder b) {
        if (b.idents.isEmpty()) {
            throw new IllegalArgumentException("grammar needs at least one ident");
        }
        if (b.roundsBase != 10 && b.roundsBase != 16) {
            throw new IllegalArgumentException("rounds base must be 10 or 16");
        }
        if (b.omission != RoundsOmission.NEVER && b.implicitRounds == null) {
            throw new IllegalArgumentException("omitting rounds requires an implicit default");
        }
        this.idents = List.copyOf(b.idents);
        this.separator = b.separator;
        this.hasRounds = b.hasRounds;
        this.roundsPrefix = b.roundsPrefix;
        this.roundsBase = b.roundsBase;
        this.implicitRounds = b.implicitRounds;
        this.omission = b.omission;
        this.configTrailingSeparator = b.configTrailingSeparator;
    }

    public static Builder builder(String ident) {
        return new Builder(ident);
    }

    public List<String> idents() {
        return idents;
    }

    public char separator() {
        return separator;
    }

    public Integer implicitRounds() {
        return implicitRounds;
    }

    /**
     * Longest ident the text starts with.
     */
    public Optional<String> matchIdent(String text) {
        String best = null;
        for (String ident : idents) {
            if (text.startsWith(ident) && (best == null || ident.length() > best.length())) {
                best = ident;
            }
        }
        return Optional.ofNullable(best);
    }

    public ParsedFields parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("no hash specified");
        }
        String ident = matchIdent(text)
                .orElseThrow(() -> new IllegalArgumentException("unrecognized identifier"));
        List<String> parts = split(text.substring(ident.length()));

        int index = 0;
        String roundsToken = null;
        if (hasRounds) {
            if (roundsPrefix.isEmpty()) {
                roundsToken = parts.get(0);
                index = 1;
            } else if (parts.get(0).startsWith(roundsPrefix)) {
                roundsToken = parts.get(0).substring(roundsPrefix.length());
                if (roundsToken.isEmpty()) {
                    throw new IllegalArgumentException("empty rounds field");
                }
                index = 1;
            }
        }
        int remaining = parts.size() - index;
        if (remaining < 1 || remaining > 2) {
            throw new IllegalArgumentException("malformed hash: wrong number of fields");
        }
        String salt = parts.get(index);
        String checksum = remaining == 2 ? parts.get(index + 1) : null;
        if (checksum != null && checksum.isEmpty()) {
            checksum = null;
        }

        Long rounds = null;
        boolean explicit = false;
        if (hasRounds) {
            if (roundsToken != null && !roundsToken.isEmpty()) {
                rounds = parseRounds(roundsToken);
                explicit = true;
            } else if (implicitRounds != null) {
                rounds = implicitRounds.longValue();
                roundsToken = null;
            } else {
                throw new IllegalArgumentException("missing rounds field");
            }
        }
        return new ParsedFields(ident, roundsToken, rounds, explicit, salt, checksum);
    }

    /**
     * Whether rendering would write the rounds field for these values.
     */
    public boolean rendersRounds(long rounds, boolean explicit) {
        return switch (omission) {
            case NEVER -> true;
            case WHEN_IMPLICIT_DEFAULT -> explicit || rounds != implicitRounds;
            case WHEN_DEFAULT_VALUE -> rounds != implicitRounds;
        };
    }

    /**
     * Renders fields; a null checksum produces a config string.
     */
    public String render(Long rounds, boolean explicit, String salt, String checksum) {
        StringBuilder sb = new StringBuilder(idents.get(0));
        if (hasRounds) {
            Objects.requireNonNull(rounds, "rounds required by this grammar");
            if (rendersRounds(rounds, explicit)) {
                sb.append(roundsPrefix).append(Long.toString(rounds, roundsBase)).append(separator);
            } else if (roundsPrefix.isEmpty()) {
                sb.append(separator);
            }
        }
        sb.append(salt);
        if (checksum != null) {
            sb.append(separator).append(checksum);
        } else if (configTrailingSeparator) {
            sb.append(separator);
        }
        return sb.toString();
    }

    private List<String> split(String rest) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < rest.length(); i++) {
            if (rest.charAt(i) == separator) {
                parts.add(rest.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(rest.substring(start));
        return parts;
    }

    private long parseRounds(String token) {
        if (token.length() > 1 && token.charAt(0) == '0') {
            throw new IllegalArgumentException("zero-padded rounds: " + token);
        }
        for (int i = 0; i < token.length(); i++) {
            if (Character.digit(token.charAt(i), roundsBase) < 0) {
                throw new IllegalArgumentException("malformed rounds: " + token);
            }
        }
        try {
            return Long.parseLong(token, roundsBase);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("rounds out of range: " + token, e);
        }
    }

    public static class Builder {
        private final List<String> idents = new ArrayList<>();
        private char separator = '$';
        private boolean hasRounds = false;
        private String roundsPrefix = "";
        private int roundsBase = 10;
        private Integer implicitRounds;
        private RoundsOmission omission = RoundsOmission.NEVER;
        private boolean configTrailingSeparator = false;

        private Builder(String ident) {
            this.idents.add(ident);
        }

        public Builder alias(String ident) {
            this.idents.add(ident);
            return this;
        }

        public Builder separator(char separator) {
            this.separator = separator;
            return this;
        }

        public Builder rounds(int base) {
            this.hasRounds = true;
            this.roundsBase = base;
            return this;
        }

        public Builder roundsPrefix(String roundsPrefix) {
            this.roundsPrefix = roundsPrefix;
            return this;
        }

        public Builder implicitRounds(int implicitRounds, RoundsOmission omission) {
            this.implicitRounds = implicitRounds;
            this.omission = omission;
            return this;
        }

        public Builder configTrailingSeparator(boolean configTrailingSeparator) {
            this.configTrailingSeparator = configTrailingSeparator;
            return this;
        }

        public FieldGrammar build() {
            return new FieldGrammar(this);
        }
    }
}
