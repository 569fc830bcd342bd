package com.libragraph.passhash.handlers.grammar;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FieldGrammarTest {

    private static final FieldGrammar MODULAR = FieldGrammar.builder("$pbkdf2$").rounds(10).build();

    private static final FieldGrammar SHA512 = FieldGrammar.builder("$6$")
            .rounds(10)
            .roundsPrefix("rounds=")
            .implicitRounds(5000, RoundsOmission.WHEN_IMPLICIT_DEFAULT)
            .configTrailingSeparator(true)
            .build();

    private static final FieldGrammar DLITZ = FieldGrammar.builder("$p5k2$")
            .rounds(16)
            .implicitRounds(400, RoundsOmission.WHEN_DEFAULT_VALUE)
            .build();

    private static final FieldGrammar GRUB = FieldGrammar.builder("grub.pbkdf2.sha512.")
            .separator('.')
            .rounds(10)
            .build();

    @Test
    void shouldSplitModularHash() {
        ParsedFields fields = MODULAR.parse("$pbkdf2$1000$c2FsdA$Y2hlY2s");

        assertThat(fields.ident()).isEqualTo("$pbkdf2$");
        assertThat(fields.rounds()).isEqualTo(1000);
        assertThat(fields.explicitRounds()).isTrue();
        assertThat(fields.salt()).isEqualTo("c2FsdA");
        assertThat(fields.checksum()).isEqualTo("Y2hlY2s");
        assertThat(fields.isConfig()).isFalse();
    }

    @Test
    void shouldTreatMissingOrEmptyChecksumAsConfig() {
        assertThat(MODULAR.parse("$pbkdf2$1000$c2FsdA").isConfig()).isTrue();
        assertThat(MODULAR.parse("$pbkdf2$1000$c2FsdA$").isConfig()).isTrue();
    }

    @Test
    void shouldRejectZeroPaddedRounds() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> MODULAR.parse("$pbkdf2$01000$c2FsdA$Y2hlY2s"))
                .withMessageContaining("zero-padded");
    }

    @Test
    void shouldRejectSignedOrNonNumericRounds() {
        assertThatIllegalArgumentException().isThrownBy(() -> MODULAR.parse("$pbkdf2$+100$salt$chk"));
        assertThatIllegalArgumentException().isThrownBy(() -> MODULAR.parse("$pbkdf2$abc$salt$chk"));
    }

    @Test
    void shouldRequireRoundsWithoutImplicitDefault() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> MODULAR.parse("$pbkdf2$$salt$chk"))
                .withMessageContaining("missing rounds");
    }

    @Test
    void shouldRejectWrongFieldCount() {
        assertThatIllegalArgumentException().isThrownBy(() -> MODULAR.parse("$pbkdf2$1000"));
        assertThatIllegalArgumentException().isThrownBy(() -> MODULAR.parse("$pbkdf2$1000$a$b$c"));
    }

    @Test
    void shouldRejectForeignIdent() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> MODULAR.parse("$6$salt$chk"))
                .withMessageContaining("identifier");
        assertThatIllegalArgumentException().isThrownBy(() -> MODULAR.parse(null));
    }

    @Test
    void shouldApplyImplicitRoundsWhenPrefixedFieldAbsent() {
        ParsedFields fields = SHA512.parse("$6$saltstring$abc");

        assertThat(fields.rounds()).isEqualTo(5000);
        assertThat(fields.explicitRounds()).isFalse();
        assertThat(fields.roundsToken()).isNull();
        assertThat(fields.salt()).isEqualTo("saltstring");
    }

    @Test
    void shouldReadPrefixedRounds() {
        ParsedFields fields = SHA512.parse("$6$rounds=5000$saltstring$abc");

        assertThat(fields.rounds()).isEqualTo(5000);
        assertThat(fields.explicitRounds()).isTrue();
        assertThat(fields.roundsToken()).isEqualTo("5000");
    }

    @Test
    void shouldOmitImplicitDefaultOnlyWhenNotExplicit() {
        assertThat(SHA512.render(5000L, false, "salt", "chk")).isEqualTo("$6$salt$chk");
        assertThat(SHA512.render(5000L, true, "salt", "chk")).isEqualTo("$6$rounds=5000$salt$chk");
        assertThat(SHA512.render(10000L, false, "salt", "chk")).isEqualTo("$6$rounds=10000$salt$chk");
    }

    @Test
    void shouldKeepTrailingSeparatorOnSha512Config() {
        assertThat(SHA512.render(5000L, false, "salt", null)).isEqualTo("$6$salt$");
    }

    @Test
    void shouldLeaveEmptyRoundsFieldForDefaultValue() {
        assertThat(DLITZ.render(400L, true, "exec", "chk")).isEqualTo("$p5k2$$exec$chk");
        assertThat(DLITZ.render(12L, true, "u9HvcT4d", null)).isEqualTo("$p5k2$c$u9HvcT4d");

        ParsedFields fields = DLITZ.parse("$p5k2$$exec$chk");
        assertThat(fields.rounds()).isEqualTo(400);
        assertThat(fields.explicitRounds()).isFalse();
    }

    @Test
    void shouldParseHexRounds() {
        assertThat(DLITZ.parse("$p5k2$3e8$salt$chk").rounds()).isEqualTo(1000);
    }

    @Test
    void shouldSplitOnDotSeparator() {
        ParsedFields fields = GRUB.parse("grub.pbkdf2.sha512.10000.ABCD.EF01");

        assertThat(fields.rounds()).isEqualTo(10000);
        assertThat(fields.salt()).isEqualTo("ABCD");
        assertThat(fields.checksum()).isEqualTo("EF01");
        assertThat(GRUB.render(10000L, true, "ABCD", "EF01")).isEqualTo("grub.pbkdf2.sha512.10000.ABCD.EF01");
    }

    @Test
    void shouldRenderExactInverseOfParse() {
        for (String text : new String[]{
                "$6$rounds=12345$abc$def", "$6$abc$def", "$6$abc$"}) {
            ParsedFields f = SHA512.parse(text);
            String rendered = SHA512.render(f.rounds(), f.explicitRounds(), f.salt(), f.checksum());
            assertThat(rendered).isEqualTo(text);
        }
    }

    @Test
    void shouldRejectUnsupportedRoundsBase() {
        assertThatIllegalArgumentException().isThrownBy(() -> FieldGrammar.builder("$x$").rounds(8).build());
    }

    @Test
    void shouldPreferLongestIdent() {
        FieldGrammar grammar = FieldGrammar.builder("$p$").alias("$p$x$").build();

        assertThat(grammar.matchIdent("$p$x$salt")).contains("$p$x$");
        assertThat(grammar.matchIdent("$p$salt")).contains("$p$");
        assertThat(grammar.matchIdent("$q$salt")).isEmpty();
    }
}
