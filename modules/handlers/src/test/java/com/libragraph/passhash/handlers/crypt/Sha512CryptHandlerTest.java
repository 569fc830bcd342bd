package com.libragraph.passhash.handlers.crypt;

import com.libragraph.passhash.handlers.api.ConfigRequest;
import com.libragraph.passhash.handlers.api.InvalidHashException;
import com.libragraph.passhash.handlers.api.Settings;
import com.libragraph.passhash.handlers.normalize.SettingNormalizer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class Sha512CryptHandlerTest {

    private static final String REFERENCE =
            "$6$saltstring$svn8UoSVapNtMuq1ukKS4tPQd8iKwSMHWjl/O817G3uBnIFNjnQJuesI68u4OTLiBFdcbYEdFCoEOfaS35inz1";
    private static final String REFERENCE_ROUNDS = "$6$rounds=10000$saltstringsaltst$"
            + "OW1/O6BYHV6BcXZu8QVeXbDWra3Oeqh0sbHbbMCVNSnCM/UrjmM0Dp8vOuZeHBy/YTBmSK6H9qs/y3RnOaw5v.";
    private static final String CHECKSUM_ABCDEFGH =
            "yVfUwsw5T.JApa8POvClA1pQ5peiq97DUNyXCZN5IrF.BMSkiaLQ5kvpuEm/VQ1Tvh/KV2TcaWh8qinoW5dhA1";

    private static final String EMPTY_SALT =
            "$6$$bLTg4cpho8PIUrjfsE7qlU08Qx2UEfw..xOc6I1wpGVtyVYToGrr7BzRdAAnEr5lYFr1Z9WcCf1xNZ1HG9qFW1";
    private static final String EMPTY_SALT_ROUNDS = "$6$rounds=1000$$"
            + "PY6jU9mjqpnXoXanyLDmsqSc0kw9JbPJybLZ/rvYhwHVrnaZZ9.u7aR1.k0KDKS2E0dSjdGktOwHg0s0fDghW1";

    private final Sha512CryptHandler handler = new Sha512CryptHandler(SettingNormalizer.secure());

    @Test
    void shouldVerifyReferenceHashes() {
        assertThat(handler.verify("Hello world!", REFERENCE)).isTrue();
        assertThat(handler.verify("Hello world!", REFERENCE_ROUNDS)).isTrue();
        assertThat(handler.verify("Hello world", REFERENCE)).isFalse();
    }

    @Test
    void shouldVerifyEmptySaltHashes() {
        assertThat(handler.identify(EMPTY_SALT)).isTrue();
        assertThat(handler.parse(EMPTY_SALT).saltText()).isEmpty();
        assertThat(handler.verify("password", EMPTY_SALT)).isTrue();
        assertThat(handler.verify("passwore", EMPTY_SALT)).isFalse();
        assertThat(handler.verify("x".repeat(100), EMPTY_SALT_ROUNDS)).isTrue();
    }

    @Test
    void shouldHashWithExplicitEmptySalt() {
        String hash = handler.encrypt("password", ConfigRequest.builder().salt("").rounds(5000).build());

        assertThat(hash).isEqualTo(EMPTY_SALT);
    }

    @Test
    void shouldTruncateLongSaltInConfig() {
        String hash = handler.generateHash("Hello world!", "$6$rounds=10000$saltstringsaltstring");

        assertThat(hash).isEqualTo(REFERENCE_ROUNDS);
    }

    @Test
    void shouldOmitImplicitRoundsByDefault() {
        String hash = handler.encrypt("password",
                ConfigRequest.builder().salt("abcdefgh").rounds(5000).implicitRounds(true).build());

        assertThat(hash).isEqualTo("$6$abcdefgh$" + CHECKSUM_ABCDEFGH);
    }

    @Test
    void shouldKeepExplicitRoundsWhenImplicitDisabled() {
        String hash = handler.encrypt("password",
                ConfigRequest.builder().salt("abcdefgh").rounds(5000).implicitRounds(false).build());

        assertThat(hash).isEqualTo("$6$rounds=5000$abcdefgh$" + CHECKSUM_ABCDEFGH);
        assertThat(handler.parse(hash).explicitRounds()).isTrue();
    }

    @Test
    void shouldWriteNonDefaultRounds() {
        String hash = handler.encrypt("password",
                ConfigRequest.builder().salt("abcdefgh").rounds(10000).implicitRounds(true).build());

        assertThat(hash).startsWith("$6$rounds=10000$abcdefgh$");
        assertThat(handler.verify("password", hash)).isTrue();
    }

    @Test
    void shouldReadMissingRoundsAs5000() {
        Settings settings = handler.parse(REFERENCE);

        assertThat(settings.rounds()).isEqualTo(5000);
        assertThat(settings.explicitRounds()).isFalse();
        assertThat(settings.saltText()).isEqualTo("saltstring");
        assertThat(settings.checksum().size()).isEqualTo(64);
    }

    @Test
    void shouldRenderConfigWithTrailingSeparator() {
        String config = handler.generateConfig(ConfigRequest.builder().salt("abcdefgh").rounds(5000).build());

        assertThat(config).isEqualTo("$6$abcdefgh$");
    }

    @Test
    void shouldGenerateSixteenCharSaltAndDefaultRounds() {
        Settings settings = handler.parse(handler.generateConfig());

        assertThat(settings.saltText()).hasSize(16).matches("[./0-9A-Za-z]+");
        assertThat(settings.rounds()).isEqualTo(40000);
    }

    @Test
    void shouldRejectRoundsBelowMinimumInHash() {
        assertThatThrownBy(() -> handler.parse("$6$rounds=999$abcdefgh$" + CHECKSUM_ABCDEFGH))
                .isInstanceOf(InvalidHashException.class)
                .hasMessageContaining("below minimum");
    }

    @Test
    void shouldRaiseInStrictModeForLowRounds() {
        assertThatThrownBy(() -> handler.generateConfig(ConfigRequest.builder().salt("abcdefgh").rounds(10).strict(true).build()))
                .hasMessageContaining("below minimum");
    }

    @Test
    void shouldRejectMalformedHashes() {
        assertThat(handler.identify("$6$rounds=$abc$def")).isFalse();
        assertThat(handler.identify("$6$rounds=05000$abcdefgh$" + CHECKSUM_ABCDEFGH)).isFalse();
        assertThat(handler.identify("$6$abcdefgh$tooShort")).isFalse();
        assertThat(handler.identify("$5$abcdefgh$" + CHECKSUM_ABCDEFGH)).isFalse();
        assertThat(handler.identify(REFERENCE)).isTrue();
        assertThat(handler.identify("$6$abcdefgh$")).isTrue();
    }
}
