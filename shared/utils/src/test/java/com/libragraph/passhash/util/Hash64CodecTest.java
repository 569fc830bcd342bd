package com.libragraph.passhash.util;

import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class Hash64CodecTest {

    private final Hash64Codec codec = Hash64Codec.HASH64;

    @Test
    void shouldPackLeastSignificantBitsFirst() {
        assertThat(codec.encode(new byte[]{0x01, 0x02, 0x03})).isEqualTo("/6k.");
        assertThat(codec.encode(new byte[]{(byte) 0xff, (byte) 0xff, (byte) 0xff})).isEqualTo("zzzz");
    }

    @Test
    void shouldShortenPartialGroups() {
        assertThat(codec.encode(new byte[]{0x00})).isEqualTo("..");
        assertThat(codec.encode(new byte[]{(byte) 0xff})).isEqualTo("z1");
        assertThat(codec.encode(new byte[]{(byte) 0xff, (byte) 0xff})).hasSize(3).endsWith("D");
    }

    @Test
    void shouldRoundTripShortInputs() {
        for (int b = 0; b < 256; b++) {
            byte[] one = {(byte) b};
            assertThat(codec.decode(codec.encode(one))).containsExactly(one);

            byte[] two = {(byte) b, (byte) (255 - b)};
            assertThat(codec.decode(codec.encode(two))).containsExactly(two);

            byte[] three = {(byte) b, (byte) (b * 7), (byte) (255 - b)};
            assertThat(codec.decode(codec.encode(three))).containsExactly(three);
        }
    }

    @Test
    void shouldRoundTripLongerInputs() {
        Random random = new SecureRandom();
        for (int len = 0; len <= 70; len++) {
            byte[] data = new byte[len];
            random.nextBytes(data);

            String text = codec.encode(data);
            assertThat(text).hasSize(Hash64Codec.encodedLength(len));
            assertThat(codec.decode(text)).containsExactly(data);
        }
    }

    @Test
    void shouldDropPaddingBitsOnDecode() {
        // 'z' in the last position of a 2-symbol group sets bits beyond the single byte
        byte[] decoded = codec.decode("zz");
        assertThat(decoded).containsExactly((byte) 0xff);
        assertThat(codec.encode(decoded)).isEqualTo("z1");
    }

    @Test
    void shouldRejectImpossibleLength() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> codec.decode("abcde"))
                .withMessageContaining("length");
    }

    @Test
    void shouldRejectForeignCharacters() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> codec.decode("ab+d"))
                .withMessageContaining("'+'");
        assertThat(codec.isValid("ab+d")).isFalse();
        assertThat(codec.isValid("./Az09")).isTrue();
    }

    @Test
    void shouldSupportAlternateAlphabet() {
        byte[] data = {0x10, 0x20, 0x30, 0x40, 0x50};
        String text = Hash64Codec.BCRYPT64.encode(data);

        assertThat(text).isNotEqualTo(codec.encode(data));
        assertThat(Hash64Codec.BCRYPT64.decode(text)).containsExactly(data);
    }

    @Test
    void shouldRejectMalformedAlphabet() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new Hash64Codec("abc"));
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new Hash64Codec("." + Hash64Codec.HASH64_CHARS.substring(0, 63)))
                .withMessageContaining("repeats");
    }
}
