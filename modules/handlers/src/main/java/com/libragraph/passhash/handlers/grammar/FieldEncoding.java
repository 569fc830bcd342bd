package com.libragraph.passhash.handlers.grammar;

import com.libragraph.passhash.util.AltBase64;
import com.libragraph.passhash.util.Hash64Codec;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/**
 * Text encodings used for salt and checksum fields.
 * {@code decode} throws {@link IllegalArgumentException} on malformed text.
 */
public enum FieldEncoding {

    /** Salt written as-is; the bytes are its ASCII characters. */
    ASCII {
        @Override
        public String encode(byte[] raw) {
            return new String(raw, StandardCharsets.US_ASCII);
        }

        @Override
        public byte[] decode(String text) {
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) >= 128) {
                    throw new IllegalArgumentException("non-ASCII character in field");
                }
            }
            return text.getBytes(StandardCharsets.US_ASCII);
        }
    },
    HASH64 {
        @Override
        public String encode(byte[] raw) {
            return Hash64Codec.HASH64.encode(raw);
        }

        @Override
        public byte[] decode(String text) {
            return Hash64Codec.HASH64.decode(text);
        }
    },
    AB64 {
        @Override
        public String encode(byte[] raw) {
            return AltBase64.AB64.encode(raw);
        }

        @Override
        public byte[] decode(String text) {
            return AltBase64.AB64.decode(text);
        }
    },
    DASH_UNDERSCORE_B64 {
        @Override
        public String encode(byte[] raw) {
            return AltBase64.DASH_UNDERSCORE.encode(raw);
        }

        @Override
        public byte[] decode(String text) {
            return AltBase64.DASH_UNDERSCORE.decode(text);
        }
    },
    STANDARD_B64 {
        @Override
        public String encode(byte[] raw) {
            return AltBase64.STANDARD.encode(raw);
        }

        @Override
        public byte[] decode(String text) {
            return AltBase64.STANDARD.decode(text);
        }
    },
    UPPER_HEX {
        @Override
        public String encode(byte[] raw) {
            return HexFormat.of().withUpperCase().formatHex(raw);
        }

        @Override
        public byte[] decode(String text) {
            return HexFormat.of().parseHex(text);
        }
    },
    LOWER_HEX {
        @Override
        public String encode(byte[] raw) {
            return HexFormat.of().formatHex(raw);
        }

        @Override
        public byte[] decode(String text) {
            return HexFormat.of().parseHex(text);
        }
    };

    public abstract String encode(byte[] raw);

    public abstract byte[] decode(String text);
}
