package com.libragraph.passhash.util;

import java.util.Arrays;
import java.util.Objects;

/**
 * Byte-to-text codec used by crypt-style hash formats ("hash64").
 *
 * <p>Every 3 input bytes become 4 symbols of 6 bits each, packed least-significant-bit first:
 * the first symbol carries the low six bits of the first byte. This is <em>not</em> the
 * bit order of standard base64. Trailing groups are shortened rather than padded:
 * 2 bytes encode to 3 symbols and 1 byte to 2 symbols, with the unused high bits zero.
 *
 * <p>The alphabet is pluggable; the packing is the same for every alphabet.
 * Instances are immutable and thread-safe.
 */
public final class Hash64Codec {

    /** Alphabet used by des-crypt, md5-crypt, sha-crypt and most other crypt formats. */
    public static final String HASH64_CHARS =
            "./0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";

    /** Same symbols, ordered the way bcrypt orders them. */
    public static final String BCRYPT64_CHARS =
            "./ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    public static final Hash64Codec HASH64 = new Hash64Codec(HASH64_CHARS);

    public static final Hash64Codec BCRYPT64 = new Hash64Codec(BCRYPT64_CHARS);

    private final String charset;
    private final char[] alphabet;
    private final byte[] lookup = new byte[128];

    public Hash64Codec(String charset) {
        Objects.requireNonNull(charset, "charset cannot be null");
        if (charset.length() != 64) {
            throw new IllegalArgumentException(
                    "hash64 alphabet must have 64 characters, got: " + charset.length());
        }
        Arrays.fill(lookup, (byte) -1);
        for (int i = 0; i < 64; i++) {
            char c = charset.charAt(i);
            if (c >= 128) {
                throw new IllegalArgumentException("hash64 alphabet must be ASCII: " + c);
            }
            if (lookup[c] != -1) {
                throw new IllegalArgumentException("hash64 alphabet repeats character: " + c);
            }
            lookup[c] = (byte) i;
        }
        this.charset = charset;
        this.alphabet = charset.toCharArray();
    }

    /**
     * Returns the 64 symbols of this codec, in value order.
     */
    public String charset() {
        return charset;
    }

    /**
     * Number of symbols produced for the given number of bytes.
     */
    public static int encodedLength(int byteCount) {
        return (byteCount * 4 + 2) / 3;
    }

    /**
     * Number of bytes recovered from the given number of symbols.
     *
     * @throws IllegalArgumentException if no byte string encodes to that many symbols
     */
    public static int decodedLength(int symbolCount) {
        if (symbolCount % 4 == 1) {
            throw new IllegalArgumentException("invalid hash64 length: " + symbolCount);
        }
        return symbolCount * 3 / 4;
    }

    public String encode(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        StringBuilder out = new StringBuilder(encodedLength(data.length));
        int i = 0;
        while (i + 3 <= data.length) {
            int w = (data[i] & 0xff) | (data[i + 1] & 0xff) << 8 | (data[i + 2] & 0xff) << 16;
            appendSymbols(out, w, 4);
            i += 3;
        }
        int tail = data.length - i;
        if (tail == 2) {
            appendSymbols(out, (data[i] & 0xff) | (data[i + 1] & 0xff) << 8, 3);
        } else if (tail == 1) {
            appendSymbols(out, data[i] & 0xff, 2);
        }
        return out.toString();
    }

    /**
     * Decodes hash64 text. Padding bits of a shortened trailing group are dropped,
     * so they never leak into the returned bytes.
     *
     * @throws IllegalArgumentException on symbols outside the alphabet or an impossible length
     */
    public byte[] decode(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        byte[] out = new byte[decodedLength(text.length())];
        int i = 0;
        int o = 0;
        while (i + 4 <= text.length()) {
            int w = readSymbols(text, i, 4);
            out[o++] = (byte) w;
            out[o++] = (byte) (w >> 8);
            out[o++] = (byte) (w >> 16);
            i += 4;
        }
        int tail = text.length() - i;
        if (tail == 3) {
            int w = readSymbols(text, i, 3);
            out[o++] = (byte) w;
            out[o] = (byte) (w >> 8);
        } else if (tail == 2) {
            out[o] = (byte) readSymbols(text, i, 2);
        }
        return out;
    }

    /**
     * Checks that every character of the text belongs to this alphabet.
     */
    public boolean isValid(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= 128 || lookup[c] == -1) {
                return false;
            }
        }
        return true;
    }

    private void appendSymbols(StringBuilder out, int w, int count) {
        for (int k = 0; k < count; k++) {
            out.append(alphabet[(w >> (6 * k)) & 0x3f]);
        }
    }

    private int readSymbols(String text, int offset, int count) {
        int w = 0;
        for (int k = 0; k < count; k++) {
            w |= valueOf(text.charAt(offset + k)) << (6 * k);
        }
        return w;
    }

    private int valueOf(char c) {
        int v = c < 128 ? lookup[c] : -1;
        if (v < 0) {
            throw new IllegalArgumentException("invalid hash64 character: '" + c + "'");
        }
        return v;
    }
}
