package com.libragraph.passhash.util;

import java.util.Base64;
import java.util.Objects;

/**
 * Standard base64 bit order with the two non-alphanumeric symbols swapped for
 * other characters. Several hash formats use this instead of hash64.
 */
public final class AltBase64 {

    /** "Adapted base64": {@code .} replaces {@code +}, no padding. */
    public static final AltBase64 AB64 = new AltBase64('.', '/', false);

    /** Base64 with {@code -_} alt characters and {@code =} padding. */
    public static final AltBase64 DASH_UNDERSCORE = new AltBase64('-', '_', true);

    /** Plain padded base64. */
    public static final AltBase64 STANDARD = new AltBase64('+', '/', true);

    private final char char62;
    private final char char63;
    private final boolean padded;

    public AltBase64(char char62, char char63, boolean padded) {
        if (char62 == char63 || Character.isLetterOrDigit(char62) || Character.isLetterOrDigit(char63)) {
            throw new IllegalArgumentException(
                    "alt characters must be distinct non-alphanumerics: " + char62 + char63);
        }
        this.char62 = char62;
        this.char63 = char63;
        this.padded = padded;
    }

    public String encode(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        Base64.Encoder encoder = padded ? Base64.getEncoder() : Base64.getEncoder().withoutPadding();
        String standard = encoder.encodeToString(data);
        return char62 == '+' && char63 == '/'
                ? standard
                : standard.replace('+', char62).replace('/', char63);
    }

    /**
     * Decodes text in this variant. Characters of other variants are rejected.
     *
     * @throws IllegalArgumentException if the text is not valid for this variant
     */
    public byte[] decode(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        StringBuilder standard = new StringBuilder(text.length());
        int padding = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '=' && padded) {
                padding++;
                standard.append(c);
                continue;
            }
            if (padding > 0) {
                throw new IllegalArgumentException("base64 data after padding: " + text);
            }
            if (c == char62) {
                standard.append('+');
            } else if (c == char63) {
                standard.append('/');
            } else if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                standard.append(c);
            } else {
                throw new IllegalArgumentException("invalid base64 character: '" + c + "'");
            }
        }
        if (padded && standard.length() % 4 != 0) {
            throw new IllegalArgumentException("padded base64 length must be a multiple of 4: " + text);
        }
        return Base64.getDecoder().decode(standard.toString());
    }
}
