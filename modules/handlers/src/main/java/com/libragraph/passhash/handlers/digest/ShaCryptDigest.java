package com.libragraph.passhash.handlers.digest;

import com.libragraph.passhash.util.Hash64Codec;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.Sha2Crypt;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;

/**
 * SHA-512-crypt kernel from commons-codec. The salt is the textual salt as ASCII bytes;
 * the result is the decoded 64-byte checksum.
 */
public final class ShaCryptDigest implements DigestProvider {

    public static final int CHECKSUM_SIZE = 64;

    // Final digest byte for each decoded checksum position
    private static final int[] TRANSPOSE = {
            42, 21, 0, 1, 43, 22, 23, 2, 44, 45, 24, 3, 4, 46, 25, 26, 5, 47, 48, 27, 6, 7,
            49, 28, 29, 8, 50, 51, 30, 9, 10, 52, 31, 32, 11, 53, 54, 33, 12, 13, 55, 34,
            35, 14, 56, 57, 36, 15, 16, 58, 37, 38, 17, 59, 60, 39, 18, 19, 61, 40, 41, 20,
            62, 63
    };

    @Override
    public byte[] compute(byte[] secret, byte[] salt, long rounds, int outputSize) {
        if (outputSize != CHECKSUM_SIZE) {
            throw new IllegalArgumentException("sha512-crypt produces " + CHECKSUM_SIZE + " bytes");
        }
        if (salt.length == 0) {
            // Sha2Crypt only accepts 1-16 salt characters
            return unsalted(secret, rounds);
        }
        String setting = "$6$rounds=" + rounds + "$" + new String(salt, StandardCharsets.US_ASCII);
        // Sha2Crypt zeroes the key array it is given
        String crypted = Sha2Crypt.sha512Crypt(Arrays.copyOf(secret, secret.length), setting);
        return Hash64Codec.HASH64.decode(crypted.substring(crypted.lastIndexOf('$') + 1));
    }

    /**
     * SHA-512-crypt with an empty salt. Every step that would mix in salt bytes is a no-op.
     */
    static byte[] unsalted(byte[] secret, long rounds) {
        MessageDigest digest = DigestUtils.getSha512Digest();

        digest.update(secret);
        digest.update(secret);
        byte[] alternate = digest.digest();

        digest.update(secret);
        int remaining = secret.length;
        for (; remaining > 64; remaining -= 64) {
            digest.update(alternate);
        }
        digest.update(alternate, 0, remaining);
        for (int bits = secret.length; bits > 0; bits >>= 1) {
            digest.update((bits & 1) != 0 ? alternate : secret);
        }
        byte[] current = digest.digest();

        for (int i = 0; i < secret.length; i++) {
            digest.update(secret);
        }
        byte[] secretBlock = digest.digest();
        byte[] secretSequence = new byte[secret.length];
        for (int i = 0; i < secretSequence.length; i++) {
            secretSequence[i] = secretBlock[i % secretBlock.length];
        }

        for (long i = 0; i < rounds; i++) {
            boolean odd = (i & 1) != 0;
            digest.update(odd ? secretSequence : current);
            if (i % 7 != 0) {
                digest.update(secretSequence);
            }
            digest.update(odd ? current : secretSequence);
            current = digest.digest();
        }

        byte[] checksum = new byte[CHECKSUM_SIZE];
        for (int i = 0; i < CHECKSUM_SIZE; i++) {
            checksum[i] = current[TRANSPOSE[i]];
        }
        return checksum;
    }
}
