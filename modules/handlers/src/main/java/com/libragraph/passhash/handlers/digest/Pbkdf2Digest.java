package com.libragraph.passhash.handlers.digest;

import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import java.util.Arrays;
import java.util.function.Supplier;

/**
 * PBKDF2 (PKCS #5 v2.0) over an HMAC digest, via BouncyCastle.
 */
public enum Pbkdf2Digest implements DigestProvider {
    SHA1("sha1", 20, SHA1Digest::new),
    SHA256("sha256", 32, SHA256Digest::new),
    SHA512("sha512", 64, SHA512Digest::new);

    private final String label;
    private final int digestSize;
    private final Supplier<Digest> digestFactory;

    Pbkdf2Digest(String label, int digestSize, Supplier<Digest> digestFactory) {
        this.label = label;
        this.digestSize = digestSize;
        this.digestFactory = digestFactory;
    }

    public String label() {
        return label;
    }

    /**
     * Output size of the underlying hash, the natural PBKDF2 key length.
     */
    public int digestSize() {
        return digestSize;
    }

    @Override
    public byte[] compute(byte[] secret, byte[] salt, long rounds, int outputSize) {
        if (rounds < 1) {
            throw new IllegalArgumentException("PBKDF2 needs at least one round");
        }
        // PKCS5S2ParametersGenerator caps the iteration count at an int
        HMac mac = new HMac(digestFactory.get());
        mac.init(new KeyParameter(secret));
        int blocks = (outputSize + digestSize - 1) / digestSize;
        byte[] output = new byte[blocks * digestSize];
        byte[] u = new byte[digestSize];
        for (int block = 1; block <= blocks; block++) {
            mac.update(salt, 0, salt.length);
            mac.update((byte) (block >>> 24));
            mac.update((byte) (block >>> 16));
            mac.update((byte) (block >>> 8));
            mac.update((byte) block);
            mac.doFinal(u, 0);
            int offset = (block - 1) * digestSize;
            System.arraycopy(u, 0, output, offset, digestSize);
            for (long i = 1; i < rounds; i++) {
                mac.update(u, 0, digestSize);
                mac.doFinal(u, 0);
                for (int j = 0; j < digestSize; j++) {
                    output[offset + j] ^= u[j];
                }
            }
        }
        return Arrays.copyOf(output, outputSize);
    }
}
