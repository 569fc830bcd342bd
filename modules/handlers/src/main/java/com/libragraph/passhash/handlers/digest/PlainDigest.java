package com.libragraph.passhash.handlers.digest;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.MessageDigestAlgorithms;

/**
 * Single unsalted message digest. Salt and rounds are ignored.
 */
public enum PlainDigest implements DigestProvider {
    SHA1("sha1", MessageDigestAlgorithms.SHA_1, 20),
    SHA256("sha256", MessageDigestAlgorithms.SHA_256, 32),
    SHA512("sha512", MessageDigestAlgorithms.SHA_512, 64);

    private final String label;
    private final String algorithm;
    private final int digestSize;

    PlainDigest(String label, String algorithm, int digestSize) {
        this.label = label;
        this.algorithm = algorithm;
        this.digestSize = digestSize;
    }

    public String label() {
        return label;
    }

    public int digestSize() {
        return digestSize;
    }

    @Override
    public byte[] compute(byte[] secret, byte[] salt, long rounds, int outputSize) {
        return new DigestUtils(algorithm).digest(secret);
    }
}
