package com.aetherclaw.auth;

import java.security.SecureRandom;
import java.util.Random;

/** One-time numeric codes; every digit is an independent uniform draw. */
public class PairingCodeGenerator {

    private final Random random;
    private final int length;

    public PairingCodeGenerator(int length) {
        this(new SecureRandom(), length);
    }

    public PairingCodeGenerator(Random random, int length) {
        if (length < 1) throw new IllegalArgumentException("length must be positive: " + length);
        this.random = random;
        this.length = length;
    }

    public String next() {
        var sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append((char) ('0' + random.nextInt(10)));
        }
        return sb.toString();
    }
}
