package io.rthub.util;

import java.security.SecureRandom;

/**
 * Short URL-safe random identifiers for events and scheduled retries.
 */
public final class Ids {
    private static final char[] ALPHABET =
            "_-0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    public static final int DEFAULT_LENGTH = 21;

    public static String newId() {
        return newId(DEFAULT_LENGTH);
    }

    public static String newId(int length) {
        byte[] bytes = new byte[length];
        RANDOM.nextBytes(bytes);
        char[] out = new char[length];
        for (int i = 0; i < length; i++) {
            // 64-char alphabet: the low six bits index it uniformly
            out[i] = ALPHABET[bytes[i] & 63];
        }
        return new String(out);
    }

    private Ids() {}
}
