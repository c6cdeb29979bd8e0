package org.projectstate.util;

import java.security.SecureRandom;

/** Generates opaque share tokens: 20 characters from {@code [a-z0-9]}. */
public final class ShareIdGenerator {

    public static final int LENGTH = 20;
    private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

    private final SecureRandom random = new SecureRandom();

    public String next() {
        char[] out = new char[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            out[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(out);
    }

    public static boolean isWellFormed(String shareId) {
        return shareId != null && shareId.matches("[a-z0-9]{" + LENGTH + "}");
    }
}
