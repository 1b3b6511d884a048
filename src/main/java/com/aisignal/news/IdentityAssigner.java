package com.aisignal.news;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Derives the dedup key of an item from its canonical locator.
 */
public final class IdentityAssigner {
    public static final int IDENTITY_LENGTH = 12;
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private IdentityAssigner() {
    }

    /**
     * MD5 of the UTF-8 locator as lower-case hex, cut to {@value #IDENTITY_LENGTH} characters.
     * A null locator hashes like the empty string.
     */
    public static String identity(String locator) {
        byte[] digest = md5().digest((locator == null ? "" : locator).getBytes(StandardCharsets.UTF_8));
        StringBuilder sb = new StringBuilder(IDENTITY_LENGTH);
        for (int i = 0; i < digest.length && sb.length() < IDENTITY_LENGTH; i++) {
            sb.append(HEX[(digest[i] >> 4) & 0x0f]);
            sb.append(HEX[digest[i] & 0x0f]);
        }
        return sb.toString();
    }

    private static MessageDigest md5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship MD5
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }
}
