package com.neal.snowchange.util;

import com.neal.snowchange.exception.MigrationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * @author Neal
 */
public class ChecksumUtils {
    public static final String ALGORITHM = "SHA-224";
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private ChecksumUtils() {
    }

    /**
     * Lowercase hex SHA-224 digest of the UTF-8 bytes of {@code content}.
     */
    public static String checksum(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return toHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new MigrationException(ALGORITHM + " is not available in this JVM", e);
        }
    }

    private static String toHex(byte[] bytes) {
        char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            chars[i * 2] = HEX[(bytes[i] >> 4) & 0x0f];
            chars[i * 2 + 1] = HEX[bytes[i] & 0x0f];
        }
        return new String(chars);
    }
}
