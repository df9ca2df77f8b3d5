package com.flighttracker.common.id;

import java.security.SecureRandom;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Generates ULIDs (Universally Unique Lexicographically Sortable Identifiers).
 * Format: 10-char timestamp (48-bit ms since epoch) + 16-char randomness (80-bit).
 * Total: 26-char Crockford Base32 string, so tracker ids sort by creation time.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class UlidGenerator {

    public static final int LENGTH = 26;

    private static final char[] ENCODING = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int TIMESTAMP_CHARS = 10;
    private static final int RANDOM_BYTES = 10;
    private static final SecureRandom RANDOM = new SecureRandom();

    public static String generate(Instant at) {
        byte[] randomness = new byte[RANDOM_BYTES];
        RANDOM.nextBytes(randomness);
        return encode(at.toEpochMilli(), randomness);
    }

    private static String encode(long timestamp, byte[] randomness) {
        char[] chars = new char[LENGTH];

        // 48-bit timestamp, most significant 5-bit group first
        for (int i = 0; i < TIMESTAMP_CHARS; i++) {
            int shift = 5 * (TIMESTAMP_CHARS - 1 - i);
            chars[i] = ENCODING[(int) ((timestamp >>> shift) & 0x1F)];
        }

        // 80 random bits, consumed 5 bits at a time
        int bitBuffer = 0;
        int bitCount = 0;
        int out = TIMESTAMP_CHARS;
        for (byte b : randomness) {
            bitBuffer = (bitBuffer << 8) | (b & 0xFF);
            bitCount += 8;
            while (bitCount >= 5) {
                bitCount -= 5;
                chars[out++] = ENCODING[(bitBuffer >>> bitCount) & 0x1F];
            }
        }
        return new String(chars);
    }
}
