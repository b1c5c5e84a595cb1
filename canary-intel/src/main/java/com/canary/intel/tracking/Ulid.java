package com.canary.intel.tracking;

import java.security.SecureRandom;

/**
 * ULID prediction ids: 48-bit millisecond timestamp + 80 random bits as 26 Crockford
 * base32 characters. Ids sort by creation time.
 */
public final class Ulid {

    private static final char[] ENCODING = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    private Ulid() {}

    public static String generate(long epochMillis) {
        byte[] rand = new byte[10];
        RANDOM.nextBytes(rand);
        return encode(epochMillis, rand);
    }

    static String encode(long epochMillis, byte[] rand) {
        char[] chars = new char[26];

        // Timestamp: 10 chars, 5 bits each, high to low
        for (int i = 9; i >= 0; i--) {
            chars[i] = ENCODING[(int) (epochMillis & 0x1F)];
            epochMillis >>>= 5;
        }

        // Randomness: 80 bits read as a bit stream
        int bitBuffer = 0;
        int bitCount = 0;
        int pos = 10;
        for (byte b : rand) {
            bitBuffer = (bitBuffer << 8) | (b & 0xFF);
            bitCount += 8;
            while (bitCount >= 5) {
                bitCount -= 5;
                chars[pos++] = ENCODING[(bitBuffer >>> bitCount) & 0x1F];
            }
        }
        return new String(chars);
    }
}
