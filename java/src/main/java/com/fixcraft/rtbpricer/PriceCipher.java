package com.fixcraft.rtbpricer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The individual steps of the price encryption scheme. Every step checks the width of what it
 * receives and what it returns.
 */
public final class PriceCipher {
    private PriceCipher() {}

    public static byte[] deriveIv(String seed) {
        if (seed == null) {
            throw new IllegalArgumentException("seed == null");
        }
        return deriveIv(seed.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] deriveIv(byte[] seed) {
        if (seed == null) {
            throw new IllegalArgumentException("seed == null");
        }
        byte[] iv = Crypto.md5(seed);
        if (iv.length != Constants.IV_LEN) {
            throw new IllegalStateException("IV digest produced " + iv.length + " bytes");
        }
        return iv;
    }

    // pad = hmac(e_key, iv), first 8 bytes
    public static byte[] pad(byte[] encryptionKey, byte[] iv) {
        requireLength(iv, Constants.IV_LEN, "iv");
        return truncate(Crypto.hmacSha1(encryptionKey, iv), Constants.PRICE_LEN);
    }

    public static byte[] obfuscate(byte[] pad, byte[] data) {
        requireLength(pad, Constants.PRICE_LEN, "pad");
        requireLength(data, Constants.PRICE_LEN, "price");
        byte[] out = new byte[Constants.PRICE_LEN];
        Crypto.xor(pad, data, out);
        return out;
    }

    // signature = hmac(i_key, micros || iv), first 4 bytes
    public static byte[] signature(byte[] integrityKey, byte[] micros, byte[] iv) {
        requireLength(micros, Constants.PRICE_LEN, "micros");
        requireLength(iv, Constants.IV_LEN, "iv");
        return truncate(Crypto.hmacSha1(integrityKey, micros, iv), Constants.SIGNATURE_LEN);
    }

    public static boolean verify(byte[] expected, byte[] received) {
        requireLength(expected, Constants.SIGNATURE_LEN, "expected signature");
        requireLength(received, Constants.SIGNATURE_LEN, "received signature");
        return Crypto.constantTimeEquals(expected, received);
    }

    private static byte[] truncate(byte[] digest, int len) {
        if (digest.length < len) {
            throw new IllegalStateException("HMAC produced " + digest.length + " bytes, need " + len);
        }
        return Arrays.copyOf(digest, len);
    }

    private static void requireLength(byte[] data, int len, String name) {
        if (data == null || data.length != len) {
            throw new IllegalArgumentException(name + " must be " + len + " bytes");
        }
    }
}
