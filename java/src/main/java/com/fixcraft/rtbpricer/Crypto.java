package com.fixcraft.rtbpricer;

import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.bouncycastle.util.Arrays;

/**
 * JCA primitives used by the price cipher. Instances are cached per thread, so every method
 * here is safe to call concurrently.
 */
public final class Crypto {
    private static final ThreadLocal<Mac> HMAC_SHA1 = ThreadLocal.withInitial(Crypto::initHmacInstance);
    private static final ThreadLocal<MessageDigest> MD5 = ThreadLocal.withInitial(Crypto::initMd5Instance);

    private Crypto() {}

    public static byte[] md5(byte[] data) {
        MessageDigest md = MD5.get();
        md.reset();
        return md.digest(data);
    }

    /**
     * HMAC-SHA1 of the concatenation of {@code parts} under {@code key}. Any key length is
     * accepted; keys longer than the block size are hashed first as HMAC prescribes.
     */
    public static byte[] hmacSha1(byte[] key, byte[]... parts) {
        Mac mac = initHmac(key);
        for (byte[] part : parts) {
            if (part != null && part.length > 0) {
                mac.update(part);
            }
        }
        return mac.doFinal();
    }

    static Mac initHmac(byte[] key) {
        if (key == null || key.length == 0) {
            throw new IllegalArgumentException("HMAC key required");
        }
        try {
            Mac mac = HMAC_SHA1.get();
            mac.init(new SecretKeySpec(key, Constants.HMAC_ALGO));
            return mac;
        } catch (GeneralSecurityException exc) {
            throw new IllegalStateException("HMAC init failed", exc);
        }
    }

    public static void xor(byte[] a, byte[] b, byte[] out) {
        if (a.length != b.length || out.length != a.length) {
            throw new IllegalArgumentException("XOR operands differ in length");
        }
        for (int i = 0; i < a.length; i++) {
            out[i] = (byte) (a[i] ^ b[i]);
        }
    }

    /**
     * Compares every byte regardless of where the first difference sits.
     */
    public static boolean constantTimeEquals(byte[] expected, byte[] received) {
        return Arrays.constantTimeAreEqual(expected, received);
    }

    private static Mac initHmacInstance() {
        try {
            return Mac.getInstance(Constants.HMAC_ALGO);
        } catch (GeneralSecurityException exc) {
            throw new IllegalStateException("HMAC unavailable", exc);
        }
    }

    private static MessageDigest initMd5Instance() {
        try {
            return MessageDigest.getInstance(Constants.IV_DIGEST);
        } catch (GeneralSecurityException exc) {
            throw new IllegalStateException("MD5 unavailable", exc);
        }
    }
}
