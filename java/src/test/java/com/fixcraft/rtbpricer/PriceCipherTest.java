package com.fixcraft.rtbpricer;

import org.bouncycastle.util.encoders.Hex;
import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

public class PriceCipherTest {
    private static final byte[] ENC_KEY = Hex.decode(PricerVectors.ENCRYPTION_KEY_HEX);
    private static final byte[] INT_KEY = Hex.decode(PricerVectors.INTEGRITY_KEY_HEX);

    @Test
    public void testDeriveIvIsMd5OfSeed() {
        byte[] iv = PriceCipher.deriveIv(PricerVectors.AUCTION_SEED);
        Assert.assertEquals(Constants.IV_LEN, iv.length);
        Assert.assertEquals(PricerVectors.AUCTION_IV_HEX, Hex.toHexString(iv));
        Assert.assertArrayEquals(iv, PriceCipher.deriveIv(PricerVectors.AUCTION_SEED.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testDeriveIvOfEmptySeed() {
        Assert.assertEquals("d41d8cd98f00b204e9800998ecf8427e", Hex.toHexString(PriceCipher.deriveIv("")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDeriveIvRejectsNull() {
        PriceCipher.deriveIv((String) null);
    }

    @Test
    public void testPad() {
        byte[] pad = PriceCipher.pad(ENC_KEY, Hex.decode(PricerVectors.AUCTION_IV_HEX));
        Assert.assertEquals(PricerVectors.AUCTION_PAD_HEX, Hex.toHexString(pad));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPadRejectsShortIv() {
        PriceCipher.pad(ENC_KEY, new byte[15]);
    }

    @Test
    public void testObfuscateIsSelfInverse() {
        byte[] pad = Hex.decode(PricerVectors.AUCTION_PAD_HEX);
        byte[] micros = ScaleTransform.microsToBytes(1_500_000L);
        byte[] encoded = PriceCipher.obfuscate(pad, micros);
        Assert.assertEquals("b32264fcd65a00d1", Hex.toHexString(encoded));
        Assert.assertArrayEquals(micros, PriceCipher.obfuscate(pad, encoded));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testObfuscateRejectsWrongWidth() {
        PriceCipher.obfuscate(new byte[8], new byte[7]);
    }

    @Test
    public void testSignatureCoversMicrosAndIv() {
        byte[] iv = Hex.decode(PricerVectors.AUCTION_IV_HEX);
        byte[] micros = ScaleTransform.microsToBytes(1_500_000L);
        byte[] signature = PriceCipher.signature(INT_KEY, micros, iv);
        Assert.assertEquals(PricerVectors.AUCTION_SIGNATURE_HEX, Hex.toHexString(signature));

        byte[] otherIv = iv.clone();
        otherIv[0] ^= 1;
        Assert.assertFalse(PriceCipher.verify(signature, PriceCipher.signature(INT_KEY, micros, otherIv)));
        Assert.assertFalse(PriceCipher.verify(signature,
            PriceCipher.signature(INT_KEY, ScaleTransform.microsToBytes(1_500_001L), iv)));
    }

    @Test
    public void testVerify() {
        Assert.assertTrue(PriceCipher.verify(Hex.decode("bc3f43ff"), Hex.decode("bc3f43ff")));
        Assert.assertFalse(PriceCipher.verify(Hex.decode("bc3f43ff"), Hex.decode("bc3f43fe")));
        Assert.assertFalse(PriceCipher.verify(Hex.decode("bc3f43ff"), Hex.decode("3c3f43ff")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testVerifyRejectsWrongWidth() {
        PriceCipher.verify(new byte[4], new byte[5]);
    }
}
