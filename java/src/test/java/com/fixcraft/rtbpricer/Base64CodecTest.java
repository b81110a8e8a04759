package com.fixcraft.rtbpricer;

import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

public class Base64CodecTest {

    @Test
    public void testEncode() {
        Assert.assertEquals("", Base64Codec.encode(new byte[0]));
        Assert.assertEquals("Zg==", Base64Codec.encode(bytes("f")));
        Assert.assertEquals("Zm8=", Base64Codec.encode(bytes("fo")));
        Assert.assertEquals("Zm9v", Base64Codec.encode(bytes("foo")));
        Assert.assertEquals("Zm9vYmFy", Base64Codec.encode(bytes("foobar")));
    }

    @Test
    public void testEncodeUsesWebSafeAlphabet() {
        Assert.assertEquals("-_8=", Base64Codec.encode(new byte[] {(byte) 0xfb, (byte) 0xff}));
    }

    @Test
    public void testDecodePaddedAndUnpadded() {
        Assert.assertArrayEquals(bytes("f"), Base64Codec.decode("Zg=="));
        Assert.assertArrayEquals(bytes("f"), Base64Codec.decode("Zg"));
        Assert.assertArrayEquals(bytes("fo"), Base64Codec.decode("Zm8"));
        Assert.assertArrayEquals(bytes("foobar"), Base64Codec.decode("Zm9vYmFy"));
        Assert.assertArrayEquals(new byte[] {(byte) 0xfb, (byte) 0xff}, Base64Codec.decode("-_8"));
    }

    @Test
    public void testRestorePadding() {
        Assert.assertEquals("Zm9v", Base64Codec.restorePadding("Zm9v"));
        Assert.assertEquals("Zg==", Base64Codec.restorePadding("Zg"));
        Assert.assertEquals("Zm8=", Base64Codec.restorePadding("Zm8"));
    }

    @Test
    public void testRejectsStandardAlphabet() {
        assertRejected("+/8=");
    }

    @Test
    public void testRejectsWhitespace() {
        assertRejected("Zm9v Zm9v");
        assertRejected("Zm9v\n");
    }

    @Test
    public void testRejectsDanglingCharacter() {
        assertRejected("Zm9vY");
    }

    @Test
    public void testRejectsMisplacedPadding() {
        assertRejected("Zg==Zm9v");
        assertRejected("Z===");
        assertRejected("Zg=v");
        assertRejected("====");
    }

    @Test
    public void testRejectsNonZeroTrailingBits() {
        assertRejected("Zh==");
        assertRejected("Zm9=");
        assertRejected("-_9");
    }

    private static void assertRejected(String input) {
        try {
            Base64Codec.decode(input);
            Assert.fail("accepted " + input);
        } catch (IllegalArgumentException expected) {
            // ok
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }
}
