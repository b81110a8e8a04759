package com.fixcraft.rtbpricer;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

public class ScaleTransformTest {

    @Test
    public void testToMicros() {
        Assert.assertEquals(1_500_000L, micros(1.5, 1_000_000d));
        Assert.assertEquals(0L, micros(0d, 1_000_000d));
        Assert.assertEquals(100L, micros(0.0001, 1_000_000d));
        Assert.assertEquals(1234L, micros(12.34, 100d));
    }

    @Test
    public void testToMicrosIsBigEndian() {
        byte[] bytes = ScaleTransform.toMicros(1.5, 1_000_000d);
        Assert.assertArrayEquals(new byte[] {0, 0, 0, 0, 0, 0x16, (byte) 0xe3, 0x60}, bytes);
    }

    @Test
    public void testBinaryFractionsDoNotTruncate() {
        // 0.29 * 1e6 is 289999.99999999994 in binary floating point
        Assert.assertEquals(290_000L, micros(0.29, 1_000_000d));
        Assert.assertEquals(57L, micros(0.57, 100d));
    }

    @Test
    public void testRoundsHalfUp() {
        Assert.assertEquals(1L, micros(0.0000005, 1_000_000d));
        Assert.assertEquals(0L, micros(0.0000004, 1_000_000d));
        Assert.assertEquals(3L, micros(2.5, 1d));
    }

    @Test
    public void testRoundTripWithinResolution() {
        double[] scales = {1d, 100d, 1_000d, 1_000_000d};
        double[] prices = {0d, 0.01, 0.29, 1.5, 2.75, 99.99, 123.456789, 4_294_967_296.5, 12345678901.234568};
        for (double scale : scales) {
            for (double price : prices) {
                double back = ScaleTransform.fromMicros(ScaleTransform.toMicros(price, scale), scale);
                Assert.assertEquals("price " + price + " scale " + scale, price, back, 1d / scale);
            }
        }
    }

    @Test
    public void testFromMicrosExact() {
        Assert.assertEquals(1.5, ScaleTransform.fromMicros(ScaleTransform.microsToBytes(1_500_000L), 1_000_000d), 0d);
        Assert.assertEquals(0d, ScaleTransform.fromMicros(new byte[8], 1_000_000d), 0d);
        Assert.assertEquals(0.0027, ScaleTransform.fromMicros(ScaleTransform.microsToBytes(2700L), 1_000_000d), 0d);
    }

    @Test
    public void testMaximumMicros() {
        byte[] max = new byte[8];
        Arrays.fill(max, (byte) 0xFF);
        Assert.assertArrayEquals(max, ScaleTransform.microsToBytes(-1L));
        Assert.assertEquals(-1L, ScaleTransform.bytesToMicros(max));
        Assert.assertEquals("18446744073709551615", Long.toUnsignedString(ScaleTransform.bytesToMicros(max)));
        Assert.assertEquals(1.8446744073709552E13, ScaleTransform.fromMicros(max, 1_000_000d), 1d);
    }

    @Test
    public void testMicrosBytesRoundTrip() {
        long[] values = {0L, 1L, 255L, 256L, Long.MAX_VALUE, Long.MIN_VALUE, -2L};
        for (long value : values) {
            Assert.assertEquals(value, ScaleTransform.bytesToMicros(ScaleTransform.microsToBytes(value)));
        }
    }

    @Test(expected = ScaleFactorException.class)
    public void testZeroScaleFactor() {
        ScaleTransform.toMicros(1d, 0d);
    }

    @Test(expected = ScaleFactorException.class)
    public void testNegativeScaleFactor() {
        ScaleTransform.fromMicros(new byte[8], -1d);
    }

    @Test(expected = ScaleFactorException.class)
    public void testNaNScaleFactor() {
        ScaleTransform.toMicros(1d, Double.NaN);
    }

    @Test(expected = PriceRangeException.class)
    public void testNegativePrice() {
        ScaleTransform.toMicros(-0.01, 1_000_000d);
    }

    @Test(expected = PriceRangeException.class)
    public void testInfinitePrice() {
        ScaleTransform.toMicros(Double.POSITIVE_INFINITY, 1_000_000d);
    }

    @Test(expected = PriceRangeException.class)
    public void testPriceTooLargeForEightBytes() {
        ScaleTransform.toMicros(2e13, 1_000_000d);
    }

    @Test
    public void testPriceJustUnderEightByteLimit() {
        long value = micros(1.8e13, 1_000_000d);
        Assert.assertEquals("18000000000000000000", Long.toUnsignedString(value));
    }

    @Test
    public void testSeventeenDigitPriceRecoveredExactly() {
        byte[] encoded = ScaleTransform.toMicros(12345678901.234568, 1_000_000d);
        Assert.assertEquals(12345678901.234568, ScaleTransform.fromMicros(encoded, 1_000_000d), 0d);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromMicrosRejectsWrongWidth() {
        ScaleTransform.fromMicros(new byte[9], 1_000_000d);
    }

    private static long micros(double price, double scale) {
        return ScaleTransform.bytesToMicros(ScaleTransform.toMicros(price, scale));
    }
}
