package com.fixcraft.rtbpricer;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Converts between a price and its fixed-point form, an unsigned 64-bit big-endian integer in
 * units of {@code 1 / scaleFactor}.
 *
 * <p>Scaling is done in decimal on the shortest string form of the double, then rounded half up,
 * so {@code 0.29 * 1_000_000} yields {@code 290000} rather than {@code 289999}. Decoding divides
 * in decimal128 precision and rounds to a double only once, which recovers the price within
 * {@code 1 / scaleFactor} even for prices that need 17 significant digits.
 */
public final class ScaleTransform {
    private static final BigInteger MAX_MICROS = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private ScaleTransform() {}

    public static byte[] toMicros(double price, double scaleFactor) {
        checkScaleFactor(scaleFactor);
        if (Double.isNaN(price) || Double.isInfinite(price)) {
            throw new PriceRangeException("Price must be finite");
        }
        if (price < 0d) {
            throw new PriceRangeException("Price must be >= 0");
        }
        BigInteger micros = BigDecimal.valueOf(price)
            .multiply(BigDecimal.valueOf(scaleFactor))
            .setScale(0, RoundingMode.HALF_UP)
            .toBigIntegerExact();
        if (micros.compareTo(MAX_MICROS) > 0) {
            throw new PriceRangeException("Scaled price does not fit in 8 bytes");
        }
        return microsToBytes(micros.longValue());
    }

    public static double fromMicros(byte[] micros, double scaleFactor) {
        checkScaleFactor(scaleFactor);
        BigInteger value = new BigInteger(1, checkLength(micros));
        return new BigDecimal(value)
            .divide(BigDecimal.valueOf(scaleFactor), MathContext.DECIMAL128)
            .doubleValue();
    }

    /**
     * Writes {@code micros} as unsigned big-endian; negative longs stand for values above 2^63-1.
     */
    public static byte[] microsToBytes(long micros) {
        byte[] out = new byte[Constants.PRICE_LEN];
        for (int i = Constants.PRICE_LEN - 1; i >= 0; i--) {
            out[i] = (byte) micros;
            micros >>>= 8;
        }
        return out;
    }

    public static long bytesToMicros(byte[] micros) {
        checkLength(micros);
        long value = 0L;
        for (int i = 0; i < Constants.PRICE_LEN; i++) {
            value = (value << 8) | (micros[i] & 0xFFL);
        }
        return value;
    }

    public static void checkScaleFactor(double scaleFactor) {
        if (Double.isNaN(scaleFactor) || Double.isInfinite(scaleFactor) || scaleFactor <= 0d) {
            throw new ScaleFactorException("Scale factor must be a finite value > 0, got " + scaleFactor);
        }
    }

    private static byte[] checkLength(byte[] micros) {
        if (micros == null || micros.length != Constants.PRICE_LEN) {
            throw new IllegalArgumentException("Micros must be " + Constants.PRICE_LEN + " bytes");
        }
        return micros;
    }
}
