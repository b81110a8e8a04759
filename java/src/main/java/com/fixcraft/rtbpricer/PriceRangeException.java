package com.fixcraft.rtbpricer;

/**
 * The price is negative, not finite, or does not fit in 8 bytes once scaled.
 */
public class PriceRangeException extends PricerException {
    public PriceRangeException(String message) {
        super(message);
    }
}
