package com.fixcraft.rtbpricer;

/**
 * Base type for every failure a pricer reports to its caller.
 */
public class PricerException extends RuntimeException {
    public PricerException(String message) {
        super(message);
    }

    public PricerException(String message, Throwable cause) {
        super(message, cause);
    }
}
