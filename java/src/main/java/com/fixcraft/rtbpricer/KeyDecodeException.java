package com.fixcraft.rtbpricer;

/**
 * A raw key string could not be decoded under the configured {@link KeyDecodingMode}.
 */
public class KeyDecodeException extends PricerException {
    public KeyDecodeException(String message) {
        super(message);
    }

    public KeyDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
