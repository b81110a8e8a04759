package com.fixcraft.rtbpricer;

/**
 * Turns the textual form of an encryption or integrity key into the raw bytes handed to HMAC.
 * Implementations must be thread-safe.
 */
public interface KeyDecoder {
    byte[] decode(String raw, KeyDecodingMode mode) throws KeyDecodeException;
}
