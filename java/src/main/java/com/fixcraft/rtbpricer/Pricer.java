package com.fixcraft.rtbpricer;

/**
 * Encrypts a winning price into a web-safe token and back.
 */
public interface Pricer {
    /**
     * @param seed  any string; the same seed always yields the same IV
     * @param price non-negative price in currency units
     * @param debug traces intermediate values for this call only
     */
    String encrypt(String seed, double price, boolean debug);

    /**
     * @throws MalformedTokenException if the text is not a 28-byte web-safe base64 token
     * @throws IntegrityException      if the signature does not match
     */
    double decrypt(String token, boolean debug);
}
