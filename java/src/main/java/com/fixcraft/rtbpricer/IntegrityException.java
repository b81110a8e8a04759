package com.fixcraft.rtbpricer;

/**
 * The signature carried by a token does not match the one recomputed from its contents.
 * The message never says which byte differed.
 */
public class IntegrityException extends PricerException {
    public IntegrityException(String message) {
        super(message);
    }
}
