package com.fixcraft.rtbpricer;

public class MalformedTokenException extends PricerException {
    public MalformedTokenException(String message) {
        super(message);
    }
}
