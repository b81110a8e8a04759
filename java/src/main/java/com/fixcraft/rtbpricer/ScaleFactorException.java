package com.fixcraft.rtbpricer;

public class ScaleFactorException extends PricerException {
    public ScaleFactorException(String message) {
        super(message);
    }
}
