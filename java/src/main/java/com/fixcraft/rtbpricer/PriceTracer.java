package com.fixcraft.rtbpricer;

/**
 * Receives the intermediate values of an encrypt or decrypt call when debugging is enabled.
 * Tracing never changes what the call returns; a tracer that throws is reported and ignored.
 */
public interface PriceTracer {
    void trace(String label, byte[] value);

    void trace(String label, String value);
}
