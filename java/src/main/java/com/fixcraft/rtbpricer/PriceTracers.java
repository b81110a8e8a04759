package com.fixcraft.rtbpricer;

import org.bouncycastle.util.encoders.Hex;

public final class PriceTracers {
    private static final PriceTracer NOOP = new PriceTracer() {
        @Override
        public void trace(String label, byte[] value) {
        }

        @Override
        public void trace(String label, String value) {
        }
    };

    private static final PriceTracer RUNTIME_LOG = new PriceTracer() {
        @Override
        public void trace(String label, byte[] value) {
            RuntimeLog.info("[rtbpricer.trace] " + label + " : " + (value == null ? "null" : Hex.toHexString(value)));
        }

        @Override
        public void trace(String label, String value) {
            RuntimeLog.info("[rtbpricer.trace] " + label + " : " + value);
        }
    };

    private PriceTracers() {}

    public static PriceTracer noop() {
        return NOOP;
    }

    /**
     * Writes one hex-encoded line per value to stderr through {@link RuntimeLog}.
     */
    public static PriceTracer runtimeLog() {
        return RUNTIME_LOG;
    }
}
