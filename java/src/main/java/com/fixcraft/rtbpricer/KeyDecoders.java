package com.fixcraft.rtbpricer;

public final class KeyDecoders {
    private static final KeyDecoder DEFAULT = new BcKeyDecoder();

    private KeyDecoders() {}

    public static KeyDecoder get() {
        return DEFAULT;
    }
}
