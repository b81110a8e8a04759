package com.fixcraft.rtbpricer;

public final class Constants {
    private Constants() {}

    public static final int IV_LEN = 16;
    public static final int PRICE_LEN = 8;
    public static final int SIGNATURE_LEN = 4;
    public static final int TOKEN_LEN = IV_LEN + PRICE_LEN + SIGNATURE_LEN;

    public static final String IV_DIGEST = "MD5";
    public static final String HMAC_ALGO = "HmacSHA1";

    public static final String INTEGRITY_FAILURE = "failed to verify price integrity";

    public static final String ENCRYPTION_KEY_ENV = "RTBPRICER_ENCRYPTION_KEY";
    public static final String INTEGRITY_KEY_ENV = "RTBPRICER_INTEGRITY_KEY";
    public static final String KEY_MODE_ENV = "RTBPRICER_KEY_MODE";
    public static final String SCALE_FACTOR_ENV = "RTBPRICER_SCALE_FACTOR";

    public static final double MICROS_SCALE_FACTOR = 1_000_000d;

    public static final String ENGINE_VERSION = "1.0.0";
}
