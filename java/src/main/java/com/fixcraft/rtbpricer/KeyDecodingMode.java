package com.fixcraft.rtbpricer;

import java.util.Locale;

public enum KeyDecodingMode {
    HEX,
    BASE64,
    PLAIN;

    public static KeyDecodingMode parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("Key decoding mode required");
        }
        String v = raw.trim().toLowerCase(Locale.US);
        switch (v) {
            case "hex":
            case "hexa":
                return HEX;
            case "base64":
            case "b64":
                return BASE64;
            case "plain":
            case "utf8":
            case "raw":
                return PLAIN;
            default:
                throw new IllegalArgumentException("Unknown key decoding mode: " + raw);
        }
    }
}
