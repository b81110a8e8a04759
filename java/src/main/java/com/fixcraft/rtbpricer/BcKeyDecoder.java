package com.fixcraft.rtbpricer;

import java.nio.charset.StandardCharsets;
import org.bouncycastle.util.encoders.Base64;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

public final class BcKeyDecoder implements KeyDecoder {
    @Override
    public byte[] decode(String raw, KeyDecodingMode mode) throws KeyDecodeException {
        if (mode == null) {
            throw new KeyDecodeException("Key decoding mode required");
        }
        if (raw == null || raw.trim().isEmpty()) {
            throw new KeyDecodeException("Empty key");
        }
        switch (mode) {
            case HEX:
                return decodeHex(raw.trim());
            case BASE64:
                return decodeBase64(raw.trim());
            case PLAIN:
                return raw.getBytes(StandardCharsets.UTF_8);
            default:
                throw new KeyDecodeException("Unsupported key decoding mode: " + mode);
        }
    }

    private static byte[] decodeHex(String key) {
        if ((key.length() & 1) != 0) {
            throw new KeyDecodeException("Invalid hex key length");
        }
        try {
            return Hex.decodeStrict(key);
        } catch (DecoderException | IllegalArgumentException exc) {
            throw new KeyDecodeException("Invalid hex key", exc);
        }
    }

    private static byte[] decodeBase64(String key) {
        // Exchanges publish keys in the web-safe alphabet as often as the standard one.
        String normalized = key.replace('-', '+').replace('_', '/');
        int rem = normalized.length() & 3;
        if (rem == 1) {
            throw new KeyDecodeException("Invalid base64 key length");
        }
        if (rem == 2) {
            normalized = normalized + "==";
        } else if (rem == 3) {
            normalized = normalized + "=";
        }
        byte[] out;
        try {
            out = Base64.decode(normalized);
        } catch (DecoderException | IllegalArgumentException exc) {
            throw new KeyDecodeException("Invalid base64 key", exc);
        }
        if (out.length == 0) {
            throw new KeyDecodeException("Empty key");
        }
        return out;
    }
}
