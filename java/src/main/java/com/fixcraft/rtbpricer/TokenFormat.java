package com.fixcraft.rtbpricer;

/**
 * Binary and text framing of a {@link Token}:
 * {@code WebSafeBase64( iv[16] || encryptedPrice[8] || signature[4] )}.
 */
public final class TokenFormat {
    private TokenFormat() {}

    public static byte[] pack(Token token) {
        if (token == null) throw new IllegalArgumentException("token == null");

        byte[] out = new byte[Constants.TOKEN_LEN];
        int offset = 0;
        offset = put(token.iv(), out, offset);
        offset = put(token.encryptedPrice(), out, offset);
        offset = put(token.signature(), out, offset);
        if (offset != Constants.TOKEN_LEN) {
            throw new IllegalStateException("Packed " + offset + " bytes, expected " + Constants.TOKEN_LEN);
        }
        return out;
    }

    public static Token unpack(byte[] data) {
        if (data == null) throw new MalformedTokenException("Token is empty");
        if (data.length != Constants.TOKEN_LEN) {
            throw new MalformedTokenException(
                "Token must decode to " + Constants.TOKEN_LEN + " bytes, got " + data.length);
        }
        int offset = 0;
        byte[] iv = slice(data, offset, Constants.IV_LEN);
        offset += Constants.IV_LEN;
        byte[] encryptedPrice = slice(data, offset, Constants.PRICE_LEN);
        offset += Constants.PRICE_LEN;
        byte[] signature = slice(data, offset, Constants.SIGNATURE_LEN);
        return new Token(iv, encryptedPrice, signature);
    }

    public static String encode(Token token) {
        return Base64Codec.encode(pack(token));
    }

    public static Token decode(String text) {
        if (text == null || text.isEmpty()) {
            throw new MalformedTokenException("Token is empty");
        }
        byte[] raw;
        try {
            raw = Base64Codec.decode(text);
        } catch (IllegalArgumentException exc) {
            throw new MalformedTokenException("Token is not web-safe base64: " + exc.getMessage());
        }
        return unpack(raw);
    }

    private static int put(byte[] part, byte[] out, int offset) {
        System.arraycopy(part, 0, out, offset, part.length);
        return offset + part.length;
    }

    private static byte[] slice(byte[] data, int offset, int len) {
        byte[] part = new byte[len];
        System.arraycopy(data, offset, part, 0, len);
        return part;
    }
}
