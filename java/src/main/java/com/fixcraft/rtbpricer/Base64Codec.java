package com.fixcraft.rtbpricer;

/**
 * Web-safe base64 (RFC 4648 section 5). Encoding always pads with {@code '='}; decoding accepts
 * padded or unpadded text but is otherwise strict: no whitespace, no foreign characters, and the
 * unused low bits of the last character must be zero, so each byte string has one spelling.
 */
public final class Base64Codec {
    private Base64Codec() {}

    private static final char[] ALPHABET =
        "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_".toCharArray();
    private static final int[] DECODE = buildDecode();
    private static final int PAD = -2;

    private static int[] buildDecode() {
        int[] table = new int[256];
        for (int i = 0; i < table.length; i++) {
            table[i] = -1;
        }
        for (int i = 0; i < ALPHABET.length; i++) {
            table[ALPHABET[i]] = i;
        }
        table['='] = PAD;
        return table;
    }

    public static String encode(byte[] data) {
        if (data == null || data.length == 0) {
            return "";
        }
        int full = data.length / 3;
        int rem = data.length % 3;
        int outLen = (full + (rem > 0 ? 1 : 0)) * 4;
        StringBuilder out = new StringBuilder(outLen);
        int idx = 0;
        for (int i = 0; i < full; i++) {
            int b0 = data[idx++] & 0xFF;
            int b1 = data[idx++] & 0xFF;
            int b2 = data[idx++] & 0xFF;
            out.append(ALPHABET[(b0 >> 2) & 0x3F]);
            out.append(ALPHABET[((b0 << 4) | (b1 >> 4)) & 0x3F]);
            out.append(ALPHABET[((b1 << 2) | (b2 >> 6)) & 0x3F]);
            out.append(ALPHABET[b2 & 0x3F]);
        }
        if (rem == 1) {
            int b0 = data[idx] & 0xFF;
            out.append(ALPHABET[(b0 >> 2) & 0x3F]);
            out.append(ALPHABET[(b0 << 4) & 0x3F]);
            out.append('=');
            out.append('=');
        } else if (rem == 2) {
            int b0 = data[idx++] & 0xFF;
            int b1 = data[idx] & 0xFF;
            out.append(ALPHABET[(b0 >> 2) & 0x3F]);
            out.append(ALPHABET[((b0 << 4) | (b1 >> 4)) & 0x3F]);
            out.append(ALPHABET[(b1 << 2) & 0x3F]);
            out.append('=');
        }
        return out.toString();
    }

    /**
     * Appends the {@code '='} characters an unpadded encoder left off.
     */
    public static String restorePadding(String input) {
        switch (input.length() & 3) {
            case 0:
                return input;
            case 2:
                return input + "==";
            case 3:
                return input + "=";
            default:
                throw new IllegalArgumentException("Invalid base64 length");
        }
    }

    public static byte[] decode(String input) {
        if (input == null || input.isEmpty()) {
            return new byte[0];
        }
        String padded = restorePadding(input);
        int inputLen = padded.length();
        int padding = 0;
        if (padded.charAt(inputLen - 1) == '=') {
            padding++;
            if (padded.charAt(inputLen - 2) == '=') {
                padding++;
            }
        }
        byte[] out = new byte[(inputLen / 4) * 3 - padding];
        int outPos = 0;
        int[] quad = new int[4];
        for (int i = 0; i < inputLen; i += 4) {
            boolean last = i + 4 == inputLen;
            for (int j = 0; j < 4; j++) {
                char ch = padded.charAt(i + j);
                int val = ch < 256 ? DECODE[ch] : -1;
                if (val == -1) {
                    throw new IllegalArgumentException("Invalid base64 payload");
                }
                if (val == PAD && (!last || j < 2)) {
                    throw new IllegalArgumentException("Invalid base64 padding");
                }
                quad[j] = val;
            }
            outPos = decodeQuad(quad, out, outPos);
        }
        return out;
    }

    private static int decodeQuad(int[] quad, byte[] out, int outPos) {
        int b0 = quad[0];
        int b1 = quad[1];
        int b2 = quad[2];
        int b3 = quad[3];

        int v = (b0 << 18) | (b1 << 12);

        if (b2 == PAD) {
            if (b3 != PAD) {
                throw new IllegalArgumentException("Invalid base64 padding");
            }
            if ((b1 & 0x0F) != 0) {
                throw new IllegalArgumentException("Invalid base64 trailing bits");
            }
            out[outPos++] = (byte) ((v >> 16) & 0xFF);
            return outPos;
        }

        v |= (b2 << 6);

        if (b3 == PAD) {
            if ((b2 & 0x03) != 0) {
                throw new IllegalArgumentException("Invalid base64 trailing bits");
            }
            out[outPos++] = (byte) ((v >> 16) & 0xFF);
            out[outPos++] = (byte) ((v >> 8) & 0xFF);
            return outPos;
        }

        v |= b3;

        out[outPos++] = (byte) ((v >> 16) & 0xFF);
        out[outPos++] = (byte) ((v >> 8) & 0xFF);
        out[outPos++] = (byte) (v & 0xFF);
        return outPos;
    }
}
