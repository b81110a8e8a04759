package com.fixcraft.rtbpricer;

import java.util.Arrays;

/**
 * The three fields of an encrypted price: {@code iv[16] | encryptedPrice[8] | signature[4]}.
 */
public final class Token {
    private final byte[] iv;
    private final byte[] encryptedPrice;
    private final byte[] signature;

    public Token(byte[] iv, byte[] encryptedPrice, byte[] signature) {
        this.iv = copyOf(iv, Constants.IV_LEN, "iv");
        this.encryptedPrice = copyOf(encryptedPrice, Constants.PRICE_LEN, "encrypted price");
        this.signature = copyOf(signature, Constants.SIGNATURE_LEN, "signature");
    }

    public byte[] iv() {
        return iv.clone();
    }

    public byte[] encryptedPrice() {
        return encryptedPrice.clone();
    }

    public byte[] signature() {
        return signature.clone();
    }

    private static byte[] copyOf(byte[] field, int len, String name) {
        if (field == null || field.length != len) {
            throw new IllegalArgumentException(name + " must be " + len + " bytes");
        }
        return field.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token)) {
            return false;
        }
        Token other = (Token) o;
        return Arrays.equals(iv, other.iv)
            && Arrays.equals(encryptedPrice, other.encryptedPrice)
            && Arrays.equals(signature, other.signature);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(iv);
        h = 31 * h + Arrays.hashCode(encryptedPrice);
        return 31 * h + Arrays.hashCode(signature);
    }
}
