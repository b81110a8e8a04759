package com.fixcraft.rtbpricer;

/**
 * Price encryption as used between an ad exchange and a bidder
 * (https://developers.google.com/authorized-buyers/rtb/response-guide/decrypt-price).
 *
 * <pre>
 * iv        = md5(seed)
 * pad       = hmac(e_key, iv), first 8 bytes
 * enc_price = pad &lt;xor&gt; price_micros
 * signature = hmac(i_key, price_micros || iv), first 4 bytes
 * token     = WebSafeBase64Encode( iv || enc_price || signature )
 * </pre>
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class DoubleClickPricer implements Pricer {
    private final byte[] encryptionKey;
    private final byte[] integrityKey;
    private final KeyDecodingMode keyDecodingMode;
    private final double scaleFactor;
    private final boolean debug;
    private final PriceTracer tracer;

    private DoubleClickPricer(byte[] encryptionKey,
                              byte[] integrityKey,
                              KeyDecodingMode keyDecodingMode,
                              double scaleFactor,
                              boolean debug,
                              PriceTracer tracer) {
        this.encryptionKey = encryptionKey;
        this.integrityKey = integrityKey;
        this.keyDecodingMode = keyDecodingMode;
        this.scaleFactor = scaleFactor;
        this.debug = debug;
        this.tracer = tracer;
    }

    public static DoubleClickPricer create(String encryptionKey,
                                           String integrityKey,
                                           KeyDecodingMode keyDecodingMode,
                                           double scaleFactor,
                                           boolean debug) {
        return create(encryptionKey, integrityKey, keyDecodingMode, scaleFactor, debug,
            KeyDecoders.get(), PriceTracers.runtimeLog());
    }

    public static DoubleClickPricer create(String encryptionKey,
                                           String integrityKey,
                                           KeyDecodingMode keyDecodingMode,
                                           double scaleFactor,
                                           boolean debug,
                                           KeyDecoder keyDecoder,
                                           PriceTracer tracer) {
        if (keyDecoder == null) {
            throw new IllegalArgumentException("keyDecoder == null");
        }
        ScaleTransform.checkScaleFactor(scaleFactor);
        byte[] encKey = decodeKey(keyDecoder, encryptionKey, keyDecodingMode, "encryption");
        byte[] intKey = decodeKey(keyDecoder, integrityKey, keyDecodingMode, "integrity");
        return new DoubleClickPricer(encKey, intKey, keyDecodingMode, scaleFactor, debug,
            tracer == null ? PriceTracers.noop() : tracer);
    }

    /**
     * Builds a pricer from key bytes that are already decoded.
     */
    public static DoubleClickPricer fromKeyBytes(byte[] encryptionKey,
                                                 byte[] integrityKey,
                                                 double scaleFactor,
                                                 PriceTracer tracer) {
        ScaleTransform.checkScaleFactor(scaleFactor);
        if (encryptionKey == null || encryptionKey.length == 0) {
            throw new KeyDecodeException("Empty encryption key");
        }
        if (integrityKey == null || integrityKey.length == 0) {
            throw new KeyDecodeException("Empty integrity key");
        }
        return new DoubleClickPricer(encryptionKey.clone(), integrityKey.clone(), null, scaleFactor, false,
            tracer == null ? PriceTracers.noop() : tracer);
    }

    private static byte[] decodeKey(KeyDecoder decoder, String raw, KeyDecodingMode mode, String which) {
        byte[] key;
        try {
            key = decoder.decode(raw, mode);
        } catch (KeyDecodeException exc) {
            throw new KeyDecodeException("Failed to decode " + which + " key: " + exc.getMessage(), exc);
        } catch (RuntimeException exc) {
            throw new KeyDecodeException("Failed to decode " + which + " key", exc);
        }
        if (key == null || key.length == 0) {
            throw new KeyDecodeException("Failed to decode " + which + " key: empty result");
        }
        return key.clone();
    }

    public double scaleFactor() {
        return scaleFactor;
    }

    @Override
    public String encrypt(String seed, double price, boolean debug) {
        return encryptInternal(seed, ScaleTransform.toMicros(price, scaleFactor), debug);
    }

    @Override
    public double decrypt(String token, boolean debug) {
        return ScaleTransform.fromMicros(decryptInternal(token, debug), scaleFactor);
    }

    /**
     * Encrypts a raw 64-bit value with no scaling. The long is read as unsigned.
     */
    public String encryptMicros(String seed, long micros, boolean debug) {
        return encryptInternal(seed, ScaleTransform.microsToBytes(micros), debug);
    }

    public long decryptMicros(String token, boolean debug) {
        return ScaleTransform.bytesToMicros(decryptInternal(token, debug));
    }

    private String encryptInternal(String seed, byte[] micros, boolean callDebug) {
        CallTrace trace = new CallTrace(tracer, debug || callDebug);
        traceKeys(trace);
        trace.emit("Price micros", micros);

        byte[] iv = PriceCipher.deriveIv(seed);
        trace.emit("Seed", seed);
        trace.emit("Initialization vector", iv);

        byte[] pad = PriceCipher.pad(encryptionKey, iv);
        trace.emit("Pad", pad);

        byte[] encoded = PriceCipher.obfuscate(pad, micros);
        trace.emit("Encoded price bytes", encoded);

        byte[] signature = PriceCipher.signature(integrityKey, micros, iv);
        trace.emit("Signature", signature);

        String token = TokenFormat.encode(new Token(iv, encoded, signature));
        trace.emit("Token", token);
        return token;
    }

    private byte[] decryptInternal(String text, boolean callDebug) {
        CallTrace trace = new CallTrace(tracer, debug || callDebug);
        traceKeys(trace);
        trace.emit("Encrypted price", text);

        Token token = TokenFormat.decode(text);
        byte[] iv = token.iv();
        byte[] encoded = token.encryptedPrice();
        byte[] received = token.signature();
        trace.emit("Initialization vector", iv);
        trace.emit("Encoded price bytes", encoded);
        trace.emit("Received signature", received);

        byte[] pad = PriceCipher.pad(encryptionKey, iv);
        trace.emit("Pad", pad);

        byte[] micros = PriceCipher.obfuscate(pad, encoded);
        byte[] expected = PriceCipher.signature(integrityKey, micros, iv);
        trace.emit("Computed signature", expected);

        if (!PriceCipher.verify(expected, received)) {
            throw new IntegrityException(Constants.INTEGRITY_FAILURE);
        }
        trace.emit("Price micros", micros);
        return micros;
    }

    private void traceKeys(CallTrace trace) {
        if (!trace.enabled) {
            return;
        }
        trace.emit("Keys decoding mode", String.valueOf(keyDecodingMode));
        trace.emit("Encryption key (bytes)", encryptionKey);
        trace.emit("Integrity key (bytes)", integrityKey);
    }

    private static final class CallTrace {
        private final PriceTracer tracer;
        private boolean enabled;

        CallTrace(PriceTracer tracer, boolean enabled) {
            this.tracer = tracer;
            this.enabled = enabled;
        }

        void emit(String label, byte[] value) {
            if (!enabled) {
                return;
            }
            try {
                tracer.trace(label, value == null ? null : value.clone());
            } catch (RuntimeException exc) {
                disable(exc);
            }
        }

        void emit(String label, String value) {
            if (!enabled) {
                return;
            }
            try {
                tracer.trace(label, value);
            } catch (RuntimeException exc) {
                disable(exc);
            }
        }

        private void disable(RuntimeException exc) {
            enabled = false;
            RuntimeLog.warn("Price tracer failed, tracing disabled for this call: " + exc);
        }
    }
}
