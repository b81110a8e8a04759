package com.fixcraft.rtbpricer.cli;

import com.fixcraft.rtbpricer.Constants;
import com.fixcraft.rtbpricer.DoubleClickPricer;
import com.fixcraft.rtbpricer.KeyDecodingMode;
import com.fixcraft.rtbpricer.PricerException;
import com.fixcraft.rtbpricer.RuntimeLog;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class RtbPricerCli {
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final class GlobalOptions {
        final boolean verbose;
        final boolean noLog;
        final boolean debug;
        final String encryptionKey;
        final String integrityKey;
        final String mode;
        final String scale;
        final String[] args;

        GlobalOptions(boolean verbose,
                      boolean noLog,
                      boolean debug,
                      String encryptionKey,
                      String integrityKey,
                      String mode,
                      String scale,
                      String[] args) {
            this.verbose = verbose;
            this.noLog = noLog;
            this.debug = debug;
            this.encryptionKey = encryptionKey;
            this.integrityKey = integrityKey;
            this.mode = mode;
            this.scale = scale;
            this.args = args;
        }
    }

    private RtbPricerCli() {}

    public static void main(String[] args) {
        int code = run(args, System.out, System.err, System.getenv());
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err, Map<String, String> env) {
        if (args == null || args.length == 0) {
            usage(out);
            return EXIT_USAGE;
        }
        GlobalOptions globals;
        try {
            globals = parseGlobalOptions(args);
        } catch (IllegalArgumentException exc) {
            err.println("ERROR: " + exc.getMessage());
            usage(out);
            return EXIT_USAGE;
        }
        RuntimeLog.configureFromCli(globals.verbose, globals.noLog);
        args = globals.args;
        if (args.length == 0) {
            usage(out);
            return EXIT_USAGE;
        }

        String command = args[0];
        int argc = args.length;
        try {
            switch (command) {
                case "encrypt": {
                    if (argc < 3) {
                        usage(out);
                        return EXIT_USAGE;
                    }
                    DoubleClickPricer pricer = buildPricer(globals, env);
                    out.println(pricer.encrypt(args[1], parseDouble(args[2], "price"), globals.debug));
                    return EXIT_OK;
                }
                case "decrypt": {
                    if (argc < 2) {
                        usage(out);
                        return EXIT_USAGE;
                    }
                    DoubleClickPricer pricer = buildPricer(globals, env);
                    out.println(formatPrice(pricer.decrypt(args[1], globals.debug)));
                    return EXIT_OK;
                }
                case "encrypt-micros": {
                    if (argc < 3) {
                        usage(out);
                        return EXIT_USAGE;
                    }
                    DoubleClickPricer pricer = buildPricer(globals, env);
                    out.println(pricer.encryptMicros(args[1], parseMicros(args[2]), globals.debug));
                    return EXIT_OK;
                }
                case "decrypt-micros": {
                    if (argc < 2) {
                        usage(out);
                        return EXIT_USAGE;
                    }
                    DoubleClickPricer pricer = buildPricer(globals, env);
                    out.println(Long.toUnsignedString(pricer.decryptMicros(args[1], globals.debug)));
                    return EXIT_OK;
                }
                case "version":
                    out.println("rtbpricer " + Constants.ENGINE_VERSION);
                    return EXIT_OK;
                default:
                    err.println("ERROR: unknown command " + command);
                    usage(out);
                    return EXIT_USAGE;
            }
        } catch (PricerException | IllegalArgumentException exc) {
            err.println("ERROR: " + exc.getMessage());
            RuntimeLog.detail("cause: " + exc.getClass().getSimpleName());
            return EXIT_ERROR;
        }
    }

    private static DoubleClickPricer buildPricer(GlobalOptions globals, Map<String, String> env) {
        String encKey = firstNonEmpty(globals.encryptionKey, env.get(Constants.ENCRYPTION_KEY_ENV));
        String intKey = firstNonEmpty(globals.integrityKey, env.get(Constants.INTEGRITY_KEY_ENV));
        if (encKey == null) {
            throw new IllegalArgumentException("Encryption key required (--enc-key or " + Constants.ENCRYPTION_KEY_ENV + ")");
        }
        if (intKey == null) {
            throw new IllegalArgumentException("Integrity key required (--int-key or " + Constants.INTEGRITY_KEY_ENV + ")");
        }
        String modeRaw = firstNonEmpty(globals.mode, env.get(Constants.KEY_MODE_ENV));
        KeyDecodingMode mode = modeRaw == null ? KeyDecodingMode.HEX : KeyDecodingMode.parse(modeRaw);
        String scaleRaw = firstNonEmpty(globals.scale, env.get(Constants.SCALE_FACTOR_ENV));
        double scale = scaleRaw == null ? Constants.MICROS_SCALE_FACTOR : parseDouble(scaleRaw, "scale factor");
        RuntimeLog.detail("mode=" + mode + " scale=" + scale + " debug=" + globals.debug);
        return DoubleClickPricer.create(encKey, intKey, mode, scale, globals.debug);
    }

    private static GlobalOptions parseGlobalOptions(String[] args) {
        boolean verbose = false;
        boolean noLog = false;
        boolean debug = false;
        String encKey = null;
        String intKey = null;
        String mode = null;
        String scale = null;
        List<String> cleaned = new ArrayList<String>(args.length);
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--verbose".equals(arg) || "-v".equals(arg)) {
                verbose = true;
                continue;
            }
            if ("--no-log".equals(arg)) {
                noLog = true;
                continue;
            }
            if ("--debug".equals(arg)) {
                debug = true;
                continue;
            }
            if ("--enc-key".equals(arg)) {
                encKey = optionValue(args, ++i, arg);
                continue;
            }
            if ("--int-key".equals(arg)) {
                intKey = optionValue(args, ++i, arg);
                continue;
            }
            if ("--mode".equals(arg)) {
                mode = optionValue(args, ++i, arg);
                continue;
            }
            if ("--scale".equals(arg)) {
                scale = optionValue(args, ++i, arg);
                continue;
            }
            cleaned.add(arg);
        }
        return new GlobalOptions(verbose, noLog, debug, encKey, intKey, mode, scale, cleaned.toArray(new String[0]));
    }

    private static String optionValue(String[] args, int index, String name) {
        if (index >= args.length) {
            throw new IllegalArgumentException(name + " expects a value");
        }
        return args[index];
    }

    private static String firstNonEmpty(String a, String b) {
        if (a != null && !a.trim().isEmpty()) {
            return a;
        }
        if (b != null && !b.trim().isEmpty()) {
            return b;
        }
        return null;
    }

    private static double parseDouble(String raw, String what) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException exc) {
            throw new IllegalArgumentException("Invalid " + what + ": " + raw);
        }
    }

    private static long parseMicros(String raw) {
        try {
            return Long.parseUnsignedLong(raw.trim());
        } catch (NumberFormatException exc) {
            throw new IllegalArgumentException("Invalid micros: " + raw);
        }
    }

    private static String formatPrice(double price) {
        return BigDecimal.valueOf(price).toPlainString();
    }

    private static void usage(PrintStream out) {
        out.println("RTB Pricer CLI");
        out.println("  [global] --verbose|-v --no-log --debug");
        out.println("  [keys]   --enc-key <key> --int-key <key> --mode hex|base64|plain --scale <factor>");
        out.println("           (env: " + Constants.ENCRYPTION_KEY_ENV + ", " + Constants.INTEGRITY_KEY_ENV
            + ", " + Constants.KEY_MODE_ENV + ", " + Constants.SCALE_FACTOR_ENV + ")");
        out.println("  encrypt <seed> <price>");
        out.println("  decrypt <token>");
        out.println("  encrypt-micros <seed> <micros>");
        out.println("  decrypt-micros <token>");
        out.println("  version");
    }
}
