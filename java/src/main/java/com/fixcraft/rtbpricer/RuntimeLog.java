package com.fixcraft.rtbpricer;

import java.util.Locale;

/**
 * Diagnostic output on stderr. Switches come from the CLI when it has run, otherwise from the
 * {@code rtbpricer.verbose} / {@code rtbpricer.noLog} system properties, then the
 * {@code RTBPRICER_VERBOSE} / {@code RTBPRICER_NO_LOG} environment variables.
 */
public final class RuntimeLog {
    static final String VERBOSE_PROPERTY = "rtbpricer.verbose";
    static final String NO_LOG_PROPERTY = "rtbpricer.noLog";

    private static volatile Boolean cliVerbose = null;
    private static volatile Boolean cliNoLog = null;

    private RuntimeLog() {}

    public static void configureFromCli(boolean verbose, boolean noLog) {
        cliVerbose = Boolean.valueOf(verbose);
        cliNoLog = Boolean.valueOf(noLog);
    }

    /** Drops the switches set by {@link #configureFromCli}; properties and environment apply again. */
    public static void clearCliOverrides() {
        cliVerbose = null;
        cliNoLog = null;
    }

    public static boolean isVerbose() {
        return enabled(cliVerbose, VERBOSE_PROPERTY, "RTBPRICER_VERBOSE");
    }

    public static boolean isNoLog() {
        return enabled(cliNoLog, NO_LOG_PROPERTY, "RTBPRICER_NO_LOG");
    }

    public static void warn(String message) {
        emit("WARN: " + message, false);
    }

    public static void info(String message) {
        emit(message, false);
    }

    /** Verbose-only line, indented under the preceding message. */
    public static void detail(String message) {
        emit("   " + message, true);
    }

    private static void emit(String line, boolean verboseOnly) {
        if (isNoLog() || (verboseOnly && !isVerbose())) {
            return;
        }
        System.err.println(line);
    }

    private static boolean enabled(Boolean cli, String property, String env) {
        if (cli != null) {
            return cli.booleanValue();
        }
        return truthy(System.getProperty(property)) || truthy(System.getenv(env));
    }

    private static boolean truthy(String raw) {
        if (raw == null) {
            return false;
        }
        String value = raw.trim().toLowerCase(Locale.US);
        return "1".equals(value) || "true".equals(value) || "yes".equals(value) || "on".equals(value);
    }
}
