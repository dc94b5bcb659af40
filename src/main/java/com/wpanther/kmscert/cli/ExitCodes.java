package com.wpanther.kmscert.cli;

/**
 * Process exit codes
 */
public final class ExitCodes {

    public static final int SUCCESS = 0;

    public static final int FAILURE = 1;

    /**
     * A certificate or key file is missing or cannot be parsed
     */
    public static final int INVALID_INPUT_FILE = 2;

    /**
     * Verification ran, but the keys differ
     */
    public static final int KEY_MISMATCH = 3;

    /**
     * Unknown command or bad arguments (BSD sysexits EX_USAGE)
     */
    public static final int USAGE = 64;

    private ExitCodes() {
    }
}
