package de.htwsaar.miniota.cli.util;

/**
 * Exit-Codes der CLI.
 */
public final class ExitCodes {
    public static final int OK = 0;
    public static final int IO_ERROR = 1;
    public static final int SERVER_ERROR = 2;
    public static final int VALIDATION = 3;
    public static final int CLIENT_ERROR = 4;
    public static final int INTEGRITY = 5;
    public static final int UPDATE_AVAILABLE = 10;

    private ExitCodes() {}

    /**
     * @param statusCode HTTP-Status außerhalb von 2xx
     * @return {@link #CLIENT_ERROR} für 4xx, sonst {@link #SERVER_ERROR}
     */
    public static int forHttpStatus(int statusCode) {
        return statusCode >= 400 && statusCode < 500 ? CLIENT_ERROR : SERVER_ERROR;
    }
}
