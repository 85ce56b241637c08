package de.htwsaar.ministatic.cli.util;

import de.htwsaar.ministatic.cli.dto.HttpCallResult;

/**
 * Exit-Codes aller Commands.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int VALIDATION = 1;
    public static final int CLIENT_ERROR = 2;
    public static final int NOT_FOUND = 3;
    public static final int SERVER_ERROR = 4;
    public static final int IO_ERROR = 5;

    private ExitCodes() {}

    /**
     * Bildet ein HTTP-Ergebnis auf einen Exit-Code ab; 304 gilt als Erfolg.
     *
     * @param result Ergebnis eines Aufrufs
     * @return Exit-Code
     */
    public static int forResult(HttpCallResult result) {
        Integer status = result.statusCode();
        if (status == null) return IO_ERROR;
        if (status == 404) return NOT_FOUND;
        if (status >= 500) return SERVER_ERROR;
        if (status >= 400) return CLIENT_ERROR;
        return OK;
    }
}
