package com.arrmcp.dispatch;

import java.util.Locale;

public enum ErrorCode {
    MALFORMED_REQUEST(400),
    MISSING_TOOL_NAME(400),
    UNKNOWN_TOOL(400),
    INVALID_PARAMETER(400),
    METHOD_NOT_ALLOWED(405),
    HANDLER_FAILURE(500),
    TIMEOUT(500),
    STREAMING_UNSUPPORTED(500);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean callerError() {
        return httpStatus < 500;
    }
}
