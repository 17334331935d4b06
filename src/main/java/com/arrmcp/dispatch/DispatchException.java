package com.arrmcp.dispatch;

public class DispatchException extends RuntimeException {

    private final ErrorCode code;

    public DispatchException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public DispatchException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
