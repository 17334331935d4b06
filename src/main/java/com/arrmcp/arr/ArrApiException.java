package com.arrmcp.arr;

public class ArrApiException extends RuntimeException {

    private final int status;

    public ArrApiException(int status, String body) {
        super("API returned error status: " + status + ", details: " + body);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
