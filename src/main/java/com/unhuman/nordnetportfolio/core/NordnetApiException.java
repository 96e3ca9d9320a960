package com.unhuman.nordnetportfolio.core;

/**
 * A Nordnet API call failed for a reason other than authentication.
 */
public class NordnetApiException extends RuntimeException {
    private final int statusCode;

    public NordnetApiException(int statusCode, String message) {
        super("Nordnet API error " + statusCode + ": " + message);
        this.statusCode = statusCode;
    }

    public NordnetApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
