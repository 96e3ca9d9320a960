package com.unhuman.nordnetportfolio.core;

/**
 * The broker still rejected the session after one re-authentication. Not retried automatically.
 */
public class AuthenticationFailedException extends RuntimeException {
    public AuthenticationFailedException(String message) {
        super(message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
