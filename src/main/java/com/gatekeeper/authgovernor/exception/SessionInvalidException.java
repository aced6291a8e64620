package com.gatekeeper.authgovernor.exception;

/**
 * The credential's session claim no longer matches an active device session.
 */
public class SessionInvalidException extends RuntimeException {

    public static final String CODE = "device_token_invalid";
    public static final String DEFAULT_MESSAGE = "Session expired. This device has been logged out or removed.";

    public SessionInvalidException() {
        super(DEFAULT_MESSAGE);
    }

    public SessionInvalidException(String message) {
        super(message);
    }
}
