package com.gatekeeper.authgovernor.exception;

/**
 * Wrong phone number, password or reset code. The message never says which.
 */
public class InvalidCredentialsException extends RuntimeException {

    private final int remainingAttempts;

    public InvalidCredentialsException(String message, int remainingAttempts) {
        super(message);
        this.remainingAttempts = remainingAttempts;
    }

    public int getRemainingAttempts() {
        return remainingAttempts;
    }
}
