package com.gatekeeper.authgovernor.exception;

/**
 * A concurrent writer won the race for a per-key critical section.
 * Services retry once before letting this escape.
 */
public class CapacityRaceException extends RuntimeException {

    public CapacityRaceException(String message) {
        super(message);
    }

    public CapacityRaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
