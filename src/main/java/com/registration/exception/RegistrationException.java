package com.registration.exception;

/**
 * Fatal failure of a registration or adjustment run. Never retried inside the pipeline;
 * the caller decides what to do with it.
 */
public abstract class RegistrationException extends Exception {

    protected RegistrationException(String message) {
        super(message);
    }

    protected RegistrationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable name of the failure, e.g. {@code InsufficientMatches}.
     */
    public abstract String kind();
}
