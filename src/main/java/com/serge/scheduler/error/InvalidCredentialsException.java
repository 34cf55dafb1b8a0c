package com.serge.scheduler.error;

/**
 * Raised for an unknown email and for a wrong password alike, so callers cannot tell which one failed.
 */
public class InvalidCredentialsException extends BadInputException {
    public InvalidCredentialsException() {
        super(Messages.INVALID_CREDENTIALS);
    }
}
