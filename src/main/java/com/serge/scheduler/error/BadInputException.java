package com.serge.scheduler.error;

/**
 * Client-correctable problem that is not tied to a single input field,
 * such as booking an event that does not exist.
 */
public class BadInputException extends ApiException {
    public BadInputException(String message) {
        super(ErrorCode.BAD_USER_INPUT, message);
    }
}
