package com.serge.scheduler.error;

import lombok.Getter;

/**
 * Base class for every fault that is expected to reach the caller with its own code.
 * Anything else is reported as {@link ErrorCode#INTERNAL_SERVER_ERROR}.
 */
@Getter
public class ApiException extends RuntimeException {
    private final ErrorCode code;

    public ApiException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ApiException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
