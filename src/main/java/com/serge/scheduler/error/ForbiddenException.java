package com.serge.scheduler.error;

public class ForbiddenException extends ApiException {
    public ForbiddenException() {
        super(ErrorCode.FORBIDDEN, Messages.FORBIDDEN);
    }
}
