package com.serge.scheduler.error;

public class UnauthenticatedException extends ApiException {
    public UnauthenticatedException() {
        super(ErrorCode.UNAUTHENTICATED, Messages.NOT_AUTHENTICATED);
    }
}
