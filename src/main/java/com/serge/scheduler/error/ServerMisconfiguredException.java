package com.serge.scheduler.error;

public class ServerMisconfiguredException extends ApiException {
    public ServerMisconfiguredException(String message) {
        super(ErrorCode.INTERNAL_SERVER_ERROR, message);
    }
}
