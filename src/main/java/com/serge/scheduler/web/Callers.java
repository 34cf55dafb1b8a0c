package com.serge.scheduler.web;

import com.serge.scheduler.error.UnauthenticatedException;

/** GraphQL context keys and the authentication gate used by every non-public resolver. */
public final class Callers {
    public static final String CALLER_ID = "callerId";
    public static final String REQUEST_ID = "requestId";

    private Callers() {
    }

    public static String require(String callerId) {
        if (callerId == null) throw new UnauthenticatedException();
        return callerId;
    }
}
