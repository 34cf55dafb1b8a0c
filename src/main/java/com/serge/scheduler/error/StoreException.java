package com.serge.scheduler.error;

import lombok.Getter;

/**
 * A document store fault re-signalled with a normalized message. The store's own text stays in the cause
 * and is never shown to clients.
 */
@Getter
public class StoreException extends RuntimeException {
    private final boolean duplicateKey;

    public StoreException(String message, boolean duplicateKey, Throwable cause) {
        super(message, cause);
        this.duplicateKey = duplicateKey;
    }
}
