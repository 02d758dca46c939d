package com.luanvv.listings.core;

/** Navigation or interaction failure; transient, retried by the caller. */
public class FetchException extends RuntimeException {
    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
