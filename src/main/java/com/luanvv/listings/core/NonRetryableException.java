package com.luanvv.listings.core;

/** Failure that another attempt cannot fix; {@link Retryer} rethrows it immediately. */
public class NonRetryableException extends RuntimeException {
    public NonRetryableException(String message) {
        super(message);
    }
}
