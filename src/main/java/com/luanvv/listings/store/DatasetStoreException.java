package com.luanvv.listings.store;

/** The dataset cannot be read or written. Fatal for the run. */
public class DatasetStoreException extends RuntimeException {
    public DatasetStoreException(String message) {
        super(message);
    }

    public DatasetStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
