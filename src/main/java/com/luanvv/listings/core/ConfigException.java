package com.luanvv.listings.core;

/** Missing or invalid configuration. Fatal for the run. */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }
}
