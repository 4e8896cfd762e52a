package com.example.offlinecache.core;

/**
 * Invalid cache configuration. Fatal at startup, never retried.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }
}
