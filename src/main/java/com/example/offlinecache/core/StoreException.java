package com.example.offlinecache.core;

/**
 * I/O failure or corruption in one of the durable stores.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
