package com.example.offlinecache.core;

/**
 * The network could not produce a response. Transient; strategies decide what happens next.
 */
public class NetworkException extends Exception {

    public NetworkException(String message) {
        super(message);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
