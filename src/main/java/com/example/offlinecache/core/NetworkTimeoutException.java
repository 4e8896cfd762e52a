package com.example.offlinecache.core;

public class NetworkTimeoutException extends NetworkException {

    public NetworkTimeoutException(String message) {
        super(message);
    }
}
