package com.example.offlinecache.control;

public class UnknownPartitionException extends RuntimeException {

    public UnknownPartitionException(String partition) {
        super("Unknown partition: " + partition);
    }
}
