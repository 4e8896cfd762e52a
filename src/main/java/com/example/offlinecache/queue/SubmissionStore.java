package com.example.offlinecache.queue;

import com.example.offlinecache.core.NetRequest;
import java.util.List;

/**
 * Durable record store behind the write-retry queue. Ids are assigned on append and only grow,
 * also across restarts.
 */
public interface SubmissionStore {

    /**
     * Persists the request and returns it with its id. The record is durable when this returns.
     */
    QueuedSubmission append(NetRequest request, long enqueuedAt);

    /**
     * All records, lowest id first.
     */
    List<QueuedSubmission> listInOrder();

    boolean remove(long id);

    int count();
}
