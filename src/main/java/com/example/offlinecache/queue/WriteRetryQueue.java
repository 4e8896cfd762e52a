package com.example.offlinecache.queue;

import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.core.NetworkException;
import com.example.offlinecache.core.StoreException;
import com.example.offlinecache.network.Network;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable FIFO of mutating requests that failed while offline.
 *
 * <p>Replay walks the queue in id order and stops at the first submission that is not confirmed,
 * so a later submission never overtakes an earlier one. Only one pass runs at a time; a trigger
 * arriving during a pass is a no-op.
 */
public class WriteRetryQueue {

    private static final Logger log = LoggerFactory.getLogger(WriteRetryQueue.class);

    private final SubmissionStore store;
    private final Network network;
    private final ExecutorService executor;
    private final Clock clock;
    private final AtomicBoolean replaying = new AtomicBoolean(false);

    public WriteRetryQueue(SubmissionStore store, Network network, ExecutorService executor, Clock clock) {
        this.store = store;
        this.network = network;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * @throws StoreException if the submission could not be made durable
     */
    public QueuedSubmission enqueue(NetRequest request) {
        QueuedSubmission submission = store.append(request, clock.millis());
        log.info("Queued submission {} for replay", submission);
        return submission;
    }

    public ReplayResult replayAll() {
        if (!replaying.compareAndSet(false, true)) {
            log.debug("Replay already in progress, ignoring trigger");
            return ReplayResult.skipped();
        }
        int delivered = 0;
        try {
            List<QueuedSubmission> pending = store.listInOrder();
            for (QueuedSubmission submission : pending) {
                if (!deliver(submission)) {
                    int remaining = pending.size() - delivered;
                    log.info("Replay stopped at {} with {} submission(s) still queued", submission, remaining);
                    return ReplayResult.stopped(delivered, remaining, submission.getId());
                }
                store.remove(submission.getId());
                delivered++;
            }
            if (delivered > 0) {
                log.info("Replayed {} queued submission(s)", delivered);
            }
            return ReplayResult.completed(delivered);
        } catch (StoreException e) {
            log.error("Replay aborted, submission store failed", e);
            return ReplayResult.failed(delivered);
        } finally {
            replaying.set(false);
        }
    }

    public void replayAllAsync() {
        try {
            executor.execute(this::replayAll);
        } catch (RejectedExecutionException e) {
            log.warn("Replay rejected by worker pool", e);
        }
    }

    public List<QueuedSubmission> pending() {
        return store.listInOrder();
    }

    public int size() {
        return store.count();
    }

    public boolean isReplaying() {
        return replaying.get();
    }

    private boolean deliver(QueuedSubmission submission) {
        try {
            NetResponse response = network.fetch(submission.toRequest());
            if (response.isOk()) {
                log.debug("Delivered {}", submission);
                return true;
            }
            log.warn("Replay of {} answered {}", submission, response);
            return false;
        } catch (NetworkException e) {
            log.debug("Replay of {} failed: {}", submission, e.getMessage());
            return false;
        }
    }
}
