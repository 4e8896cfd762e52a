package com.example.offlinecache.queue;

import com.example.offlinecache.network.ConnectivityMonitor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic replay while online, for submissions queued after the last connectivity transition.
 */
@Component
public class ReplayScheduler {

    private final WriteRetryQueue queue;
    private final ConnectivityMonitor connectivity;

    public ReplayScheduler(WriteRetryQueue queue, ConnectivityMonitor connectivity) {
        this.queue = queue;
        this.connectivity = connectivity;
    }

    @Scheduled(fixedDelayString = "${offline-cache.replay-interval:PT1M}", initialDelayString = "${offline-cache.replay-interval:PT1M}")
    public void replayPending() {
        if (connectivity.isOnline() && queue.size() > 0) {
            queue.replayAll();
        }
    }
}
