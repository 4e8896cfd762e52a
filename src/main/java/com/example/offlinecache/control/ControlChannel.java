package com.example.offlinecache.control;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process channel from the host to the cache. Messages run on their own executor, separate
 * from the worker pool that serves fetches, because warming waits on fetches in that pool.
 * Callers that only fire and forget can ignore the returned future.
 */
public class ControlChannel {

    private static final Logger log = LoggerFactory.getLogger(ControlChannel.class);

    private final CacheControl control;
    private final ExecutorService executor;

    public ControlChannel(CacheControl control, ExecutorService executor) {
        this.control = control;
        this.executor = executor;
    }

    public CompletableFuture<ControlReply> send(ControlMessage message) {
        return CompletableFuture.supplyAsync(() -> dispatch(message), executor);
    }

    /**
     * Runs the message on the calling thread.
     */
    public ControlReply dispatch(ControlMessage message) {
        try {
            return message.accept(new Dispatcher());
        } catch (RuntimeException e) {
            log.error("Control message {} failed", message.type(), e);
            return ControlReply.failed(message.type(), e.getMessage());
        }
    }

    private final class Dispatcher implements ControlMessage.Visitor<ControlReply> {

        @Override
        public ControlReply visitInvalidate(ControlMessage.Invalidate message) {
            return ControlReply.ok(message.type(), control.clearPartition(message.getPartition()));
        }

        @Override
        public ControlReply visitStatus(ControlMessage.Status message) {
            return ControlReply.ok(message.type(), control.getCacheStatus());
        }

        @Override
        public ControlReply visitWarm(ControlMessage.Warm message) {
            return ControlReply.ok(message.type(), control.warm(message.getUrls()));
        }

        @Override
        public ControlReply visitWarmPartition(ControlMessage.WarmPartition message) {
            return ControlReply.ok(message.type(), control.warmPartition(message.getPartition()));
        }

        @Override
        public ControlReply visitPreloadCritical(ControlMessage.PreloadCritical message) {
            return ControlReply.ok(message.type(), control.preloadCritical());
        }

        @Override
        public ControlReply visitForceActivate(ControlMessage.ForceActivate message) {
            return ControlReply.ok(message.type(), control.forceActivate());
        }
    }
}
