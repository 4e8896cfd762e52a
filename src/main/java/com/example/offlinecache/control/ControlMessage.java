package com.example.offlinecache.control;

import java.util.List;

/**
 * Messages the host application sends to the cache. Each variant is dispatched through
 * {@link Visitor}, so adding a variant breaks every handler that does not cover it.
 */
public interface ControlMessage {

    <R> R accept(Visitor<R> visitor);

    /**
     * Tag of the variant, as used on the wire and in replies.
     */
    String type();

    interface Visitor<R> {
        R visitInvalidate(Invalidate message);

        R visitStatus(Status message);

        R visitWarm(Warm message);

        R visitWarmPartition(WarmPartition message);

        R visitPreloadCritical(PreloadCritical message);

        R visitForceActivate(ForceActivate message);
    }

    /**
     * Clears one partition, or all storages when {@code partition} is null.
     */
    final class Invalidate implements ControlMessage {
        private final String partition;

        public Invalidate(String partition) {
            this.partition = partition;
        }

        public static Invalidate all() {
            return new Invalidate(null);
        }

        public String getPartition() {
            return partition;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInvalidate(this);
        }

        @Override
        public String type() {
            return "INVALIDATE";
        }
    }

    final class Status implements ControlMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStatus(this);
        }

        @Override
        public String type() {
            return "STATUS";
        }
    }

    final class Warm implements ControlMessage {
        private final List<String> urls;

        public Warm(List<String> urls) {
            this.urls = urls == null ? List.of() : List.copyOf(urls);
        }

        public List<String> getUrls() {
            return urls;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWarm(this);
        }

        @Override
        public String type() {
            return "WARM";
        }
    }

    final class WarmPartition implements ControlMessage {
        private final String partition;

        public WarmPartition(String partition) {
            this.partition = partition;
        }

        public String getPartition() {
            return partition;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWarmPartition(this);
        }

        @Override
        public String type() {
            return "WARM_PARTITION";
        }
    }

    final class PreloadCritical implements ControlMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPreloadCritical(this);
        }

        @Override
        public String type() {
            return "PRELOAD_CRITICAL";
        }
    }

    final class ForceActivate implements ControlMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitForceActivate(this);
        }

        @Override
        public String type() {
            return "FORCE_ACTIVATE";
        }
    }
}
