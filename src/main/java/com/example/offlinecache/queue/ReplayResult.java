package com.example.offlinecache.queue;

/**
 * Outcome of one replay pass.
 */
public final class ReplayResult {

    private final boolean skipped;
    private final int delivered;
    private final int remaining;
    private final Long stoppedAt;

    private ReplayResult(boolean skipped, int delivered, int remaining, Long stoppedAt) {
        this.skipped = skipped;
        this.delivered = delivered;
        this.remaining = remaining;
        this.stoppedAt = stoppedAt;
    }

    /**
     * Another pass was already running; this trigger did nothing.
     */
    public static ReplayResult skipped() {
        return new ReplayResult(true, 0, -1, null);
    }

    public static ReplayResult completed(int delivered) {
        return new ReplayResult(false, delivered, 0, null);
    }

    public static ReplayResult stopped(int delivered, int remaining, long stoppedAt) {
        return new ReplayResult(false, delivered, remaining, stoppedAt);
    }

    /**
     * The submission store itself failed mid-pass; the queue size is unknown.
     */
    public static ReplayResult failed(int delivered) {
        return new ReplayResult(false, delivered, -1, null);
    }

    public boolean isSkipped() {
        return skipped;
    }

    public int getDelivered() {
        return delivered;
    }

    public int getRemaining() {
        return remaining;
    }

    /**
     * Id of the submission that could not be delivered, or {@code null} when the queue drained.
     */
    public Long getStoppedAt() {
        return stoppedAt;
    }

    @Override
    public String toString() {
        if (skipped) {
            return "ReplayResult[skipped]";
        }
        return "ReplayResult[delivered=" + delivered + ", remaining=" + remaining + ", stoppedAt=" + stoppedAt + "]";
    }
}
