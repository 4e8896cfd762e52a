package com.example.offlinecache.queue;

import com.example.offlinecache.core.NetRequest;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * A mutating request that failed for lack of connectivity and waits for replay.
 */
public final class QueuedSubmission {

    private final long id;
    private final String method;
    private final String targetEndpoint;
    private final Map<String, String> headers;
    private final String payload;
    private final long enqueuedAt;

    @JsonCreator
    public QueuedSubmission(
        @JsonProperty("id") long id,
        @JsonProperty("method") String method,
        @JsonProperty("targetEndpoint") String targetEndpoint,
        @JsonProperty("headers") Map<String, String> headers,
        @JsonProperty("payload") String payload,
        @JsonProperty("enqueuedAt") long enqueuedAt
    ) {
        this.id = id;
        this.method = method;
        this.targetEndpoint = targetEndpoint;
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.payload = payload;
        this.enqueuedAt = enqueuedAt;
    }

    public long getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    public String getTargetEndpoint() {
        return targetEndpoint;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getPayload() {
        return payload;
    }

    public long getEnqueuedAt() {
        return enqueuedAt;
    }

    public NetRequest toRequest() {
        return new NetRequest(method, targetEndpoint, headers, payload);
    }

    @Override
    public String toString() {
        return "#" + id + " " + method + " " + targetEndpoint;
    }
}
