package com.example.offlinecache.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A stored response. Never mutated: a revalidation writes a whole new entry.
 */
public final class CacheEntry {

    public static final String CACHE_DATE_HEADER = "x-cache-date";

    private final String requestKey;
    private final int status;
    private final String statusText;
    private final String responseBody;
    private final Map<String, String> responseHeaders;
    private final long storedAt;   // epoch millis, drives freshness
    private final long sequence;   // write order inside a storage, drives eviction

    @JsonCreator
    public CacheEntry(
        @JsonProperty("requestKey") String requestKey,
        @JsonProperty("status") int status,
        @JsonProperty("statusText") String statusText,
        @JsonProperty("responseBody") String responseBody,
        @JsonProperty("responseHeaders") Map<String, String> responseHeaders,
        @JsonProperty("storedAt") long storedAt,
        @JsonProperty("sequence") long sequence
    ) {
        this.requestKey = requestKey;
        this.status = status;
        this.statusText = statusText;
        this.responseBody = responseBody == null ? "" : responseBody;
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (responseHeaders != null) {
            copy.putAll(responseHeaders);
        }
        this.responseHeaders = Collections.unmodifiableMap(copy);
        this.storedAt = storedAt;
        this.sequence = sequence;
    }

    public static CacheEntry of(String requestKey, NetResponse response, long storedAt) {
        return new CacheEntry(requestKey, response.getStatus(), response.getStatusText(),
            response.getBody(), response.getHeaders(), storedAt, 0L);
    }

    public CacheEntry withSequence(long newSequence) {
        return new CacheEntry(requestKey, status, statusText, responseBody, responseHeaders, storedAt, newSequence);
    }

    public String getRequestKey() {
        return requestKey;
    }

    public int getStatus() {
        return status;
    }

    public String getStatusText() {
        return statusText;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public Map<String, String> getResponseHeaders() {
        return responseHeaders;
    }

    public long getStoredAt() {
        return storedAt;
    }

    public long getSequence() {
        return sequence;
    }

    /**
     * A non-positive max age means entries never go stale.
     */
    public boolean isFresh(long now, long maxAgeMs) {
        if (maxAgeMs <= 0) {
            return true;
        }
        return now - storedAt < maxAgeMs;
    }

    @JsonIgnore
    public long approximateBytes() {
        long size = responseBody.getBytes(StandardCharsets.UTF_8).length;
        for (Map.Entry<String, String> header : responseHeaders.entrySet()) {
            size += header.getKey().length() + header.getValue().length();
        }
        return size;
    }

    public NetResponse toResponse() {
        return new NetResponse(status, statusText, responseHeaders, responseBody)
            .withHeaders(Map.of(CACHE_DATE_HEADER, Instant.ofEpochMilli(storedAt).toString()));
    }
}
