package com.example.offlinecache.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Response envelope returned to the caller, whether it came from the network,
 * the response store or the offline responder.
 */
public final class NetResponse {

    public static final String SERVED_BY = "x-served-by";
    public static final String OFFLINE = "x-offline";

    private final int status;
    private final String statusText;
    private final Map<String, String> headers;
    private final String body;

    @JsonCreator
    public NetResponse(
        @JsonProperty("status") int status,
        @JsonProperty("statusText") String statusText,
        @JsonProperty("headers") Map<String, String> headers,
        @JsonProperty("body") String body
    ) {
        this.status = status;
        this.statusText = statusText == null ? "" : statusText;
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body == null ? "" : body;
    }

    public static NetResponse ok(String body) {
        return new NetResponse(200, "OK", Map.of(), body);
    }

    public int getStatus() {
        return status;
    }

    public String getStatusText() {
        return statusText;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    public String header(String name) {
        return headers.get(name);
    }

    @JsonIgnore
    public boolean isOk() {
        return status >= 200 && status < 300;
    }

    @JsonIgnore
    public boolean isOffline() {
        return "true".equals(headers.get(OFFLINE));
    }

    public NetResponse withHeaders(Map<String, String> extra) {
        Map<String, String> merged = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        merged.putAll(headers);
        merged.putAll(extra);
        return new NetResponse(status, statusText, merged, body);
    }

    @Override
    public String toString() {
        return status + " " + statusText;
    }
}
