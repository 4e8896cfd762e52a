package com.example.offlinecache.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.net.URI;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Outgoing request envelope as seen by the interception layer.
 * Header names are case-insensitive.
 */
public final class NetRequest {

    private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS");

    private final String method;
    private final String url;
    private final Map<String, String> headers;
    private final String body;

    @JsonCreator
    public NetRequest(
        @JsonProperty("method") String method,
        @JsonProperty("url") String url,
        @JsonProperty("headers") Map<String, String> headers,
        @JsonProperty("body") String body
    ) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Request url is required");
        }
        this.method = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        this.url = url;
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body;
    }

    public static NetRequest get(String url) {
        return new NetRequest("GET", url, Map.of(), null);
    }

    public static NetRequest navigate(String url) {
        return new NetRequest("GET", url, Map.of("Sec-Fetch-Mode", "navigate", "Accept", "text/html"), null);
    }

    public static NetRequest post(String url, String body) {
        return new NetRequest("POST", url, Map.of("Content-Type", "application/json"), body);
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
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
    public boolean isSafe() {
        return SAFE_METHODS.contains(method);
    }

    /**
     * A top-level page load, as opposed to a subresource or API call.
     */
    @JsonIgnore
    public boolean isNavigation() {
        if ("navigate".equalsIgnoreCase(headers.get("Sec-Fetch-Mode"))) {
            return true;
        }
        String accept = headers.get("Accept");
        return isSafe() && accept != null && accept.contains("text/html");
    }

    /**
     * Path component of the url, without query or fragment.
     */
    @JsonIgnore
    public String path() {
        try {
            String path = URI.create(url).getRawPath();
            return path == null || path.isEmpty() ? "/" : path;
        } catch (IllegalArgumentException e) {
            int cut = url.length();
            int query = url.indexOf('?');
            int fragment = url.indexOf('#');
            if (query >= 0) cut = Math.min(cut, query);
            if (fragment >= 0) cut = Math.min(cut, fragment);
            return url.substring(0, cut);
        }
    }

    public NetRequest withUrl(String newUrl) {
        return new NetRequest(method, newUrl, headers, body);
    }

    @Override
    public String toString() {
        return method + " " + url;
    }
}
