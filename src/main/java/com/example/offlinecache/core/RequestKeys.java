package com.example.offlinecache.core;

import java.util.List;
import java.util.Locale;

public final class RequestKeys {

    private RequestKeys() {
    }

    public static String of(NetRequest request) {
        return of(request, List.of());
    }

    /**
     * Derives the store key from method and url plus the values of the given vary headers.
     * HEAD shares the GET entry.
     */
    public static String of(NetRequest request, List<String> varyHeaders) {
        String method = "HEAD".equals(request.getMethod()) ? "GET" : request.getMethod();
        StringBuilder key = new StringBuilder(method).append(' ').append(request.getUrl());
        for (String name : varyHeaders) {
            String value = request.header(name);
            if (value != null) {
                key.append(" [").append(name.toLowerCase(Locale.ROOT)).append('=').append(value).append(']');
            }
        }
        return key.toString();
    }
}
