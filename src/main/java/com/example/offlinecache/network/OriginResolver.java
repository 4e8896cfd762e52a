package com.example.offlinecache.network;

import com.example.offlinecache.core.NetRequest;
import java.net.URI;

/**
 * Makes request urls absolute against the application's origin, so the same resource
 * always maps to the same cache key however the host spelled it.
 */
public class OriginResolver {

    private final URI origin;

    public OriginResolver(URI origin) {
        this.origin = origin;
    }

    public URI getOrigin() {
        return origin;
    }

    public String absolute(String url) {
        URI uri = URI.create(url);
        return uri.isAbsolute() ? uri.toString() : origin.resolve(uri).toString();
    }

    public NetRequest absolute(NetRequest request) {
        String resolved = absolute(request.getUrl());
        return resolved.equals(request.getUrl()) ? request : request.withUrl(resolved);
    }
}
