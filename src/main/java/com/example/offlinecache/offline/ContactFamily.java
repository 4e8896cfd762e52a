package com.example.offlinecache.offline;

import com.example.offlinecache.core.NetRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Contact form submissions that could neither be sent nor queued.
 */
public class ContactFamily implements EndpointFamily {

    private final String pathPrefix;

    public ContactFamily(String pathPrefix) {
        this.pathPrefix = pathPrefix;
    }

    @Override
    public String name() {
        return "contact";
    }

    @Override
    public boolean matches(NetRequest request) {
        return request.path().startsWith(pathPrefix);
    }

    @Override
    public String message() {
        return "Your message cannot be sent while offline. Please try again when your connection is restored.";
    }

    @Override
    public void fill(ObjectNode body) {
        body.put("success", false);
        body.put("queued", false);
    }
}
