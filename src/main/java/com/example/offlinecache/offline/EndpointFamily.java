package com.example.offlinecache.offline;

import com.example.offlinecache.core.NetRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A group of endpoints whose callers understand a richer offline body than the generic one,
 * usually an empty result of the shape they normally get.
 */
public interface EndpointFamily {

    String name();

    boolean matches(NetRequest request);

    String message();

    /**
     * Adds the family's default data to a body that already carries the offline marker.
     */
    void fill(ObjectNode body);
}
