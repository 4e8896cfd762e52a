package com.example.offlinecache.offline;

import com.example.offlinecache.core.NetRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Inventory listings: an empty page, so list views render "nothing here" instead of breaking.
 */
public class InventoryFamily implements EndpointFamily {

    private final String pathPrefix;

    public InventoryFamily(String pathPrefix) {
        this.pathPrefix = pathPrefix;
    }

    @Override
    public String name() {
        return "vehicles";
    }

    @Override
    public boolean matches(NetRequest request) {
        return request.isSafe() && request.path().startsWith(pathPrefix);
    }

    @Override
    public String message() {
        return "Vehicle data is not available offline. Please check your internet connection to see the latest inventory.";
    }

    @Override
    public void fill(ObjectNode body) {
        body.putArray("vehicles");
        body.put("total", 0);
        body.put("page", 1);
        body.put("totalPages", 0);
        body.put("hasMore", false);
        ObjectNode cacheInfo = body.putObject("cacheInfo");
        cacheInfo.putNull("lastUpdate");
        cacheInfo.put("nextUpdate", "When online");
    }
}
