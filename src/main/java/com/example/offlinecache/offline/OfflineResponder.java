package com.example.offlinecache.offline;

import com.example.offlinecache.core.CacheEntry;
import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.core.RequestKeys;
import com.example.offlinecache.lifecycle.Generation;
import com.example.offlinecache.store.ResponseStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last stop for requests neither the cache nor the network could answer.
 * Always produces a well-formed response carrying {@code offline: true}; never throws.
 */
public class OfflineResponder {

    private static final Logger log = LoggerFactory.getLogger(OfflineResponder.class);

    public static final String DEFAULT_MESSAGE = "Resource not available offline";

    private static final String LAST_RESORT_BODY =
        "{\"ok\":false,\"offline\":true,\"error\":\"Offline\",\"message\":\"" + DEFAULT_MESSAGE + "\"}";

    private final ObjectMapper mapper;
    private final List<EndpointFamily> families;
    private final ResponseStore store;
    private final Generation generation;
    private final String offlinePagePartition;
    private final String offlinePageUrl;
    private final int retryAfterSeconds;
    private final Clock clock;

    public OfflineResponder(
        ObjectMapper mapper,
        List<EndpointFamily> families,
        ResponseStore store,
        Generation generation,
        String offlinePagePartition,
        String offlinePageUrl,
        int retryAfterSeconds,
        Clock clock
    ) {
        this.mapper = mapper;
        this.families = List.copyOf(families);
        this.store = store;
        this.generation = generation;
        this.offlinePagePartition = offlinePagePartition;
        this.offlinePageUrl = offlinePageUrl;
        this.retryAfterSeconds = retryAfterSeconds;
        this.clock = clock;
    }

    public NetResponse buildFallback(NetRequest request) {
        try {
            if (request.isNavigation()) {
                Optional<NetResponse> page = offlinePage();
                if (page.isPresent()) {
                    return page.get();
                }
            }
            for (EndpointFamily family : families) {
                if (family.matches(request)) {
                    ObjectNode body = envelope(family.message());
                    family.fill(body);
                    return respond(body, Map.of("x-api-type", family.name()));
                }
            }
            return generic(request.isNavigation() ? "Page not available offline" : DEFAULT_MESSAGE);
        } catch (RuntimeException e) {
            log.error("Failed to build offline response for {}", request, e);
            return new NetResponse(503, "Service Unavailable", baseHeaders(), LAST_RESORT_BODY);
        }
    }

    public NetResponse generic(String message) {
        return respond(envelope(message), Map.of());
    }

    private ObjectNode envelope(String message) {
        ObjectNode body = mapper.createObjectNode();
        body.put("ok", false);
        body.put("offline", true);
        body.put("error", "Offline");
        body.put("message", message);
        body.put("retryAfterSeconds", retryAfterSeconds);
        body.put("timestamp", clock.instant().toString());
        return body;
    }

    private NetResponse respond(ObjectNode body, Map<String, String> extraHeaders) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize offline body", e);
            json = LAST_RESORT_BODY;
        }
        return new NetResponse(503, "Service Unavailable", baseHeaders(), json).withHeaders(extraHeaders);
    }

    private Map<String, String> baseHeaders() {
        return Map.of(
            "Content-Type", "application/json",
            "Cache-Control", "no-cache",
            "Retry-After", String.valueOf(retryAfterSeconds),
            NetResponse.SERVED_BY, "offline-responder",
            NetResponse.OFFLINE, "true"
        );
    }

    private Optional<NetResponse> offlinePage() {
        if (offlinePageUrl == null || offlinePagePartition == null) {
            return Optional.empty();
        }
        try {
            String key = RequestKeys.of(NetRequest.get(offlinePageUrl));
            return store.get(generation.storageName(offlinePagePartition), key)
                .map(CacheEntry::toResponse)
                .map(r -> r.withHeaders(Map.of(NetResponse.SERVED_BY, "offline-page", NetResponse.OFFLINE, "true")));
        } catch (RuntimeException e) {
            log.warn("Offline page lookup failed", e);
            return Optional.empty();
        }
    }
}
