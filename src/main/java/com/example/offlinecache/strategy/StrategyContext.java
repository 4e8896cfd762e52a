package com.example.offlinecache.strategy;

import com.example.offlinecache.core.CacheEntry;
import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.core.NetworkException;
import com.example.offlinecache.core.StoreException;
import com.example.offlinecache.lifecycle.Generation;
import com.example.offlinecache.network.Network;
import com.example.offlinecache.offline.OfflineResponder;
import com.example.offlinecache.partition.Partition;
import com.example.offlinecache.store.ResponseStore;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Store and network operations shared by the strategies.
 *
 * <p>Store failures are logged and treated as a miss (reads) or skipped (writes), so a broken
 * storage degrades its partition to network-only instead of failing requests.
 */
public class StrategyContext {

    private static final Logger log = LoggerFactory.getLogger(StrategyContext.class);

    private final ResponseStore store;
    private final Generation generation;
    private final Network network;
    private final OfflineResponder offlineResponder;
    private final ExecutorService executor;
    private final Clock clock;
    private final long defaultNetworkTimeoutMs;

    public StrategyContext(
        ResponseStore store,
        Generation generation,
        Network network,
        OfflineResponder offlineResponder,
        ExecutorService executor,
        Clock clock,
        long defaultNetworkTimeoutMs
    ) {
        this.store = store;
        this.generation = generation;
        this.network = network;
        this.offlineResponder = offlineResponder;
        this.executor = executor;
        this.clock = clock;
        this.defaultNetworkTimeoutMs = defaultNetworkTimeoutMs;
    }

    public long now() {
        return clock.millis();
    }

    public long defaultNetworkTimeoutMs() {
        return defaultNetworkTimeoutMs;
    }

    public Optional<CacheEntry> lookup(Partition partition, String key) {
        try {
            return store.get(generation.storageName(partition.getName()), key);
        } catch (StoreException e) {
            log.warn("Store read failed for partition {}, continuing network-only", partition.getName(), e);
            return Optional.empty();
        }
    }

    public NetResponse fetch(NetRequest request) throws NetworkException {
        return network.fetch(request);
    }

    /**
     * Persists a successful GET response and trims the partition. Non-2xx responses are never
     * stored, and neither are answers to other methods: a HEAD shares the GET key but has no body.
     */
    public NetResponse store(Partition partition, NetRequest request, String key, NetResponse response) {
        if (!response.isOk()) {
            return response;
        }
        if (!"GET".equals(request.getMethod())) {
            log.debug("Not storing answer to {}", request);
            return response.withHeaders(Map.of(NetResponse.SERVED_BY, "network"));
        }
        CacheEntry entry = CacheEntry.of(key, response, now());
        String storage = generation.storageName(partition.getName());
        try {
            store.put(storage, key, entry);
            store.trim(storage, partition.getMaxEntries());
        } catch (StoreException e) {
            log.warn("Store write failed for partition {}, serving uncached", partition.getName(), e);
        }
        return entry.toResponse().withHeaders(Map.of(NetResponse.SERVED_BY, "network"));
    }

    /**
     * Fetches and stores on the worker pool. The returned future may be abandoned by a caller that
     * stops waiting; the fetch and the store write still complete.
     */
    public CompletableFuture<NetResponse> fetchAndStoreAsync(NetRequest request, Partition partition, String key) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return store(partition, request, key, network.fetch(request));
            } catch (NetworkException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    /**
     * Detached refresh; the outcome is only ever logged.
     */
    public void revalidateInBackground(NetRequest request, Partition partition, String key) {
        try {
            executor.execute(() -> {
                try {
                    NetResponse response = network.fetch(request);
                    if (response.isOk()) {
                        store(partition, request, key, response);
                        log.debug("Revalidated {} in {}", request, partition.getName());
                    } else {
                        log.debug("Revalidation of {} returned {}, keeping cached copy", request, response);
                    }
                } catch (NetworkException | RuntimeException e) {
                    log.warn("Background revalidation failed for {}", request, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Background revalidation of {} rejected", request, e);
        }
    }

    public NetResponse fromCache(CacheEntry entry, boolean networkFailed) {
        if (networkFailed) {
            return entry.toResponse().withHeaders(Map.of(NetResponse.SERVED_BY, "cache", NetResponse.OFFLINE, "true"));
        }
        return entry.toResponse().withHeaders(Map.of(NetResponse.SERVED_BY, "cache"));
    }

    public NetResponse offline(NetRequest request) {
        return offlineResponder.buildFallback(request);
    }
}
