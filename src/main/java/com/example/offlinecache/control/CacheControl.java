package com.example.offlinecache.control;

import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.core.NetworkException;
import com.example.offlinecache.core.RequestKeys;
import com.example.offlinecache.lifecycle.CacheLifecycle;
import com.example.offlinecache.lifecycle.Generation;
import com.example.offlinecache.network.OriginResolver;
import com.example.offlinecache.partition.Partition;
import com.example.offlinecache.partition.PartitionRegistry;
import com.example.offlinecache.store.ResponseStore;
import com.example.offlinecache.strategy.StrategyContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache inspection and invalidation commands. Every command is idempotent and may run while
 * requests are being served; all store access goes through the store's own locking.
 */
public class CacheControl {

    private static final Logger log = LoggerFactory.getLogger(CacheControl.class);

    static final int SIZE_SAMPLE = 10;

    private final PartitionRegistry registry;
    private final ResponseStore store;
    private final Generation generation;
    private final StrategyContext context;
    private final CacheLifecycle lifecycle;
    private final OriginResolver origin;
    private final String defaultWarmPartition;

    public CacheControl(
        PartitionRegistry registry,
        ResponseStore store,
        Generation generation,
        StrategyContext context,
        CacheLifecycle lifecycle,
        OriginResolver origin,
        String defaultWarmPartition
    ) {
        this.registry = registry;
        this.store = store;
        this.generation = generation;
        this.context = context;
        this.lifecycle = lifecycle;
        this.origin = origin;
        this.defaultWarmPartition = defaultWarmPartition;
    }

    /**
     * Prefetches the partition's configured warm urls.
     *
     * @return number of urls stored
     */
    public int warmPartition(String name) {
        Partition partition = partition(name);
        int stored = lifecycle.precache(partition.getName(), partition.getWarmUrls());
        log.info("Warmed partition {}: {}/{}", name, stored, partition.getWarmUrls().size());
        return stored;
    }

    /**
     * Fetches each url into the partition it routes to, or the default warm partition when none matches.
     *
     * @return number of urls stored
     */
    public int warm(List<String> urls) {
        int stored = 0;
        for (String url : urls) {
            NetRequest request;
            try {
                request = NetRequest.get(origin.absolute(url));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed url {}", url);
                continue;
            }
            Optional<Partition> target = registry.resolve(request).or(() -> registry.find(defaultWarmPartition));
            if (target.isEmpty()) {
                log.warn("No partition to warm {} into", url);
                continue;
            }
            try {
                NetResponse response = context.fetch(request);
                if (response.isOk()) {
                    context.store(target.get(), request, RequestKeys.of(request), response);
                    stored++;
                } else {
                    log.warn("Failed to warm {}: {}", url, response);
                }
            } catch (NetworkException e) {
                log.warn("Failed to warm {}: {}", url, e.getMessage());
            }
        }
        log.info("Batch cached {}/{} URLs", stored, urls.size());
        return stored;
    }

    public CacheStatus getCacheStatus() {
        Map<String, CacheStatus.PartitionStatus> partitions = new LinkedHashMap<>();
        for (Partition partition : registry.all()) {
            String storage = generation.storageName(partition.getName());
            partitions.put(partition.getName(), new CacheStatus.PartitionStatus(
                storage, store.count(storage), store.approximateBytes(storage, SIZE_SAMPLE)));
        }
        return new CacheStatus(generation.getNumber(), partitions);
    }

    /**
     * Clears the current storage of one partition, or every storage when {@code name} is null.
     *
     * @return names of the storages that existed and were removed
     */
    public List<String> clearPartition(String name) {
        List<String> cleared = new ArrayList<>();
        if (name == null) {
            for (String storage : store.storageNames()) {
                if (store.deletePartition(storage)) {
                    cleared.add(storage);
                }
            }
            log.info("All caches cleared ({})", cleared.size());
            return cleared;
        }
        String storage = generation.storageName(partition(name).getName());
        if (store.deletePartition(storage)) {
            cleared.add(storage);
        }
        log.info("Cache cleared: {}", storage);
        return cleared;
    }

    public int preloadCritical() {
        return lifecycle.preloadCritical();
    }

    public List<String> forceActivate() {
        return lifecycle.activate();
    }

    private Partition partition(String name) {
        return registry.find(name).orElseThrow(() -> new UnknownPartitionException(name));
    }
}
