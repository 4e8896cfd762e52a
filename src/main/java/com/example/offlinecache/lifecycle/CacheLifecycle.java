package com.example.offlinecache.lifecycle;

import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.core.NetworkException;
import com.example.offlinecache.core.RequestKeys;
import com.example.offlinecache.core.StoreException;
import com.example.offlinecache.network.OriginResolver;
import com.example.offlinecache.partition.Partition;
import com.example.offlinecache.partition.PartitionRegistry;
import com.example.offlinecache.store.ResponseStore;
import com.example.offlinecache.strategy.StrategyContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Install (precache) and activate (drop older generations, re-apply size limits).
 */
public class CacheLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CacheLifecycle.class);

    private final PartitionRegistry registry;
    private final ResponseStore store;
    private final Generation generation;
    private final StrategyContext context;
    private final OriginResolver origin;
    private final PrecachePlan plan;
    private final ExecutorService executor;
    private final ApplicationEventPublisher events;
    private final AtomicReference<LifecycleState> state = new AtomicReference<>(LifecycleState.NEW);

    public CacheLifecycle(
        PartitionRegistry registry,
        ResponseStore store,
        Generation generation,
        StrategyContext context,
        OriginResolver origin,
        PrecachePlan plan,
        ExecutorService executor,
        ApplicationEventPublisher events
    ) {
        this.registry = registry;
        this.store = store;
        this.generation = generation;
        this.context = context;
        this.origin = origin;
        this.plan = plan;
        this.executor = executor;
        this.events = events;
    }

    public LifecycleState getState() {
        return state.get();
    }

    public Generation getGeneration() {
        return generation;
    }

    /**
     * Precaches the plan. Individual failures are logged and skipped; install itself never fails.
     *
     * @return number of urls stored
     */
    public int install() {
        state.set(LifecycleState.INSTALLING);
        log.info("Installing cache generation {}", generation);
        int stored = precache(plan.getStaticPartition(), plan.getStaticAssets())
            + precache(plan.getApiPartition(), plan.getEssentialApis())
            + precache(plan.getPagesPartition(), plan.getCriticalPages());
        state.set(LifecycleState.INSTALLED);
        log.info("Installation of {} completed, {} resource(s) precached", generation, stored);
        return stored;
    }

    /**
     * Deletes every storage not belonging to a current partition, then trims current ones to their
     * configured size. Safe to repeat.
     *
     * @return names of the storages deleted
     */
    public synchronized List<String> activate() {
        state.set(LifecycleState.ACTIVATING);
        log.info("Activating cache generation {}", generation);
        Set<String> current = registry.all().stream()
            .map(p -> generation.storageName(p.getName()))
            .collect(Collectors.toSet());

        List<String> deleted = new ArrayList<>();
        for (String storage : store.storageNames()) {
            if (current.contains(storage)) {
                continue;
            }
            try {
                if (store.deletePartition(storage)) {
                    log.info("Deleting old cache: {}", storage);
                    deleted.add(storage);
                }
            } catch (StoreException e) {
                log.error("Failed to delete old cache {}", storage, e);
            }
        }

        for (Partition partition : registry.all()) {
            try {
                store.trim(generation.storageName(partition.getName()), partition.getMaxEntries());
            } catch (StoreException e) {
                log.error("Failed to limit cache size for {}", partition.getName(), e);
            }
        }

        state.set(LifecycleState.ACTIVE);
        List<String> storages = registry.all().stream().map(p -> generation.storageName(p.getName())).toList();
        events.publishEvent(new CacheActivatedEvent(generation.getNumber(), storages, deleted));
        log.info("Activation of {} completed, {} old storage(s) removed", generation, deleted.size());
        return deleted;
    }

    /**
     * Re-fetches the static asset list.
     */
    public int preloadCritical() {
        int stored = precache(plan.getStaticPartition(), plan.getStaticAssets());
        log.info("Critical resources preloaded: {}/{}", stored, plan.getStaticAssets().size());
        return stored;
    }

    /**
     * Fetches every url in parallel and stores the successful ones in the named partition.
     * Blocks until all fetches finish, so it must not be called from a thread of the worker pool.
     *
     * @return number of urls stored
     */
    public int precache(String partitionName, List<String> urls) {
        if (partitionName == null || urls.isEmpty()) {
            return 0;
        }
        Optional<Partition> partition = registry.find(partitionName);
        if (partition.isEmpty()) {
            log.warn("Cannot precache into unknown partition {}", partitionName);
            return 0;
        }
        AtomicInteger stored = new AtomicInteger();
        List<CompletableFuture<Void>> fetches = new ArrayList<>();
        for (String url : urls) {
            fetches.add(CompletableFuture.runAsync(() -> {
                if (precacheOne(partition.get(), url)) {
                    stored.incrementAndGet();
                }
            }, executor));
        }
        CompletableFuture.allOf(fetches.toArray(new CompletableFuture[0])).join();
        return stored.get();
    }

    private boolean precacheOne(Partition partition, String url) {
        try {
            NetRequest request = NetRequest.get(origin.absolute(url));
            NetResponse response = context.fetch(request);
            if (!response.isOk()) {
                log.warn("Failed to precache {}: {}", url, response);
                return false;
            }
            context.store(partition, request, RequestKeys.of(request), response);
            return true;
        } catch (NetworkException | RuntimeException e) {
            log.warn("Failed to precache {}: {}", url, e.getMessage());
            return false;
        }
    }
}
