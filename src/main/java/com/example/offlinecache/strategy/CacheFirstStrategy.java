package com.example.offlinecache.strategy;

import com.example.offlinecache.core.CacheEntry;
import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.core.NetworkException;
import com.example.offlinecache.core.RequestKeys;
import com.example.offlinecache.partition.Partition;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fresh cached copy wins outright; otherwise go to the network, falling back to the stale copy.
 */
public class CacheFirstStrategy implements CachingStrategy {

    private static final Logger log = LoggerFactory.getLogger(CacheFirstStrategy.class);

    @Override
    public NetResponse handle(NetRequest request, Partition partition, StrategyContext context) {
        String key = RequestKeys.of(request);
        Optional<CacheEntry> cached = context.lookup(partition, key);

        if (cached.isPresent() && cached.get().isFresh(context.now(), partition.getMaxAgeMs())) {
            log.debug("Fresh hit for {} in {}", request, partition.getName());
            return context.fromCache(cached.get(), false);
        }

        try {
            NetResponse response = context.fetch(request);
            if (response.isOk()) {
                return context.store(partition, request, key, response);
            }
            log.debug("Network answered {} for {}", response, request);
            return cached.map(entry -> context.fromCache(entry, true)).orElse(response);
        } catch (NetworkException e) {
            log.warn("Network failed for {}, using stale cache: {}", request, e.getMessage());
            return cached.map(entry -> context.fromCache(entry, true)).orElseGet(() -> context.offline(request));
        }
    }
}
