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
 * Any cached copy is returned at once, stale or not, while a detached fetch refreshes the store.
 */
public class StaleWhileRevalidateStrategy implements CachingStrategy {

    private static final Logger log = LoggerFactory.getLogger(StaleWhileRevalidateStrategy.class);

    @Override
    public NetResponse handle(NetRequest request, Partition partition, StrategyContext context) {
        String key = RequestKeys.of(request);
        Optional<CacheEntry> cached = context.lookup(partition, key);

        if (cached.isPresent()) {
            context.revalidateInBackground(request, partition, key);
            return context.fromCache(cached.get(), false);
        }

        try {
            return context.store(partition, request, key, context.fetch(request));
        } catch (NetworkException e) {
            log.warn("Network failed for {} with nothing cached: {}", request, e.getMessage());
            return context.offline(request);
        }
    }
}
