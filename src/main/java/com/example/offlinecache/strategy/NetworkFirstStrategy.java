package com.example.offlinecache.strategy;

import com.example.offlinecache.core.CacheEntry;
import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.core.RequestKeys;
import com.example.offlinecache.partition.Partition;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Network raced against a timeout; on timeout or failure the latest stored copy is served,
 * however old it is.
 */
public class NetworkFirstStrategy implements CachingStrategy {

    private static final Logger log = LoggerFactory.getLogger(NetworkFirstStrategy.class);

    @Override
    public NetResponse handle(NetRequest request, Partition partition, StrategyContext context) {
        String key = RequestKeys.of(request);
        long timeoutMs = partition.getNetworkTimeoutMs().orElse(context.defaultNetworkTimeoutMs());
        CompletableFuture<NetResponse> pending = context.fetchAndStoreAsync(request, partition, key);

        NetResponse networkResponse = null;
        try {
            networkResponse = pending.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (networkResponse.isOk()) {
                return networkResponse;
            }
            log.debug("Network answered {} for {}, trying cache", networkResponse, request);
        } catch (TimeoutException e) {
            // pending keeps running and will still populate the store
            log.warn("Network timed out after {} ms for {}, trying cache", timeoutMs, request);
        } catch (ExecutionException e) {
            log.warn("Network failed for {}, trying cache: {}", request, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for network on {}, trying cache", request);
        }

        Optional<CacheEntry> cached = context.lookup(partition, key);
        if (cached.isPresent()) {
            return context.fromCache(cached.get(), true);
        }
        return networkResponse != null ? networkResponse : context.offline(request);
    }
}
