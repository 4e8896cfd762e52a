package com.example.offlinecache.strategy;

import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.partition.Partition;
import com.example.offlinecache.partition.StrategyType;
import java.util.EnumMap;
import java.util.Map;

public class StrategyExecutor {

    private final Map<StrategyType, CachingStrategy> strategies = new EnumMap<>(StrategyType.class);
    private final StrategyContext context;

    public StrategyExecutor(StrategyContext context) {
        this.context = context;
        strategies.put(StrategyType.CACHE_FIRST, new CacheFirstStrategy());
        strategies.put(StrategyType.NETWORK_FIRST, new NetworkFirstStrategy());
        strategies.put(StrategyType.STALE_WHILE_REVALIDATE, new StaleWhileRevalidateStrategy());
    }

    public NetResponse execute(NetRequest request, Partition partition) {
        return execute(request, partition, partition.getStrategy());
    }

    /**
     * Runs a strategy other than the partition's own against that partition's storage.
     */
    public NetResponse execute(NetRequest request, Partition partition, StrategyType strategy) {
        return strategies.get(strategy).handle(request, partition, context);
    }

    public StrategyContext context() {
        return context;
    }
}
