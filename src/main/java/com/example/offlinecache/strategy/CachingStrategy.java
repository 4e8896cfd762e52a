package com.example.offlinecache.strategy;

import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.partition.Partition;

/**
 * Decides, for one request, how the store and the network are consulted.
 * Implementations never throw for network or store failures; they fall back instead.
 */
public interface CachingStrategy {

    NetResponse handle(NetRequest request, Partition partition, StrategyContext context);
}
