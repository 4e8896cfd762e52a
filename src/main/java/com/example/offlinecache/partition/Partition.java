package com.example.offlinecache.partition;

import java.util.List;
import java.util.OptionalLong;

/**
 * A named group of cache entries sharing match rules, a strategy and size/age limits.
 * Immutable once registered.
 */
public final class Partition {

    private final String name;
    private final List<MatchRule> matchRules;
    private final StrategyType strategy;
    private final long maxAgeMs;
    private final int maxEntries;
    private final Long networkTimeoutMs;
    private final List<String> warmUrls;

    public Partition(
        String name,
        List<MatchRule> matchRules,
        StrategyType strategy,
        long maxAgeMs,
        int maxEntries,
        Long networkTimeoutMs,
        List<String> warmUrls
    ) {
        this.name = name;
        this.matchRules = matchRules == null ? List.of() : List.copyOf(matchRules);
        this.strategy = strategy;
        this.maxAgeMs = maxAgeMs;
        this.maxEntries = maxEntries;
        this.networkTimeoutMs = networkTimeoutMs;
        this.warmUrls = warmUrls == null ? List.of() : List.copyOf(warmUrls);
    }

    public static Partition of(String name, StrategyType strategy, long maxAgeMs, int maxEntries, String... patterns) {
        List<MatchRule> rules = java.util.Arrays.stream(patterns).map(MatchRule::regex).toList();
        return new Partition(name, rules, strategy, maxAgeMs, maxEntries, null, List.of());
    }

    public Partition withNetworkTimeout(long timeoutMs) {
        return new Partition(name, matchRules, strategy, maxAgeMs, maxEntries, timeoutMs, warmUrls);
    }

    public Partition withWarmUrls(List<String> urls) {
        return new Partition(name, matchRules, strategy, maxAgeMs, maxEntries, networkTimeoutMs, urls);
    }

    public String getName() {
        return name;
    }

    public List<MatchRule> getMatchRules() {
        return matchRules;
    }

    public StrategyType getStrategy() {
        return strategy;
    }

    public long getMaxAgeMs() {
        return maxAgeMs;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public OptionalLong getNetworkTimeoutMs() {
        return networkTimeoutMs == null ? OptionalLong.empty() : OptionalLong.of(networkTimeoutMs);
    }

    public List<String> getWarmUrls() {
        return warmUrls;
    }

    @Override
    public String toString() {
        return name + "(" + strategy + ", maxEntries=" + maxEntries + ")";
    }
}
