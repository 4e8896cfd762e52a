package com.example.offlinecache.partition;

import com.example.offlinecache.core.ConfigException;
import java.util.Locale;

public enum StrategyType {
    CACHE_FIRST,
    NETWORK_FIRST,
    STALE_WHILE_REVALIDATE;

    /**
     * Accepts both enum names and the kebab-case names used in configuration files
     * ({@code cache-first}, {@code network-first}, {@code stale-while-revalidate}).
     */
    public static StrategyType parse(String value) {
        if (value == null) {
            throw new ConfigException("Strategy is required");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Unknown strategy: " + value);
        }
    }
}
