package com.example.offlinecache.lifecycle;

import java.util.List;

/**
 * Published once a generation has taken over and older storages are gone.
 */
public final class CacheActivatedEvent {

    private final long generation;
    private final List<String> storages;
    private final List<String> deletedStorages;

    public CacheActivatedEvent(long generation, List<String> storages, List<String> deletedStorages) {
        this.generation = generation;
        this.storages = List.copyOf(storages);
        this.deletedStorages = List.copyOf(deletedStorages);
    }

    public long getGeneration() {
        return generation;
    }

    public List<String> getStorages() {
        return storages;
    }

    public List<String> getDeletedStorages() {
        return deletedStorages;
    }
}
