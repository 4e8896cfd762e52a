package com.example.offlinecache.store;

import com.example.offlinecache.core.CacheEntry;
import java.util.List;
import java.util.Optional;

/**
 * Durable map of request key to stored response, split into named storages
 * (one per partition and generation). All mutation goes through this interface.
 *
 * <p>Implementations throw {@link com.example.offlinecache.core.StoreException} on I/O failure.
 */
public interface ResponseStore {

    Optional<CacheEntry> get(String storage, String key);

    /**
     * Writes or fully replaces the entry. Readers see either the old or the new entry, never a partial one.
     * A replaced key moves to the newest position.
     */
    void put(String storage, String key, CacheEntry entry);

    boolean delete(String storage, String key);

    /**
     * Drops the storage and everything in it.
     *
     * @return {@code true} if the storage existed
     */
    boolean deletePartition(String storage);

    /**
     * Keys in insertion order, oldest first.
     */
    List<String> listKeys(String storage);

    /**
     * Removes the oldest entries until at most {@code maxEntries} remain.
     *
     * @return number of entries removed
     */
    int trim(String storage, int maxEntries);

    int count(String storage);

    /**
     * Every storage known to the store, including ones left behind by earlier generations.
     */
    List<String> storageNames();

    /**
     * Size estimate extrapolated from the first {@code sampleSize} entries.
     */
    long approximateBytes(String storage, int sampleSize);
}
