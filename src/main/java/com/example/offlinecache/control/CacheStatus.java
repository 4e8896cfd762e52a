package com.example.offlinecache.control;

import java.util.Map;

public final class CacheStatus {

    private final long generation;
    private final Map<String, PartitionStatus> partitions;

    public CacheStatus(long generation, Map<String, PartitionStatus> partitions) {
        this.generation = generation;
        this.partitions = partitions;
    }

    public long getGeneration() {
        return generation;
    }

    public Map<String, PartitionStatus> getPartitions() {
        return partitions;
    }

    public static final class PartitionStatus {
        private final String storage;
        private final int count;
        private final long approxBytes;

        public PartitionStatus(String storage, int count, long approxBytes) {
            this.storage = storage;
            this.count = count;
            this.approxBytes = approxBytes;
        }

        public String getStorage() {
            return storage;
        }

        public int getCount() {
            return count;
        }

        public long getApproxBytes() {
            return approxBytes;
        }
    }
}
