package com.example.offlinecache.lifecycle;

/**
 * The current cache generation. Every partition's storage name embeds it, so bumping the
 * generation moves all reads and writes to fresh storages and leaves the old ones for cleanup.
 */
public final class Generation {

    private final String prefix;
    private final long number;

    public Generation(String prefix, long number) {
        if (number < 0) {
            throw new IllegalArgumentException("Generation must not be negative: " + number);
        }
        this.prefix = prefix;
        this.number = number;
    }

    public String getPrefix() {
        return prefix;
    }

    public long getNumber() {
        return number;
    }

    public String storageName(String partition) {
        return prefix + "-" + partition + "-v" + number;
    }

    public boolean isCurrent(String storageName) {
        return storageName.startsWith(prefix + "-") && storageName.endsWith("-v" + number);
    }

    @Override
    public String toString() {
        return prefix + "-v" + number;
    }
}
