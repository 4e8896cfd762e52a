package com.example.offlinecache.store;

import com.example.offlinecache.core.CacheEntry;
import com.example.offlinecache.core.StoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.DigestUtils;
import org.springframework.util.FileSystemUtils;

/**
 * {@link ResponseStore} keeping one directory per storage and one JSON file per entry.
 *
 * <p>Writes go to a temp file that is atomically moved into place. Each storage keeps an in-memory
 * index ordered by write sequence, rebuilt from disk the first time the storage is touched after a
 * restart. A per-storage lock serialises put, trim and delete, so the entry cap holds once writers settle.
 */
public class FileResponseStore implements ResponseStore {

    private static final Logger log = LoggerFactory.getLogger(FileResponseStore.class);

    private static final Pattern STORAGE_NAME = Pattern.compile("[A-Za-z0-9._-]+");
    private static final String SUFFIX = ".json";
    private static final String TMP_PREFIX = ".tmp-";

    private final Path root;
    private final ObjectMapper mapper;
    private final ConcurrentHashMap<String, StorageIndex> indexes = new ConcurrentHashMap<>();

    public FileResponseStore(Path root, ObjectMapper mapper) {
        this.root = root;
        this.mapper = mapper;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StoreException("Cannot create response store at " + root, e);
        }
    }

    private static final class StorageIndex {
        final ReentrantLock lock = new ReentrantLock();
        // key -> sequence, iteration order is write order
        final LinkedHashMap<String, Long> order = new LinkedHashMap<>();
        long nextSequence = 1;
        boolean deleted;
    }

    @Override
    public Optional<CacheEntry> get(String storage, String key) {
        checkName(storage);
        try {
            String json = Files.readString(entryFile(storage, key), StandardCharsets.UTF_8);
            return Optional.of(mapper.readValue(json, CacheEntry.class));
        } catch (NoSuchFileException e) {
            // never stored, or evicted
            return Optional.empty();
        } catch (IOException e) {
            throw new StoreException("Cannot read entry '" + key + "' from " + storage, e);
        }
    }

    @Override
    public void put(String storage, String key, CacheEntry entry) {
        withIndex(storage, index -> {
            CacheEntry sequenced = entry.withSequence(index.nextSequence++);
            Path dir = storageDir(storage);
            try {
                Files.createDirectories(dir);
                Path tmp = dir.resolve(TMP_PREFIX + UUID.randomUUID());
                Files.writeString(tmp, mapper.writeValueAsString(sequenced), StandardCharsets.UTF_8);
                Files.move(tmp, entryFile(storage, key), StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new StoreException("Cannot write entry '" + key + "' to " + storage, e);
            }
            index.order.remove(key);
            index.order.put(key, sequenced.getSequence());
            return null;
        });
    }

    @Override
    public boolean delete(String storage, String key) {
        return withIndex(storage, index -> {
            boolean present = index.order.remove(key) != null;
            try {
                return Files.deleteIfExists(entryFile(storage, key)) || present;
            } catch (IOException e) {
                throw new StoreException("Cannot delete entry '" + key + "' from " + storage, e);
            }
        });
    }

    @Override
    public boolean deletePartition(String storage) {
        checkName(storage);
        StorageIndex index = indexes.remove(storage);
        if (index != null) {
            index.lock.lock();
            index.deleted = true;
        }
        try {
            return FileSystemUtils.deleteRecursively(storageDir(storage));
        } catch (IOException e) {
            throw new StoreException("Cannot delete storage " + storage, e);
        } finally {
            if (index != null) {
                index.lock.unlock();
            }
        }
    }

    @Override
    public List<String> listKeys(String storage) {
        return withIndex(storage, index -> new ArrayList<>(index.order.keySet()));
    }

    @Override
    public int trim(String storage, int maxEntries) {
        int removed = withIndex(storage, index -> {
            int count = 0;
            Iterator<String> oldest = index.order.keySet().iterator();
            while (index.order.size() > Math.max(0, maxEntries) && oldest.hasNext()) {
                String key = oldest.next();
                oldest.remove();
                try {
                    Files.deleteIfExists(entryFile(storage, key));
                } catch (IOException e) {
                    throw new StoreException("Cannot evict entry '" + key + "' from " + storage, e);
                }
                count++;
            }
            return count;
        });
        if (removed > 0) {
            log.debug("Cleaned {} entries from {}", removed, storage);
        }
        return removed;
    }

    @Override
    public int count(String storage) {
        return withIndex(storage, index -> index.order.size());
    }

    @Override
    public List<String> storageNames() {
        TreeSet<String> names = new TreeSet<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : dirs) {
                names.add(dir.getFileName().toString());
            }
        } catch (IOException e) {
            throw new StoreException("Cannot list storages under " + root, e);
        }
        return new ArrayList<>(names);
    }

    @Override
    public long approximateBytes(String storage, int sampleSize) {
        List<String> keys = listKeys(storage);
        int sample = Math.min(keys.size(), sampleSize);
        if (sample == 0) {
            return 0L;
        }
        long total = 0;
        int measured = 0;
        for (int i = 0; i < sample; i++) {
            try {
                Optional<CacheEntry> entry = get(storage, keys.get(i));
                if (entry.isPresent()) {
                    total += entry.get().approximateBytes();
                    measured++;
                }
            } catch (StoreException e) {
                log.debug("Skipping unreadable entry while sizing {}", storage, e);
            }
        }
        if (measured == 0) {
            return 0L;
        }
        return Math.round((double) total / measured * keys.size());
    }

    private <T> T withIndex(String storage, Function<StorageIndex, T> action) {
        while (true) {
            StorageIndex index = indexed(storage);
            index.lock.lock();
            try {
                if (index.deleted) {
                    // storage was dropped while we waited; start over with a fresh one
                    continue;
                }
                return action.apply(index);
            } finally {
                index.lock.unlock();
            }
        }
    }

    private StorageIndex indexed(String storage) {
        checkName(storage);
        return indexes.computeIfAbsent(storage, this::load);
    }

    private StorageIndex load(String storage) {
        StorageIndex index = new StorageIndex();
        Path dir = storageDir(storage);
        if (!Files.isDirectory(dir)) {
            return index;
        }
        List<CacheEntry> entries = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                String fileName = file.getFileName().toString();
                if (fileName.startsWith(TMP_PREFIX)) {
                    // leftover of a write interrupted by a crash
                    Files.deleteIfExists(file);
                    continue;
                }
                if (!fileName.endsWith(SUFFIX)) {
                    continue;
                }
                try {
                    entries.add(mapper.readValue(Files.readString(file, StandardCharsets.UTF_8), CacheEntry.class));
                } catch (JsonProcessingException e) {
                    log.warn("Dropping corrupt cache entry {} in {}", fileName, storage, e);
                    Files.deleteIfExists(file);
                }
            }
        } catch (IOException e) {
            throw new StoreException("Cannot load storage " + storage, e);
        }
        entries.sort(Comparator.comparingLong(CacheEntry::getSequence));
        for (CacheEntry entry : entries) {
            index.order.put(entry.getRequestKey(), entry.getSequence());
            index.nextSequence = Math.max(index.nextSequence, entry.getSequence() + 1);
        }
        log.debug("Loaded {} entries for storage {}", index.order.size(), storage);
        return index;
    }

    private Path storageDir(String storage) {
        return root.resolve(storage);
    }

    private Path entryFile(String storage, String key) {
        return storageDir(storage).resolve(DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8)) + SUFFIX);
    }

    private static void checkName(String storage) {
        if (storage == null || !STORAGE_NAME.matcher(storage).matches()) {
            throw new IllegalArgumentException("Invalid storage name: " + storage);
        }
    }
}
