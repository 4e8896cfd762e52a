package com.example.offlinecache.partition;

import com.example.offlinecache.core.ConfigException;
import com.example.offlinecache.core.NetRequest;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered set of partitions. Resolution walks them in declaration order; first match wins.
 */
public class PartitionRegistry {

    private static final Logger log = LoggerFactory.getLogger(PartitionRegistry.class);

    // partition names end up in storage (directory) names
    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private final CopyOnWriteArrayList<Partition> partitions = new CopyOnWriteArrayList<>();

    public synchronized void register(Partition partition) {
        if (partition.getName() == null || !NAME.matcher(partition.getName()).matches()) {
            throw new ConfigException("Invalid partition name: '" + partition.getName() + "'");
        }
        if (partition.getMatchRules().isEmpty()) {
            throw new ConfigException("Partition '" + partition.getName() + "' has no match rules");
        }
        if (partition.getMaxEntries() <= 0) {
            throw new ConfigException("Partition '" + partition.getName() + "' needs maxEntries > 0, got "
                + partition.getMaxEntries());
        }
        if (partition.getStrategy() == null) {
            throw new ConfigException("Partition '" + partition.getName() + "' has no strategy");
        }
        if (find(partition.getName()).isPresent()) {
            throw new ConfigException("Partition '" + partition.getName() + "' is already registered");
        }
        partitions.add(partition);
        log.debug("Registered partition {} with rules {}", partition, partition.getMatchRules());
    }

    public Optional<Partition> resolve(NetRequest request) {
        for (Partition partition : partitions) {
            for (MatchRule rule : partition.getMatchRules()) {
                if (rule.matches(request)) {
                    return Optional.of(partition);
                }
            }
        }
        return Optional.empty();
    }

    public Optional<Partition> find(String name) {
        return partitions.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    public List<Partition> all() {
        return List.copyOf(partitions);
    }
}
