package com.example.offlinecache.config;

import com.example.offlinecache.core.ConfigException;
import com.example.offlinecache.partition.MatchRule;
import com.example.offlinecache.partition.Partition;
import com.example.offlinecache.partition.StrategyType;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "offline-cache")
public class OfflineCacheProperties {

    private long generation = 1;
    private String cachePrefix = "offline-cache";
    private String storageDir = "data/offline-cache";
    private URI origin = URI.create("http://localhost:3000");
    private Duration defaultNetworkTimeout = Duration.ofSeconds(3);
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration requestTimeout = Duration.ofSeconds(30);
    private int retryAfterSeconds = 30;
    private int workerThreads = 16;
    private int controlThreads = 2;
    private boolean installOnStartup = true;
    private Duration replayInterval = Duration.ofMinutes(1);
    private String offlinePage = "/offline";
    private String inventoryPath = "/api/vehicles";
    private String contactPath = "/api/contact";
    private List<String> queueableEndpoints = new ArrayList<>(List.of("/api/contact"));
    private List<PartitionProperties> partitions = new ArrayList<>();
    private Precache precache = new Precache();

    public static class PartitionProperties {
        private String name;
        private List<String> patterns = new ArrayList<>();
        private List<String> methods = new ArrayList<>();
        private String strategy;
        private Duration maxAge = Duration.ZERO;
        private int maxEntries;
        private Duration networkTimeout;
        private List<String> warmUrls = new ArrayList<>();

        public Partition toPartition() {
            List<MatchRule> rules = new ArrayList<>();
            for (String pattern : patterns) {
                try {
                    rules.add(new MatchRule(Pattern.compile(pattern), new HashSet<>(methods)));
                } catch (PatternSyntaxException e) {
                    throw new ConfigException("Partition '" + name + "' has an invalid pattern: " + pattern);
                }
            }
            Long timeoutMs = networkTimeout == null ? null : networkTimeout.toMillis();
            return new Partition(name, rules, StrategyType.parse(strategy), maxAge.toMillis(), maxEntries,
                timeoutMs, warmUrls);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getPatterns() {
            return patterns;
        }

        public void setPatterns(List<String> patterns) {
            this.patterns = patterns;
        }

        public List<String> getMethods() {
            return methods;
        }

        public void setMethods(List<String> methods) {
            this.methods = methods;
        }

        public String getStrategy() {
            return strategy;
        }

        public void setStrategy(String strategy) {
            this.strategy = strategy;
        }

        public Duration getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(Duration maxAge) {
            this.maxAge = maxAge;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public Duration getNetworkTimeout() {
            return networkTimeout;
        }

        public void setNetworkTimeout(Duration networkTimeout) {
            this.networkTimeout = networkTimeout;
        }

        public List<String> getWarmUrls() {
            return warmUrls;
        }

        public void setWarmUrls(List<String> warmUrls) {
            this.warmUrls = warmUrls;
        }
    }

    public static class Precache {
        private String staticPartition = "static";
        private List<String> staticAssets = new ArrayList<>();
        private String apiPartition = "api";
        private List<String> essentialApis = new ArrayList<>();
        private String pagesPartition = "pages";
        private List<String> criticalPages = new ArrayList<>();

        public String getStaticPartition() {
            return staticPartition;
        }

        public void setStaticPartition(String staticPartition) {
            this.staticPartition = staticPartition;
        }

        public List<String> getStaticAssets() {
            return staticAssets;
        }

        public void setStaticAssets(List<String> staticAssets) {
            this.staticAssets = staticAssets;
        }

        public String getApiPartition() {
            return apiPartition;
        }

        public void setApiPartition(String apiPartition) {
            this.apiPartition = apiPartition;
        }

        public List<String> getEssentialApis() {
            return essentialApis;
        }

        public void setEssentialApis(List<String> essentialApis) {
            this.essentialApis = essentialApis;
        }

        public String getPagesPartition() {
            return pagesPartition;
        }

        public void setPagesPartition(String pagesPartition) {
            this.pagesPartition = pagesPartition;
        }

        public List<String> getCriticalPages() {
            return criticalPages;
        }

        public void setCriticalPages(List<String> criticalPages) {
            this.criticalPages = criticalPages;
        }
    }

    public long getGeneration() {
        return generation;
    }

    public void setGeneration(long generation) {
        this.generation = generation;
    }

    public String getCachePrefix() {
        return cachePrefix;
    }

    public void setCachePrefix(String cachePrefix) {
        this.cachePrefix = cachePrefix;
    }

    public String getStorageDir() {
        return storageDir;
    }

    public void setStorageDir(String storageDir) {
        this.storageDir = storageDir;
    }

    public URI getOrigin() {
        return origin;
    }

    public void setOrigin(URI origin) {
        this.origin = origin;
    }

    public Duration getDefaultNetworkTimeout() {
        return defaultNetworkTimeout;
    }

    public void setDefaultNetworkTimeout(Duration defaultNetworkTimeout) {
        this.defaultNetworkTimeout = defaultNetworkTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public void setRetryAfterSeconds(int retryAfterSeconds) {
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getControlThreads() {
        return controlThreads;
    }

    public void setControlThreads(int controlThreads) {
        this.controlThreads = controlThreads;
    }

    public boolean isInstallOnStartup() {
        return installOnStartup;
    }

    public void setInstallOnStartup(boolean installOnStartup) {
        this.installOnStartup = installOnStartup;
    }

    public Duration getReplayInterval() {
        return replayInterval;
    }

    public void setReplayInterval(Duration replayInterval) {
        this.replayInterval = replayInterval;
    }

    public String getOfflinePage() {
        return offlinePage;
    }

    public void setOfflinePage(String offlinePage) {
        this.offlinePage = offlinePage;
    }

    public String getInventoryPath() {
        return inventoryPath;
    }

    public void setInventoryPath(String inventoryPath) {
        this.inventoryPath = inventoryPath;
    }

    public String getContactPath() {
        return contactPath;
    }

    public void setContactPath(String contactPath) {
        this.contactPath = contactPath;
    }

    public List<String> getQueueableEndpoints() {
        return queueableEndpoints;
    }

    public void setQueueableEndpoints(List<String> queueableEndpoints) {
        this.queueableEndpoints = queueableEndpoints;
    }

    public List<PartitionProperties> getPartitions() {
        return partitions;
    }

    public void setPartitions(List<PartitionProperties> partitions) {
        this.partitions = partitions;
    }

    public Precache getPrecache() {
        return precache;
    }

    public void setPrecache(Precache precache) {
        this.precache = precache;
    }
}
