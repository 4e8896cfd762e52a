package com.example.offlinecache.config;

import com.example.offlinecache.control.CacheControl;
import com.example.offlinecache.control.ControlChannel;
import com.example.offlinecache.lifecycle.CacheLifecycle;
import com.example.offlinecache.lifecycle.Generation;
import com.example.offlinecache.lifecycle.PrecachePlan;
import com.example.offlinecache.network.ConnectivityMonitor;
import com.example.offlinecache.network.HttpClientNetwork;
import com.example.offlinecache.network.Network;
import com.example.offlinecache.network.OriginResolver;
import com.example.offlinecache.offline.ContactFamily;
import com.example.offlinecache.offline.InventoryFamily;
import com.example.offlinecache.offline.OfflineResponder;
import com.example.offlinecache.partition.PartitionRegistry;
import com.example.offlinecache.queue.FileSubmissionStore;
import com.example.offlinecache.queue.SubmissionStore;
import com.example.offlinecache.queue.WriteRetryQueue;
import com.example.offlinecache.router.RequestRouter;
import com.example.offlinecache.store.FileResponseStore;
import com.example.offlinecache.store.ResponseStore;
import com.example.offlinecache.strategy.StrategyContext;
import com.example.offlinecache.strategy.StrategyExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
@EnableConfigurationProperties(OfflineCacheProperties.class)
public class OfflineCacheConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OfflineCacheConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Dedicated pool for network calls and background refreshes, kept off the servlet threads
    @Bean(destroyMethod = "shutdown")
    @Primary
    public ExecutorService cacheWorkerPool(OfflineCacheProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkerThreads(), new CustomizableThreadFactory("cache-worker-"));
    }

    @Bean
    public OriginResolver originResolver(OfflineCacheProperties properties) {
        return new OriginResolver(properties.getOrigin());
    }

    @Bean
    public Generation generation(OfflineCacheProperties properties) {
        return new Generation(properties.getCachePrefix(), properties.getGeneration());
    }

    @Bean
    public PartitionRegistry partitionRegistry(OfflineCacheProperties properties) {
        PartitionRegistry registry = new PartitionRegistry();
        for (OfflineCacheProperties.PartitionProperties partition : properties.getPartitions()) {
            registry.register(partition.toPartition());
        }
        log.info("Registered {} cache partition(s): {}", registry.all().size(), registry.all());
        return registry;
    }

    @Bean
    public ResponseStore responseStore(OfflineCacheProperties properties, ObjectMapper mapper) {
        return new FileResponseStore(Path.of(properties.getStorageDir(), "responses"), mapper);
    }

    @Bean
    public SubmissionStore submissionStore(OfflineCacheProperties properties, ObjectMapper mapper) {
        return new FileSubmissionStore(Path.of(properties.getStorageDir(), "submissions"), mapper);
    }

    @Bean
    public Network network(OfflineCacheProperties properties, OriginResolver origin) {
        HttpClient client = HttpClient.newBuilder()
            .connectTimeout(properties.getConnectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        return new HttpClientNetwork(client, origin, properties.getRequestTimeout());
    }

    @Bean
    public OfflineResponder offlineResponder(
        OfflineCacheProperties properties,
        ObjectMapper mapper,
        ResponseStore store,
        Generation generation,
        OriginResolver origin,
        Clock clock
    ) {
        return new OfflineResponder(
            mapper,
            List.of(new InventoryFamily(properties.getInventoryPath()), new ContactFamily(properties.getContactPath())),
            store,
            generation,
            properties.getPrecache().getStaticPartition(),
            origin.absolute(properties.getOfflinePage()),
            properties.getRetryAfterSeconds(),
            clock
        );
    }

    @Bean
    public StrategyContext strategyContext(
        OfflineCacheProperties properties,
        ResponseStore store,
        Generation generation,
        Network network,
        OfflineResponder offlineResponder,
        ExecutorService cacheWorkerPool,
        Clock clock
    ) {
        return new StrategyContext(store, generation, network, offlineResponder, cacheWorkerPool, clock,
            properties.getDefaultNetworkTimeout().toMillis());
    }

    @Bean
    public StrategyExecutor strategyExecutor(StrategyContext context) {
        return new StrategyExecutor(context);
    }

    @Bean
    public WriteRetryQueue writeRetryQueue(SubmissionStore store, Network network, ExecutorService cacheWorkerPool, Clock clock) {
        return new WriteRetryQueue(store, network, cacheWorkerPool, clock);
    }

    @Bean
    public ConnectivityMonitor connectivityMonitor(WriteRetryQueue queue) {
        ConnectivityMonitor monitor = new ConnectivityMonitor();
        monitor.addListener(online -> {
            if (online) {
                queue.replayAllAsync();
            }
        });
        return monitor;
    }

    @Bean
    public RequestRouter requestRouter(
        OfflineCacheProperties properties,
        PartitionRegistry registry,
        StrategyExecutor executor,
        Network network,
        WriteRetryQueue queue,
        OfflineResponder offlineResponder,
        OriginResolver origin,
        ObjectMapper mapper
    ) {
        List<Pattern> queueable = properties.getQueueableEndpoints().stream()
            .map(Pattern::compile)
            .collect(Collectors.toList());
        return new RequestRouter(registry, executor, network, queue, offlineResponder, origin, queueable,
            properties.getPrecache().getPagesPartition(), mapper);
    }

    @Bean
    public CacheLifecycle cacheLifecycle(
        OfflineCacheProperties properties,
        PartitionRegistry registry,
        ResponseStore store,
        Generation generation,
        StrategyContext context,
        OriginResolver origin,
        ExecutorService cacheWorkerPool,
        ApplicationEventPublisher events
    ) {
        OfflineCacheProperties.Precache precache = properties.getPrecache();
        PrecachePlan plan = new PrecachePlan(
            precache.getStaticPartition(), precache.getStaticAssets(),
            precache.getApiPartition(), precache.getEssentialApis(),
            precache.getPagesPartition(), precache.getCriticalPages());
        return new CacheLifecycle(registry, store, generation, context, origin, plan, cacheWorkerPool, events);
    }

    @Bean
    public CacheControl cacheControl(
        OfflineCacheProperties properties,
        PartitionRegistry registry,
        ResponseStore store,
        Generation generation,
        StrategyContext context,
        CacheLifecycle lifecycle,
        OriginResolver origin
    ) {
        return new CacheControl(registry, store, generation, context, lifecycle, origin,
            properties.getPrecache().getPagesPartition());
    }

    // Control commands wait on precache fetches running in cacheWorkerPool, so they must not occupy it
    @Bean(destroyMethod = "shutdown")
    public ExecutorService cacheControlPool(OfflineCacheProperties properties) {
        return Executors.newFixedThreadPool(properties.getControlThreads(), new CustomizableThreadFactory("cache-control-"));
    }

    @Bean
    public ControlChannel controlChannel(CacheControl control, @Qualifier("cacheControlPool") ExecutorService cacheControlPool) {
        return new ControlChannel(control, cacheControlPool);
    }

    @Bean
    public ApplicationListener<ApplicationReadyEvent> lifecycleStarter(OfflineCacheProperties properties, CacheLifecycle lifecycle) {
        return event -> {
            if (properties.isInstallOnStartup()) {
                lifecycle.install();
            }
            lifecycle.activate();
        };
    }
}
