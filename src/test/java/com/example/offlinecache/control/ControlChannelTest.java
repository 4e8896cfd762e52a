package com.example.offlinecache.control;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.lifecycle.PrecachePlan;
import com.example.offlinecache.partition.Partition;
import com.example.offlinecache.partition.StrategyType;
import com.example.offlinecache.support.TestCache;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ControlChannelTest {

    @TempDir
    Path dir;

    private TestCache cache;

    @BeforeEach
    void setUp() {
        PrecachePlan plan = new PrecachePlan("static", List.of("/site.css", "/app.js"), null, List.of(), null, List.of());
        cache = new TestCache(dir, 1, plan)
            .with(Partition.of("static", StrategyType.CACHE_FIRST, 0, 100, "\\.(?:css|js)$"))
            .with(Partition.of("api", StrategyType.NETWORK_FIRST, 300_000, 30, "/api/")
                .withWarmUrls(List.of("/api/vehicles", "/api/vehicles?page=2")))
            .with(Partition.of("pages", StrategyType.STALE_WHILE_REVALIDATE, 0, 50, "/vehicles/"));
        cache.network.respond(TestCache.url("/site.css"), "body{}")
            .respond(TestCache.url("/app.js"), "run()")
            .respond(TestCache.url("/api/vehicles"), "{\"vehicles\":[1]}")
            .respond(TestCache.url("/api/vehicles?page=2"), "{\"vehicles\":[2]}")
            .respond(TestCache.url("/financing"), "<p>rates</p>");
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private ControlReply send(ControlMessage message) throws Exception {
        return cache.channel.send(message).get(5, TimeUnit.SECONDS);
    }

    @Test
    void statusReportsCountAndSizePerPartition() throws Exception {
        cache.router.handle(NetRequest.get("/site.css"));
        cache.router.handle(NetRequest.get("/app.js"));

        ControlReply reply = send(new ControlMessage.Status());

        assertThat(reply.isOk()).isTrue();
        assertThat(reply.getType()).isEqualTo("STATUS");
        CacheStatus status = (CacheStatus) reply.getPayload();
        assertThat(status.getGeneration()).isEqualTo(1);
        assertThat(status.getPartitions()).containsOnlyKeys("static", "api", "pages");
        CacheStatus.PartitionStatus staticStatus = status.getPartitions().get("static");
        assertThat(staticStatus.getStorage()).isEqualTo("test-cache-static-v1");
        assertThat(staticStatus.getCount()).isEqualTo(2);
        assertThat(staticStatus.getApproxBytes()).isPositive();
        assertThat(status.getPartitions().get("api").getCount()).isZero();
        assertThat(status.getPartitions().get("api").getApproxBytes()).isZero();
    }

    @Test
    void invalidateOnePartitionIsIdempotent() throws Exception {
        cache.router.handle(NetRequest.get("/site.css"));
        cache.router.handle(NetRequest.get("/api/vehicles"));

        ControlReply first = send(new ControlMessage.Invalidate("static"));
        ControlReply again = send(new ControlMessage.Invalidate("static"));

        assertThat(first.getPayload()).isEqualTo(List.of("test-cache-static-v1"));
        assertThat(again.isOk()).isTrue();
        assertThat(again.getPayload()).isEqualTo(List.of());
        assertThat(cache.store.count(cache.storage("static"))).isZero();
        assertThat(cache.store.count(cache.storage("api"))).isEqualTo(1);
    }

    @Test
    void invalidateAllClearsEveryStorage() throws Exception {
        cache.router.handle(NetRequest.get("/site.css"));
        cache.router.handle(NetRequest.get("/api/vehicles"));

        ControlReply reply = send(ControlMessage.Invalidate.all());

        assertThat(reply.isOk()).isTrue();
        assertThat(cache.store.storageNames()).isEmpty();
        assertThat(send(ControlMessage.Invalidate.all()).getPayload()).isEqualTo(List.of());

        cache.router.handle(NetRequest.get("/site.css"));
        assertThat(cache.network.callCount()).isEqualTo(3);
    }

    @Test
    void unknownPartitionIsAFailedReplyNotAnException() throws Exception {
        ControlReply reply = send(new ControlMessage.Invalidate("nope"));

        assertThat(reply.isOk()).isFalse();
        assertThat(reply.getType()).isEqualTo("INVALIDATE");
        assertThat(reply.getError()).contains("nope");
        assertThat(send(new ControlMessage.WarmPartition("nope")).isOk()).isFalse();
    }

    @Test
    void warmPartitionFetchesConfiguredUrls() throws Exception {
        ControlReply reply = send(new ControlMessage.WarmPartition("api"));

        assertThat(reply.getPayload()).isEqualTo(2);
        assertThat(cache.store.count(cache.storage("api"))).isEqualTo(2);
    }

    @Test
    void warmRoutesEachUrlToItsPartition() throws Exception {
        ControlReply reply = send(new ControlMessage.Warm(List.of("/site.css", "/financing", "/not-there.css")));

        assertThat(reply.getPayload()).isEqualTo(2);
        assertThat(cache.store.count(cache.storage("static"))).isEqualTo(1);
        assertThat(cache.store.count(cache.storage("pages"))).isEqualTo(1);
    }

    @Test
    void preloadAndForceActivate() throws Exception {
        assertThat(send(new ControlMessage.PreloadCritical()).getPayload()).isEqualTo(2);

        ControlReply activated = send(new ControlMessage.ForceActivate());

        assertThat(activated.isOk()).isTrue();
        assertThat(activated.getPayload()).isEqualTo(List.of());
        assertThat(cache.events).hasSize(1);
        assertThat(cache.store.count(cache.storage("static"))).isEqualTo(2);
    }

    @Test
    void concurrentWarmCommandsDoNotStarveTheWorkerPool() throws Exception {
        cache.network.setLatencyMs(200);
        List<CompletableFuture<ControlReply>> replies = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            replies.add(cache.channel.send(new ControlMessage.WarmPartition("api")));
        }

        NetResponse served = cache.router.handle(NetRequest.get("/api/vehicles"));
        CompletableFuture.allOf(replies.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        assertThat(served.getBody()).isEqualTo("{\"vehicles\":[1]}");
        assertThat(replies).allSatisfy(reply -> assertThat(reply.join().getPayload()).isEqualTo(2));
        assertThat(cache.store.count(cache.storage("api"))).isEqualTo(2);
    }
}
