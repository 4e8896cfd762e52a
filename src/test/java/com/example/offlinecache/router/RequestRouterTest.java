package com.example.offlinecache.router;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.offlinecache.core.CacheEntry;
import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.core.RequestKeys;
import com.example.offlinecache.partition.Partition;
import com.example.offlinecache.partition.StrategyType;
import com.example.offlinecache.queue.ReplayResult;
import com.example.offlinecache.support.TestCache;
import com.fasterxml.jackson.databind.JsonNode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RequestRouterTest {

    @TempDir
    Path dir;

    private TestCache cache;

    @BeforeEach
    void setUp() {
        cache = new TestCache(dir)
            .with(Partition.of("static", StrategyType.CACHE_FIRST, Duration.ofDays(365).toMillis(), 200, "\\.(?:css|png)$"))
            .with(Partition.of("api", StrategyType.NETWORK_FIRST, 300_000, 30, "/api/").withNetworkTimeout(3000))
            .with(Partition.of("pages", StrategyType.STALE_WHILE_REVALIDATE, Duration.ofHours(24).toMillis(), 50, "/vehicles/"));
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    void relativeUrlsAreKeyedAgainstTheOrigin() {
        cache.network.respond(TestCache.url("/site.css"), "body{}");

        cache.router.handle(NetRequest.get("/site.css"));
        NetResponse second = cache.router.handle(NetRequest.get(TestCache.url("/site.css")));

        assertThat(second.header(NetResponse.SERVED_BY)).isEqualTo("cache");
        assertThat(cache.network.callCount()).isEqualTo(1);
    }

    @Test
    void contactSubmissionIsQueuedOfflineAndDeliveredOnceWhenBackOnline() throws Exception {
        cache.network.setReachable(false);

        NetResponse response = cache.router.handle(NetRequest.post("/api/contact", "{\"name\":\"Ana\"}"));

        assertThat(response.getStatus()).isEqualTo(202);
        JsonNode body = cache.mapper.readTree(response.getBody());
        assertThat(body.path("queued").asBoolean()).isTrue();
        assertThat(body.path("offline").asBoolean()).isTrue();
        assertThat(cache.queue.size()).isEqualTo(1);

        cache.network.setReachable(true);
        cache.network.respond(TestCache.url("/api/contact"), "{\"success\":true}");
        ReplayResult first = cache.queue.replayAll();
        ReplayResult second = cache.queue.replayAll();

        assertThat(first.getDelivered()).isEqualTo(1);
        assertThat(second.getDelivered()).isZero();
        assertThat(cache.queue.size()).isZero();
        assertThat(cache.network.answeredUrls("POST")).containsExactly(TestCache.url("/api/contact"));
        assertThat(cache.network.answered().get(0).getBody()).isEqualTo("{\"name\":\"Ana\"}");
    }

    @Test
    void onlineContactSubmissionPassesStraightThrough() {
        cache.network.respond(TestCache.url("/api/contact"), "{\"success\":true}");

        NetResponse response = cache.router.handle(NetRequest.post("/api/contact", "{}"));

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(cache.queue.size()).isZero();
    }

    @Test
    void otherMutatingRequestsAreNeitherCachedNorQueued() {
        cache.network.setReachable(false);

        NetResponse response = cache.router.handle(new NetRequest("PUT", "/api/profile", Map.of(), "{}"));

        assertThat(response.getStatus()).isEqualTo(503);
        assertThat(response.isOffline()).isTrue();
        assertThat(cache.queue.size()).isZero();
        assertThat(cache.store.count(cache.storage("api"))).isZero();
    }

    @Test
    void unmatchedGetPassesThroughUncached() {
        cache.network.respond(TestCache.url("/robots.txt"), "User-agent: *");

        assertThat(cache.router.handle(NetRequest.get("/robots.txt")).getBody()).isEqualTo("User-agent: *");
        assertThat(cache.router.handle(NetRequest.get("/missing")).getStatus()).isEqualTo(404);

        cache.network.setReachable(false);
        NetResponse offline = cache.router.handle(NetRequest.get("/robots.txt"));
        assertThat(offline.getStatus()).isEqualTo(503);
        assertThat(offline.isOffline()).isTrue();
    }

    @Test
    void navigationFallsBackToCachedPageThenOfflinePage() {
        cache.network.respond(TestCache.url("/contact"), "<form/>");
        cache.router.handle(NetRequest.navigate("/contact"));
        NetRequest offlinePage = NetRequest.get(TestCache.url("/offline"));
        cache.store.put(cache.storage("static"), RequestKeys.of(offlinePage),
            CacheEntry.of(RequestKeys.of(offlinePage), NetResponse.ok("offline page"), 0L));
        cache.network.setReachable(false);

        NetResponse cached = cache.router.handle(NetRequest.navigate("/contact"));
        NetResponse fallback = cache.router.handle(NetRequest.navigate("/financing"));

        assertThat(cached.getBody()).isEqualTo("<form/>");
        assertThat(cached.isOffline()).isTrue();
        assertThat(fallback.getBody()).isEqualTo("offline page");
    }

    @Test
    void malformedUrlStillGetsAResponse() {
        NetResponse response = cache.router.handle(NetRequest.get("http://app.test/bad path|x"));

        assertThat(response.getStatus()).isEqualTo(503);
        assertThat(response.isOffline()).isTrue();
    }
}
