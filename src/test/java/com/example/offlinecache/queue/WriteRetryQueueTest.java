package com.example.offlinecache.queue;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.network.ConnectivityMonitor;
import com.example.offlinecache.network.Network;
import com.example.offlinecache.support.Eventually;
import com.example.offlinecache.support.ScriptedNetwork;
import com.example.offlinecache.support.TestCache;
import com.example.offlinecache.support.TestClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WriteRetryQueueTest {

    private static final String A = TestCache.url("/api/contact/a");
    private static final String B = TestCache.url("/api/contact/b");
    private static final String C = TestCache.url("/api/contact/c");

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final TestClock clock = new TestClock();
    private final ScriptedNetwork network = new ScriptedNetwork();
    private ExecutorService executor;
    private FileSubmissionStore store;
    private WriteRetryQueue queue;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        store = new FileSubmissionStore(dir, mapper);
        queue = new WriteRetryQueue(store, network, executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void replaysInEnqueueOrderAndDrains() {
        queue.enqueue(NetRequest.post(A, "1"));
        queue.enqueue(NetRequest.post(B, "2"));
        queue.enqueue(NetRequest.post(C, "3"));
        network.respond(A, "ok").respond(B, "ok").respond(C, "ok");

        ReplayResult result = queue.replayAll();

        assertThat(result.getDelivered()).isEqualTo(3);
        assertThat(result.getStoppedAt()).isNull();
        assertThat(network.answeredUrls("POST")).containsExactly(A, B, C);
        assertThat(queue.size()).isZero();
    }

    @Test
    void stopsAtFirstRejectedSubmissionSoLaterOnesNeverOvertake() {
        queue.enqueue(NetRequest.post(A, "1"));
        QueuedSubmission b = queue.enqueue(NetRequest.post(B, "2"));
        queue.enqueue(NetRequest.post(C, "3"));
        network.respond(A, "ok")
            .respond(B, new NetResponse(500, "Internal Server Error", Map.of(), ""))
            .respond(C, "ok");

        ReplayResult result = queue.replayAll();

        assertThat(result.getDelivered()).isEqualTo(1);
        assertThat(result.getRemaining()).isEqualTo(2);
        assertThat(result.getStoppedAt()).isEqualTo(b.getId());
        assertThat(network.answeredUrls("POST")).containsExactly(A, B);
        assertThat(queue.pending()).extracting(QueuedSubmission::getTargetEndpoint).containsExactly(B, C);
    }

    @Test
    void unreachableNetworkLeavesQueueUntouched() {
        queue.enqueue(NetRequest.post(A, "1"));
        network.setReachable(false);

        ReplayResult result = queue.replayAll();

        assertThat(result.getDelivered()).isZero();
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void replayedRequestCarriesOriginalMethodHeadersAndPayload() {
        queue.enqueue(new NetRequest("POST", A, Map.of("Content-Type", "application/json", "X-Trace", "t1"),
            "{\"name\":\"Ana\"}"));
        network.respond(A, "ok");

        queue.replayAll();

        NetRequest sent = network.answered().get(0);
        assertThat(sent.getMethod()).isEqualTo("POST");
        assertThat(sent.header("x-trace")).isEqualTo("t1");
        assertThat(sent.getBody()).isEqualTo("{\"name\":\"Ana\"}");
    }

    @Test
    void concurrentTriggerIsANoOp() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger deliveries = new AtomicInteger();
        Network blocking = request -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            deliveries.incrementAndGet();
            return NetResponse.ok("ok");
        };
        WriteRetryQueue blockingQueue = new WriteRetryQueue(store, blocking, executor, clock);
        blockingQueue.enqueue(NetRequest.post(A, "1"));

        Future<ReplayResult> first = executor.submit(blockingQueue::replayAll);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        ReplayResult second = blockingQueue.replayAll();
        release.countDown();

        assertThat(second.isSkipped()).isTrue();
        assertThat(first.get(5, TimeUnit.SECONDS).getDelivered()).isEqualTo(1);
        assertThat(deliveries.get()).isEqualTo(1);
        assertThat(blockingQueue.isReplaying()).isFalse();
    }

    @Test
    void survivesRestartInOrder() {
        queue.enqueue(NetRequest.post(A, "1"));
        queue.enqueue(NetRequest.post(B, "2"));

        FileSubmissionStore reopened = new FileSubmissionStore(dir, mapper);
        WriteRetryQueue restarted = new WriteRetryQueue(reopened, network, executor, clock);
        QueuedSubmission c = restarted.enqueue(NetRequest.post(C, "3"));

        assertThat(restarted.pending()).extracting(QueuedSubmission::getTargetEndpoint).containsExactly(A, B, C);
        assertThat(c.getId()).isEqualTo(3L);
        assertThat(c.getEnqueuedAt()).isEqualTo(clock.millis());
    }

    @Test
    void halfWrittenRecordFromACrashIsNeverVisibleAndGetsOverwritten() throws Exception {
        queue.enqueue(NetRequest.post(A, "1"));
        Path leftover = dir.resolve("." + String.format("%020d.json", 2) + ".tmp");
        Files.writeString(leftover, "{\"id\":2,\"meth");

        FileSubmissionStore reopened = new FileSubmissionStore(dir, mapper);
        assertThat(reopened.listInOrder()).extracting(QueuedSubmission::getTargetEndpoint).containsExactly(A);

        QueuedSubmission b = reopened.append(NetRequest.post(B, "2"), clock.millis());

        assertThat(b.getId()).isEqualTo(2L);
        assertThat(Files.exists(leftover)).isFalse();
        assertThat(reopened.listInOrder()).extracting(QueuedSubmission::getPayload).containsExactly("1", "2");
        assertThat(dir.resolve(String.format("%020d.json", 2)).toFile().length()).isPositive();
    }

    @Test
    void corruptSubmissionIsSetAsideWithoutBlockingOthers() throws Exception {
        queue.enqueue(NetRequest.post(A, "1"));
        Files.writeString(dir.resolve(String.format("%020d.json", 2)), "{not json");
        network.respond(A, "ok");

        assertThat(queue.pending()).hasSize(1);
        assertThat(queue.replayAll().getDelivered()).isEqualTo(1);
        assertThat(queue.size()).isZero();
    }

    @Test
    void comingBackOnlineTriggersReplay() throws Exception {
        ConnectivityMonitor monitor = new ConnectivityMonitor();
        monitor.addListener(online -> {
            if (online) {
                queue.replayAllAsync();
            }
        });
        queue.enqueue(NetRequest.post(A, "1"));
        network.respond(A, "ok");

        monitor.setOnline(false);
        assertThat(queue.size()).isEqualTo(1);
        monitor.setOnline(true);

        Eventually.await(() -> queue.size() == 0, Duration.ofSeconds(5));
        assertThat(network.answeredUrls("POST")).containsExactly(A);
    }
}
