package com.example.offlinecache.router;

import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.core.NetworkException;
import com.example.offlinecache.core.StoreException;
import com.example.offlinecache.network.Network;
import com.example.offlinecache.network.OriginResolver;
import com.example.offlinecache.offline.OfflineResponder;
import com.example.offlinecache.partition.Partition;
import com.example.offlinecache.partition.PartitionRegistry;
import com.example.offlinecache.partition.StrategyType;
import com.example.offlinecache.queue.QueuedSubmission;
import com.example.offlinecache.queue.WriteRetryQueue;
import com.example.offlinecache.strategy.StrategyExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for every intercepted request. Always answers with a response: a real one,
 * a cached one, a "queued" acknowledgement, or an offline envelope.
 */
public class RequestRouter {

    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    private final PartitionRegistry registry;
    private final StrategyExecutor executor;
    private final Network network;
    private final WriteRetryQueue queue;
    private final OfflineResponder offlineResponder;
    private final OriginResolver origin;
    private final List<Pattern> queueableEndpoints;
    private final String pagesPartition;
    private final ObjectMapper mapper;

    public RequestRouter(
        PartitionRegistry registry,
        StrategyExecutor executor,
        Network network,
        WriteRetryQueue queue,
        OfflineResponder offlineResponder,
        OriginResolver origin,
        List<Pattern> queueableEndpoints,
        String pagesPartition,
        ObjectMapper mapper
    ) {
        this.registry = registry;
        this.executor = executor;
        this.network = network;
        this.queue = queue;
        this.offlineResponder = offlineResponder;
        this.origin = origin;
        this.queueableEndpoints = List.copyOf(queueableEndpoints);
        this.pagesPartition = pagesPartition;
        this.mapper = mapper;
    }

    public NetResponse handle(NetRequest incoming) {
        NetRequest request;
        try {
            request = origin.absolute(incoming);
        } catch (IllegalArgumentException e) {
            log.warn("Cannot resolve url of {}", incoming, e);
            return offlineResponder.buildFallback(incoming);
        }

        try {
            if (request.isSafe()) {
                return handleSafe(request);
            }
            if (isQueueable(request)) {
                return handleQueueable(request);
            }
            return passThrough(request);
        } catch (RuntimeException e) {
            log.error("Unhandled failure while routing {}", request, e);
            return offlineResponder.buildFallback(request);
        }
    }

    private NetResponse handleSafe(NetRequest request) {
        Optional<Partition> partition = registry.resolve(request);
        if (partition.isPresent()) {
            log.debug("{} -> partition {}", request, partition.get().getName());
            return executor.execute(request, partition.get());
        }
        if (request.isNavigation() && pagesPartition != null) {
            Optional<Partition> pages = registry.find(pagesPartition);
            if (pages.isPresent()) {
                return executor.execute(request, pages.get(), StrategyType.NETWORK_FIRST);
            }
        }
        return passThrough(request);
    }

    private NetResponse handleQueueable(NetRequest request) {
        try {
            return network.fetch(request);
        } catch (NetworkException e) {
            log.warn("Submission to {} failed, queueing: {}", request.path(), e.getMessage());
        }
        try {
            return queued(queue.enqueue(request));
        } catch (StoreException e) {
            log.error("Could not queue {}", request, e);
            return offlineResponder.buildFallback(request);
        }
    }

    /**
     * Neither cached nor queued. Non-2xx answers are returned as they came.
     */
    private NetResponse passThrough(NetRequest request) {
        try {
            return network.fetch(request);
        } catch (NetworkException e) {
            log.debug("Pass-through of {} failed: {}", request, e.getMessage());
            return offlineResponder.buildFallback(request);
        }
    }

    private boolean isQueueable(NetRequest request) {
        String path = request.path();
        for (Pattern pattern : queueableEndpoints) {
            if (pattern.matcher(path).find()) {
                return true;
            }
        }
        return false;
    }

    private NetResponse queued(QueuedSubmission submission) {
        ObjectNode body = mapper.createObjectNode();
        body.put("ok", true);
        body.put("queued", true);
        body.put("offline", true);
        body.put("submissionId", submission.getId());
        body.put("message", "Your submission was saved and will be sent when your connection is restored.");
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            json = "{\"ok\":true,\"queued\":true,\"offline\":true}";
        }
        return new NetResponse(202, "Accepted", Map.of(
            "Content-Type", "application/json",
            NetResponse.SERVED_BY, "write-retry-queue",
            NetResponse.OFFLINE, "true"
        ), json);
    }
}
