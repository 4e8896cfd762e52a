package com.example.offlinecache.api;

import com.example.offlinecache.control.ControlChannel;
import com.example.offlinecache.control.ControlMessage;
import com.example.offlinecache.control.ControlReply;
import com.example.offlinecache.network.ConnectivityMonitor;
import com.example.offlinecache.queue.QueuedSubmission;
import com.example.offlinecache.queue.ReplayResult;
import com.example.offlinecache.queue.WriteRetryQueue;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CacheControlController {

    private final ControlChannel channel;
    private final ConnectivityMonitor connectivity;
    private final WriteRetryQueue queue;

    public CacheControlController(ControlChannel channel, ConnectivityMonitor connectivity, WriteRetryQueue queue) {
        this.channel = channel;
        this.connectivity = connectivity;
        this.queue = queue;
    }

    @GetMapping("/cache/status")
    public ResponseEntity<ControlReply> status() {
        return reply(new ControlMessage.Status());
    }

    @PostMapping("/cache/invalidate")
    public ResponseEntity<ControlReply> invalidate(@RequestParam(required = false) String partition) {
        return reply(new ControlMessage.Invalidate(partition));
    }

    @PostMapping("/cache/warm")
    public ResponseEntity<ControlReply> warm(@RequestBody List<String> urls) {
        return reply(new ControlMessage.Warm(urls));
    }

    @PostMapping("/cache/warm/{partition}")
    public ResponseEntity<ControlReply> warmPartition(@PathVariable String partition) {
        return reply(new ControlMessage.WarmPartition(partition));
    }

    @PostMapping("/cache/preload")
    public ResponseEntity<ControlReply> preloadCritical() {
        return reply(new ControlMessage.PreloadCritical());
    }

    @PostMapping("/cache/activate")
    public ResponseEntity<ControlReply> forceActivate() {
        return reply(new ControlMessage.ForceActivate());
    }

    @PostMapping("/connectivity")
    public Map<String, Object> connectivity(@RequestParam boolean online) {
        connectivity.setOnline(online);
        return Map.of("online", connectivity.isOnline(), "queued", queue.size());
    }

    @GetMapping("/queue")
    public List<QueuedSubmission> pending() {
        return queue.pending();
    }

    @PostMapping("/queue/replay")
    public ReplayResult replay() {
        return queue.replayAll();
    }

    private ResponseEntity<ControlReply> reply(ControlMessage message) {
        ControlReply reply = channel.send(message).join();
        return ResponseEntity.status(reply.isOk() ? HttpStatus.OK : HttpStatus.BAD_REQUEST).body(reply);
    }
}
