package com.example.offlinecache.network;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Online/offline signal fed by the host. Listeners hear about transitions only, not repeats.
 */
public class ConnectivityMonitor {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityMonitor.class);

    @FunctionalInterface
    public interface Listener {
        void onConnectivityChanged(boolean online);
    }

    private final AtomicBoolean online = new AtomicBoolean(true);
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public boolean isOnline() {
        return online.get();
    }

    public void setOnline(boolean nowOnline) {
        if (online.getAndSet(nowOnline) == nowOnline) {
            return;
        }
        log.info("Connectivity changed: {}", nowOnline ? "online" : "offline");
        for (Listener listener : listeners) {
            try {
                listener.onConnectivityChanged(nowOnline);
            } catch (RuntimeException e) {
                log.error("Connectivity listener failed", e);
            }
        }
    }
}
