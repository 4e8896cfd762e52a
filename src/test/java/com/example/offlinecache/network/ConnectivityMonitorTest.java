package com.example.offlinecache.network;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConnectivityMonitorTest {

    @Test
    void listenersHearTransitionsOnly() {
        ConnectivityMonitor monitor = new ConnectivityMonitor();
        List<Boolean> heard = new ArrayList<>();
        monitor.addListener(heard::add);

        monitor.setOnline(true);
        monitor.setOnline(false);
        monitor.setOnline(false);
        monitor.setOnline(true);

        assertThat(heard).containsExactly(false, true);
        assertThat(monitor.isOnline()).isTrue();
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        ConnectivityMonitor monitor = new ConnectivityMonitor();
        List<Boolean> heard = new ArrayList<>();
        monitor.addListener(online -> {
            throw new IllegalStateException("boom");
        });
        monitor.addListener(heard::add);

        monitor.setOnline(false);

        assertThat(heard).containsExactly(false);
    }
}
