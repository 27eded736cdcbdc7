package com.agonyforge.perpscanner.service.broadcast;

import com.agonyforge.perpscanner.config.ScannerConfiguration;
import com.agonyforge.perpscanner.service.QuoteCache;
import com.agonyforge.perpscanner.service.model.AggregatedSymbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Turns a stream of "the cache changed" signals into at most one broadcast per window. The first signal after
 * a quiet window goes out right away. Signals inside the window schedule a single trailing broadcast at the end
 * of the window, which reads the cache at that moment so the last state of a burst always goes out.
 */
@Component
public class BroadcastThrottle {
    private static final Logger LOGGER = LoggerFactory.getLogger(BroadcastThrottle.class);

    private final ScannerConfiguration scannerConfiguration;
    private final QuoteCache quoteCache;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private volatile SnapshotBroadcaster snapshotBroadcaster = null;
    private long lastBroadcastMillis = Long.MIN_VALUE;
    private ScheduledFuture<?> trailingBroadcast = null;

    public BroadcastThrottle(
        ScannerConfiguration scannerConfiguration,
        QuoteCache quoteCache,
        ScheduledExecutorService scheduler,
        Clock clock) {

        this.scannerConfiguration = scannerConfiguration;
        this.quoteCache = quoteCache;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public void setSnapshotBroadcaster(SnapshotBroadcaster snapshotBroadcaster) {
        this.snapshotBroadcaster = snapshotBroadcaster;
    }

    /**
     * Signal that the cache has changed.
     */
    public synchronized void signal() {
        if (trailingBroadcast != null) {
            return; // the trailing broadcast will pick this change up
        }

        long window = scannerConfiguration.getBroadcastWindow().toMillis();
        long now = clock.millis();
        long elapsed = lastBroadcastMillis == Long.MIN_VALUE ? window : now - lastBroadcastMillis;

        if (elapsed >= window) {
            broadcast();
        } else {
            trailingBroadcast = scheduler.schedule(this::broadcastTrailing, window - elapsed, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Cancel any pending trailing broadcast.
     */
    public synchronized void stop() {
        if (trailingBroadcast != null) {
            trailingBroadcast.cancel(false);
            trailingBroadcast = null;
        }
    }

    private synchronized void broadcastTrailing() {
        trailingBroadcast = null;
        broadcast();
    }

    private void broadcast() {
        SnapshotBroadcaster broadcaster = snapshotBroadcaster;

        if (broadcaster == null) {
            return;
        }

        Map<String, AggregatedSymbol> snapshot = quoteCache.getSnapshot();

        if (snapshot.values().stream().noneMatch(AggregatedSymbol::isPopulated)) {
            LOGGER.trace("Not broadcasting an empty snapshot");
            return;
        }

        lastBroadcastMillis = clock.millis();

        try {
            broadcaster.broadcast(snapshot);
        } catch (RuntimeException e) {
            LOGGER.warn("Broadcast failed: {}", e.getMessage(), e);
        }
    }
}
