package com.agonyforge.perpscanner.service;

import com.agonyforge.perpscanner.config.ScannerConfiguration;
import com.agonyforge.perpscanner.service.broadcast.BroadcastThrottle;
import com.agonyforge.perpscanner.service.broadcast.SnapshotBroadcaster;
import com.agonyforge.perpscanner.service.connector.ConnectorProvider;
import com.agonyforge.perpscanner.service.connector.HybridConnector;
import com.agonyforge.perpscanner.service.event.QuoteEvent;
import com.agonyforge.perpscanner.service.event.QuoteEventQueue;
import com.agonyforge.perpscanner.service.event.QuoteIngestionLoop;
import com.agonyforge.perpscanner.service.model.AggregatedSymbol;
import com.agonyforge.perpscanner.service.model.AlertRecord;
import com.agonyforge.perpscanner.service.model.ConnectorStats;
import com.agonyforge.perpscanner.service.model.Venue;
import com.agonyforge.perpscanner.service.persistence.SpreadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import javax.inject.Inject;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Starts the connectors and runs every price they deliver through the pipeline: cache, alerts, persistence
 * and broadcast, in that order.
 */
@Component
public class ScannerOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScannerOrchestrator.class);

    private final ScannerConfiguration scannerConfiguration;
    private final ConnectorProvider connectorProvider;
    private final QuoteEventQueue quoteEventQueue;
    private final QuoteCache quoteCache;
    private final AlertService alertService;
    private final SpreadRepository spreadRepository;
    private final BroadcastThrottle broadcastThrottle;
    private final ErrorCollectorService errorCollectorService;
    private final ScheduledExecutorService scannerScheduler;
    private final Clock clock;
    private final Map<String, Instant> lastPersisted = new ConcurrentHashMap<>();
    private final List<HybridConnector> connectors = new ArrayList<>();

    private boolean running = false;
    private QuoteIngestionLoop ingestionLoop = null;
    private ScheduledFuture<?> stalenessSweep = null;

    @Inject
    public ScannerOrchestrator(
        ScannerConfiguration scannerConfiguration,
        ConnectorProvider connectorProvider,
        QuoteEventQueue quoteEventQueue,
        QuoteCache quoteCache,
        AlertService alertService,
        SpreadRepository spreadRepository,
        BroadcastThrottle broadcastThrottle,
        ErrorCollectorService errorCollectorService,
        ScheduledExecutorService scannerScheduler,
        Clock clock,
        Optional<SnapshotBroadcaster> snapshotBroadcaster) {

        this.scannerConfiguration = scannerConfiguration;
        this.connectorProvider = connectorProvider;
        this.quoteEventQueue = quoteEventQueue;
        this.quoteCache = quoteCache;
        this.alertService = alertService;
        this.spreadRepository = spreadRepository;
        this.broadcastThrottle = broadcastThrottle;
        this.errorCollectorService = errorCollectorService;
        this.scannerScheduler = scannerScheduler;
        this.clock = clock;

        snapshotBroadcaster.ifPresent(broadcastThrottle::setSnapshotBroadcaster);
    }

    /**
     * Validate the configuration, seed the cache and start every connector. Does nothing if already started.
     */
    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }

        scannerConfiguration.validate();

        quoteCache.seed(scannerConfiguration.getAllowList());

        LOGGER.info("Scanning {} symbols: {}", quoteCache.getAllowList().size(), quoteCache.getAllowList());

        ingestionLoop = new QuoteIngestionLoop(quoteEventQueue, this::ingest);
        ingestionLoop.start();

        connectors.addAll(connectorProvider.createConnectors());
        connectors.forEach(HybridConnector::start);

        long sweepMillis = scannerConfiguration.getStalenessSweepInterval().toMillis();

        stalenessSweep = scannerScheduler.scheduleWithFixedDelay(
            this::sweepStaleQuotes,
            sweepMillis,
            sweepMillis,
            TimeUnit.MILLISECONDS);

        running = true;

        LOGGER.info("Started {} connectors", connectors.size());
    }

    /**
     * Stop every connector and the ingestion loop. Does nothing if already stopped.
     */
    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;

        if (stalenessSweep != null) {
            stalenessSweep.cancel(false);
            stalenessSweep = null;
        }

        connectors.forEach(HybridConnector::stop);
        connectors.clear();

        ingestionLoop.stop();
        ingestionLoop = null;
        quoteEventQueue.clear();
        broadcastThrottle.stop();

        LOGGER.info("Scanner stopped");
    }

    /**
     * Run one price through the pipeline.
     *
     * @param quoteEvent The price and the transport it arrived on.
     */
    void ingest(QuoteEvent quoteEvent) {
        LOGGER.trace("Ingesting {}", quoteEvent);

        Optional<AggregatedSymbol> updated = quoteCache.upsert(quoteEvent.getQuote());

        if (updated.isEmpty()) {
            return;
        }

        AggregatedSymbol aggregatedSymbol = updated.get();

        alertService.evaluate(aggregatedSymbol);
        persistMetric(aggregatedSymbol);
        broadcastThrottle.signal();
    }

    // re-evaluate every symbol so a venue that went quiet ages out of the best prices, and alert on what's left
    void sweepStaleQuotes() {
        try {
            boolean changed = false;

            for (String symbol : quoteCache.getAllowList()) {
                Optional<AggregatedSymbol> refreshed = quoteCache.refresh(symbol);

                if (refreshed.isPresent()) {
                    changed = true;
                    alertService.evaluate(refreshed.get());
                }
            }

            if (changed) {
                LOGGER.debug("Staleness sweep changed the cache");
                broadcastThrottle.signal();
            }
        } catch (RuntimeException e) {
            // an exception would cancel the sweep timer
            LOGGER.error("Staleness sweep failed: {}", e.getMessage(), e);
        }
    }

    private void persistMetric(AggregatedSymbol aggregatedSymbol) {
        // one-sided or stale books have no spread to record
        if (aggregatedSymbol.getSpreadPct().isEmpty()) {
            return;
        }

        Instant now = clock.instant();
        Instant last = lastPersisted.get(aggregatedSymbol.getSymbol());

        if (last != null && Duration.between(last, now).compareTo(scannerConfiguration.getPersistenceThrottle()) < 0) {
            return;
        }

        lastPersisted.put(aggregatedSymbol.getSymbol(), now);

        try {
            spreadRepository.saveSpreadMetric(
                aggregatedSymbol.getSymbol(),
                aggregatedSymbol.getSpreadPct().orElseThrow(),
                aggregatedSymbol.getBestBid().orElseThrow(),
                aggregatedSymbol.getBestAsk().orElseThrow(),
                aggregatedSymbol.getBestBidVenue().orElseThrow(),
                aggregatedSymbol.getBestAskVenue().orElseThrow());
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Failed to save spread metric for {}: {}", aggregatedSymbol.getSymbol(), e.getMessage());
        }
    }

    public Map<String, AggregatedSymbol> getSnapshot() {
        return quoteCache.getSnapshot();
    }

    public synchronized Map<Venue, ConnectorStats> getConnectorStats() {
        Map<Venue, ConnectorStats> stats = new EnumMap<>(Venue.class);

        connectors.forEach(connector -> stats.put(connector.getVenue(), connector.getStats()));

        return stats;
    }

    /**
     * Get the most recent alerts from the repository.
     *
     * @param limit The maximum number of alerts.
     * @return The alerts, newest first. Empty if the repository can't be read.
     */
    public List<AlertRecord> getRecentAlerts(int limit) {
        try {
            return spreadRepository.getRecentAlerts(limit);
        } catch (IOException e) {
            LOGGER.error("Failed to read recent alerts: {}", e.getMessage());
        }

        return Collections.emptyList();
    }

    /**
     * Summarize non-critical errors once a minute.
     */
    @Scheduled(cron = "0 * * * * *") // every minute
    public void errorSummary() {
        if (errorCollectorService.isEmpty()) {
            return;
        }

        errorCollectorService.report().forEach(LOGGER::info);
        errorCollectorService.clear();
    }

    /**
     * Log where each connector and symbol stands.
     */
    @Scheduled(cron = "0 */5 * * * *") // every 5 minutes
    public void summary() {
        if (!running) {
            return;
        }

        getConnectorStats().values().forEach(stats -> LOGGER.info("Connector: {}", stats));

        if (quoteEventQueue.getDroppedCount() > 0) {
            LOGGER.info("Ingestion queue has dropped {} events", quoteEventQueue.getDroppedCount());
        }

        getSnapshot().values().forEach(aggregatedSymbol -> LOGGER.info("Symbol: {}", aggregatedSymbol));
    }
}
