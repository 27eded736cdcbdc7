package com.agonyforge.perpscanner.service.connector;

import com.agonyforge.perpscanner.config.ScannerConfiguration;
import com.agonyforge.perpscanner.config.VenueConfiguration;
import com.agonyforge.perpscanner.service.ErrorCollectorService;
import com.agonyforge.perpscanner.service.event.QuoteEventQueue;
import com.agonyforge.perpscanner.service.venue.ExtendedQuoteSource;
import com.agonyforge.perpscanner.service.venue.LighterQuoteSource;
import com.agonyforge.perpscanner.service.venue.ParadexQuoteSource;
import com.agonyforge.perpscanner.service.venue.QuoteSource;
import com.agonyforge.perpscanner.service.venue.VestQuoteSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.inject.Inject;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Builds a QuoteSource and a HybridConnector for each configured venue.
 */
@Component
public class ConnectorProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectorProvider.class);

    private final ScannerConfiguration scannerConfiguration;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ErrorCollectorService errorCollectorService;
    private final QuoteEventQueue quoteEventQueue;
    private final ScheduledExecutorService scannerScheduler;
    private final Clock clock;

    @Inject
    public ConnectorProvider(
        ScannerConfiguration scannerConfiguration,
        OkHttpClient httpClient,
        ObjectMapper objectMapper,
        ErrorCollectorService errorCollectorService,
        QuoteEventQueue quoteEventQueue,
        ScheduledExecutorService scannerScheduler,
        Clock clock) {

        this.scannerConfiguration = scannerConfiguration;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.errorCollectorService = errorCollectorService;
        this.quoteEventQueue = quoteEventQueue;
        this.scannerScheduler = scannerScheduler;
        this.clock = clock;
    }

    /**
     * Create connectors for every active venue. The connectors are not started.
     *
     * @return One HybridConnector per active venue.
     */
    public List<HybridConnector> createConnectors() {
        List<HybridConnector> connectors = new ArrayList<>();
        Set<String> allowList = scannerConfiguration.getAllowList();

        scannerConfiguration.getVenues().forEach(venueConfiguration -> {
            // skip venues that are explicitly disabled
            if (venueConfiguration.getActive() != null && !venueConfiguration.getActive()) {
                LOGGER.info("Skipping venue '{}' because it is not set as active", venueConfiguration.getVenue());
                return;
            }

            QuoteSource quoteSource = createQuoteSource(venueConfiguration, allowList);

            LOGGER.info("Configured venue {} ({})",
                venueConfiguration.getVenue(),
                quoteSource.isPushCapable() && venueConfiguration.isPushEnabled() ? "push with polling fallback" : "polling");

            connectors.add(new HybridConnector(quoteSource, venueConfiguration, quoteEventQueue, scannerScheduler, clock));
        });

        return connectors;
    }

    QuoteSource createQuoteSource(VenueConfiguration venueConfiguration, Set<String> allowList) {
        switch (venueConfiguration.getVenue()) {
            case PARADEX:
                return new ParadexQuoteSource(venueConfiguration, allowList, httpClient, objectMapper, errorCollectorService);
            case LIGHTER:
                return new LighterQuoteSource(venueConfiguration, allowList, httpClient, objectMapper, errorCollectorService);
            case VEST:
                return new VestQuoteSource(venueConfiguration, allowList, httpClient, objectMapper, errorCollectorService);
            case EXTENDED:
                return new ExtendedQuoteSource(venueConfiguration, allowList, httpClient, objectMapper, errorCollectorService);
            default:
                throw new IllegalArgumentException("Unsupported venue: " + venueConfiguration.getVenue());
        }
    }
}
