package com.agonyforge.perpscanner.config;

import com.agonyforge.perpscanner.exception.ConfigurationException;
import com.agonyforge.perpscanner.service.model.Venue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Configuration that governs the scanner as a whole. These settings can be set in application.yaml in the
 * "scanner" section.
 */
@ConfigurationProperties("scanner")
@Configuration
public class ScannerConfiguration {
    private List<String> symbols = new ArrayList<>();
    private Duration stalenessWindow = Duration.ofSeconds(30);
    private BigDecimal alertThreshold = new BigDecimal("0.5");
    private Duration alertCooldown = Duration.ofSeconds(60);
    private Duration broadcastWindow = Duration.ofSeconds(1);
    private Duration persistenceThrottle = Duration.ofSeconds(5);
    private Duration stalenessSweepInterval = Duration.ofSeconds(5);
    private Integer ingestionQueueCapacity = 10_000;
    private List<Venue> venuePriority = new ArrayList<>(Arrays.asList(Venue.values()));
    private String historyDirectory = ".perpscanner";
    private List<VenueConfiguration> venues = new ArrayList<>();

    /**
     * Check the configuration for problems we can't recover from. Called once at startup.
     *
     * @throws ConfigurationException if the configuration is unusable.
     */
    public void validate() {
        if (symbols == null || symbols.isEmpty()) {
            throw new ConfigurationException("No symbols configured in scanner.symbols");
        }

        symbols.forEach(symbol -> {
            if (symbol == null || symbol.isBlank()) {
                throw new ConfigurationException("Blank entry in scanner.symbols: " + symbols);
            }
        });

        if (alertThreshold == null) {
            throw new ConfigurationException("scanner.alert-threshold must be set");
        }

        if (ingestionQueueCapacity == null || ingestionQueueCapacity <= 0) {
            throw new ConfigurationException("scanner.ingestion-queue-capacity must be positive");
        }

        requirePositive("scanner.staleness-window", stalenessWindow);
        requirePositive("scanner.broadcast-window", broadcastWindow);
        requirePositive("scanner.staleness-sweep-interval", stalenessSweepInterval);

        Set<Venue> seen = EnumSet.noneOf(Venue.class);

        for (VenueConfiguration venueConfiguration : venues) {
            venueConfiguration.validate();

            if (!seen.add(venueConfiguration.getVenue())) {
                throw new ConfigurationException("Venue configured more than once: " + venueConfiguration.getVenue());
            }
        }
    }

    /**
     * The allow-list of canonical symbols, upper case and without duplicates, in configured order.
     *
     * @return The set of symbols we track.
     */
    public Set<String> getAllowList() {
        Set<String> allowList = new LinkedHashSet<>();

        symbols.forEach(symbol -> allowList.add(symbol.trim().toUpperCase(Locale.ROOT)));

        return allowList;
    }

    static void requirePositive(String name, Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new ConfigurationException(name + " must be a positive duration");
        }
    }

    public List<String> getSymbols() {
        return symbols;
    }

    public void setSymbols(List<String> symbols) {
        this.symbols = symbols;
    }

    public Duration getStalenessWindow() {
        return stalenessWindow;
    }

    public void setStalenessWindow(Duration stalenessWindow) {
        this.stalenessWindow = stalenessWindow;
    }

    public BigDecimal getAlertThreshold() {
        return alertThreshold;
    }

    public void setAlertThreshold(BigDecimal alertThreshold) {
        this.alertThreshold = alertThreshold;
    }

    public Duration getAlertCooldown() {
        return alertCooldown;
    }

    public void setAlertCooldown(Duration alertCooldown) {
        this.alertCooldown = alertCooldown;
    }

    public Duration getBroadcastWindow() {
        return broadcastWindow;
    }

    public void setBroadcastWindow(Duration broadcastWindow) {
        this.broadcastWindow = broadcastWindow;
    }

    public Duration getPersistenceThrottle() {
        return persistenceThrottle;
    }

    public void setPersistenceThrottle(Duration persistenceThrottle) {
        this.persistenceThrottle = persistenceThrottle;
    }

    public Duration getStalenessSweepInterval() {
        return stalenessSweepInterval;
    }

    public void setStalenessSweepInterval(Duration stalenessSweepInterval) {
        this.stalenessSweepInterval = stalenessSweepInterval;
    }

    public Integer getIngestionQueueCapacity() {
        return ingestionQueueCapacity;
    }

    public void setIngestionQueueCapacity(Integer ingestionQueueCapacity) {
        this.ingestionQueueCapacity = ingestionQueueCapacity;
    }

    public List<Venue> getVenuePriority() {
        return venuePriority;
    }

    public void setVenuePriority(List<Venue> venuePriority) {
        this.venuePriority = venuePriority;
    }

    public String getHistoryDirectory() {
        return historyDirectory;
    }

    public void setHistoryDirectory(String historyDirectory) {
        this.historyDirectory = historyDirectory;
    }

    public List<VenueConfiguration> getVenues() {
        return venues;
    }

    public void setVenues(List<VenueConfiguration> venues) {
        this.venues = venues;
    }
}
