package com.agonyforge.perpscanner.service.model;

import java.time.Duration;
import java.util.Optional;

/**
 * A read-only view of a connector's state, for diagnostics.
 */
public class ConnectorStats {
    private final Venue venue;
    private final TransportState transport;
    private final int reconnectAttempts;
    private final Duration lastEventAge;

    public ConnectorStats(Venue venue, TransportState transport, int reconnectAttempts, Duration lastEventAge) {
        this.venue = venue;
        this.transport = transport;
        this.reconnectAttempts = reconnectAttempts;
        this.lastEventAge = lastEventAge;
    }

    public Venue getVenue() {
        return venue;
    }

    public TransportState getTransport() {
        return transport;
    }

    public int getReconnectAttempts() {
        return reconnectAttempts;
    }

    // empty until the first message arrives
    public Optional<Duration> getLastEventAge() {
        return Optional.ofNullable(lastEventAge);
    }

    @Override
    public String toString() {
        return String.format("%s %s reconnects=%d lastEvent=%s",
            venue,
            transport,
            reconnectAttempts,
            getLastEventAge().map(age -> age.toMillis() + " ms ago").orElse("never"));
    }
}
