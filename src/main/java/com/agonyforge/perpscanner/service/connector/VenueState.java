package com.agonyforge.perpscanner.service.connector;

import com.agonyforge.perpscanner.service.model.TransportState;

import java.time.Instant;

/**
 * The mutable state of one connector. Only its HybridConnector touches it, always while holding the
 * connector's lock.
 */
class VenueState {
    private TransportState transport = TransportState.DISCONNECTED;
    private Instant lastEventTime = null;

    TransportState getTransport() {
        return transport;
    }

    void setTransport(TransportState transport) {
        this.transport = transport;
    }

    Instant getLastEventTime() {
        return lastEventTime;
    }

    void setLastEventTime(Instant lastEventTime) {
        this.lastEventTime = lastEventTime;
    }

    void clear() {
        transport = TransportState.DISCONNECTED;
        lastEventTime = null;
    }
}
