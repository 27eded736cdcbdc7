package com.agonyforge.perpscanner.service.broadcast;

import com.agonyforge.perpscanner.service.model.AggregatedSymbol;

import java.util.Map;

/**
 * Receives snapshots of the price cache, for example to push them to connected clients.
 */
@FunctionalInterface
public interface SnapshotBroadcaster {
    /**
     * Deliver a snapshot. Delivery is best effort.
     *
     * @param snapshot Every allow-listed symbol and its AggregatedSymbol.
     */
    void broadcast(Map<String, AggregatedSymbol> snapshot);
}
