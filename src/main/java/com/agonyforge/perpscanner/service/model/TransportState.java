package com.agonyforge.perpscanner.service.model;

/**
 * How a connector is currently receiving prices from its venue.
 */
public enum TransportState {
    DISCONNECTED,
    CONNECTING_PUSH,
    CONNECTED_PUSH,
    FALLBACK_PULL
}
