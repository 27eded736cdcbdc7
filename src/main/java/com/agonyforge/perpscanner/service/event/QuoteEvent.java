package com.agonyforge.perpscanner.service.event;

import com.agonyforge.perpscanner.service.model.Quote;
import com.agonyforge.perpscanner.service.model.TransportState;

/**
 * An event generated when a connector receives a quote from its venue.
 */
public class QuoteEvent {
    private final Quote quote;
    private final TransportState transport;

    public QuoteEvent(Quote quote, TransportState transport) {
        this.quote = quote;
        this.transport = transport;
    }

    public Quote getQuote() {
        return quote;
    }

    // which transport delivered the quote
    public TransportState getTransport() {
        return transport;
    }

    @Override
    public String toString() {
        return quote + " via " + transport;
    }
}
