package com.agonyforge.perpscanner.service.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The top of the book for one symbol on one venue at a point in time. Quotes are never modified, a newer
 * Quote for the same symbol and venue replaces the old one.
 */
public class Quote {
    private final String symbol;
    private final BigDecimal bid;
    private final BigDecimal ask;
    private final Instant timestamp;
    private final Venue venue;

    public Quote(String symbol, BigDecimal bid, BigDecimal ask, Instant timestamp, Venue venue) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.bid = Objects.requireNonNull(bid, "bid");
        this.ask = Objects.requireNonNull(ask, "ask");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.venue = Objects.requireNonNull(venue, "venue");

        if (bid.signum() < 0 || ask.signum() < 0) {
            throw new IllegalArgumentException("Negative price in quote for " + symbol + " on " + venue);
        }
    }

    public String getSymbol() {
        return symbol;
    }

    public BigDecimal getBid() {
        return bid;
    }

    public BigDecimal getAsk() {
        return ask;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Venue getVenue() {
        return venue;
    }

    /**
     * A Quote is only usable for computing spreads if both sides of the book are present.
     *
     * @return true if both bid and ask are greater than zero.
     */
    public boolean isValid() {
        return bid.signum() > 0 && ask.signum() > 0;
    }

    /**
     * Is this Quote young enough to be used at the given time?
     *
     * @param now The time of evaluation.
     * @param stalenessWindow The maximum age of a usable Quote.
     * @return true if the Quote is no older than the staleness window.
     */
    public boolean isFresh(Instant now, Duration stalenessWindow) {
        return !timestamp.plus(stalenessWindow).isBefore(now);
    }

    public boolean isOlderThan(Quote other) {
        return timestamp.isBefore(other.getTimestamp());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Quote)) return false;
        Quote quote = (Quote) o;
        return symbol.equals(quote.symbol) &&
            bid.compareTo(quote.bid) == 0 &&
            ask.compareTo(quote.ask) == 0 &&
            timestamp.equals(quote.timestamp) &&
            venue == quote.venue;
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, bid.stripTrailingZeros(), ask.stripTrailingZeros(), timestamp, venue);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s/%s @ %s", venue, symbol, bid, ask, timestamp);
    }
}
