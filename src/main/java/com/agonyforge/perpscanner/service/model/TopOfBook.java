package com.agonyforge.perpscanner.service.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A best bid and best ask as parsed from a venue, before the connector stamps it into a Quote.
 * The symbol is already in canonical form.
 */
public class TopOfBook {
    private final String symbol;
    private final BigDecimal bid;
    private final BigDecimal ask;

    public TopOfBook(String symbol, BigDecimal bid, BigDecimal ask) {
        this.symbol = Objects.requireNonNull(symbol);
        this.bid = Objects.requireNonNull(bid);
        this.ask = Objects.requireNonNull(ask);
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TopOfBook)) return false;
        TopOfBook that = (TopOfBook) o;
        return symbol.equals(that.symbol) &&
            bid.compareTo(that.bid) == 0 &&
            ask.compareTo(that.ask) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, bid.stripTrailingZeros(), ask.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return String.format("%s %s/%s", symbol, bid, ask);
    }
}
