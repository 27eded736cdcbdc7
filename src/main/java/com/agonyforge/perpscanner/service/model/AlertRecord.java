package com.agonyforge.perpscanner.service.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A cross-venue spread that crossed the alert threshold: buy on the venue with the best ask and sell on
 * the venue with the best bid.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertRecord {
    private final String symbol;
    private final BigDecimal spreadPct;
    private final Venue buyVenue;
    private final Venue sellVenue;
    private final BigDecimal buyPrice;
    private final BigDecimal sellPrice;
    private final Instant timestamp;

    @JsonCreator
    public AlertRecord(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("spreadPct") BigDecimal spreadPct,
        @JsonProperty("buyVenue") Venue buyVenue,
        @JsonProperty("sellVenue") Venue sellVenue,
        @JsonProperty("buyPrice") BigDecimal buyPrice,
        @JsonProperty("sellPrice") BigDecimal sellPrice,
        @JsonProperty("timestamp") Instant timestamp) {

        this.symbol = symbol;
        this.spreadPct = spreadPct;
        this.buyVenue = buyVenue;
        this.sellVenue = sellVenue;
        this.buyPrice = buyPrice;
        this.sellPrice = sellPrice;
        this.timestamp = timestamp;
    }

    /**
     * Build an AlertRecord from a symbol that has a cross-venue signal.
     *
     * @param aggregatedSymbol The symbol with a signal.
     * @param timestamp When the alert was raised.
     * @return A new AlertRecord.
     */
    public static AlertRecord from(AggregatedSymbol aggregatedSymbol, Instant timestamp) {
        if (!aggregatedSymbol.isCrossVenue()) {
            throw new IllegalArgumentException("No cross-venue signal for " + aggregatedSymbol.getSymbol());
        }

        return new AlertRecord(
            aggregatedSymbol.getSymbol(),
            aggregatedSymbol.getSpreadPct().orElseThrow(),
            aggregatedSymbol.getBestAskVenue().orElseThrow(),
            aggregatedSymbol.getBestBidVenue().orElseThrow(),
            aggregatedSymbol.getBestAsk().orElseThrow(),
            aggregatedSymbol.getBestBid().orElseThrow(),
            timestamp);
    }

    public String getSymbol() {
        return symbol;
    }

    public BigDecimal getSpreadPct() {
        return spreadPct;
    }

    public Venue getBuyVenue() {
        return buyVenue;
    }

    public Venue getSellVenue() {
        return sellVenue;
    }

    public BigDecimal getBuyPrice() {
        return buyPrice;
    }

    public BigDecimal getSellPrice() {
        return sellPrice;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlertRecord)) return false;
        AlertRecord that = (AlertRecord) o;
        return Objects.equals(symbol, that.symbol) &&
            Objects.equals(spreadPct, that.spreadPct) &&
            buyVenue == that.buyVenue &&
            sellVenue == that.sellVenue &&
            Objects.equals(buyPrice, that.buyPrice) &&
            Objects.equals(sellPrice, that.sellPrice) &&
            Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, spreadPct, buyVenue, sellVenue, buyPrice, sellPrice, timestamp);
    }

    @Override
    public String toString() {
        return String.format("%s %s%% buy %s@%s sell %s@%s",
            symbol,
            spreadPct,
            buyVenue,
            buyPrice,
            sellVenue,
            sellPrice);
    }
}
