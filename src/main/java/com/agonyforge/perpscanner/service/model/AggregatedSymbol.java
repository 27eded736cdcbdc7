package com.agonyforge.perpscanner.service.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything we know about one symbol across all venues: the latest Quote from each venue and the best bid and
 * ask derived from the fresh ones. Instances are immutable, the QuoteCache swaps in a new one on every change
 * so a reader never sees a half updated symbol.
 *
 * When there is no usable bid or ask the best prices, their venues and the spread are all absent. An absent
 * spread means "no signal", it is not the same thing as a spread of zero.
 */
public class AggregatedSymbol {
    private final String symbol;
    private final Map<Venue, Quote> quotes;
    private final Quote bestBidQuote;
    private final Quote bestAskQuote;
    private final BigDecimal spreadPct;
    private final Instant computedAt;

    private AggregatedSymbol(
        String symbol,
        Map<Venue, Quote> quotes,
        Quote bestBidQuote,
        Quote bestAskQuote,
        BigDecimal spreadPct,
        Instant computedAt) {

        this.symbol = symbol;
        this.quotes = quotes;
        this.bestBidQuote = bestBidQuote;
        this.bestAskQuote = bestAskQuote;
        this.spreadPct = spreadPct;
        this.computedAt = computedAt;
    }

    /**
     * Create an AggregatedSymbol with no quotes and no signal.
     *
     * @param symbol The canonical symbol.
     * @return An empty AggregatedSymbol.
     */
    public static AggregatedSymbol empty(String symbol) {
        return new AggregatedSymbol(Objects.requireNonNull(symbol), Collections.emptyMap(), null, null, null, null);
    }

    /**
     * Replace the Quote for the Quote's venue. Derived figures are carried over unchanged until the next
     * computation.
     *
     * @param quote The new Quote.
     * @return A new AggregatedSymbol holding the Quote.
     */
    public AggregatedSymbol withQuote(Quote quote) {
        if (!symbol.equals(quote.getSymbol())) {
            throw new IllegalArgumentException("Quote for " + quote.getSymbol() + " does not belong to " + symbol);
        }

        Map<Venue, Quote> updated = new EnumMap<>(Venue.class);

        updated.putAll(quotes);
        updated.put(quote.getVenue(), quote);

        return new AggregatedSymbol(symbol, Collections.unmodifiableMap(updated), bestBidQuote, bestAskQuote, spreadPct, computedAt);
    }

    /**
     * Attach the result of a spread computation.
     *
     * @param bestBidQuote The Quote holding the highest bid.
     * @param bestAskQuote The Quote holding the lowest ask.
     * @param spreadPct The spread between them in percent.
     * @param computedAt When the computation happened.
     * @return A new AggregatedSymbol with the derived figures set.
     */
    public AggregatedSymbol withBest(Quote bestBidQuote, Quote bestAskQuote, BigDecimal spreadPct, Instant computedAt) {
        return new AggregatedSymbol(
            symbol,
            quotes,
            Objects.requireNonNull(bestBidQuote),
            Objects.requireNonNull(bestAskQuote),
            Objects.requireNonNull(spreadPct),
            computedAt);
    }

    /**
     * Clear the derived figures because no usable Quote was available.
     *
     * @param computedAt When the computation happened.
     * @return A new AggregatedSymbol with no signal.
     */
    public AggregatedSymbol withoutSignal(Instant computedAt) {
        return new AggregatedSymbol(symbol, quotes, null, null, null, computedAt);
    }

    public String getSymbol() {
        return symbol;
    }

    public Map<Venue, Quote> getQuotes() {
        return quotes;
    }

    public Optional<Quote> getQuote(Venue venue) {
        return Optional.ofNullable(quotes.get(venue));
    }

    public Optional<BigDecimal> getBestBid() {
        return Optional.ofNullable(bestBidQuote).map(Quote::getBid);
    }

    public Optional<BigDecimal> getBestAsk() {
        return Optional.ofNullable(bestAskQuote).map(Quote::getAsk);
    }

    public Optional<Venue> getBestBidVenue() {
        return Optional.ofNullable(bestBidQuote).map(Quote::getVenue);
    }

    public Optional<Venue> getBestAskVenue() {
        return Optional.ofNullable(bestAskQuote).map(Quote::getVenue);
    }

    public Optional<BigDecimal> getSpreadPct() {
        return Optional.ofNullable(spreadPct);
    }

    public Optional<Instant> getComputedAt() {
        return Optional.ofNullable(computedAt);
    }

    /**
     * The per-unit profit of buying at the best ask and selling at the best bid, in quote currency.
     *
     * @return bestBid - bestAsk, if there is a signal.
     */
    public Optional<BigDecimal> getProfit() {
        if (bestBidQuote == null || bestAskQuote == null) {
            return Optional.empty();
        }

        return Optional.of(bestBidQuote.getBid().subtract(bestAskQuote.getAsk()));
    }

    /**
     * @return true if at least one venue has delivered a Quote for this symbol.
     */
    public boolean isPopulated() {
        return !quotes.isEmpty();
    }

    /**
     * A spread is only an arbitrage opportunity if we'd buy on one venue and sell on another.
     *
     * @return true if there is a signal and the best bid and best ask come from different venues.
     */
    public boolean isCrossVenue() {
        return bestBidQuote != null
            && bestAskQuote != null
            && bestBidQuote.getVenue() != bestAskQuote.getVenue();
    }

    /**
     * Compare only the derived figures of two AggregatedSymbols, ignoring when they were computed.
     *
     * @param other Another AggregatedSymbol.
     * @return true if both have the same best prices, venues and spread.
     */
    public boolean hasSameSignal(AggregatedSymbol other) {
        return other != null
            && symbol.equals(other.symbol)
            && compare(getBestBid(), other.getBestBid())
            && compare(getBestAsk(), other.getBestAsk())
            && getBestBidVenue().equals(other.getBestBidVenue())
            && getBestAskVenue().equals(other.getBestAskVenue())
            && compare(getSpreadPct(), other.getSpreadPct());
    }

    private static boolean compare(Optional<BigDecimal> a, Optional<BigDecimal> b) {
        if (a.isPresent() && b.isPresent()) {
            return a.get().compareTo(b.get()) == 0;
        }

        return a.isPresent() == b.isPresent();
    }

    @Override
    public String toString() {
        if (spreadPct == null) {
            return String.format("%s [no signal] %d venue(s)", symbol, quotes.size());
        }

        return String.format("%s bid %s (%s) ask %s (%s) spread %s%%",
            symbol,
            bestBidQuote.getBid(),
            bestBidQuote.getVenue(),
            bestAskQuote.getAsk(),
            bestAskQuote.getVenue(),
            spreadPct);
    }
}
