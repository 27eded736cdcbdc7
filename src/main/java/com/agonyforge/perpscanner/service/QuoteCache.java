package com.agonyforge.perpscanner.service;

import com.agonyforge.perpscanner.service.model.AggregatedSymbol;
import com.agonyforge.perpscanner.service.model.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.inject.Inject;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Holds the latest Quote from every venue for every allow-listed symbol, along with the best prices derived from
 * them. This is the single source of truth for prices.
 *
 * Every change to a symbol happens inside ConcurrentHashMap.compute() for that symbol, so changes to one symbol
 * are serialized while other symbols stay independent. Readers get whole immutable AggregatedSymbols.
 */
@Component
public class QuoteCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(QuoteCache.class);

    private final SpreadService spreadService;
    private final Clock clock;
    private final Map<String, AggregatedSymbol> symbols = new ConcurrentHashMap<>();
    private volatile List<String> allowList = Collections.emptyList();

    @Inject
    public QuoteCache(SpreadService spreadService, Clock clock) {
        this.spreadService = spreadService;
        this.clock = clock;
    }

    /**
     * Start over with one empty AggregatedSymbol per allow-listed symbol. The set of symbols never changes
     * after this.
     *
     * @param allowList The symbols to track.
     */
    public synchronized void seed(Collection<String> allowList) {
        symbols.clear();
        allowList.forEach(symbol -> symbols.put(symbol, AggregatedSymbol.empty(symbol)));

        this.allowList = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(allowList)));

        LOGGER.info("Initialized cache with {} symbols", symbols.size());
    }

    /**
     * Store a new Quote and recompute its symbol. Quotes for symbols outside the allow-list are dropped, and a
     * Quote older than the one we already have for its venue is ignored.
     *
     * @param quote The new Quote.
     * @return The recomputed AggregatedSymbol, or empty if the Quote was rejected.
     */
    public Optional<AggregatedSymbol> upsert(Quote quote) {
        AtomicBoolean accepted = new AtomicBoolean(false);

        AggregatedSymbol result = symbols.computeIfPresent(quote.getSymbol(), (symbol, current) -> {
            Optional<Quote> stored = current.getQuote(quote.getVenue());

            if (stored.isPresent() && quote.isOlderThan(stored.get())) {
                LOGGER.debug("Discarding out of order quote {}, already have {}", quote, stored.get());
                return current;
            }

            accepted.set(true);

            return spreadService.recompute(current.withQuote(quote), clock.instant());
        });

        if (result == null) {
            LOGGER.trace("Dropping quote for symbol outside the allow-list: {}", quote);
            return Optional.empty();
        }

        return accepted.get() ? Optional.of(result) : Optional.empty();
    }

    /**
     * Recompute a symbol at the current time without a new Quote, so quotes that went stale stop counting.
     *
     * @param symbol The symbol to recompute.
     * @return The recomputed AggregatedSymbol if its best prices or spread changed, otherwise empty.
     */
    public Optional<AggregatedSymbol> refresh(String symbol) {
        AtomicBoolean changed = new AtomicBoolean(false);

        AggregatedSymbol result = symbols.computeIfPresent(symbol, (key, current) -> {
            AggregatedSymbol recomputed = spreadService.recompute(current, clock.instant());

            changed.set(!recomputed.hasSameSignal(current));

            return recomputed;
        });

        return result != null && changed.get() ? Optional.of(result) : Optional.empty();
    }

    /**
     * Get a snapshot of every allow-listed symbol. This never blocks on a venue and does no I/O, so it's an
     * inexpensive call to make.
     *
     * @return A map of symbol to AggregatedSymbol, in allow-list order.
     */
    public Map<String, AggregatedSymbol> getSnapshot() {
        Map<String, AggregatedSymbol> snapshot = new LinkedHashMap<>();

        allowList.forEach(symbol -> {
            AggregatedSymbol aggregatedSymbol = symbols.get(symbol);

            if (aggregatedSymbol != null) {
                snapshot.put(symbol, aggregatedSymbol);
            }
        });

        return Collections.unmodifiableMap(snapshot);
    }

    public Optional<AggregatedSymbol> getSymbol(String symbol) {
        return Optional.ofNullable(symbols.get(symbol));
    }

    public List<String> getAllowList() {
        return allowList;
    }
}
