package com.agonyforge.perpscanner.service;

import com.agonyforge.perpscanner.config.ScannerConfiguration;
import com.agonyforge.perpscanner.service.model.AggregatedSymbol;
import com.agonyforge.perpscanner.service.model.Quote;
import com.agonyforge.perpscanner.service.model.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.agonyforge.perpscanner.DecimalConstants.ONE_HUNDRED;
import static com.agonyforge.perpscanner.DecimalConstants.PERCENT_SCALE;

/**
 * Services related to computing spreads. A spread is the percentage gap between the best bid on one venue and
 * the best ask on another.
 */
@Component
public class SpreadService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpreadService.class);

    private final ScannerConfiguration scannerConfiguration;

    public SpreadService(ScannerConfiguration scannerConfiguration) {
        this.scannerConfiguration = scannerConfiguration;
    }

    /**
     * Recompute the best bid, best ask and spread for a symbol. Only quotes that are fresh at the given time and
     * have both sides of the book count. Stale quotes stay in the AggregatedSymbol, they just don't contribute.
     *
     * When two venues quote the same best price, the one that comes first in the configured venue priority wins
     * so the result never depends on which quote happened to arrive first.
     *
     * @param aggregatedSymbol The symbol to recompute.
     * @param now The time of evaluation.
     * @return A new AggregatedSymbol with the derived figures set, or cleared if no quote was usable.
     */
    public AggregatedSymbol recompute(AggregatedSymbol aggregatedSymbol, Instant now) {
        List<Quote> usable = aggregatedSymbol.getQuotes().values()
            .stream()
            .filter(Quote::isValid)
            .filter(quote -> quote.isFresh(now, scannerConfiguration.getStalenessWindow()))
            .collect(Collectors.toList());

        if (usable.isEmpty()) {
            LOGGER.trace("No usable quotes for {}", aggregatedSymbol.getSymbol());
            return aggregatedSymbol.withoutSignal(now);
        }

        Comparator<Quote> byPriority = Comparator.comparingInt(quote -> priorityOf(quote.getVenue()));

        // highest bid first, then venue priority
        Optional<Quote> bestBid = usable.stream()
            .min(Comparator.comparing(Quote::getBid, Comparator.reverseOrder()).thenComparing(byPriority));

        // lowest ask first, then venue priority
        Optional<Quote> bestAsk = usable.stream()
            .min(Comparator.comparing(Quote::getAsk).thenComparing(byPriority));

        BigDecimal spreadPct = computeSpreadPct(bestBid.orElseThrow().getBid(), bestAsk.orElseThrow().getAsk());

        AggregatedSymbol result = aggregatedSymbol.withBest(bestBid.get(), bestAsk.get(), spreadPct, now);

        LOGGER.trace("Recomputed {}", result);

        return result;
    }

    /**
     * The formula is: spread = (bestBid - bestAsk) / bestAsk * 100
     * That gives us a percentage. For example:
     *   1.8 means we could sell 1.8% higher than we could buy.
     *   -0.5 means buying costs 0.5% more than selling pays.
     *
     * @param bestBid The highest bid across venues.
     * @param bestAsk The lowest ask across venues.
     * @return The spread in percent.
     */
    public BigDecimal computeSpreadPct(BigDecimal bestBid, BigDecimal bestAsk) {
        return bestBid.subtract(bestAsk)
            .multiply(ONE_HUNDRED)
            .divide(bestAsk, PERCENT_SCALE, RoundingMode.HALF_EVEN);
    }

    // venues missing from the priority list lose every tie, in declaration order
    int priorityOf(Venue venue) {
        int index = scannerConfiguration.getVenuePriority().indexOf(venue);

        return index >= 0 ? index : scannerConfiguration.getVenuePriority().size() + venue.ordinal();
    }
}
