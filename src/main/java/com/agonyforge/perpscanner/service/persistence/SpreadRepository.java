package com.agonyforge.perpscanner.service.persistence;

import com.agonyforge.perpscanner.service.model.AlertRecord;
import com.agonyforge.perpscanner.service.model.Venue;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

/**
 * Durable storage for spread history and alerts. Writes are best effort: callers log failures and carry on.
 */
public interface SpreadRepository {
    /**
     * Record the current spread for a symbol.
     *
     * @param symbol The canonical symbol.
     * @param spread The spread in percent.
     * @param bestBid The best bid across venues.
     * @param bestAsk The best ask across venues.
     * @param bestBidVenue The venue with the best bid.
     * @param bestAskVenue The venue with the best ask.
     * @throws IOException if the metric could not be written.
     */
    void saveSpreadMetric(
        String symbol,
        BigDecimal spread,
        BigDecimal bestBid,
        BigDecimal bestAsk,
        Venue bestBidVenue,
        Venue bestAskVenue) throws IOException;

    /**
     * Store an alert.
     *
     * @param alertRecord The alert to store.
     * @return The id of the stored alert, or null if an identical alert was already stored.
     * @throws IOException if the alert could not be written.
     */
    Long saveAlert(AlertRecord alertRecord) throws IOException;

    /**
     * Read back the most recent alerts.
     *
     * @param limit The maximum number of alerts to return.
     * @return Alerts, newest first.
     * @throws IOException if the alerts could not be read.
     */
    List<AlertRecord> getRecentAlerts(int limit) throws IOException;
}
