package com.agonyforge.perpscanner.service.persistence;

import com.agonyforge.perpscanner.config.ScannerConfiguration;
import com.agonyforge.perpscanner.service.model.AlertRecord;
import com.agonyforge.perpscanner.service.model.Venue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps spread history in a CSV file and alerts in a file with one JSON object per line, both in the
 * configured history directory.
 */
@Component
public class FileSpreadRepository implements SpreadRepository {
    static final String SPREAD_HISTORY_FILE = "spread-history.csv";
    static final String ALERT_HISTORY_FILE = "alert-history.jsonl";
    static final String SPREAD_HISTORY_HEADERS = "timestamp,symbol,spread_pct,best_bid,best_ask,best_bid_venue,best_ask_venue,profit\n";

    private static final Logger LOGGER = LoggerFactory.getLogger(FileSpreadRepository.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final File spreadHistoryFile;
    private final File alertHistoryFile;
    private Long lastAlertId = null;
    private AlertRecord lastAlert = null;

    public FileSpreadRepository(ScannerConfiguration scannerConfiguration, ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.spreadHistoryFile = new File(scannerConfiguration.getHistoryDirectory(), SPREAD_HISTORY_FILE);
        this.alertHistoryFile = new File(scannerConfiguration.getHistoryDirectory(), ALERT_HISTORY_FILE);
    }

    @Override
    public synchronized void saveSpreadMetric(
        String symbol,
        BigDecimal spread,
        BigDecimal bestBid,
        BigDecimal bestAsk,
        Venue bestBidVenue,
        Venue bestAskVenue) throws IOException {

        if (!spreadHistoryFile.exists()) {
            // Add headers first
            FileUtils.write(spreadHistoryFile, SPREAD_HISTORY_HEADERS, StandardCharsets.UTF_8, false);
        }

        String row = String.format("%s,%s,%s,%s,%s,%s,%s,%s%n",
            clock.instant(),
            symbol,
            spread.toPlainString(),
            bestBid.toPlainString(),
            bestAsk.toPlainString(),
            bestBidVenue,
            bestAskVenue,
            bestBid.subtract(bestAsk).toPlainString());

        FileUtils.write(spreadHistoryFile, row, StandardCharsets.UTF_8, true);
    }

    @Override
    public synchronized Long saveAlert(AlertRecord alertRecord) throws IOException {
        if (alertRecord.equals(lastAlert)) {
            LOGGER.debug("Alert already stored: {}", alertRecord);
            return null;
        }

        long id = nextAlertId();
        ObjectNode line = objectMapper.createObjectNode();

        line.put("id", id);
        line.setAll((ObjectNode) objectMapper.valueToTree(alertRecord));

        FileUtils.write(alertHistoryFile, objectMapper.writeValueAsString(line) + "\n", StandardCharsets.UTF_8, true);

        lastAlertId = id;
        lastAlert = alertRecord;

        return id;
    }

    @Override
    public synchronized List<AlertRecord> getRecentAlerts(int limit) throws IOException {
        List<AlertRecord> alerts = new ArrayList<>();

        if (!alertHistoryFile.exists()) {
            return alerts;
        }

        List<String> lines = FileUtils.readLines(alertHistoryFile, StandardCharsets.UTF_8);

        for (int i = lines.size() - 1; i >= 0 && alerts.size() < limit; i--) {
            String line = lines.get(i);

            if (line.isBlank()) {
                continue;
            }

            try {
                alerts.add(objectMapper.treeToValue(objectMapper.readTree(line), AlertRecord.class));
            } catch (IOException e) {
                LOGGER.warn("Skipping unreadable line {} in {}: {}", i + 1, alertHistoryFile, e.getMessage());
            }
        }

        return alerts;
    }

    // continue numbering from whatever is already in the file
    private long nextAlertId() throws IOException {
        if (lastAlertId == null) {
            lastAlertId = 0L;

            if (alertHistoryFile.exists()) {
                for (String line : FileUtils.readLines(alertHistoryFile, StandardCharsets.UTF_8)) {
                    if (line.isBlank()) {
                        continue;
                    }

                    try {
                        JsonNode node = objectMapper.readTree(line);
                        lastAlertId = Math.max(lastAlertId, node.path("id").asLong(0));
                    } catch (IOException e) {
                        LOGGER.warn("Skipping unreadable line in {}: {}", alertHistoryFile, e.getMessage());
                    }
                }
            }
        }

        return lastAlertId + 1;
    }
}
