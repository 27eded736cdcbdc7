package com.agonyforge.perpscanner.service;

import com.agonyforge.perpscanner.config.ScannerConfiguration;
import com.agonyforge.perpscanner.service.model.AggregatedSymbol;
import com.agonyforge.perpscanner.service.model.AlertRecord;
import com.agonyforge.perpscanner.service.persistence.SpreadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Raises an alert when a cross-venue spread reaches the configured threshold, at most once per symbol per
 * cool-down period.
 */
@Component
public class AlertService {
    private static final Logger LOGGER = LoggerFactory.getLogger(AlertService.class);

    private final ScannerConfiguration scannerConfiguration;
    private final SpreadRepository spreadRepository;
    private final Clock clock;
    private final Map<String, Instant> lastAlerts = new ConcurrentHashMap<>();

    public AlertService(ScannerConfiguration scannerConfiguration, SpreadRepository spreadRepository, Clock clock) {
        this.scannerConfiguration = scannerConfiguration;
        this.spreadRepository = spreadRepository;
        this.clock = clock;
    }

    /**
     * Check a freshly computed symbol for an alert. The cool-down starts when we decide to alert, whether or not
     * the alert could be stored, so a broken repository can't turn into a flood of retries.
     *
     * @param aggregatedSymbol The recomputed symbol.
     * @return The AlertRecord we raised, or empty if there was nothing to alert, we alerted recently, or the
     * repository already held an identical alert.
     */
    public Optional<AlertRecord> evaluate(AggregatedSymbol aggregatedSymbol) {
        if (!aggregatedSymbol.isCrossVenue()) {
            return Optional.empty();
        }

        BigDecimal spreadPct = aggregatedSymbol.getSpreadPct().orElseThrow();

        if (spreadPct.compareTo(scannerConfiguration.getAlertThreshold()) < 0) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        AtomicBoolean due = new AtomicBoolean(false);

        lastAlerts.compute(aggregatedSymbol.getSymbol(), (symbol, lastAlert) -> {
            if (lastAlert != null && Duration.between(lastAlert, now).compareTo(scannerConfiguration.getAlertCooldown()) < 0) {
                return lastAlert;
            }

            due.set(true);

            return now;
        });

        if (!due.get()) {
            LOGGER.trace("Suppressing alert for {} within cool-down", aggregatedSymbol.getSymbol());
            return Optional.empty();
        }

        AlertRecord alertRecord = AlertRecord.from(aggregatedSymbol, now);

        try {
            Long id = spreadRepository.saveAlert(alertRecord);

            if (id == null) {
                LOGGER.debug("Alert was already stored: {}", alertRecord);
                return Optional.empty();
            }

            LOGGER.info("Spread alert #{}: {}", id, alertRecord);
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Failed to save alert {}: {}", alertRecord, e.getMessage());
        }

        return Optional.of(alertRecord);
    }
}
