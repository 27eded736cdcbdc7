package com.agonyforge.perpscanner.service.persistence;

import com.agonyforge.perpscanner.MutableClock;
import com.agonyforge.perpscanner.config.JsonConfiguration;
import com.agonyforge.perpscanner.config.ScannerConfiguration;
import com.agonyforge.perpscanner.service.model.AlertRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.agonyforge.perpscanner.service.model.Venue.LIGHTER;
import static com.agonyforge.perpscanner.service.model.Venue.PARADEX;
import static com.agonyforge.perpscanner.service.model.Venue.VEST;
import static com.agonyforge.perpscanner.service.persistence.FileSpreadRepository.ALERT_HISTORY_FILE;
import static com.agonyforge.perpscanner.service.persistence.FileSpreadRepository.SPREAD_HISTORY_FILE;
import static org.junit.Assert.*;

public class FileSpreadRepositoryTest {
    private static final Instant START = Instant.parse("2024-03-01T12:00:00Z");

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private ScannerConfiguration scannerConfiguration;
    private ObjectMapper objectMapper;
    private MutableClock clock;

    private FileSpreadRepository fileSpreadRepository;

    @Before
    public void setUp() throws IOException {
        scannerConfiguration = new ScannerConfiguration();
        scannerConfiguration.setHistoryDirectory(temporaryFolder.newFolder("history").getAbsolutePath());

        objectMapper = new JsonConfiguration().objectMapper();
        clock = new MutableClock(START);

        fileSpreadRepository = new FileSpreadRepository(scannerConfiguration, objectMapper, clock);
    }

    @Test
    public void testSaveSpreadMetric() throws IOException {
        fileSpreadRepository.saveSpreadMetric("BTC", new BigDecimal("1.79640719"), new BigDecimal("102"), new BigDecimal("100.2"), VEST, PARADEX);
        fileSpreadRepository.saveSpreadMetric("ETH", new BigDecimal("-0.1"), new BigDecimal("3000"), new BigDecimal("3003"), LIGHTER, PARADEX);

        List<String> lines = FileUtils.readLines(historyFile(SPREAD_HISTORY_FILE), StandardCharsets.UTF_8);

        assertEquals(3, lines.size());
        assertEquals("timestamp,symbol,spread_pct,best_bid,best_ask,best_bid_venue,best_ask_venue,profit", lines.get(0));
        assertEquals("2024-03-01T12:00:00Z,BTC,1.79640719,102,100.2,VEST,PARADEX,1.8", lines.get(1));
        assertEquals("2024-03-01T12:00:00Z,ETH,-0.1,3000,3003,LIGHTER,PARADEX,-3", lines.get(2));
    }

    @Test
    public void testSaveAlertAssignsSequentialIds() throws IOException {
        assertEquals(Long.valueOf(1), fileSpreadRepository.saveAlert(alert("BTC", START)));
        assertEquals(Long.valueOf(2), fileSpreadRepository.saveAlert(alert("ETH", START)));

        List<String> lines = FileUtils.readLines(historyFile(ALERT_HISTORY_FILE), StandardCharsets.UTF_8);

        assertEquals(2, lines.size());

        JsonNode first = objectMapper.readTree(lines.get(0));

        assertEquals(1, first.path("id").asLong());
        assertEquals("BTC", first.path("symbol").asText());
        assertEquals("PARADEX", first.path("buyVenue").asText());
        assertEquals("VEST", first.path("sellVenue").asText());
    }

    @Test
    public void testSaveDuplicateAlert() throws IOException {
        AlertRecord alert = alert("BTC", START);

        assertNotNull(fileSpreadRepository.saveAlert(alert));
        assertNull(fileSpreadRepository.saveAlert(alert(alert.getSymbol(), alert.getTimestamp())));
    }

    @Test
    public void testIdsContinueFromExistingFile() throws IOException {
        fileSpreadRepository.saveAlert(alert("BTC", START));
        fileSpreadRepository.saveAlert(alert("ETH", START));

        FileSpreadRepository reopened = new FileSpreadRepository(scannerConfiguration, objectMapper, clock);

        assertEquals(Long.valueOf(3), reopened.saveAlert(alert("SOL", START)));
    }

    @Test
    public void testGetRecentAlerts() throws IOException {
        fileSpreadRepository.saveAlert(alert("BTC", START));
        fileSpreadRepository.saveAlert(alert("ETH", START.plus(Duration.ofMinutes(1))));
        fileSpreadRepository.saveAlert(alert("SOL", START.plus(Duration.ofMinutes(2))));

        List<AlertRecord> recent = fileSpreadRepository.getRecentAlerts(2);

        assertEquals(2, recent.size());
        assertEquals("SOL", recent.get(0).getSymbol());
        assertEquals("ETH", recent.get(1).getSymbol());
        assertEquals(START.plus(Duration.ofMinutes(1)), recent.get(1).getTimestamp());
        assertEquals(alert("ETH", START.plus(Duration.ofMinutes(1))), recent.get(1));
    }

    @Test
    public void testGetRecentAlertsWithoutFile() throws IOException {
        assertTrue(fileSpreadRepository.getRecentAlerts(10).isEmpty());
    }

    @Test
    public void testGetRecentAlertsSkipsBadLines() throws IOException {
        fileSpreadRepository.saveAlert(alert("BTC", START));
        FileUtils.write(historyFile(ALERT_HISTORY_FILE), "{not json\n", StandardCharsets.UTF_8, true);

        List<AlertRecord> recent = fileSpreadRepository.getRecentAlerts(10);

        assertEquals(1, recent.size());
        assertEquals("BTC", recent.get(0).getSymbol());
    }

    private File historyFile(String name) {
        return new File(scannerConfiguration.getHistoryDirectory(), name);
    }

    private static AlertRecord alert(String symbol, Instant timestamp) {
        return new AlertRecord(
            symbol,
            new BigDecimal("1.79640719"),
            PARADEX,
            VEST,
            new BigDecimal("100.2"),
            new BigDecimal("102"),
            timestamp);
    }
}
