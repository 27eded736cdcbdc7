package com.agonyforge.perpscanner.service.broadcast;

import com.agonyforge.perpscanner.MutableClock;
import com.agonyforge.perpscanner.config.ScannerConfiguration;
import com.agonyforge.perpscanner.service.QuoteCache;
import com.agonyforge.perpscanner.service.SpreadService;
import com.agonyforge.perpscanner.service.model.AggregatedSymbol;
import com.agonyforge.perpscanner.service.model.Quote;
import com.agonyforge.perpscanner.service.model.Venue;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

public class BroadcastThrottleTest {
    private static final Instant START = Instant.parse("2024-03-01T12:00:00Z");
    private static final long WINDOW_MILLIS = 200;

    @Mock
    private SnapshotBroadcaster snapshotBroadcaster;

    private MutableClock clock;
    private QuoteCache quoteCache;
    private ScheduledExecutorService scheduler;

    private BroadcastThrottle broadcastThrottle;

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);

        ScannerConfiguration scannerConfiguration = new ScannerConfiguration();
        scannerConfiguration.setBroadcastWindow(Duration.ofMillis(WINDOW_MILLIS));

        clock = new MutableClock(START);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        quoteCache = new QuoteCache(new SpreadService(scannerConfiguration), clock);
        quoteCache.seed(Arrays.asList("BTC", "ETH"));

        broadcastThrottle = new BroadcastThrottle(scannerConfiguration, quoteCache, scheduler, clock);
        broadcastThrottle.setSnapshotBroadcaster(snapshotBroadcaster);
    }

    @After
    public void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    public void testLeadingEdge() {
        quoteCache.upsert(quote("100"));

        broadcastThrottle.signal();

        verify(snapshotBroadcaster).broadcast(anyMap());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testBurstYieldsOneTrailingBroadcastWithLatestState() throws InterruptedException {
        quoteCache.upsert(quote("100"));
        broadcastThrottle.signal();

        for (int i = 1; i <= 5; i++) {
            quoteCache.upsert(quote(String.valueOf(100 + i)));
            broadcastThrottle.signal();
        }

        ArgumentCaptor<Map<String, AggregatedSymbol>> captor = ArgumentCaptor.forClass(Map.class);

        verify(snapshotBroadcaster, timeout(WINDOW_MILLIS * 5).times(2)).broadcast(captor.capture());

        Thread.sleep(WINDOW_MILLIS * 2);

        verify(snapshotBroadcaster, times(2)).broadcast(anyMap());

        AggregatedSymbol last = captor.getAllValues().get(1).get("BTC");

        assertEquals(0, new BigDecimal("105").compareTo(last.getBestBid().orElseThrow()));
    }

    @Test
    public void testNewWindowBroadcastsImmediately() {
        quoteCache.upsert(quote("100"));
        broadcastThrottle.signal();

        clock.advance(Duration.ofMillis(WINDOW_MILLIS));
        broadcastThrottle.signal();

        verify(snapshotBroadcaster, times(2)).broadcast(anyMap());
    }

    @Test
    public void testEmptySnapshotNotBroadcast() throws InterruptedException {
        broadcastThrottle.signal();
        broadcastThrottle.signal();

        Thread.sleep(WINDOW_MILLIS * 2);

        verify(snapshotBroadcaster, never()).broadcast(anyMap());
    }

    @Test
    public void testNoBroadcasterIsNoOp() {
        broadcastThrottle.setSnapshotBroadcaster(null);
        quoteCache.upsert(quote("100"));

        broadcastThrottle.signal();

        verifyNoInteractions(snapshotBroadcaster);
    }

    @Test
    public void testStopCancelsTrailingBroadcast() throws InterruptedException {
        quoteCache.upsert(quote("100"));
        broadcastThrottle.signal();
        broadcastThrottle.signal();

        broadcastThrottle.stop();

        Thread.sleep(WINDOW_MILLIS * 2);

        verify(snapshotBroadcaster, times(1)).broadcast(anyMap());
    }

    @Test
    public void testBroadcasterFailureIsContained() {
        doThrow(new IllegalStateException("Socket closed")).when(snapshotBroadcaster).broadcast(anyMap());
        quoteCache.upsert(quote("100"));

        broadcastThrottle.signal();

        clock.advance(Duration.ofMillis(WINDOW_MILLIS));
        broadcastThrottle.signal();

        verify(snapshotBroadcaster, times(2)).broadcast(anyMap());
    }

    private Quote quote(String bid) {
        return new Quote("BTC", new BigDecimal(bid), new BigDecimal(bid).add(BigDecimal.ONE), clock.instant(), Venue.PARADEX);
    }
}
