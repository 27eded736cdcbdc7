package com.agonyforge.perpscanner.service.connector;

import com.agonyforge.perpscanner.config.ScannerConfiguration;
import com.agonyforge.perpscanner.config.VenueConfiguration;
import com.agonyforge.perpscanner.service.event.QuoteEvent;
import com.agonyforge.perpscanner.service.event.QuoteEventQueue;
import com.agonyforge.perpscanner.service.model.ConnectorStats;
import com.agonyforge.perpscanner.service.model.TopOfBook;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static com.agonyforge.perpscanner.service.model.TransportState.CONNECTED_PUSH;
import static com.agonyforge.perpscanner.service.model.TransportState.CONNECTING_PUSH;
import static com.agonyforge.perpscanner.service.model.TransportState.DISCONNECTED;
import static com.agonyforge.perpscanner.service.model.TransportState.FALLBACK_PULL;
import static com.agonyforge.perpscanner.service.model.Venue.LIGHTER;
import static org.junit.Assert.*;

public class HybridConnectorTest {
    private static final TopOfBook BTC = new TopOfBook("BTC", new BigDecimal("100"), new BigDecimal("100.5"));
    private static final long WAIT_MILLIS = 3000;

    private ScheduledExecutorService executor;
    private QuoteEventQueue quoteEventQueue;
    private VenueConfiguration venueConfiguration;
    private Clock clock;

    private HybridConnector connector;

    @Before
    public void setUp() {
        executor = Executors.newScheduledThreadPool(4);
        quoteEventQueue = new QuoteEventQueue(new ScannerConfiguration());
        clock = Clock.systemUTC();

        venueConfiguration = new VenueConfiguration();
        venueConfiguration.setVenue(LIGHTER);
        venueConfiguration.setPushEnabled(true);
        venueConfiguration.setPollInterval(Duration.ofMillis(20));
        venueConfiguration.setPushConnectTimeout(Duration.ofSeconds(10));
        venueConfiguration.setReconnectBaseDelay(Duration.ofMillis(20));
        venueConfiguration.setReconnectMaxDelay(Duration.ofMillis(40));
        venueConfiguration.setReconnectMaxAttempts(3);
        venueConfiguration.setPushRetryInterval(Duration.ofSeconds(30));
        venueConfiguration.setKeepAliveAfter(Duration.ofSeconds(30));
        venueConfiguration.setKeepAliveTimeout(Duration.ofSeconds(10));
    }

    @After
    public void tearDown() {
        if (connector != null) {
            connector.stop();
        }

        executor.shutdownNow();
    }

    @Test
    public void testPullOnlyVenuePolls() throws InterruptedException {
        FakeQuoteSource source = new FakeQuoteSource(LIGHTER, false);
        source.setPollResult(Collections.singletonList(BTC));
        connector = new HybridConnector(source, venueConfiguration, quoteEventQueue, executor, clock);

        connector.start();

        assertEquals(FALLBACK_PULL, connector.getTransport());

        QuoteEvent event = quoteEventQueue.poll(WAIT_MILLIS, TimeUnit.MILLISECONDS);

        assertNotNull(event);
        assertEquals(FALLBACK_PULL, event.getTransport());
        assertEquals(LIGHTER, event.getQuote().getVenue());
        assertEquals("BTC", event.getQuote().getSymbol());
        assertEquals(0, new BigDecimal("100.5").compareTo(event.getQuote().getAsk()));
        assertEquals(0, source.getConnectCount());
    }

    @Test
    public void testPushDisabledPolls() {
        venueConfiguration.setPushEnabled(false);

        FakeQuoteSource source = new FakeQuoteSource(LIGHTER, true);
        connector = new HybridConnector(source, venueConfiguration, quoteEventQueue, executor, clock);

        connector.start();

        assertEquals(FALLBACK_PULL, connector.getTransport());
        await(() -> source.getFetchCount() > 0);
        assertEquals(0, source.getConnectCount());
    }

    @Test
    public void testPushConnects() throws InterruptedException {
        FakeQuoteSource source = new FakeQuoteSource(LIGHTER, true);
        connector = new HybridConnector(source, venueConfiguration, quoteEventQueue, executor, clock);

        connector.start();

        assertEquals(CONNECTING_PUSH, connector.getTransport());
        assertEquals(1, source.getConnectCount());

        source.getLastListener().onOpen();
        source.getLastListener().onQuote(BTC);

        assertEquals(CONNECTED_PUSH, connector.getTransport());

        QuoteEvent event = quoteEventQueue.poll(WAIT_MILLIS, TimeUnit.MILLISECONDS);

        assertNotNull(event);
        assertEquals(CONNECTED_PUSH, event.getTransport());
        assertEquals(0, source.getFetchCount());
    }

    @Test
    public void testStartIsIdempotent() {
        FakeQuoteSource source = new FakeQuoteSource(LIGHTER, true);
        connector = new HybridConnector(source, venueConfiguration, quoteEventQueue, executor, clock);

        connector.start();
        connector.start();

        assertEquals(1, source.getConnectCount());
    }

    @Test
    public void testPushLossFallsBackThenReconnects() throws InterruptedException {
        FakeQuoteSource source = new FakeQuoteSource(LIGHTER, true);
        source.setPollResult(Collections.singletonList(BTC));
        connector = new HybridConnector(source, venueConfiguration, quoteEventQueue, executor, clock);

        connector.start();
        source.getLastListener().onOpen();
        source.getLastListener().onFailure(new IOException("Connection reset"));

        assertEquals(FALLBACK_PULL, connector.getTransport());
        assertTrue(source.getSession(0).isClosed());

        QuoteEvent event = quoteEventQueue.poll(WAIT_MILLIS, TimeUnit.MILLISECONDS);

        assertNotNull(event);
        assertEquals(FALLBACK_PULL, event.getTransport());

        await(() -> source.getConnectCount() == 2);

        // still polling while the reconnect is in progress
        assertEquals(FALLBACK_PULL, connector.getTransport());
        assertEquals(1, connector.getStats().getReconnectAttempts());

        source.getLastListener().onOpen();

        assertEquals(CONNECTED_PUSH, connector.getTransport());
        assertEquals(0, connector.getStats().getReconnectAttempts());

        int fetches = source.getFetchCount();
        Thread.sleep(200);

        assertTrue(source.getFetchCount() <= fetches + 1);
    }

    @Test
    public void testClosedStreamFallsBack() {
        FakeQuoteSource source = new FakeQuoteSource(LIGHTER, true);
        connector = new HybridConnector(source, venueConfiguration, quoteEventQueue, executor, clock);

        connector.start();
        source.getLastListener().onOpen();
        source.getLastListener().onClosed("1001 going away");

        assertEquals(FALLBACK_PULL, connector.getTransport());
        await(() -> source.getFetchCount() > 0);
    }

    @Test
    public void testSupersededStreamIgnored() throws InterruptedException {
        FakeQuoteSource source = new FakeQuoteSource(LIGHTER, true);
        connector = new HybridConnector(source, venueConfiguration, quoteEventQueue, executor, clock);

        connector.start();
        source.getListener(0).onFailure(new IOException("Connection refused"));

        await(() -> source.getConnectCount() == 2);

        source.getListener(1).onOpen();
        source.getListener(0).onQuote(BTC);
        source.getListener(0).onClosed("late");

        assertEquals(CONNECTED_PUSH, connector.getTransport());
        assertNull(quoteEventQueue.poll(100, TimeUnit.MILLISECONDS));
    }

    @Test
    public void testConnectTimeout() {
        venueConfiguration.setPushConnectTimeout(Duration.ofMillis(50));

        FakeQuoteSource source = new FakeQuoteSource(LIGHTER, true);
        connector = new HybridConnector(source, venueConfiguration, quoteEventQueue, executor, clock);

        connector.start();

        await(() -> connector.getTransport() == FALLBACK_PULL);
        await(() -> source.getFetchCount() > 0);
        assertTrue(source.getSession(0).isClosed());
    }

    @Test
    public void testReconnectsExhausted() throws InterruptedException {
        FakeQuoteSource source = new FakeQuoteSource(LIGHTER, true);
        source.setFailOnConnect(true);
        connector = new HybridConnector(source, venueConfiguration, quoteEventQueue, executor, clock);

        connector.start();

        // the first attempt plus three reconnects
        await(() -> source.getConnectCount() == 4);
        Thread.sleep(300);

        assertEquals(4, source.getConnectCount());
        assertEquals(FALLBACK_PULL, connector.getTransport());
        assertEquals(3, connector.getStats().getReconnectAttempts());
        assertTrue(source.getFetchCount() > 0);

        // asking again starts a fresh round of attempts
        source.setFailOnConnect(false);
        connector.start();

        assertEquals(5, source.getConnectCount());

        source.getLastListener().onOpen();

        assertEquals(CONNECTED_PUSH, connector.getTransport());
    }

    @Test
    public void testPushRetriedAfterInterval() {
        venueConfiguration.setReconnectMaxAttempts(1);
        venueConfiguration.setPushRetryInterval(Duration.ofMillis(100));

        FakeQuoteSource source = new FakeQuoteSource(LIGHTER, true);
        source.setFailOnConnect(true);
        connector = new HybridConnector(source, venueConfiguration, quoteEventQueue, executor, clock);

        connector.start();

        // one attempt, one reconnect, then the periodic retry
        await(() -> source.getConnectCount() >= 3);
        assertEquals(FALLBACK_PULL, connector.getTransport());
    }

    @Test
    public void testKeepAliveWithoutAnswerForcesReconnect() {
        venueConfiguration.setKeepAliveAfter(Duration.ofMillis(50));
        venueConfiguration.setKeepAliveTimeout(Duration.ofMillis(50));

        FakeQuoteSource source = new FakeQuoteSource(LIGHTER, true);
        connector = new HybridConnector(source, venueConfiguration, quoteEventQueue, executor, clock);

        connector.start();
        source.getLastListener().onOpen();

        await(() -> source.getSession(0).getKeepAlives() > 0);
        await(() -> source.getSession(0).isClosed());
        await(() -> source.getConnectCount() == 2);
    }

    @Test
    public void testKeepAliveAnswered() throws InterruptedException {
        venueConfiguration.setKeepAliveAfter(Duration.ofMillis(50));
        venueConfiguration.setKeepAliveTimeout(Duration.ofMillis(200));

        FakeQuoteSource source = new FakeQuoteSource(LIGHTER, true);
        connector = new HybridConnector(source, venueConfiguration, quoteEventQueue, executor, clock);

        connector.start();
        source.getLastListener().onOpen();

        await(() -> source.getSession(0).getKeepAlives() > 0);
        source.getLastListener().onActivity();

        Thread.sleep(100);

        assertEquals(CONNECTED_PUSH, connector.getTransport());
        assertFalse(source.getSession(0).isClosed());
    }

    @Test
    public void testStop() throws InterruptedException {
        FakeQuoteSource source = new FakeQuoteSource(LIGHTER, true);
        connector = new HybridConnector(source, venueConfiguration, quoteEventQueue, executor, clock);

        connector.start();
        source.getLastListener().onOpen();

        connector.stop();

        assertEquals(DISCONNECTED, connector.getTransport());
        assertTrue(source.getSession(0).isClosed());

        source.getLastListener().onQuote(BTC);

        assertNull(quoteEventQueue.poll(100, TimeUnit.MILLISECONDS));

        // stopping twice is harmless
        connector.stop();
    }

    @Test
    public void testPollResultDiscardedAfterStop() throws InterruptedException {
        CountDownLatch gate = new CountDownLatch(1);
        FakeQuoteSource source = new FakeQuoteSource(LIGHTER, false);
        source.setPollResult(Collections.singletonList(BTC));
        source.setFetchGate(gate);
        connector = new HybridConnector(source, venueConfiguration, quoteEventQueue, executor, clock);

        connector.start();
        await(() -> source.getFetchCount() > 0);

        connector.stop();
        gate.countDown();

        assertNull(quoteEventQueue.poll(200, TimeUnit.MILLISECONDS));
    }

    @Test
    public void testStats() {
        FakeQuoteSource source = new FakeQuoteSource(LIGHTER, true);
        connector = new HybridConnector(source, venueConfiguration, quoteEventQueue, executor, clock);

        ConnectorStats before = connector.getStats();

        assertEquals(LIGHTER, before.getVenue());
        assertEquals(DISCONNECTED, before.getTransport());
        assertFalse(before.getLastEventAge().isPresent());

        connector.start();
        source.getLastListener().onOpen();

        ConnectorStats after = connector.getStats();

        assertEquals(CONNECTED_PUSH, after.getTransport());
        assertTrue(after.getLastEventAge().isPresent());
        assertEquals(0, after.getReconnectAttempts());
    }

    private static void await(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + WAIT_MILLIS;

        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within " + WAIT_MILLIS + " ms");
            }

            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted");
            }
        }
    }
}
