package com.agonyforge.perpscanner.service.connector;

import com.agonyforge.perpscanner.config.VenueConfiguration;
import com.agonyforge.perpscanner.service.event.QuoteEvent;
import com.agonyforge.perpscanner.service.event.QuoteEventQueue;
import com.agonyforge.perpscanner.service.model.ConnectorStats;
import com.agonyforge.perpscanner.service.model.Quote;
import com.agonyforge.perpscanner.service.model.TopOfBook;
import com.agonyforge.perpscanner.service.model.TransportState;
import com.agonyforge.perpscanner.service.model.Venue;
import com.agonyforge.perpscanner.service.venue.PushListener;
import com.agonyforge.perpscanner.service.venue.PushSession;
import com.agonyforge.perpscanner.service.venue.QuoteSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static com.agonyforge.perpscanner.service.model.TransportState.CONNECTED_PUSH;
import static com.agonyforge.perpscanner.service.model.TransportState.CONNECTING_PUSH;
import static com.agonyforge.perpscanner.service.model.TransportState.FALLBACK_PULL;

/**
 * Keeps prices flowing from one venue. A push stream is preferred when the venue has one. While the stream is
 * down the venue is polled, and reconnects are attempted with exponential backoff. Once the reconnects are used
 * up the connector keeps polling, and tries the stream again after the push retry interval.
 *
 * Every price, whichever transport delivered it, is stamped with the local time and published to the
 * QuoteEventQueue.
 *
 * All state is guarded by one lock. Callbacks from a stream that has since been replaced are ignored, and no
 * events are published after stop() returns.
 */
public class HybridConnector {
    private static final Logger LOGGER = LoggerFactory.getLogger(HybridConnector.class);

    private final Object lock = new Object();
    private final QuoteSource quoteSource;
    private final VenueConfiguration venueConfiguration;
    private final QuoteEventQueue quoteEventQueue;
    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final ReconnectBackoff backoff;
    private final VenueState state = new VenueState();

    private boolean running = false;
    private long generation = 0;
    private PushSession pushSession = null;
    private PushListener currentListener = null;
    private boolean pushOpen = false;
    private Instant keepAlivePendingSince = null;

    private ScheduledFuture<?> pollTask = null;
    private ScheduledFuture<?> reconnectTask = null;
    private ScheduledFuture<?> connectTimeoutTask = null;
    private ScheduledFuture<?> livenessTask = null;
    private ScheduledFuture<?> pushRetryTask = null;

    public HybridConnector(
        QuoteSource quoteSource,
        VenueConfiguration venueConfiguration,
        QuoteEventQueue quoteEventQueue,
        ScheduledExecutorService executor,
        Clock clock) {

        this.quoteSource = quoteSource;
        this.venueConfiguration = venueConfiguration;
        this.quoteEventQueue = quoteEventQueue;
        this.executor = executor;
        this.clock = clock;
        this.backoff = new ReconnectBackoff(
            venueConfiguration.getReconnectBaseDelay(),
            venueConfiguration.getReconnectMaxDelay(),
            venueConfiguration.getReconnectMaxAttempts());
    }

    public Venue getVenue() {
        return quoteSource.getVenue();
    }

    /**
     * Start receiving prices. Calling start() on a running connector that has given up on its stream makes it
     * try the stream again right away.
     */
    public void start() {
        synchronized (lock) {
            if (running) {
                if (isPushEnabled() && currentListener == null && reconnectTask == null) {
                    LOGGER.info("{} retrying push on request", getVenue());

                    cancel(pushRetryTask);
                    pushRetryTask = null;
                    backoff.reset();
                    connectPush();
                }

                return;
            }

            running = true;
            generation++;

            if (isPushEnabled()) {
                connectPush();

                long period = Math.max(1, Math.min(
                    venueConfiguration.getKeepAliveAfter().toMillis(),
                    venueConfiguration.getKeepAliveTimeout().toMillis()) / 2);

                livenessTask = executor.scheduleWithFixedDelay(this::checkLiveness, period, period, TimeUnit.MILLISECONDS);
            } else {
                startFallback();
            }
        }
    }

    /**
     * Stop receiving prices, close the stream and cancel every timer. Safe to call more than once.
     */
    public void stop() {
        synchronized (lock) {
            if (!running) {
                return;
            }

            running = false;
            generation++;
            currentListener = null;
            pushOpen = false;
            keepAlivePendingSince = null;

            cancel(connectTimeoutTask);
            cancel(reconnectTask);
            cancel(livenessTask);
            cancel(pushRetryTask);
            connectTimeoutTask = null;
            reconnectTask = null;
            livenessTask = null;
            pushRetryTask = null;

            if (pollTask != null) {
                pollTask.cancel(true);
                pollTask = null;
            }

            closeSession();
            state.clear();
            backoff.reset();

            LOGGER.info("{} connector stopped", getVenue());
        }
    }

    public ConnectorStats getStats() {
        synchronized (lock) {
            Instant lastEventTime = state.getLastEventTime();
            Duration lastEventAge = lastEventTime == null ? null : Duration.between(lastEventTime, clock.instant());

            return new ConnectorStats(getVenue(), state.getTransport(), backoff.getAttempts(), lastEventAge);
        }
    }

    public TransportState getTransport() {
        synchronized (lock) {
            return state.getTransport();
        }
    }

    private boolean isPushEnabled() {
        return quoteSource.isPushCapable() && venueConfiguration.isPushEnabled();
    }

    // called with the lock held
    private void connectPush() {
        if (state.getTransport() != FALLBACK_PULL) {
            state.setTransport(CONNECTING_PUSH);
        }

        PushListener listener = new SessionListener();

        currentListener = listener;
        pushOpen = false;
        keepAlivePendingSince = null;

        connectTimeoutTask = executor.schedule(
            () -> onConnectTimeout(listener),
            venueConfiguration.getPushConnectTimeout().toMillis(),
            TimeUnit.MILLISECONDS);

        PushSession session;

        try {
            session = quoteSource.connect(listener);
        } catch (RuntimeException e) {
            LOGGER.warn("{} could not open push stream: {}", getVenue(), e.getMessage());
            handlePushLoss(listener, e.getMessage());
            return;
        }

        if (currentListener == listener) {
            pushSession = session;
        } else {
            // the stream already failed while connecting
            session.close();
        }
    }

    private void onOpen(PushListener listener) {
        synchronized (lock) {
            if (!running || currentListener != listener) {
                return;
            }

            cancel(connectTimeoutTask);
            connectTimeoutTask = null;
            cancel(pushRetryTask);
            pushRetryTask = null;

            pushOpen = true;
            state.setTransport(CONNECTED_PUSH);
            backoff.reset();
            touch();
            stopFallback();

            LOGGER.info("{} receiving prices by push", getVenue());
        }
    }

    private void onActivity(PushListener listener) {
        synchronized (lock) {
            if (running && currentListener == listener) {
                touch();
            }
        }
    }

    private void onQuote(PushListener listener, TopOfBook topOfBook) {
        synchronized (lock) {
            if (running && currentListener == listener) {
                emit(topOfBook, CONNECTED_PUSH);
            }
        }
    }

    private void onConnectTimeout(PushListener listener) {
        synchronized (lock) {
            if (running && currentListener == listener && !pushOpen) {
                LOGGER.warn("{} push stream did not connect within {}", getVenue(), venueConfiguration.getPushConnectTimeout());
                handlePushLoss(listener, "connect timeout");
            }
        }
    }

    private void handlePushLoss(PushListener listener, String reason) {
        synchronized (lock) {
            if (!running || currentListener != listener) {
                return;
            }

            LOGGER.warn("{} push stream lost: {}", getVenue(), reason);

            currentListener = null;
            pushOpen = false;
            keepAlivePendingSince = null;
            cancel(connectTimeoutTask);
            connectTimeoutTask = null;

            closeSession();
            startFallback();
            scheduleReconnect();
        }
    }

    // called with the lock held
    private void scheduleReconnect() {
        if (!backoff.shouldRetry()) {
            LOGGER.warn("{} reconnect attempts exhausted, polling and trying push again in {}",
                getVenue(),
                venueConfiguration.getPushRetryInterval());

            pushRetryTask = executor.schedule(
                this::retryPush,
                venueConfiguration.getPushRetryInterval().toMillis(),
                TimeUnit.MILLISECONDS);

            return;
        }

        Duration delay = backoff.getNextDelay();

        backoff.recordFailure();

        LOGGER.info("{} reconnecting in {} ms (attempt {})", getVenue(), delay.toMillis(), backoff.getAttempts());

        reconnectTask = executor.schedule(this::reconnect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void reconnect() {
        synchronized (lock) {
            reconnectTask = null;

            if (running && currentListener == null) {
                connectPush();
            }
        }
    }

    private void retryPush() {
        synchronized (lock) {
            pushRetryTask = null;

            if (running && currentListener == null) {
                LOGGER.info("{} retrying push", getVenue());

                backoff.reset();
                connectPush();
            }
        }
    }

    private void checkLiveness() {
        synchronized (lock) {
            if (!running || !pushOpen || pushSession == null) {
                return;
            }

            Instant now = clock.instant();

            if (keepAlivePendingSince != null) {
                if (Duration.between(keepAlivePendingSince, now).compareTo(venueConfiguration.getKeepAliveTimeout()) >= 0) {
                    handlePushLoss(currentListener, "no answer to keep-alive");
                }

                return;
            }

            Instant lastEventTime = state.getLastEventTime();

            if (lastEventTime != null
                && Duration.between(lastEventTime, now).compareTo(venueConfiguration.getKeepAliveAfter()) >= 0) {

                LOGGER.debug("{} silent since {}, sending keep-alive", getVenue(), lastEventTime);

                keepAlivePendingSince = now;
                pushSession.sendKeepAlive();
            }
        }
    }

    // called with the lock held
    private void startFallback() {
        state.setTransport(FALLBACK_PULL);

        if (pollTask == null) {
            LOGGER.info("{} polling every {}", getVenue(), venueConfiguration.getPollInterval());

            pollTask = executor.scheduleWithFixedDelay(
                this::poll,
                0,
                venueConfiguration.getPollInterval().toMillis(),
                TimeUnit.MILLISECONDS);
        }
    }

    // called with the lock held
    private void stopFallback() {
        if (pollTask != null) {
            LOGGER.info("{} stopped polling", getVenue());

            pollTask.cancel(false);
            pollTask = null;
        }
    }

    private void poll() {
        long pollGeneration;

        synchronized (lock) {
            if (!running || state.getTransport() != FALLBACK_PULL) {
                return;
            }

            pollGeneration = generation;
        }

        List<TopOfBook> quotes;

        try {
            quotes = quoteSource.fetchQuotes();
        } catch (RuntimeException e) {
            // an exception would cancel the poll timer
            LOGGER.warn("{} poll failed: {}", getVenue(), e.getMessage());
            return;
        }

        synchronized (lock) {
            if (!running || generation != pollGeneration || state.getTransport() != FALLBACK_PULL) {
                LOGGER.debug("{} discarding {} polled prices", getVenue(), quotes.size());
                return;
            }

            if (!quotes.isEmpty()) {
                touch();
            }

            quotes.forEach(topOfBook -> emit(topOfBook, FALLBACK_PULL));
        }
    }

    // called with the lock held
    private void emit(TopOfBook topOfBook, TransportState transport) {
        Quote quote;

        try {
            quote = new Quote(topOfBook.getSymbol(), topOfBook.getBid(), topOfBook.getAsk(), clock.instant(), getVenue());
        } catch (IllegalArgumentException e) {
            LOGGER.debug("{} skipping invalid price {}: {}", getVenue(), topOfBook, e.getMessage());
            return;
        }

        quoteEventQueue.publish(new QuoteEvent(quote, transport));
    }

    // called with the lock held
    private void touch() {
        state.setLastEventTime(clock.instant());
        keepAlivePendingSince = null;
    }

    // called with the lock held
    private void closeSession() {
        if (pushSession != null) {
            try {
                pushSession.close();
            } catch (RuntimeException e) {
                LOGGER.debug("{} error closing push stream: {}", getVenue(), e.getMessage());
            }

            pushSession = null;
        }
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private class SessionListener implements PushListener {
        @Override
        public void onOpen() {
            HybridConnector.this.onOpen(this);
        }

        @Override
        public void onActivity() {
            HybridConnector.this.onActivity(this);
        }

        @Override
        public void onQuote(TopOfBook topOfBook) {
            HybridConnector.this.onQuote(this, topOfBook);
        }

        @Override
        public void onClosed(String reason) {
            handlePushLoss(this, "closed " + reason);
        }

        @Override
        public void onFailure(Throwable t) {
            handlePushLoss(this, t.getMessage());
        }
    }
}
