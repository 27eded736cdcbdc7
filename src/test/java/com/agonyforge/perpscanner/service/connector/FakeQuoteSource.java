package com.agonyforge.perpscanner.service.connector;

import com.agonyforge.perpscanner.service.model.TopOfBook;
import com.agonyforge.perpscanner.service.model.Venue;
import com.agonyforge.perpscanner.service.venue.PushListener;
import com.agonyforge.perpscanner.service.venue.PushSession;
import com.agonyforge.perpscanner.service.venue.QuoteSource;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A QuoteSource whose stream is driven by the test.
 */
class FakeQuoteSource implements QuoteSource {
    private final Venue venue;
    private final boolean pushCapable;
    private final List<PushListener> listeners = new CopyOnWriteArrayList<>();
    private final List<FakeSession> sessions = new CopyOnWriteArrayList<>();
    private final AtomicInteger fetchCount = new AtomicInteger();

    private volatile List<TopOfBook> pollResult = Collections.emptyList();
    private volatile boolean failOnConnect = false;
    private volatile CountDownLatch fetchGate = null;

    FakeQuoteSource(Venue venue, boolean pushCapable) {
        this.venue = venue;
        this.pushCapable = pushCapable;
    }

    @Override
    public Venue getVenue() {
        return venue;
    }

    @Override
    public boolean isPushCapable() {
        return pushCapable;
    }

    @Override
    public List<TopOfBook> fetchQuotes() {
        fetchCount.incrementAndGet();

        CountDownLatch gate = fetchGate;

        if (gate != null) {
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        return pollResult;
    }

    @Override
    public PushSession connect(PushListener pushListener) {
        FakeSession session = new FakeSession();

        listeners.add(pushListener);
        sessions.add(session);

        if (failOnConnect) {
            pushListener.onFailure(new IOException("Connection refused"));
        }

        return session;
    }

    void setPollResult(List<TopOfBook> pollResult) {
        this.pollResult = pollResult;
    }

    void setFailOnConnect(boolean failOnConnect) {
        this.failOnConnect = failOnConnect;
    }

    void setFetchGate(CountDownLatch fetchGate) {
        this.fetchGate = fetchGate;
    }

    int getFetchCount() {
        return fetchCount.get();
    }

    int getConnectCount() {
        return listeners.size();
    }

    PushListener getListener(int index) {
        return listeners.get(index);
    }

    PushListener getLastListener() {
        return listeners.get(listeners.size() - 1);
    }

    FakeSession getSession(int index) {
        return sessions.get(index);
    }

    static class FakeSession implements PushSession {
        private final AtomicInteger keepAlives = new AtomicInteger();
        private volatile boolean closed = false;

        @Override
        public void subscribe() {
            // subscriptions are implicit
        }

        @Override
        public void sendKeepAlive() {
            keepAlives.incrementAndGet();
        }

        @Override
        public void close() {
            closed = true;
        }

        int getKeepAlives() {
            return keepAlives.get();
        }

        boolean isClosed() {
            return closed;
        }
    }
}
