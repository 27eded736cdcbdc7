package com.agonyforge.perpscanner.service.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Drains the QuoteEventQueue on a single thread and hands each event to the ingestion pipeline. Running every
 * event to completion on one thread keeps updates for each symbol and venue in order.
 */
public class QuoteIngestionLoop implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(QuoteIngestionLoop.class);
    private static final long POLL_MILLIS = 250;

    private final QuoteEventQueue quoteEventQueue;
    private final Consumer<QuoteEvent> handler;
    private volatile boolean running = false;
    private Thread thread;

    public QuoteIngestionLoop(QuoteEventQueue quoteEventQueue, Consumer<QuoteEvent> handler) {
        this.quoteEventQueue = quoteEventQueue;
        this.handler = handler;
    }

    public synchronized void start() {
        if (running) {
            return;
        }

        running = true;
        thread = new Thread(this, "quote-ingestion");
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Stop the loop and wait for the event in progress, if any, to finish.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        thread.interrupt();

        try {
            thread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (thread.isAlive()) {
            LOGGER.warn("Ingestion thread did not stop within 5 seconds");
        }

        thread = null;
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void run() {
        LOGGER.debug("Ingestion loop started");

        while (running) {
            QuoteEvent quoteEvent;

            try {
                quoteEvent = quoteEventQueue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                LOGGER.trace("Ingestion loop interrupted");
                break;
            }

            if (quoteEvent == null || !running) {
                continue;
            }

            try {
                handler.accept(quoteEvent);
            } catch (RuntimeException e) {
                LOGGER.error("Failed to ingest {}: {}", quoteEvent, e.getMessage(), e);
            }
        }

        LOGGER.debug("Ingestion loop stopped");
    }
}
