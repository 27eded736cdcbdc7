package com.agonyforge.perpscanner.service.event;

import com.agonyforge.perpscanner.config.ScannerConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The bounded channel between the connectors and the ingestion loop. Publishing never blocks: when the queue is
 * full the event is dropped, since a newer quote from the same venue will be along shortly.
 */
@Component
public class QuoteEventQueue {
    private static final Logger LOGGER = LoggerFactory.getLogger(QuoteEventQueue.class);

    private final BlockingQueue<QuoteEvent> queue;
    private final AtomicLong dropped = new AtomicLong();

    public QuoteEventQueue(ScannerConfiguration scannerConfiguration) {
        this.queue = new ArrayBlockingQueue<>(scannerConfiguration.getIngestionQueueCapacity());
    }

    /**
     * Publish a QuoteEvent.
     *
     * @param quoteEvent the QuoteEvent to publish.
     * @return true if the event was queued, false if it was dropped.
     */
    public boolean publish(QuoteEvent quoteEvent) {
        LOGGER.trace("Publishing quote event: {}", quoteEvent);

        if (!queue.offer(quoteEvent)) {
            long count = dropped.incrementAndGet();

            // don't flood the log when ingestion falls behind
            if (count == 1 || count % 1000 == 0) {
                LOGGER.warn("Ingestion queue is full, {} quote event(s) dropped so far", count);
            }

            return false;
        }

        return true;
    }

    /**
     * Wait up to the given time for the next event.
     *
     * @param timeout How long to wait.
     * @param unit The unit of the timeout.
     * @return The next event, or null if none arrived in time.
     * @throws InterruptedException if interrupted while waiting.
     */
    public QuoteEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public void clear() {
        queue.clear();
    }

    public int size() {
        return queue.size();
    }

    public long getDroppedCount() {
        return dropped.get();
    }
}
