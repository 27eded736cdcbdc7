package com.agonyforge.perpscanner.service.venue;

import com.agonyforge.perpscanner.service.model.TopOfBook;
import com.agonyforge.perpscanner.service.model.Venue;

import java.util.List;

/**
 * A QuoteSource turns one venue's wire protocol into TopOfBook prices for canonical symbols. Every source can be
 * polled. Sources that also offer a streaming connection report it through isPushCapable().
 *
 * Implementations never throw from fetchQuotes(): failures are logged and produce an empty list.
 */
public interface QuoteSource {
    Venue getVenue();

    /**
     * @return true if this source can open a push stream.
     */
    boolean isPushCapable();

    /**
     * Make one bounded-time request for prices. Malformed records are skipped.
     *
     * @return Zero or more prices for allow-listed symbols.
     */
    List<TopOfBook> fetchQuotes();

    /**
     * Open a push stream. The connection is made asynchronously, and the source subscribes to the allow-listed
     * symbols before calling PushListener.onOpen().
     *
     * @param pushListener Receives the stream's events.
     * @return A handle for the stream.
     * @throws UnsupportedOperationException if this source can't push.
     */
    PushSession connect(PushListener pushListener);
}
