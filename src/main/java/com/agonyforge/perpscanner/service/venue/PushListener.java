package com.agonyforge.perpscanner.service.venue;

import com.agonyforge.perpscanner.service.model.TopOfBook;

/**
 * Callbacks from a push stream. They may be called from any thread.
 */
public interface PushListener {
    /**
     * The stream is connected and subscribed.
     */
    void onOpen();

    /**
     * Something arrived on the stream, whether or not it contained a price. Used for liveness.
     */
    void onActivity();

    /**
     * A price arrived on the stream.
     *
     * @param topOfBook The price.
     */
    void onQuote(TopOfBook topOfBook);

    /**
     * The venue closed the stream.
     *
     * @param reason The reason given, if any.
     */
    void onClosed(String reason);

    /**
     * The stream failed, or never connected.
     *
     * @param t The cause.
     */
    void onFailure(Throwable t);
}
