package com.agonyforge.perpscanner.service.venue;

/**
 * A handle for an open (or opening) push stream.
 */
public interface PushSession {
    /**
     * Send the subscription messages for the allow-listed symbols.
     */
    void subscribe();

    /**
     * Send the venue's keep-alive message. The venue is expected to answer with something.
     */
    void sendKeepAlive();

    /**
     * Close the stream. No more callbacks will be made for it after this.
     */
    void close();
}
