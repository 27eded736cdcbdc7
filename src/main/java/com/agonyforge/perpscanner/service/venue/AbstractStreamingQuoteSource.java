package com.agonyforge.perpscanner.service.venue;

import com.agonyforge.perpscanner.config.VenueConfiguration;
import com.agonyforge.perpscanner.exception.VenueRequestException;
import com.agonyforge.perpscanner.service.ErrorCollectorService;
import com.agonyforge.perpscanner.service.model.TopOfBook;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * A QuoteSource that can also stream prices over a WebSocket. Subclasses describe the venue's protocol:
 * what to send to subscribe, what to send as a keep-alive, and how to read a message.
 */
public abstract class AbstractStreamingQuoteSource extends AbstractQuoteSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractStreamingQuoteSource.class);

    protected AbstractStreamingQuoteSource(
        VenueConfiguration venueConfiguration,
        Set<String> allowList,
        OkHttpClient httpClient,
        ObjectMapper objectMapper,
        ErrorCollectorService errorCollectorService) {

        super(venueConfiguration, allowList, httpClient, objectMapper, errorCollectorService);
    }

    @Override
    public boolean isPushCapable() {
        return true;
    }

    @Override
    public PushSession connect(PushListener pushListener) {
        LOGGER.info("{} connecting to {}", getVenue(), venueConfiguration.getWsUri());

        Request request = new Request.Builder()
            .url(venueConfiguration.getWsUri())
            .build();

        WebSocketSession session = new WebSocketSession(pushListener);

        session.webSocket = httpClient.newWebSocket(request, session);

        return session;
    }

    /**
     * @return The messages that subscribe to prices for the allow-listed symbols.
     * @throws IOException if a message could not be built.
     * @throws VenueRequestException if the venue could not tell us what to subscribe to.
     */
    protected abstract List<String> subscriptionMessages() throws IOException, VenueRequestException;

    /**
     * @return A message the venue will answer, or null to rely on WebSocket pings alone.
     */
    protected abstract String keepAliveMessage();

    /**
     * Read prices out of a message. Messages that aren't price updates produce an empty list.
     *
     * @param text The message.
     * @return Prices for allow-listed symbols.
     * @throws IOException if the message is not valid JSON.
     */
    protected abstract List<TopOfBook> parseMessage(String text) throws IOException;

    private class WebSocketSession extends WebSocketListener implements PushSession {
        private final PushListener pushListener;
        private volatile WebSocket webSocket;
        private volatile boolean open = false;
        private volatile boolean closed = false;

        WebSocketSession(PushListener pushListener) {
            this.pushListener = pushListener;
        }

        @Override
        public void subscribe() {
            WebSocket ws = webSocket;

            if (ws == null || closed) {
                return;
            }

            try {
                for (String message : subscriptionMessages()) {
                    ws.send(message);
                }
            } catch (IOException | VenueRequestException e) {
                errorCollectorService.collect(getVenue(), e);
                LOGGER.warn("{} could not subscribe: {}", getVenue(), e.getMessage());

                closed = true;
                ws.cancel();
                pushListener.onFailure(e);
            }
        }

        @Override
        public void sendKeepAlive() {
            WebSocket ws = webSocket;
            String message = keepAliveMessage();

            if (ws != null && message != null && !closed) {
                LOGGER.debug("{} sending keep-alive", getVenue());
                ws.send(message);
            }
        }

        @Override
        public void close() {
            closed = true;

            WebSocket ws = webSocket;

            if (ws == null) {
                return;
            }

            if (open) {
                ws.close(1000, "shutdown");
            } else {
                ws.cancel();
            }
        }

        @Override
        public void onOpen(WebSocket ws, Response response) {
            webSocket = ws;

            if (closed) {
                ws.cancel();
                return;
            }

            open = true;

            subscribe();

            if (!closed) {
                LOGGER.info("{} stream connected", getVenue());
                pushListener.onOpen();
            }
        }

        @Override
        public void onMessage(WebSocket ws, String text) {
            if (closed) {
                return;
            }

            pushListener.onActivity();

            try {
                parseMessage(text).forEach(pushListener::onQuote);
            } catch (IOException e) {
                LOGGER.trace("{} skipping malformed message: {}", getVenue(), e.getMessage());
            }
        }

        @Override
        public void onMessage(WebSocket ws, ByteString bytes) {
            onMessage(ws, bytes.utf8());
        }

        @Override
        public void onClosing(WebSocket ws, int code, String reason) {
            ws.close(1000, null);
        }

        @Override
        public void onClosed(WebSocket ws, int code, String reason) {
            if (closed) {
                return;
            }

            closed = true;

            LOGGER.info("{} stream closed: {} {}", getVenue(), code, reason);
            pushListener.onClosed(code + " " + reason);
        }

        @Override
        public void onFailure(WebSocket ws, Throwable t, Response response) {
            if (closed) {
                return;
            }

            closed = true;

            errorCollectorService.collect(getVenue(), t);
            LOGGER.warn("{} stream failed: {}", getVenue(), t.getMessage());
            pushListener.onFailure(t);
        }
    }
}
