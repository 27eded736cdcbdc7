package com.agonyforge.perpscanner.service.venue;

import com.agonyforge.perpscanner.config.VenueConfiguration;
import com.agonyforge.perpscanner.exception.VenueRequestException;
import com.agonyforge.perpscanner.service.ErrorCollectorService;
import com.agonyforge.perpscanner.service.model.TopOfBook;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Paradex publishes a summary of every market on one JSON-RPC channel, so one subscription covers all symbols.
 */
public class ParadexQuoteSource extends AbstractStreamingQuoteSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(ParadexQuoteSource.class);

    static final String SUFFIX = "-USD-PERP";
    static final String CHANNEL = "markets_summary";

    private final AtomicInteger requestId = new AtomicInteger();

    public ParadexQuoteSource(
        VenueConfiguration venueConfiguration,
        Set<String> allowList,
        OkHttpClient httpClient,
        ObjectMapper objectMapper,
        ErrorCollectorService errorCollectorService) {

        super(venueConfiguration, allowList, httpClient, objectMapper, errorCollectorService);
    }

    @Override
    protected List<TopOfBook> fetch() throws IOException, VenueRequestException {
        JsonNode root = getJson(restUrl());

        if (!root.path("results").isArray()) {
            throw new VenueRequestException(getVenue(), "Response has no results");
        }

        return parseMarkets(root.path("results"));
    }

    @Override
    protected List<String> subscriptionMessages() throws IOException {
        return Collections.singletonList(subscribeMessage());
    }

    // Paradex answers a repeated subscription, which is all a keep-alive needs
    @Override
    protected String keepAliveMessage() {
        try {
            return subscribeMessage();
        } catch (IOException e) {
            LOGGER.debug("Unable to build keep-alive: {}", e.getMessage());
            return null;
        }
    }

    @Override
    protected List<TopOfBook> parseMessage(String text) throws IOException {
        JsonNode message = objectMapper.readTree(text);
        JsonNode params = message.path("params");

        if (!CHANNEL.equals(params.path("channel").asText())) {
            if (message.has("result")) {
                LOGGER.debug("Paradex confirmed subscription: {}", message.path("result"));
            }

            return Collections.emptyList();
        }

        return parseMarkets(params.path("data"));
    }

    private String subscribeMessage() throws IOException {
        ObjectNode message = objectMapper.createObjectNode();

        message.put("id", requestId.incrementAndGet());
        message.put("jsonrpc", "2.0");
        message.put("method", "subscribe");
        message.putObject("params").put("channel", CHANNEL);

        return objectMapper.writeValueAsString(message);
    }

    private List<TopOfBook> parseMarkets(JsonNode markets) {
        List<TopOfBook> quotes = new ArrayList<>();

        for (JsonNode market : elements(markets)) {
            Optional<String> symbol = SymbolNames.stripSuffix(market.path("symbol").asText(null), SUFFIX);

            if (symbol.isEmpty() || !isAllowed(symbol.get())) {
                continue;
            }

            BigDecimal bid = parsePrice(market.get("bid"));
            BigDecimal ask = parsePrice(market.get("ask"));

            if (isPositive(bid) && isPositive(ask)) {
                quotes.add(new TopOfBook(symbol.get(), bid, ask));
            } else {
                LOGGER.trace("Skipping {} without a two-sided price", symbol.get());
            }
        }

        return quotes;
    }
}
