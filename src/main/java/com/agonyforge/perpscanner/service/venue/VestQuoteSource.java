package com.agonyforge.perpscanner.service.venue;

import com.agonyforge.perpscanner.config.VenueConfiguration;
import com.agonyforge.perpscanner.exception.VenueRequestException;
import com.agonyforge.perpscanner.service.ErrorCollectorService;
import com.agonyforge.perpscanner.service.model.TopOfBook;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.apache.commons.collections4.ListUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Vest's ticker only lists symbols, so prices come from one depth request per symbol. The depth requests are
 * made in small parallel batches with a pause between batches to stay under the venue's rate limit.
 */
public class VestQuoteSource extends AbstractStreamingQuoteSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(VestQuoteSource.class);

    static final String SUFFIX = "-PERP";
    static final String DEPTH_CHANNEL = "@depth";
    static final String DEPTH_LIMIT = "5";

    public VestQuoteSource(
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

        if (!root.path("tickers").isArray()) {
            throw new VenueRequestException(getVenue(), "Response has no tickers");
        }

        Set<String> symbols = new LinkedHashSet<>();

        for (JsonNode ticker : root.path("tickers")) {
            SymbolNames.stripSuffix(ticker.path("symbol").asText(null), SUFFIX)
                .filter(this::isAllowed)
                .ifPresent(symbols::add);
        }

        List<List<String>> partitions = ListUtils.partition(new ArrayList<>(symbols), venueConfiguration.getBatchSize());
        List<TopOfBook> quotes = new ArrayList<>();

        for (int i = 0; i < partitions.size(); i++) {
            if (i > 0) {
                try {
                    Thread.sleep(venueConfiguration.getBatchDelay().toMillis());
                } catch (InterruptedException e) {
                    LOGGER.debug("Interrupted between depth batches");
                    Thread.currentThread().interrupt();
                    break;
                }
            }

            quotes.addAll(partitions.get(i)
                .parallelStream()
                .map(this::fetchDepth)
                .filter(Objects::nonNull)
                .collect(Collectors.toList()));
        }

        return quotes;
    }

    @Override
    protected List<String> subscriptionMessages() throws IOException {
        ObjectNode message = objectMapper.createObjectNode();
        ArrayNode params = message.put("method", "SUBSCRIBE").putArray("params");

        allowList.forEach(symbol -> params.add(SymbolNames.toVenueSymbol(symbol, SUFFIX) + DEPTH_CHANNEL));
        message.put("id", System.currentTimeMillis());

        return Collections.singletonList(objectMapper.writeValueAsString(message));
    }

    @Override
    protected String keepAliveMessage() {
        return "{\"method\":\"PING\",\"params\":[],\"id\":0}";
    }

    @Override
    protected List<TopOfBook> parseMessage(String text) throws IOException {
        JsonNode message = objectMapper.readTree(text);
        String channel = message.path("channel").asText("");

        if (!channel.endsWith(DEPTH_CHANNEL) || !message.has("data")) {
            return Collections.emptyList();
        }

        Optional<String> symbol = SymbolNames
            .stripSuffix(channel.substring(0, channel.length() - DEPTH_CHANNEL.length()), SUFFIX)
            .filter(this::isAllowed);

        if (symbol.isEmpty()) {
            return Collections.emptyList();
        }

        JsonNode data = message.path("data");
        TopOfBook topOfBook = parseDepth(symbol.get(), data.path("bids"), data.path("asks"));

        return topOfBook == null ? Collections.emptyList() : Collections.singletonList(topOfBook);
    }

    private TopOfBook fetchDepth(String symbol) {
        HttpUrl url = HttpUrl.get(venueConfiguration.getDepthUri())
            .newBuilder()
            .addQueryParameter("symbol", SymbolNames.toVenueSymbol(symbol, SUFFIX))
            .addQueryParameter("limit", DEPTH_LIMIT)
            .build();

        try {
            JsonNode depth = getJson(url);

            return parseDepth(symbol, depth.path("bids"), depth.path("asks"));
        } catch (IOException | VenueRequestException e) {
            // one missing symbol shouldn't sink the whole poll
            errorCollectorService.collect(getVenue(), e);
            LOGGER.debug("Failed to fetch {} depth: {}", symbol, e.getMessage());
        }

        return null;
    }

    private static TopOfBook parseDepth(String symbol, JsonNode bids, JsonNode asks) {
        BigDecimal bid = parsePrice(bids.path(0).path(0));
        BigDecimal ask = parsePrice(asks.path(0).path(0));

        if (isPositive(bid) && isPositive(ask)) {
            return new TopOfBook(symbol, bid, ask);
        }

        return null;
    }
}
