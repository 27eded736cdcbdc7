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
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lighter streams one order book per market, addressed by a numeric market id. The ids come from the REST
 * market list, so it has to be fetched before subscribing.
 *
 * Book updates are partial: a message may carry only bids or only asks, so the last known side is held per
 * market and merged with each update.
 */
public class LighterQuoteSource extends AbstractStreamingQuoteSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(LighterQuoteSource.class);

    static final String MARKET_TYPE_PERP = "perp";
    static final String STATUS_ACTIVE = "active";

    private final Map<Integer, String> marketSymbols = new ConcurrentHashMap<>();
    private final Map<Integer, TopOfBook> books = new ConcurrentHashMap<>();

    public LighterQuoteSource(
        VenueConfiguration venueConfiguration,
        Set<String> allowList,
        OkHttpClient httpClient,
        ObjectMapper objectMapper,
        ErrorCollectorService errorCollectorService) {

        super(venueConfiguration, allowList, httpClient, objectMapper, errorCollectorService);
    }

    @Override
    protected List<TopOfBook> fetch() throws IOException, VenueRequestException {
        List<TopOfBook> quotes = new ArrayList<>();

        for (JsonNode market : fetchMarkets()) {
            Optional<String> symbol = SymbolNames.beforeSeparator(market.path("symbol").asText(null), "-");

            if (symbol.isEmpty() || !isAllowed(symbol.get())) {
                continue;
            }

            BigDecimal bid = priceOrLastTrade(market, "best_bid");
            BigDecimal ask = priceOrLastTrade(market, "best_ask");

            if (isPositive(bid) && isPositive(ask)) {
                quotes.add(new TopOfBook(symbol.get(), bid, ask));
            }
        }

        return quotes;
    }

    @Override
    protected List<String> subscriptionMessages() throws IOException, VenueRequestException {
        if (marketSymbols.isEmpty()) {
            fetchMarkets();
        }

        if (marketSymbols.isEmpty()) {
            throw new VenueRequestException(getVenue(), "No allow-listed markets to subscribe to");
        }

        // a new session starts from fresh books
        books.clear();

        List<String> messages = new ArrayList<>();

        for (Integer marketId : new TreeMap<>(marketSymbols).keySet()) {
            ObjectNode message = objectMapper.createObjectNode();

            message.put("type", "subscribe");
            message.put("channel", "order_book/" + marketId);

            messages.add(objectMapper.writeValueAsString(message));
        }

        LOGGER.debug("Subscribing to {} Lighter order books", messages.size());

        return messages;
    }

    @Override
    protected String keepAliveMessage() {
        return "{\"type\":\"ping\"}";
    }

    @Override
    protected List<TopOfBook> parseMessage(String text) throws IOException {
        JsonNode message = objectMapper.readTree(text);
        String type = message.path("type").asText();

        if (!type.endsWith("/order_book") || !message.has("order_book")) {
            return Collections.emptyList();
        }

        Optional<Integer> marketId = parseMarketId(message.path("channel").asText());

        if (marketId.isEmpty()) {
            return Collections.emptyList();
        }

        String symbol = marketSymbols.get(marketId.get());

        if (symbol == null) {
            return Collections.emptyList();
        }

        JsonNode book = message.path("order_book");
        BigDecimal bestBid = bestPrice(book.path("bids"), true);
        BigDecimal bestAsk = bestPrice(book.path("asks"), false);
        TopOfBook previous = books.get(marketId.get());

        BigDecimal bid = bestBid != null ? bestBid : previous != null ? previous.getBid() : BigDecimal.ZERO;
        BigDecimal ask = bestAsk != null ? bestAsk : previous != null ? previous.getAsk() : BigDecimal.ZERO;

        if (bid.signum() <= 0 && ask.signum() <= 0) {
            return Collections.emptyList();
        }

        TopOfBook merged = new TopOfBook(symbol, bid, ask);

        books.put(marketId.get(), merged);

        return Collections.singletonList(merged);
    }

    private List<JsonNode> fetchMarkets() throws IOException, VenueRequestException {
        JsonNode root = getJson(restUrl());

        if (!root.path("order_book_details").isArray()) {
            throw new VenueRequestException(getVenue(), "Response has no order_book_details");
        }

        List<JsonNode> markets = new ArrayList<>();

        for (JsonNode market : root.path("order_book_details")) {
            if (!MARKET_TYPE_PERP.equals(market.path("market_type").asText())
                || !STATUS_ACTIVE.equals(market.path("status").asText())) {
                continue;
            }

            markets.add(market);

            Optional<String> symbol = SymbolNames.beforeSeparator(market.path("symbol").asText(null), "-");

            if (symbol.isPresent() && isAllowed(symbol.get()) && market.path("market_id").canConvertToInt()) {
                marketSymbols.put(market.path("market_id").asInt(), symbol.get());
            }
        }

        return markets;
    }

    // the channel comes back as "order_book:<id>"
    static Optional<Integer> parseMarketId(String channel) {
        int index = Math.max(channel.lastIndexOf(':'), channel.lastIndexOf('/'));

        if (index < 0 || index == channel.length() - 1) {
            return Optional.empty();
        }

        try {
            return Optional.of(Integer.parseInt(channel.substring(index + 1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static BigDecimal priceOrLastTrade(JsonNode market, String field) {
        BigDecimal price = parsePrice(market.get(field));

        return isPositive(price) ? price : parsePrice(market.get("last_trade_price"));
    }

    // levels are either [price, size] tuples or {"price": ..., "size": ...} objects
    private static BigDecimal bestPrice(JsonNode levels, boolean highest) {
        BigDecimal best = null;

        for (JsonNode level : elements(levels)) {
            BigDecimal price = parsePrice(level.isArray() ? level.get(0) : level.get("price"));

            if (!isPositive(price)) {
                continue;
            }

            if (best == null || (highest ? price.compareTo(best) > 0 : price.compareTo(best) < 0)) {
                best = price;
            }
        }

        return best;
    }
}
