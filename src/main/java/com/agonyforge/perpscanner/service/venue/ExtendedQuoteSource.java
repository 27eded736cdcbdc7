package com.agonyforge.perpscanner.service.venue;

import com.agonyforge.perpscanner.config.VenueConfiguration;
import com.agonyforge.perpscanner.exception.VenueRequestException;
import com.agonyforge.perpscanner.service.ErrorCollectorService;
import com.agonyforge.perpscanner.service.model.TopOfBook;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Extended has no public price stream, so it is polled.
 */
public class ExtendedQuoteSource extends AbstractQuoteSource {
    static final String STATUS_OK = "ok";
    static final String MARKET_ACTIVE = "ACTIVE";

    public ExtendedQuoteSource(
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

        if (!STATUS_OK.equalsIgnoreCase(root.path("status").asText()) || !root.path("data").isArray()) {
            throw new VenueRequestException(getVenue(), "Unexpected response status: " + root.path("status").asText());
        }

        List<TopOfBook> quotes = new ArrayList<>();

        for (JsonNode market : root.path("data")) {
            String name = market.path("name").asText("");

            if (!name.contains("-")) {
                continue;
            }

            Optional<String> symbol = SymbolNames.beforeSeparator(name, "-");

            if (symbol.isEmpty() || !isAllowed(symbol.get())) {
                continue;
            }

            if (!market.path("active").asBoolean(false) || !MARKET_ACTIVE.equals(market.path("status").asText())) {
                continue;
            }

            JsonNode stats = market.path("marketStats");
            BigDecimal bid = parsePrice(stats.get("bidPrice"));
            BigDecimal ask = parsePrice(stats.get("askPrice"));

            if (isPositive(bid) && isPositive(ask)) {
                quotes.add(new TopOfBook(symbol.get(), bid, ask));
            }
        }

        return quotes;
    }
}
