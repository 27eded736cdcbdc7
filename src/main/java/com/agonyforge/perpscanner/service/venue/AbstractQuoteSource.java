package com.agonyforge.perpscanner.service.venue;

import com.agonyforge.perpscanner.config.VenueConfiguration;
import com.agonyforge.perpscanner.exception.VenueRequestException;
import com.agonyforge.perpscanner.service.ErrorCollectorService;
import com.agonyforge.perpscanner.service.model.TopOfBook;
import com.agonyforge.perpscanner.service.model.Venue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Shared plumbing for QuoteSources: REST calls with the venue's headers and timeout, JSON parsing, and the
 * guarantee that fetchQuotes() turns every failure into an empty result.
 */
public abstract class AbstractQuoteSource implements QuoteSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractQuoteSource.class);

    protected final VenueConfiguration venueConfiguration;
    protected final Set<String> allowList;
    protected final OkHttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final ErrorCollectorService errorCollectorService;

    protected AbstractQuoteSource(
        VenueConfiguration venueConfiguration,
        Set<String> allowList,
        OkHttpClient httpClient,
        ObjectMapper objectMapper,
        ErrorCollectorService errorCollectorService) {

        this.venueConfiguration = venueConfiguration;
        this.allowList = allowList;
        this.objectMapper = objectMapper;
        this.errorCollectorService = errorCollectorService;

        // every call to this venue, start to finish, is bounded by its request timeout
        this.httpClient = httpClient.newBuilder()
            .callTimeout(venueConfiguration.getRequestTimeout())
            .build();
    }

    @Override
    public Venue getVenue() {
        return venueConfiguration.getVenue();
    }

    @Override
    public boolean isPushCapable() {
        return false;
    }

    @Override
    public PushSession connect(PushListener pushListener) {
        throw new UnsupportedOperationException(getVenue() + " does not support push");
    }

    @Override
    public List<TopOfBook> fetchQuotes() {
        long start = System.currentTimeMillis();

        try {
            List<TopOfBook> quotes = fetch();

            LOGGER.debug("Fetched {} quotes from {} in {} ms",
                quotes.size(),
                getVenue(),
                System.currentTimeMillis() - start);

            return quotes;
        } catch (IOException | VenueRequestException | RuntimeException e) {
            // collect errors quietly, but expose them in the debug log
            errorCollectorService.collect(getVenue(), e);
            LOGGER.debug("Failed to fetch quotes from {}: {}", getVenue(), e.getMessage());
        }

        return Collections.emptyList();
    }

    /**
     * Fetch prices from the venue's REST API.
     *
     * @return Prices for allow-listed symbols.
     * @throws IOException if the request failed or the response could not be parsed.
     * @throws VenueRequestException if the venue answered with an error.
     */
    protected abstract List<TopOfBook> fetch() throws IOException, VenueRequestException;

    /**
     * GET a URL and parse the body as JSON.
     *
     * @param url The URL to fetch.
     * @return The parsed body.
     * @throws IOException if the request failed, timed out or the body was not JSON.
     * @throws VenueRequestException if the response was not successful.
     */
    protected JsonNode getJson(HttpUrl url) throws IOException, VenueRequestException {
        Request.Builder builder = new Request.Builder().url(url).get();

        venueConfiguration.getHeaders().forEach(builder::header);

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new VenueRequestException(getVenue(), response.code(), "HTTP " + response.code() + " from " + url.encodedPath());
            }

            ResponseBody body = response.body();

            if (body == null) {
                throw new VenueRequestException(getVenue(), response.code(), "Empty response from " + url.encodedPath());
            }

            return objectMapper.readTree(body.string());
        }
    }

    protected HttpUrl restUrl() {
        return HttpUrl.get(venueConfiguration.getRestUri());
    }

    protected boolean isAllowed(String symbol) {
        return allowList.contains(symbol);
    }

    /**
     * Parse a price that may be sent as a string or a number.
     *
     * @param node The JSON node holding the price.
     * @return The price, or null if it's missing or not a number.
     */
    protected static BigDecimal parsePrice(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return null;
        }

        String text = node.asText();

        if (text == null || text.isBlank()) {
            return null;
        }

        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    protected static boolean isPositive(BigDecimal price) {
        return price != null && price.signum() > 0;
    }

    // venues send either a list of records or a single record
    protected static List<JsonNode> elements(JsonNode node) {
        List<JsonNode> elements = new ArrayList<>();

        if (node == null) {
            return elements;
        }

        if (node.isArray()) {
            node.forEach(elements::add);
        } else if (node.isObject()) {
            elements.add(node);
        }

        return elements;
    }

    @Override
    public String toString() {
        return getVenue().toString();
    }
}
