package com.agonyforge.perpscanner.service;

import com.agonyforge.perpscanner.service.model.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Collect non-critical errors and report them together as a batch or summary.
 * Venues fail all the time in small ways, and logging each one would bury everything else in the logs.
 */
@Component
public class ErrorCollectorService {
    static final String HEADER = "Noncritical error summary: [Venue]: [Exception name]: [Error message] x [Count]";

    private static final Logger LOGGER = LoggerFactory.getLogger(ErrorCollectorService.class);

    private final Map<String, Integer> errors = new ConcurrentHashMap<>();

    /**
     * Collect an error and store it.
     *
     * @param venue The Venue this error is related to.
     * @param t The error object.
     */
    public void collect(Venue venue, Throwable t) {
        // store the error in the map and increment the count if there's already a similar error
        errors.merge(computeKey(venue, t), 1, Integer::sum);

        // when DEBUG is enabled, show the exception to help with debugging problems
        LOGGER.debug("Surfacing noncritical stack trace for debugging: ", t);
    }

    /**
     * Tells whether the error collector is empty.
     *
     * @return true if the error collector is empty.
     */
    public boolean isEmpty() {
        return errors.isEmpty();
    }

    /**
     * Clear any errors stored in the error collector.
     */
    public void clear() {
        errors.clear();
    }

    /**
     * Generate a report of any errors stored in the error collector.
     *
     * @return a report of stored errors, formatted as a list of strings
     */
    public List<String> report() {
        List<String> report = new ArrayList<>();

        report.add(HEADER);
        report.addAll(errors.entrySet()
            .stream()
            .map(entry -> entry.getKey() + " x " + entry.getValue())
            .sorted()
            .collect(Collectors.toList()));

        return report;
    }

    // compute a string based on a Venue and a Throwable, suitable for use as a key in a Map
    private String computeKey(Venue venue, Throwable t) {
        return venue + ": " + t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}
