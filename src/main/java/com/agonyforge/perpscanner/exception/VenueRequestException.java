package com.agonyforge.perpscanner.exception;

import com.agonyforge.perpscanner.service.model.Venue;

/**
 * A venue answered a request with something other than a usable response.
 */
public class VenueRequestException extends Exception {
    private final Venue venue;
    private final int statusCode;

    public VenueRequestException(Venue venue, int statusCode, String message) {
        super(message);

        this.venue = venue;
        this.statusCode = statusCode;
    }

    public VenueRequestException(Venue venue, String message) {
        this(venue, -1, message);
    }

    public Venue getVenue() {
        return venue;
    }

    // -1 when the request itself succeeded but the content was unusable
    public int getStatusCode() {
        return statusCode;
    }
}
