package com.agonyforge.perpscanner.service.model;

/**
 * The exchanges we collect prices from. The set is closed: each one has its own QuoteSource.
 */
public enum Venue {
    PARADEX,
    LIGHTER,
    VEST,
    EXTENDED
}
