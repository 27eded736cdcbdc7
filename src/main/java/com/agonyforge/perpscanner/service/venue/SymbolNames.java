package com.agonyforge.perpscanner.service.venue;

import java.util.Locale;
import java.util.Optional;

/**
 * Conversions between venue symbol spellings ("BTC-USD-PERP", "BTC-PERP", "BTC-USD", "BTC") and canonical
 * base symbols ("BTC").
 */
public final class SymbolNames {
    private SymbolNames() {
        // this method intentionally left blank
    }

    /**
     * Strip a venue suffix from a symbol.
     *
     * @param venueSymbol The venue's spelling, eg. "BTC-USD-PERP".
     * @param suffix The suffix to strip, eg. "-USD-PERP".
     * @return The canonical symbol, or empty if the venue symbol doesn't end with the suffix.
     */
    public static Optional<String> stripSuffix(String venueSymbol, String suffix) {
        if (venueSymbol == null || !venueSymbol.endsWith(suffix) || venueSymbol.length() == suffix.length()) {
            return Optional.empty();
        }

        return Optional.of(canonical(venueSymbol.substring(0, venueSymbol.length() - suffix.length())));
    }

    /**
     * Take everything before the first separator. A symbol with no separator is returned whole.
     *
     * @param venueSymbol The venue's spelling, eg. "SOL--USDC" or "ETH".
     * @param separator The separator, eg. "-".
     * @return The canonical symbol, or empty if nothing is left.
     */
    public static Optional<String> beforeSeparator(String venueSymbol, String separator) {
        if (venueSymbol == null) {
            return Optional.empty();
        }

        int index = venueSymbol.indexOf(separator);
        String base = index >= 0 ? venueSymbol.substring(0, index) : venueSymbol;

        return base.isBlank() ? Optional.empty() : Optional.of(canonical(base));
    }

    /**
     * @param symbol A canonical symbol.
     * @param suffix The venue suffix, eg. "-PERP".
     * @return The venue spelling, eg. "BTC-PERP".
     */
    public static String toVenueSymbol(String symbol, String suffix) {
        return symbol + suffix;
    }

    private static String canonical(String base) {
        return base.trim().toUpperCase(Locale.ROOT);
    }
}
