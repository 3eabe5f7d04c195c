package io.marketlens.security;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates client-supplied identifiers before they reach the core.
 *
 * Rules:
 * - Symbols: upper-cased, then {@code ^[A-Z0-9][A-Z0-9_:./-]{0,19}$} (e.g. AAPL, BTC/USD, NSE:INFY-EQ)
 * - Symbol lists: 1..{@value #MAX_SYMBOLS_PER_REQUEST} entries, duplicates collapsed
 * - Request ids: alphanumeric with _ and -, at most 64 chars
 * - Free text echoed back to clients: trimmed, control characters removed, length capped
 */
public class InputValidator {

    private static final Pattern SYMBOL_PATTERN = Pattern.compile("^[A-Z0-9][A-Z0-9_:./-]{0,19}$");
    private static final Pattern REQUEST_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

    public static final int MAX_SYMBOLS_PER_REQUEST = 10;
    private static final int MAX_STRING_LENGTH = 256;

    public boolean isValidSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return false;
        }
        return SYMBOL_PATTERN.matcher(symbol.trim().toUpperCase()).matches();
    }

    /**
     * @return the symbol trimmed and upper-cased
     * @throws IllegalArgumentException if invalid
     */
    public String normalizeSymbol(String symbol) {
        if (!isValidSymbol(symbol)) {
            throw new IllegalArgumentException("Invalid symbol: " + sanitize(symbol));
        }
        return symbol.trim().toUpperCase();
    }

    /**
     * Normalize a request's symbol list, keeping first-seen order.
     *
     * @throws IllegalArgumentException if empty, too long or any symbol is invalid
     */
    public List<String> normalizeSymbols(List<String> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("At least one symbol is required");
        }
        if (symbols.size() > MAX_SYMBOLS_PER_REQUEST) {
            throw new IllegalArgumentException(
                "Too many symbols (max " + MAX_SYMBOLS_PER_REQUEST + "): " + symbols.size());
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String s : symbols) {
            normalized.add(normalizeSymbol(s));
        }
        return new ArrayList<>(normalized);
    }

    /**
     * @throws IllegalArgumentException if missing or malformed
     */
    public void validateRequestId(String requestId) {
        if (requestId == null || !REQUEST_ID_PATTERN.matcher(requestId).matches()) {
            throw new IllegalArgumentException("Invalid requestId: " + sanitize(requestId));
        }
    }

    /**
     * Trim, strip control characters and cap length. Null stays null.
     */
    public String sanitize(String input) {
        if (input == null) {
            return null;
        }
        String result = input.trim().replaceAll("\\p{Cntrl}", "");
        if (result.length() > MAX_STRING_LENGTH) {
            result = result.substring(0, MAX_STRING_LENGTH);
        }
        return result;
    }
}
