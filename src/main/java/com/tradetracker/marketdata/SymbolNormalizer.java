package com.tradetracker.marketdata;

import com.tradetracker.exception.BusinessException;
import com.tradetracker.exception.ErrorCode;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts between the signal source's symbol format and the venue-neutral format
 * used as the subscription key.
 *
 * <p>Signal sources send e.g. {@code BTCUSDT} (spot) or {@code HIPPOUSDT.P}
 * (perpetual). The venue-neutral form is {@code BASE/QUOTE} for spot and
 * {@code BASE/QUOTE:QUOTE} for USDT-style linear perpetuals. Venue clients derive
 * their native formats from the parsed {@link Instrument}.
 */
public final class SymbolNormalizer {

    private static final List<String> PERPETUAL_SUFFIXES = List.of(".P", ".PERP", "-PERP", "PERP");

    /** Longer and more common quotes first, so USDT wins over USD. */
    private static final List<String> QUOTE_CURRENCIES = List.of("USDT", "USDC", "BUSD", "USD", "EUR", "BTC", "ETH");

    private SymbolNormalizer() {}

    /** Parsed instrument: base and quote assets plus whether it is a perpetual contract. */
    public record Instrument(String base, String quote, boolean perpetual) {

        /** Venue-neutral symbol, the key used by the multiplexer. */
        public String tradingSymbol() {
            return perpetual ? base + "/" + quote + ":" + quote : base + "/" + quote;
        }

        /** Concatenated form used by Binance and Bybit, e.g. BTCUSDT. */
        public String concatenated() {
            return base + quote;
        }

        /** OKX instrument id for the linear swap, e.g. BTC-USDT-SWAP. */
        public String okxSwapId() {
            return base + "-" + quote + "-SWAP";
        }
    }

    /**
     * Parses a signal-source symbol such as {@code HIPPOUSDT.P}.
     *
     * @throws BusinessException when no known quote currency can be split off
     */
    public static Instrument normalize(String sourceSymbol) {
        if (sourceSymbol == null || sourceSymbol.isBlank()) {
            throw invalid(sourceSymbol);
        }
        String symbol = sourceSymbol.trim().toUpperCase(Locale.ROOT);
        boolean perpetual = false;
        for (String suffix : PERPETUAL_SUFFIXES) {
            if (symbol.endsWith(suffix)) {
                symbol = symbol.substring(0, symbol.length() - suffix.length());
                perpetual = true;
                break;
            }
        }
        for (String quote : QUOTE_CURRENCIES) {
            if (symbol.endsWith(quote) && symbol.length() > quote.length()) {
                return new Instrument(symbol.substring(0, symbol.length() - quote.length()), quote, perpetual);
            }
        }
        throw invalid(sourceSymbol);
    }

    /** Parses a venue-neutral symbol such as {@code BTC/USDT} or {@code BTC/USDT:USDT}. */
    public static Instrument parseTradingSymbol(String tradingSymbol) {
        if (tradingSymbol == null) {
            throw invalid(null);
        }
        int slash = tradingSymbol.indexOf('/');
        if (slash <= 0) {
            throw invalid(tradingSymbol);
        }
        String base = tradingSymbol.substring(0, slash);
        String rest = tradingSymbol.substring(slash + 1);
        int colon = rest.indexOf(':');
        String quote = colon >= 0 ? rest.substring(0, colon) : rest;
        if (quote.isEmpty()) {
            throw invalid(tradingSymbol);
        }
        return new Instrument(base, quote, colon >= 0);
    }

    /** Display form without perpetual suffix, e.g. HIPPOUSDT.P becomes HIPPOUSDT. */
    public static String displaySymbol(String sourceSymbol) {
        for (String suffix : PERPETUAL_SUFFIXES) {
            if (sourceSymbol.endsWith(suffix)) {
                return sourceSymbol.substring(0, sourceSymbol.length() - suffix.length());
            }
        }
        return sourceSymbol;
    }

    private static BusinessException invalid(String symbol) {
        return new BusinessException(
                ErrorCode.INVALID_SYMBOL,
                "Unable to parse symbol: " + symbol,
                Map.of("symbol", String.valueOf(symbol)));
    }
}
