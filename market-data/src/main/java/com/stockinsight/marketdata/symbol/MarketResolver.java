package com.stockinsight.marketdata.symbol;

import com.stockinsight.common.exception.ValidationException;
import com.stockinsight.common.model.Market;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Detects the market of a raw symbol and normalises it.
 *
 * <pre>
 *   600519      → A_SHARE
 *   00700, HK00700, HK700 (with market HK) → HK "00700"
 *   AAPL        → US
 *   anything else → A_SHARE, logged as unrecognised
 * </pre>
 */
public final class MarketResolver {

    private static final Logger log = LoggerFactory.getLogger(MarketResolver.class);

    private static final Pattern A_SHARE = Pattern.compile("^\\d{6}$");
    private static final Pattern HK_CODE = Pattern.compile("^(HK)?\\d{5}$");
    private static final Pattern US_TICKER = Pattern.compile("^[A-Z]{1,5}$");

    private MarketResolver() {}

    public static Market detect(String rawSymbol) {
        String code = clean(rawSymbol);
        if (A_SHARE.matcher(code).matches()) return Market.A_SHARE;
        if (HK_CODE.matcher(code).matches()) return Market.HK;
        if (US_TICKER.matcher(code).matches()) return Market.US;
        log.warn("[MarketResolver] Unrecognised symbol format, assuming A_SHARE. symbol={}", code);
        return Market.A_SHARE;
    }

    /**
     * @param market explicit market, or {@code null} to detect it
     * @throws ValidationException if the symbol is blank
     */
    public static ResolvedSymbol resolve(String rawSymbol, Market market) {
        String code = clean(rawSymbol);
        Market resolved = market != null ? market : detect(code);
        if (resolved == Market.HK) {
            if (code.startsWith("HK")) code = code.substring(2);
            if (code.isEmpty()) throw new ValidationException("Empty Hong Kong stock code: " + rawSymbol);
            if (code.length() < 5) code = "0".repeat(5 - code.length()) + code;
        }
        return new ResolvedSymbol(code, resolved);
    }

    private static String clean(String rawSymbol) {
        if (rawSymbol == null || rawSymbol.isBlank()) {
            throw new ValidationException("Symbol must not be blank");
        }
        return rawSymbol.strip().toUpperCase(Locale.ROOT);
    }
}
