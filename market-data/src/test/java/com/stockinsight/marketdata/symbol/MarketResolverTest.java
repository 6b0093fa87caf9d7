package com.stockinsight.marketdata.symbol;

import com.stockinsight.common.exception.ValidationException;
import com.stockinsight.common.model.Market;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MarketResolverTest {

    @Test
    @DisplayName("detects market from the code format")
    void detect() {
        assertEquals(Market.A_SHARE, MarketResolver.detect("600519"));
        assertEquals(Market.HK, MarketResolver.detect("00700"));
        assertEquals(Market.HK, MarketResolver.detect("hk00700"));
        assertEquals(Market.US, MarketResolver.detect(" aapl "));
        assertEquals(Market.A_SHARE, MarketResolver.detect("BRK.B"));
    }

    @Test
    @DisplayName("HK codes lose the prefix and are zero-padded to five digits")
    void normaliseHk() {
        assertEquals(new ResolvedSymbol("00700", Market.HK), MarketResolver.resolve("HK700", Market.HK));
        assertEquals(new ResolvedSymbol("00700", Market.HK), MarketResolver.resolve("HK00700", null));
        assertEquals("HK:00700", MarketResolver.resolve("700", Market.HK).cacheKey());
    }

    @Test
    @DisplayName("explicit market wins over detection")
    void explicitMarket() {
        assertEquals(Market.US, MarketResolver.resolve("600519", Market.US).market());
    }

    @Test
    @DisplayName("blank symbol → ValidationException")
    void blank() {
        assertThrows(ValidationException.class, () -> MarketResolver.resolve("  ", null));
        assertThrows(ValidationException.class, () -> MarketResolver.resolve(null, Market.US));
    }
}
