package com.stockinsight.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FinancialIndicatorSetTest {

    @Test
    @DisplayName("vocabulary has 25 indicators, five per group")
    void vocabulary() {
        assertEquals(25, FinancialIndicator.COUNT);
        for (IndicatorGroup group : IndicatorGroup.values()) {
            long n = java.util.Arrays.stream(FinancialIndicator.values()).filter(i -> i.group() == group).count();
            assertEquals(5, n, group.name());
        }
    }

    @Test
    @DisplayName("null and non-finite values are absent, not zero")
    void dropsInvalidValues() {
        Map<FinancialIndicator, Double> raw = new HashMap<>();
        raw.put(FinancialIndicator.RETURN_ON_EQUITY, 18.5);
        raw.put(FinancialIndicator.PE_RATIO, Double.NaN);
        raw.put(FinancialIndicator.DEBT_RATIO, null);
        raw.put(FinancialIndicator.PB_RATIO, Double.POSITIVE_INFINITY);

        FinancialIndicatorSet set = FinancialIndicatorSet.of("600519", raw);

        assertEquals(1, set.presentCount());
        assertEquals(18.5, set.get(FinancialIndicator.RETURN_ON_EQUITY).getAsDouble());
        assertTrue(set.get(FinancialIndicator.PE_RATIO).isEmpty());
        assertFalse(set.isPresent(FinancialIndicator.DEBT_RATIO));
    }

    @Test
    @DisplayName("values() is unmodifiable")
    void immutable() {
        FinancialIndicatorSet set = FinancialIndicatorSet.of("AAPL", Map.of(FinancialIndicator.GROSS_MARGIN, 40.0));
        assertThrows(UnsupportedOperationException.class,
            () -> set.values().put(FinancialIndicator.PE_RATIO, 10.0));
    }
}
