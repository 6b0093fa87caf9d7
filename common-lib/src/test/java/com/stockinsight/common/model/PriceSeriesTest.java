package com.stockinsight.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PriceSeriesTest {

    private static final Instant T0 = Instant.parse("2024-01-02T00:00:00Z");

    private static PriceBar bar(int day, double close, long volume) {
        return PriceBar.of(T0.plus(day, ChronoUnit.DAYS), close, close, close, close, volume);
    }

    @Test
    @DisplayName("closes() and volumes() are oldest first")
    void orderedAccessors() {
        PriceSeries series = PriceSeries.of("600519", List.of(bar(0, 10, 100), bar(1, 11, 200), bar(2, 12, 300)));
        assertEquals(List.of(10.0, 11.0, 12.0), series.closes());
        assertEquals(List.of(100L, 200L, 300L), series.volumes());
        assertEquals(12.0, series.latest().close());
    }

    @Test
    @DisplayName("out-of-order bars are rejected")
    void rejectsUnordered() {
        assertThrows(IllegalArgumentException.class,
            () -> PriceSeries.of("AAPL", List.of(bar(1, 10, 1), bar(0, 11, 1))));
    }

    @Test
    @DisplayName("duplicate timestamps are rejected")
    void rejectsDuplicates() {
        assertThrows(IllegalArgumentException.class,
            () -> PriceSeries.of("AAPL", List.of(bar(0, 10, 1), bar(0, 11, 1))));
    }

    @Test
    @DisplayName("null bars → empty series, latest() throws")
    void emptySeries() {
        PriceSeries series = PriceSeries.of("AAPL", null);
        assertTrue(series.isEmpty());
        assertThrows(IllegalStateException.class, series::latest);
    }
}
