package com.pbpreminder.bot.activity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TrendTest {

    @Test
    void noDataAndNew() {
        assertEquals(Trend.NO_DATA, Trend.classify(0, 0));
        assertEquals(Trend.NEW, Trend.classify(5, 0));
    }

    @Test
    void fifteenPercentBandIsSteady() {
        assertEquals(Trend.STEADY, Trend.classify(115, 100));
        assertEquals(Trend.UP, Trend.classify(116, 100));
        assertEquals(Trend.STEADY, Trend.classify(85, 100));
        assertEquals(Trend.DOWN, Trend.classify(84, 100));
        assertEquals(Trend.DOWN, Trend.classify(0, 3));
    }

    @Test
    void paceSplitTrendUsesTotals() {
        PaceSplit split = new PaceSplit(2, 10, 1, 5);
        assertEquals(12, split.thisWeek());
        assertEquals(6, split.lastWeek());
        assertEquals(Trend.UP, split.trend());
        assertEquals("📈", split.trend().icon());
    }
}
