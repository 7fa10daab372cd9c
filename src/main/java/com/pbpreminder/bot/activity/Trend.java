package com.pbpreminder.bot.activity;

public enum Trend {
    NO_DATA("💤"),
    NEW("🆕"),
    UP("📈"),
    DOWN("📉"),
    STEADY("➡️");

    // percent bounds; integer math keeps 115 vs 100 exactly on the boundary
    private static final long UP_PERCENT = 115;
    private static final long DOWN_PERCENT = 85;

    private final String icon;

    Trend(String icon) {
        this.icon = icon;
    }

    public String icon() {
        return icon;
    }

    public static Trend classify(long recent, long previous) {
        if (previous == 0 && recent == 0) return NO_DATA;
        if (previous == 0) return NEW;
        if (recent * 100 > previous * UP_PERCENT) return UP;
        if (recent * 100 < previous * DOWN_PERCENT) return DOWN;
        return STEADY;
    }
}
