package com.pbpreminder.bot.model;

import java.time.LocalDate;

// Latest unbroken run of calendar days with a post, as epoch days. Survives timestamp pruning.
public final class PostDayRun {
    public long firstDay;
    public long lastDay;

    public static PostDayRun of(LocalDate first, LocalDate last) {
        PostDayRun r = new PostDayRun();
        r.firstDay = first.toEpochDay();
        r.lastDay = last.toEpochDay();
        return r;
    }

    public LocalDate first() {
        return LocalDate.ofEpochDay(firstDay);
    }

    public LocalDate last() {
        return LocalDate.ofEpochDay(lastDay);
    }
}
