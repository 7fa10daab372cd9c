package com.pbpreminder.bot.activity;

public record PaceSplit(int gmThisWeek, int playersThisWeek, int gmLastWeek, int playersLastWeek) {

    public int thisWeek() {
        return gmThisWeek + playersThisWeek;
    }

    public int lastWeek() {
        return gmLastWeek + playersLastWeek;
    }

    public boolean isEmpty() {
        return thisWeek() == 0 && lastWeek() == 0;
    }

    public Trend trend() {
        return Trend.classify(thisWeek(), lastWeek());
    }
}
