package com.pbpreminder.bot.activity;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Collapses bursts of raw posts into sessions. A session is anchored at its first post and
 * absorbs every later post no more than the burst window after that anchor.
 */
public final class SessionNormalizer {

    private SessionNormalizer() {}

    public static List<Instant> sessions(Collection<Instant> timestamps, Duration window) {
        List<Instant> out = new ArrayList<>();
        if (timestamps == null || timestamps.isEmpty()) return out;
        List<Instant> sorted = new ArrayList<>(timestamps);
        sorted.sort(null);
        Instant anchor = sorted.get(0);
        out.add(anchor);
        for (int i = 1; i < sorted.size(); i++) {
            Instant t = sorted.get(i);
            if (Duration.between(anchor, t).compareTo(window) > 0) {
                out.add(t);
                anchor = t;
            }
        }
        return out;
    }
}
