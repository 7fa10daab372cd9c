package com.pbpreminder.bot.ranking;

import com.pbpreminder.bot.activity.ActivityMetrics;
import com.pbpreminder.bot.config.Settings;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

public final class AwardSelector {

    static final Comparator<AwardCandidate> ORDER = Comparator
            .comparingDouble(AwardCandidate::avgGapHours)
            .thenComparingLong(AwardCandidate::userId);

    private AwardSelector() {}

    public static List<AwardCandidate> candidates(Map<Long, List<Instant>> byUser, Set<Long> gmIds,
                                                  Instant now, Settings settings) {
        Instant weekAgo = now.minus(Duration.ofDays(7));
        List<AwardCandidate> out = new ArrayList<>();
        for (Map.Entry<Long, List<Instant>> e : byUser.entrySet()) {
            if (gmIds.contains(e.getKey())) continue;
            List<Instant> sessions = ActivityMetrics.sessionsIn(e.getValue(), weekAgo, null, settings.burstWindow());
            if (sessions.size() < settings.awardMinSessions()) continue;
            double gap = ActivityMetrics.avgGapHours(sessions).orElse(Double.POSITIVE_INFINITY);
            out.add(new AwardCandidate(e.getKey(), sessions.size(), gap));
        }
        out.sort(ORDER);
        return out;
    }

    public static Optional<AwardCandidate> select(Map<Long, List<Instant>> byUser, Set<Long> gmIds,
                                                  Instant now, Settings settings) {
        List<AwardCandidate> c = candidates(byUser, gmIds, now, settings);
        return c.isEmpty() ? Optional.empty() : Optional.of(c.get(0));
    }
}
