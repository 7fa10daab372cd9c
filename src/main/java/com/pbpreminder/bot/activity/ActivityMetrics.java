package com.pbpreminder.bot.activity;

import com.pbpreminder.bot.model.ActivitySnapshot;
import com.pbpreminder.bot.model.PlayerKey;
import com.pbpreminder.bot.model.PostDayRun;
import com.pbpreminder.bot.util.TimeUtil;

import java.time.*;
import java.util.*;

public final class ActivityMetrics {

    private ActivityMetrics() {}

    // Timestamps in [after, before); a null before leaves the window open.
    public static List<Instant> window(Collection<Instant> timestamps, Instant after, Instant before) {
        List<Instant> out = new ArrayList<>();
        for (Instant t : timestamps) {
            if (t.isBefore(after)) continue;
            if (before != null && !t.isBefore(before)) continue;
            out.add(t);
        }
        return out;
    }

    public static int countIn(Collection<Instant> timestamps, Instant after, Instant before) {
        return window(timestamps, after, before).size();
    }

    // Sessions started in [after, before).
    public static List<Instant> sessionsIn(Collection<Instant> timestamps, Instant after, Instant before,
                                           Duration burstWindow) {
        return SessionNormalizer.sessions(window(timestamps, after, before), burstWindow);
    }

    /**
     * Mean of consecutive deltas in hours. Empty below two points: there is no gap to speak of,
     * which is different from a gap of zero.
     */
    public static OptionalDouble avgGapHours(List<Instant> sorted) {
        if (sorted == null || sorted.size() < 2) return OptionalDouble.empty();
        double sum = 0;
        for (int i = 1; i < sorted.size(); i++) {
            sum += Duration.between(sorted.get(i - 1), sorted.get(i)).toSeconds() / 3600.0;
        }
        return OptionalDouble.of(sum / (sorted.size() - 1));
    }

    /**
     * Consecutive calendar days with at least one post, counted back from the latest post day.
     * Zero when the latest post day is before yesterday.
     */
    public static int streak(Collection<Instant> timestamps, Instant now, ZoneId zone) {
        return streak(timestamps, null, now, zone);
    }

    // Same as above, with days older than the retained timestamps supplied by saved.
    public static int streak(Collection<Instant> timestamps, PostDayRun saved, Instant now, ZoneId zone) {
        Optional<PostDayRun> run = latestRun(timestamps, saved, zone);
        if (run.isEmpty()) return 0;
        LocalDate today = now.atZone(zone).toLocalDate();
        if (run.get().last().isBefore(today.minusDays(1))) return 0;
        return (int) (run.get().lastDay - run.get().firstDay + 1);
    }

    public static int streak(ActivitySnapshot snap, PlayerKey key, Instant now, ZoneId zone) {
        return streak(snap.timestamps(key), snap.postRun(key).orElse(null), now, zone);
    }

    // Latest unbroken run of post days over timestamps and the previously saved run.
    public static Optional<PostDayRun> latestRun(Collection<Instant> timestamps, PostDayRun saved, ZoneId zone) {
        TreeSet<LocalDate> days = new TreeSet<>();
        if (timestamps != null) {
            for (Instant t : timestamps) days.add(t.atZone(zone).toLocalDate());
        }
        if (saved != null) {
            for (long d = saved.firstDay; d <= saved.lastDay; d++) days.add(LocalDate.ofEpochDay(d));
        }
        if (days.isEmpty()) return Optional.empty();

        LocalDate last = days.last();
        LocalDate first = last;
        while (days.contains(first.minusDays(1))) first = first.minusDays(1);
        return Optional.of(PostDayRun.of(first, last));
    }

    // byUser: userId to raw timestamps
    public static PaceSplit paceSplit(Map<Long, List<Instant>> byUser, Set<Long> gmIds, Instant now,
                                      Duration burstWindow) {
        Instant weekAgo = now.minus(Duration.ofDays(7));
        Instant twoWeeksAgo = now.minus(Duration.ofDays(14));
        int gmThis = 0, gmLast = 0, plThis = 0, plLast = 0;
        for (Map.Entry<Long, List<Instant>> e : byUser.entrySet()) {
            int thisWeek = sessionsIn(e.getValue(), weekAgo, null, burstWindow).size();
            int lastWeek = sessionsIn(e.getValue(), twoWeeksAgo, weekAgo, burstWindow).size();
            if (gmIds.contains(e.getKey())) {
                gmThis += thisWeek;
                gmLast += lastWeek;
            } else {
                plThis += thisWeek;
                plLast += lastWeek;
            }
        }
        return new PaceSplit(gmThis, plThis, gmLast, plLast);
    }

    public static Optional<Instant> latest(Collection<List<Instant>> series) {
        Instant max = null;
        for (List<Instant> s : series) {
            for (Instant t : s) {
                if (max == null || t.isAfter(max)) max = t;
            }
        }
        return Optional.ofNullable(max);
    }

    // --- formatting ---

    // "N/A", "42 minutes" or "5.3 hours".
    public static String fmtGap(OptionalDouble hours) {
        if (hours.isEmpty()) return "N/A";
        double h = hours.getAsDouble();
        if (h < 1) return String.format(Locale.ROOT, "%.0f minutes", h * 60);
        return String.format(Locale.ROOT, "%.1f hours", h);
    }

    // Compact "5.3h" or "N/A".
    public static String fmtGapShort(OptionalDouble hours) {
        if (hours.isEmpty()) return "N/A";
        return String.format(Locale.ROOT, "%.1fh", hours.getAsDouble());
    }

    // "today", "5h ago", "yesterday", "3d ago" or "never".
    public static String fmtBriefRelative(Instant now, Instant then) {
        if (then == null) return "never";
        double days = TimeUtil.daysSince(now, then);
        if (days < 0.04) return "today";
        if (days < 1) return ((int) (days * 24)) + "h ago";
        if (days < 2) return "yesterday";
        return ((int) days) + "d ago";
    }

    // "today (2026-02-10)", "yesterday (...)" or "5d ago (...)".
    public static String fmtRelativeDate(Instant now, Instant then, ZoneId zone) {
        int daysAgo = (int) TimeUtil.daysSince(now, then);
        String date = TimeUtil.fmtDate(then, zone);
        if (daysAgo == 0) return "today (" + date + ")";
        if (daysAgo == 1) return "yesterday (" + date + ")";
        return daysAgo + "d ago (" + date + ")";
    }

    public static String posts(long n) {
        return n == 1 ? "1 post" : n + " posts";
    }

    public static String plural(long n, String word) {
        return n == 1 ? n + " " + word : n + " " + word + "s";
    }
}
