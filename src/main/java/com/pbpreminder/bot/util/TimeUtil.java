package com.pbpreminder.bot.util;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.util.Locale;

public final class TimeUtil {
    private TimeUtil() {}

    public static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE; // yyyy-MM-dd
    public static final DateTimeFormatter LONG_DATE = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);

    public static double hoursSince(Instant now, Instant then) {
        return Duration.between(then, now).toSeconds() / 3600.0;
    }

    public static double daysSince(Instant now, Instant then) {
        return Duration.between(then, now).toSeconds() / 86400.0;
    }

    public static boolean elapsed(Instant last, Duration interval, Instant now) {
        if (last == null) return true;
        return Duration.between(last, now).compareTo(interval) >= 0;
    }

    public static LocalDate parseDate(String iso) {
        return LocalDate.parse(iso, DATE);
    }

    public static String fmtDate(Instant t, ZoneId zone) {
        return t.atZone(zone).toLocalDate().format(DATE);
    }

    public static String fmtLong(LocalDate d) {
        return d.format(LONG_DATE);
    }

    public static String isoWeekKey(LocalDate d) {
        int year = d.get(IsoFields.WEEK_BASED_YEAR);
        int week = d.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        return String.format(Locale.ROOT, "%d-W%02d", year, week);
    }

    public static int isoWeek(Instant t, ZoneId zone) {
        return t.atZone(zone).toLocalDate().get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }

    public static String fmtElapsed(double hours) {
        if (hours < 1) return Math.round(hours * 60) + "m";
        if (hours < 24) return ((int) hours) + "h";
        int days = (int) (hours / 24);
        int rem = (int) (hours % 24);
        return days + "d " + rem + "h";
    }
}
