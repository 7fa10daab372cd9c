package com.pbpreminder.bot.model;

import java.time.Instant;

public final class PlayerRecord {
    public long userId;
    public long campaignId;
    public String campaignName;

    public String firstName;
    public String lastName = "";
    public String username = "";

    public Instant lastPostTime;

    // Highest inactivity rung already announced, in weeks; 0 when none.
    public int lastWarnedWeek;
    public Instant lastWarnedAt;

    public PlayerKey key() {
        return PlayerKey.of(campaignId, userId);
    }

    public String fullName() {
        String first = firstName == null || firstName.isBlank() ? "Unknown" : firstName;
        if (lastName == null || lastName.isBlank()) return first;
        return first + " " + lastName;
    }

    // "First Last (@username)", or just the full name without a username.
    public String mention() {
        if (username == null || username.isBlank()) return fullName();
        return fullName() + " (@" + username + ")";
    }
}
