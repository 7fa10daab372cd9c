package com.pbpreminder.bot.ranking;

public record PlayerTally(long userId, String fullName, String username, int sessions, int campaigns) {

    PlayerTally plus(PlayerTally other) {
        return new PlayerTally(userId, fullName, username, sessions + other.sessions, campaigns + other.campaigns);
    }
}
