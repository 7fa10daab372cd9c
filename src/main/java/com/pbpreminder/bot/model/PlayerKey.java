package com.pbpreminder.bot.model;

public record PlayerKey(long campaignId, long userId) {

    public static PlayerKey of(long campaignId, long userId) {
        return new PlayerKey(campaignId, userId);
    }
}
