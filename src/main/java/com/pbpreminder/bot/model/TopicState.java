package com.pbpreminder.bot.model;

import java.time.Instant;

public final class TopicState {
    public Instant lastMessageTime;
    public String lastUser;
    public long lastUserId;
    public String campaignName;
}
