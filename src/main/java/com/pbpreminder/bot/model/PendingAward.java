package com.pbpreminder.bot.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class PendingAward {
    public int messageId;
    public long winnerUserId;
    public List<String> options = new ArrayList<>();
    public String baseMessage;
    public Instant postedAt;
}
