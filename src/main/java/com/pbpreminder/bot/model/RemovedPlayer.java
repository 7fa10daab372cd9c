package com.pbpreminder.bot.model;

import java.time.Instant;

public final class RemovedPlayer {
    public Instant removedAt;
    public String firstName;
    public String username = "";
    public String campaignName;
}
