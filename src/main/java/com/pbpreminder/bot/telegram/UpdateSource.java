package com.pbpreminder.bot.telegram;

import java.util.List;

public interface UpdateSource {

    List<InboundUpdate> fetch(long offset);
}
