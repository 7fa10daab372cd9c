package com.pbpreminder.bot.config;

public final class TopicMapCache {

    private long version = -1;
    private TopicMaps maps;

    public synchronized TopicMaps get(CampaignConfig cfg) {
        if (maps == null || version != cfg.version()) {
            maps = TopicMaps.build(cfg);
            version = cfg.version();
        }
        return maps;
    }
}
