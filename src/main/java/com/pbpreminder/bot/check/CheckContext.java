package com.pbpreminder.bot.check;

import com.pbpreminder.bot.config.CampaignConfig;
import com.pbpreminder.bot.config.Feature;
import com.pbpreminder.bot.config.Settings;
import com.pbpreminder.bot.config.TopicMaps;
import com.pbpreminder.bot.model.ActivitySnapshot;
import com.pbpreminder.bot.model.DebounceLedger;
import com.pbpreminder.bot.model.PlayerRecord;
import com.pbpreminder.bot.notify.NotificationSink;

import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record CheckContext(
        ActivitySnapshot snapshot,
        CampaignConfig config,
        TopicMaps maps,
        Instant now,
        NotificationSink sink
) {

    public Settings settings() {
        return config.settings();
    }

    public ZoneId zone() {
        return config.settings().zone();
    }

    public DebounceLedger ledger() {
        return snapshot.ledger;
    }

    public boolean send(long threadId, String html) {
        return sink.send(config.groupId(), threadId, html);
    }

    public Map<Long, Long> campaigns(Feature feature) {
        Map<Long, Long> out = new LinkedHashMap<>();
        for (Map.Entry<Long, Long> e : maps.chatTopics().entrySet()) {
            if (config.featureEnabled(e.getKey(), feature)) out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    public List<PlayerRecord> players(long campaignId) {
        return snapshot.playersIn(campaignId);
    }
}
