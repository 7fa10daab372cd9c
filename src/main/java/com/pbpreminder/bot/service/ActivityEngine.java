package com.pbpreminder.bot.service;

import com.pbpreminder.bot.check.CheckContext;
import com.pbpreminder.bot.check.CheckOrchestrator;
import com.pbpreminder.bot.config.CampaignConfig;
import com.pbpreminder.bot.config.TopicMapCache;
import com.pbpreminder.bot.config.TopicMaps;
import com.pbpreminder.bot.model.ActivitySnapshot;
import com.pbpreminder.bot.notify.NotificationSink;
import com.pbpreminder.bot.store.SnapshotStore;
import com.pbpreminder.bot.telegram.InboundUpdate;
import com.pbpreminder.bot.telegram.UpdateSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public final class ActivityEngine {
    private static final Logger log = LoggerFactory.getLogger(ActivityEngine.class);

    private final SnapshotStore store;
    private final UpdateSource source;
    private final NotificationSink sink;
    private final CheckOrchestrator orchestrator;
    private final TopicMapCache topicMaps;
    private final Clock clock;

    public ActivityEngine(SnapshotStore store, UpdateSource source, NotificationSink sink,
                          CheckOrchestrator orchestrator, TopicMapCache topicMaps, Clock clock) {
        this.store = store;
        this.source = source;
        this.sink = sink;
        this.orchestrator = orchestrator;
        this.topicMaps = topicMaps;
        this.clock = clock;
    }

    public int runOnce(CampaignConfig cfg) {
        ActivitySnapshot snap = store.load();
        log.info("Loaded state. Offset: {}, {} topics, {} players",
                snap.offset, snap.topics.size(), snap.allPlayers().size());

        Instant now = Instant.now(clock);
        TopicMaps maps = topicMaps.get(cfg);
        int failed = 0;
        try {
            List<InboundUpdate> updates = source.fetch(snap.offset);
            log.info("Received {} new updates", updates.size());
            if (!updates.isEmpty()) {
                new EventProcessor(cfg, maps, sink).process(snap, updates, now);
            }

            failed = orchestrator.runAll(new CheckContext(snap, cfg, maps, now, sink));
            snap.pruneTimestamps(now.minus(Duration.ofDays(cfg.settings().retentionDays())));
        } finally {
            store.save(snap);
        }
        log.info("Done ({} failed checks)", failed);
        return failed;
    }
}
