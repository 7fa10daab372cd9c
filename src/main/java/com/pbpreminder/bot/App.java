package com.pbpreminder.bot;

import com.pbpreminder.bot.check.BoonCatalog;
import com.pbpreminder.bot.check.CheckOrchestrator;
import com.pbpreminder.bot.config.CampaignConfig;
import com.pbpreminder.bot.config.Config;
import com.pbpreminder.bot.config.TopicMapCache;
import com.pbpreminder.bot.db.Database;
import com.pbpreminder.bot.db.Schema;
import com.pbpreminder.bot.service.ActivityEngine;
import com.pbpreminder.bot.store.ArchiveRepository;
import com.pbpreminder.bot.store.SqliteSnapshotStore;
import com.pbpreminder.bot.telegram.TelegramGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Random;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        Config cfg = Config.load();
        if (cfg.botToken().isBlank()) {
            log.error("BOT_TOKEN not set");
            System.exit(1);
        }

        CampaignConfig campaigns = CampaignConfig.load(cfg.campaignsPath());
        if (cfg.zoneOverride().isPresent()) {
            campaigns = campaigns.withSettings(campaigns.settings().withZone(cfg.zoneOverride().get()));
        }
        List<String> issues = campaigns.validate();
        for (String issue : issues) {
            if (issue.startsWith("ERROR:")) log.error(issue);
            else log.warn(issue);
        }
        if (issues.stream().anyMatch(i -> i.startsWith("ERROR:"))) {
            log.error("Fatal config errors found, aborting");
            System.exit(1);
        }

        log.info("DB path={}, campaigns={}", cfg.dbPath().toAbsolutePath(), campaigns.campaigns().size());
        Database db = new Database(cfg);
        Schema.migrate(db);

        Clock clock = Clock.systemUTC();
        TelegramGateway gateway = new TelegramGateway(cfg);
        ActivityEngine engine = new ActivityEngine(
                new SqliteSnapshotStore(db, clock),
                gateway,
                gateway,
                CheckOrchestrator.standard(new Random(), BoonCatalog.fromClasspath(), new ArchiveRepository(db)),
                new TopicMapCache(),
                clock
        );
        engine.runOnce(campaigns);
    }
}
