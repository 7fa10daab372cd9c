package com.pbpreminder.bot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

public final class Config {
    private static final Logger log = LoggerFactory.getLogger(Config.class);

    private final String botToken;
    private final Path dbPath;
    private final Path campaignsPath;
    private final int maxMessageLen;
    private final int fetchLimit;
    private final ZoneId zoneOverride;

    private Config(
            String botToken,
            Path dbPath,
            Path campaignsPath,
            int maxMessageLen,
            int fetchLimit,
            ZoneId zoneOverride
    ) {
        this.botToken = Objects.requireNonNull(botToken);
        this.dbPath = Objects.requireNonNull(dbPath);
        this.campaignsPath = Objects.requireNonNull(campaignsPath);
        this.maxMessageLen = maxMessageLen;
        this.fetchLimit = fetchLimit;
        this.zoneOverride = zoneOverride;
    }

    public static Config load() {
        String botToken = get("BOT_TOKEN", "");
        String dbPath = get("DB_PATH", "./data/pbp_state.db");
        String campaignsPath = get("CAMPAIGNS_PATH", "./config.json");
        int maxLen = getInt("MAX_MESSAGE_LEN", 4000);
        int fetchLimit = getInt("FETCH_LIMIT", 100);
        ZoneId zone = getZone("BOT_TIMEZONE");

        if (botToken.isBlank()) {
            log.warn("BOT_TOKEN is empty. Set env BOT_TOKEN or VM option -DBOT_TOKEN=...");
        }

        return new Config(botToken, Path.of(dbPath), Path.of(campaignsPath), maxLen, fetchLimit, zone);
    }

    private static String get(String key, String def) {
        String env = System.getenv(key);
        if (env != null && !env.isBlank()) return env;
        String prop = System.getProperty(key);
        if (prop != null && !prop.isBlank()) return prop;
        return def;
    }

    private static int getInt(String key, int def) {
        String v = get(key, "");
        if (v.isBlank()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("{}={} is not a number, using {}", key, v, def);
            return def;
        }
    }

    private static ZoneId getZone(String key) {
        String v = get(key, "");
        if (v.isBlank()) return null;
        try {
            return ZoneId.of(v.trim());
        } catch (DateTimeException e) {
            log.warn("{}={} is not a valid time zone, ignoring", key, v);
            return null;
        }
    }

    public String botToken() { return botToken; }
    public Path dbPath() { return dbPath; }
    public Path campaignsPath() { return campaignsPath; }
    public int maxMessageLen() { return maxMessageLen; }
    public int fetchLimit() { return fetchLimit; }
    public Optional<ZoneId> zoneOverride() { return Optional.ofNullable(zoneOverride); }
}
