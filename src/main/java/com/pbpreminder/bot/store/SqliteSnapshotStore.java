package com.pbpreminder.bot.store;

import com.google.gson.JsonParseException;
import com.pbpreminder.bot.db.Database;
import com.pbpreminder.bot.model.ActivitySnapshot;
import com.pbpreminder.bot.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Instant;

public final class SqliteSnapshotStore implements SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteSnapshotStore.class);

    private final Database db;
    private final Clock clock;

    public SqliteSnapshotStore(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public ActivitySnapshot load() {
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT json FROM snapshot WHERE id=1")) {
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        log.info("No stored snapshot, starting fresh");
                        return new ActivitySnapshot();
                    }
                    ActivitySnapshot s = JsonUtils.GSON.fromJson(rs.getString(1), ActivitySnapshot.class);
                    return s == null ? new ActivitySnapshot() : s.backfill();
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load snapshot from " + db.path(), e);
        } catch (JsonParseException e) {
            throw new IllegalStateException("Stored snapshot is not valid JSON", e);
        }
    }

    @Override
    public void save(ActivitySnapshot snapshot) {
        String json = JsonUtils.GSON.toJson(snapshot);
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO snapshot(id, json, saved_at) VALUES(1,?,?) " +
                            "ON CONFLICT(id) DO UPDATE SET json=excluded.json, saved_at=excluded.saved_at"
            )) {
                ps.setString(1, json);
                ps.setString(2, Instant.now(clock).toString());
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to save snapshot to " + db.path(), e);
        }
        log.debug("Saved snapshot ({} chars)", json.length());
    }
}
