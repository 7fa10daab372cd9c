package com.pbpreminder.bot.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public final class Schema {

    private Schema() {}

    public static void migrate(Database db) throws SQLException {
        try (Connection c = db.getConnection()) {
            try (Statement st = c.createStatement()) {

                // The whole activity snapshot is a single JSON document in row id=1.
                st.execute("CREATE TABLE IF NOT EXISTS snapshot (" +
                        "id INTEGER PRIMARY KEY CHECK (id = 1)," +
                        "json TEXT NOT NULL," +
                        "saved_at TEXT NOT NULL" +
                        ");");

                st.execute("CREATE TABLE IF NOT EXISTS weekly_archive (" +
                        "campaign_id INTEGER NOT NULL," +
                        "week TEXT NOT NULL," +
                        "campaign TEXT NOT NULL," +
                        "gm_posts INTEGER NOT NULL DEFAULT 0," +
                        "player_posts INTEGER NOT NULL DEFAULT 0," +
                        "total_posts INTEGER NOT NULL DEFAULT 0," +
                        "player_avg_gap_h REAL," +
                        "active_players INTEGER NOT NULL DEFAULT 0," +
                        "top_players TEXT NOT NULL DEFAULT '{}'," +
                        "archived_at TEXT NOT NULL," +
                        "PRIMARY KEY(campaign_id, week)" +
                        ");");

                st.execute("CREATE INDEX IF NOT EXISTS idx_weekly_archive_week ON weekly_archive(week);");
            }
        }
    }
}
