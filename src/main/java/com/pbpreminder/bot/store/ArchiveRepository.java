package com.pbpreminder.bot.store;

import com.google.gson.reflect.TypeToken;
import com.pbpreminder.bot.db.Database;
import com.pbpreminder.bot.util.JsonUtils;

import java.lang.reflect.Type;
import java.sql.*;
import java.time.Instant;
import java.util.*;

public final class ArchiveRepository {

    private static final Type TOP_PLAYERS = new TypeToken<LinkedHashMap<String, Integer>>() {}.getType();

    private final Database db;

    public ArchiveRepository(Database db) {
        this.db = db;
    }

    public void saveWeek(List<WeeklyArchiveRow> rows, Instant now) {
        try (Connection c = db.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT OR REPLACE INTO weekly_archive(campaign_id, week, campaign, gm_posts, player_posts, " +
                            "total_posts, player_avg_gap_h, active_players, top_players, archived_at) " +
                            "VALUES(?,?,?,?,?,?,?,?,?,?)"
            )) {
                for (WeeklyArchiveRow r : rows) {
                    ps.setLong(1, r.campaignId());
                    ps.setString(2, r.week());
                    ps.setString(3, r.campaign());
                    ps.setInt(4, r.gmPosts());
                    ps.setInt(5, r.playerPosts());
                    ps.setInt(6, r.totalPosts());
                    if (r.playerAvgGapHours().isPresent()) {
                        ps.setDouble(7, r.playerAvgGapHours().getAsDouble());
                    } else {
                        ps.setNull(7, Types.REAL);
                    }
                    ps.setInt(8, r.activePlayers());
                    ps.setString(9, JsonUtils.GSON.toJson(r.topPlayers()));
                    ps.setString(10, now.toString());
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to archive week", e);
        }
    }

    public List<WeeklyArchiveRow> listWeek(String week) {
        List<WeeklyArchiveRow> out = new ArrayList<>();
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT * FROM weekly_archive WHERE week=? ORDER BY campaign_id"
            )) {
                ps.setString(1, week);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
        return out;
    }

    private static WeeklyArchiveRow map(ResultSet rs) throws SQLException {
        double gap = rs.getDouble("player_avg_gap_h");
        OptionalDouble avg = rs.wasNull() ? OptionalDouble.empty() : OptionalDouble.of(gap);
        Map<String, Integer> top = JsonUtils.GSON.fromJson(rs.getString("top_players"), TOP_PLAYERS);
        return new WeeklyArchiveRow(
                rs.getLong("campaign_id"),
                rs.getString("week"),
                rs.getString("campaign"),
                rs.getInt("gm_posts"),
                rs.getInt("player_posts"),
                avg,
                rs.getInt("active_players"),
                top == null ? Map.of() : top
        );
    }
}
