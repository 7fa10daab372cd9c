package com.pbpreminder.bot.db;

import com.pbpreminder.bot.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final Path path;
    private final String jdbcUrl;

    public Database(Config cfg) throws IOException {
        this(Objects.requireNonNull(cfg).dbPath());
    }

    public Database(Path path) throws IOException {
        this.path = path.toAbsolutePath();
        Path parent = this.path.getParent();
        if (parent != null) Files.createDirectories(parent);
        this.jdbcUrl = "jdbc:sqlite:" + this.path;
    }

    public Connection getConnection() throws SQLException {
        Connection c = DriverManager.getConnection(jdbcUrl);
        try (Statement st = c.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL;");
            st.execute("PRAGMA busy_timeout=5000;");
        } catch (SQLException e) {
            // pragmas are tuning only; the connection is still usable
            log.debug("Could not apply sqlite pragmas to {}: {}", path, e.getMessage());
        }
        return c;
    }

    public Path path() {
        return path;
    }
}
