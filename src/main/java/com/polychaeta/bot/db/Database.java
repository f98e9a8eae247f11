package com.polychaeta.bot.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final String jdbcUrl;

    public Database(String dbPath) {
        this.jdbcUrl = "jdbc:sqlite:" + dbPath;
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode = WAL;");
            // accepted jobs must survive a crash right after schedule() returns
            st.execute("PRAGMA synchronous = FULL;");
            st.execute("PRAGMA busy_timeout = 5000;");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    public void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {

            st.execute("""
                    CREATE TABLE IF NOT EXISTS jobs (
                        id TEXT PRIMARY KEY,
                        run_at INTEGER NOT NULL,
                        action TEXT NOT NULL,
                        args TEXT NOT NULL,
                        created_at INTEGER NOT NULL,
                        updated_at INTEGER NOT NULL
                    );
                    """);

            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_run_at ON jobs(run_at);");

            log.info("SQLite schema initialized ({}).", jdbcUrl);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to init SQLite schema", e);
        }
    }
}
