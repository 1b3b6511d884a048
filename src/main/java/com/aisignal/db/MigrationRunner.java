package com.aisignal.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Brings the article store up to {@link #TARGET_VERSION}.
 *
 * <p>Each step runs in its own transaction and bumps {@code schema_version} in the {@code metadata}
 * table when it commits, so a failed run resumes from the last completed step. All DDL is
 * {@code IF NOT EXISTS} and safe to replay against a store created before versioning.</p>
 */
public final class MigrationRunner {
    private static final Logger log = LogManager.getLogger(MigrationRunner.class);

    static final List<Step> STEPS = List.of(
            new Step(1, "article, subscriber and digest_log tables", List.of(
                    "CREATE TABLE IF NOT EXISTS article ("
                            + "id TEXT PRIMARY KEY,"
                            + "title TEXT NOT NULL,"
                            + "url TEXT NOT NULL,"
                            + "source TEXT NULL,"
                            + "published_at TIMESTAMPTZ NULL,"
                            + "body_text TEXT NULL,"
                            + "author TEXT NULL,"
                            + "tags_json TEXT NOT NULL DEFAULT '[]',"
                            + "rank_score BIGINT NOT NULL DEFAULT 0,"
                            + "summary TEXT NULL,"
                            + "category TEXT NOT NULL DEFAULT 'Industry News',"
                            + "relevance_score INTEGER NOT NULL DEFAULT 5,"
                            + "is_product_or_tool BOOLEAN NOT NULL DEFAULT FALSE,"
                            + "product_name TEXT NOT NULL DEFAULT '',"
                            + "competitors_json TEXT NOT NULL DEFAULT '[]',"
                            + "competitive_advantage TEXT NOT NULL DEFAULT '',"
                            + "fetched_at TIMESTAMPTZ NOT NULL DEFAULT now(),"
                            + "updated_at TIMESTAMPTZ NOT NULL DEFAULT now())",
                    "CREATE TABLE IF NOT EXISTS subscriber ("
                            + "id BIGSERIAL PRIMARY KEY,"
                            + "email TEXT NOT NULL UNIQUE,"
                            + "name TEXT NULL,"
                            + "active BOOLEAN NOT NULL DEFAULT TRUE,"
                            + "categories_json TEXT NOT NULL DEFAULT '[]',"
                            + "min_relevance INTEGER NOT NULL DEFAULT 5,"
                            + "created_at TIMESTAMPTZ NOT NULL DEFAULT now())",
                    "CREATE TABLE IF NOT EXISTS digest_log ("
                            + "id BIGSERIAL PRIMARY KEY,"
                            + "sent_at TIMESTAMPTZ NOT NULL DEFAULT now(),"
                            + "recipient_email TEXT NOT NULL,"
                            + "article_count INTEGER NOT NULL DEFAULT 0,"
                            + "status TEXT NOT NULL,"
                            + "error TEXT NULL)")),
            new Step(2, "listing and digest indexes", List.of(
                    "CREATE INDEX IF NOT EXISTS idx_article_fetched ON article(fetched_at DESC)",
                    "CREATE INDEX IF NOT EXISTS idx_article_relevance ON article(relevance_score DESC)",
                    "CREATE INDEX IF NOT EXISTS idx_article_category ON article(category)",
                    "CREATE INDEX IF NOT EXISTS idx_digest_log_sent ON digest_log(sent_at DESC)")));

    static final int TARGET_VERSION = STEPS.get(STEPS.size() - 1).version;

    public void run(Database database) throws SQLException {
        String schema = database.schema();
        try (Connection conn = database.connect()) {
            try (Statement st = conn.createStatement()) {
                st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
                st.execute("SET search_path TO " + schema + ", public");
                st.execute("CREATE TABLE IF NOT EXISTS metadata ("
                        + "meta_key TEXT PRIMARY KEY,"
                        + "meta_value TEXT NOT NULL,"
                        + "updated_at TIMESTAMPTZ NOT NULL DEFAULT now())");
            }

            int from = currentVersion(conn);
            List<Step> pending = pendingAfter(from);
            if (pending.isEmpty()) {
                log.debug("schema {} already at version {}", schema, from);
                return;
            }
            for (Step step : pending) {
                apply(conn, step);
            }
            log.info("schema {} migrated from version {} to {}", schema, from, TARGET_VERSION);
        }
    }

    static List<Step> pendingAfter(int version) {
        return STEPS.stream().filter(step -> step.version > version).collect(Collectors.toList());
    }

    private void apply(Connection conn, Step step) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        String current = "";
        try (Statement st = conn.createStatement()) {
            for (String sql : step.statements) {
                current = sql;
                st.execute(sql);
            }
            recordVersion(conn, step.version);
            conn.commit();
            log.info("applied migration {} ({})", step.version, step.description);
        } catch (SQLException e) {
            conn.rollback();
            String detail = "migration " + step.version + " failed at `" + abbreviate(current) + "`: " + e.getMessage();
            log.error(detail);
            throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    private int currentVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key = 'schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return 0;
            }
            String raw = rs.getString(1);
            try {
                return raw == null ? 0 : Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                log.warn("schema_version '{}' is not a number, replaying every migration", raw);
                return 0;
            }
        }
    }

    private void recordVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value) VALUES ('schema_version', ?) "
                        + "ON CONFLICT (meta_key) DO UPDATE SET meta_value = excluded.meta_value, updated_at = now()")) {
            ps.setString(1, String.valueOf(version));
            ps.executeUpdate();
        }
    }

    static String abbreviate(String sql) {
        String oneLine = sql == null ? "" : sql.replaceAll("\\s+", " ").trim();
        if (oneLine.isEmpty()) {
            return "-";
        }
        return oneLine.length() <= 120 ? oneLine : oneLine.substring(0, 117) + "...";
    }

    static final class Step {
        final int version;
        final String description;
        final List<String> statements;

        Step(int version, String description, List<String> statements) {
            this.version = version;
            this.description = description;
            this.statements = statements;
        }
    }
}
