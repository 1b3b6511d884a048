package com.aisignal.db;

import com.aisignal.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Opens PostgreSQL connections for the article store. Connections start in the configured schema,
 * so mapper SQL never qualifies table names.
 */
public final class Database {
    private static final Logger log = LogManager.getLogger(Database.class);
    private static final Pattern SCHEMA_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern URL_PASSWORD = Pattern.compile("(?i)(password=)[^&]+");
    private static final Pattern URL_USERINFO = Pattern.compile("(://[^:/@]+:)[^@]+(@)");
    static final String DEFAULT_SCHEMA = "aisignal";

    private final PGSimpleDataSource dataSource = new PGSimpleDataSource();
    private final String jdbcUrl;
    private final String schema;

    public Database(String jdbcUrl, String user, String pass, String schema) {
        String url = jdbcUrl == null ? "" : jdbcUrl.trim();
        if (!url.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.url must be a PostgreSQL JDBC URL, got '" + mask(url) + "'");
        }
        this.jdbcUrl = url;
        this.schema = normalizeSchema(schema);

        dataSource.setUrl(url);
        if (user != null && !user.isBlank()) {
            dataSource.setUser(user.trim());
        }
        if (pass != null) {
            dataSource.setPassword(pass);
        }
        // search_path is schema first, then public for extensions
        dataSource.setCurrentSchema(this.schema + ",public");
        dataSource.setApplicationName("aisignal");
        dataSource.setConnectTimeout(10);
    }

    /**
     * Reads {@code db.url}, {@code db.user}, {@code db.pass} and {@code db.schema}.
     *
     * @throws IllegalArgumentException for a non-PostgreSQL URL or an unsafe schema name
     */
    public static Database fromConfig(Config config) {
        return new Database(
                config.getString("db.url"),
                config.getString("db.user"),
                config.getString("db.pass"),
                config.getString("db.schema", DEFAULT_SCHEMA)
        );
    }

    /**
     * @throws SQLException with a short failure hint (auth, unreachable, missing_database) in the message
     */
    public Connection connect() throws SQLException {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            String message = "cannot open article store at " + maskedJdbcUrl()
                    + " (" + failureHint(e.getMessage()) + "): " + e.getMessage();
            log.error(message);
            throw new SQLException(message, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    public String schema() {
        return schema;
    }

    /** JDBC URL with any password replaced by {@code ***}, safe to log. */
    public String maskedJdbcUrl() {
        return mask(jdbcUrl);
    }

    static String normalizeSchema(String raw) {
        String value = raw == null || raw.isBlank() ? DEFAULT_SCHEMA : raw.trim();
        if (!SCHEMA_NAME.matcher(value).matches()) {
            throw new IllegalArgumentException("db.schema '" + value + "' is not a plain SQL identifier");
        }
        return value;
    }

    static String failureHint(String message) {
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (msg.contains("password authentication failed") || msg.contains("permission denied")) {
            return "auth";
        }
        if (msg.contains("connection refused") || msg.contains("timed out")) {
            return "unreachable";
        }
        if (msg.contains("does not exist")) {
            return "missing_database";
        }
        return "connection_error";
    }

    private static String mask(String url) {
        String out = URL_PASSWORD.matcher(url).replaceAll("$1***");
        return URL_USERINFO.matcher(out).replaceAll("$1***$2");
    }
}
