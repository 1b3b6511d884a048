package com.aisignal.db;

import com.aisignal.db.mybatis.MyBatisSupport;
import com.aisignal.db.mybatis.SubscriberMapper;
import com.aisignal.db.mybatis.SubscriberRow;
import com.aisignal.model.Subscriber;
import com.aisignal.output.SubscriberDirectory;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * DAO for digest subscribers and the digest send log.
 */
public final class SubscriberDao implements SubscriberDirectory {
    private static final Logger log = LogManager.getLogger(SubscriberDao.class);
    public static final int DEFAULT_MIN_RELEVANCE = 5;

    private final Database database;

    public SubscriberDao(Database database) {
        this.database = database;
    }

    /**
     * Creates the subscriber unless the address is already known; returns the stored row either way.
     */
    public Subscriber create(String name, String email, List<String> categories, int minRelevance) throws SQLException {
        String normalizedEmail = normalizeEmail(email);
        if (!normalizedEmail.contains("@")) {
            throw new IllegalArgumentException("invalid email: " + email);
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            SubscriberMapper mapper = session.getMapper(SubscriberMapper.class);
            int inserted = mapper.insertIfAbsent(
                    normalizedEmail,
                    name == null ? "" : name.trim(),
                    new JSONArray(categories == null ? List.of() : categories).toString(),
                    Math.max(0, Math.min(10, minRelevance))
            );
            if (inserted == 0) {
                log.info("subscriber {} already exists", normalizedEmail);
            }
            return toSubscriber(mapper.findByEmail(normalizedEmail));
        } catch (PersistenceException e) {
            throw ArticleDao.asSqlException("subscriber create failed", e);
        }
    }

    /** Case-insensitive lookup, active or not. */
    public Optional<Subscriber> findByEmail(String email) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            SubscriberRow row = session.getMapper(SubscriberMapper.class).findByEmail(normalizeEmail(email));
            return row == null ? Optional.empty() : Optional.of(toSubscriber(row));
        } catch (PersistenceException e) {
            throw ArticleDao.asSqlException("subscriber lookup failed", e);
        }
    }

    @Override
    public List<Subscriber> listActive() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return toSubscribers(session.getMapper(SubscriberMapper.class).listActive());
        } catch (PersistenceException e) {
            throw ArticleDao.asSqlException("subscriber list failed", e);
        }
    }

    /** Every subscriber including deactivated ones, oldest first. */
    public List<Subscriber> listAll() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return toSubscribers(session.getMapper(SubscriberMapper.class).listAll());
        } catch (PersistenceException e) {
            throw ArticleDao.asSqlException("subscriber list failed", e);
        }
    }

    /**
     * @return true when an active subscriber was switched off
     */
    public boolean deactivate(String email) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(SubscriberMapper.class).deactivate(normalizeEmail(email)) > 0;
        } catch (PersistenceException e) {
            throw ArticleDao.asSqlException("subscriber deactivate failed", e);
        }
    }

    /**
     * Creates every {@code Name:email} entry of a comma separated seed list; malformed entries are
     * logged and skipped.
     */
    public int seed(String seedList) throws SQLException {
        int created = 0;
        for (SeedEntry entry : parseSeed(seedList)) {
            create(entry.name, entry.email, List.of(), DEFAULT_MIN_RELEVANCE);
            created++;
        }
        return created;
    }

    /**
     * Appends one row to {@code digest_log}; {@code error} may be null for a sent message.
     */
    @Override
    public void logDigest(String email, int articleCount, String status, String error) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            session.getMapper(SubscriberMapper.class).insertDigestLog(
                    normalizeEmail(email),
                    Math.max(0, articleCount),
                    status == null ? "" : status,
                    error
            );
        } catch (PersistenceException e) {
            throw ArticleDao.asSqlException("digest log insert failed", e);
        }
    }

    static List<SeedEntry> parseSeed(String seedList) {
        List<SeedEntry> out = new ArrayList<>();
        if (seedList == null || seedList.isBlank()) {
            return out;
        }
        for (String raw : seedList.split(",")) {
            String entry = raw.trim();
            if (entry.isEmpty()) {
                continue;
            }
            int colon = entry.indexOf(':');
            String name = colon > 0 ? entry.substring(0, colon).trim() : "";
            String email = colon >= 0 ? entry.substring(colon + 1).trim() : entry;
            if (!email.contains("@")) {
                log.warn("ignoring malformed subscriber seed entry '{}'", entry);
                continue;
            }
            out.add(new SeedEntry(name.isEmpty() ? email.substring(0, email.indexOf('@')) : name, email));
        }
        return out;
    }

    private static List<Subscriber> toSubscribers(List<SubscriberRow> rows) {
        List<Subscriber> out = new ArrayList<>();
        if (rows != null) {
            for (SubscriberRow row : rows) {
                out.add(toSubscriber(row));
            }
        }
        return out;
    }

    private static Subscriber toSubscriber(SubscriberRow row) {
        if (row == null) {
            return null;
        }
        return Subscriber.builder()
                .id(row.getId())
                .email(row.getEmail())
                .name(row.getName())
                .active(row.isActive())
                .categories(readCategories(row.getCategoriesJson()))
                .minRelevance(row.getMinRelevance())
                .build();
    }

    static List<String> readCategories(String json) {
        List<String> out = new ArrayList<>();
        try {
            JSONArray array = new JSONArray(json == null || json.isBlank() ? "[]" : json);
            for (int i = 0; i < array.length(); i++) {
                String category = array.optString(i, "").trim();
                if (!category.isEmpty()) {
                    out.add(category);
                }
            }
        } catch (JSONException e) {
            log.warn("unreadable categories_json '{}': {}", json, e.getMessage());
        }
        return out;
    }

    private static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    static final class SeedEntry {
        final String name;
        final String email;

        SeedEntry(String name, String email) {
            this.name = name;
            this.email = email;
        }
    }
}
