package com.aisignal.db;

import com.aisignal.db.mybatis.ArticleMapper;
import com.aisignal.db.mybatis.ArticleRow;
import com.aisignal.db.mybatis.CategoryCountRow;
import com.aisignal.db.mybatis.MyBatisSupport;
import com.aisignal.model.Category;
import com.aisignal.model.ClassifiedRecord;
import com.aisignal.model.Competitor;
import com.aisignal.news.RecordStore;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DAO for classified articles. Tags and competitors are stored as JSON text.
 */
public final class ArticleDao implements RecordStore {
    private static final Logger log = LogManager.getLogger(ArticleDao.class);
    private static final int MAX_LIST_LIMIT = 100;

    private final Database database;

    public ArticleDao(Database database) {
        this.database = database;
    }

    /**
     * Inserts or refreshes every record in one transaction, keyed by identity. Records without an
     * identity or title are skipped; any database error rolls the whole batch back.
     *
     * @return number of records written
     */
    @Override
    public int upsert(List<ClassifiedRecord> records) throws SQLException {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        int affected = 0;
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            ArticleMapper mapper = session.getMapper(ArticleMapper.class);
            try {
                for (ClassifiedRecord record : records) {
                    if (record == null || record.getIdentity().isEmpty() || record.getTitle().isEmpty()) {
                        continue;
                    }
                    mapper.upsertArticle(toRow(record));
                    affected++;
                }
                conn.commit();
            } catch (PersistenceException | SQLException e) {
                conn.rollback();
                throw asSqlException("article upsert failed", e);
            }
        }
        log.info("Upserted {} articles", affected);
        return affected;
    }

    /**
     * Records at or above {@code minRelevance}, ordered by relevance, then rank score, then recency.
     */
    @Override
    public List<ClassifiedRecord> queryTop(int minRelevance, int limit) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            List<ArticleRow> rows = session.getMapper(ArticleMapper.class)
                    .queryTop(Math.max(0, minRelevance), Math.max(1, limit));
            return fromRows(rows);
        } catch (PersistenceException e) {
            throw asSqlException("article top query failed", e);
        }
    }

    /**
     * Filtered, paged listing. Blank filter fields are ignored, the page size is capped at
     * {@value #MAX_LIST_LIMIT} and the relevance floor is clamped to 0..10.
     */
    public List<ClassifiedRecord> list(ArticleFilter filter) throws SQLException {
        ArticleFilter f = filter == null ? ArticleFilter.builder().build() : filter;
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            List<ArticleRow> rows = session.getMapper(ArticleMapper.class).listArticles(
                    blankToNull(f.getCategory()),
                    blankToNull(f.getSource()),
                    Math.max(0, Math.min(10, f.getMinRelevance())),
                    blankToNull(f.getSearch()),
                    Math.max(1, Math.min(MAX_LIST_LIMIT, f.getLimit())),
                    Math.max(0, f.getOffset())
            );
            return fromRows(rows);
        } catch (PersistenceException e) {
            throw asSqlException("article list failed", e);
        }
    }

    /** Totals overall, for products and tools, and per category. */
    public ArticleStats stats() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            ArticleMapper mapper = session.getMapper(ArticleMapper.class);
            Map<String, Integer> byCategory = new LinkedHashMap<>();
            for (CategoryCountRow row : mapper.countByCategory()) {
                byCategory.put(row.getCategory(), row.getTotal());
            }
            return new ArticleStats(mapper.countAll(), mapper.countProducts(), byCategory);
        } catch (PersistenceException e) {
            throw asSqlException("article stats failed", e);
        }
    }

    static ArticleRow toRow(ClassifiedRecord record) {
        JSONArray competitors = new JSONArray();
        for (Competitor competitor : record.getCompetitors()) {
            competitors.put(new JSONObject()
                    .put("name", competitor.getName())
                    .put("description", competitor.getDescription())
                    .put("comparison", competitor.getComparison()));
        }
        return ArticleRow.builder()
                .id(record.getIdentity())
                .title(record.getTitle())
                .url(record.getLocator())
                .source(record.getSourceName())
                .publishedAt(record.getPublishedAt())
                .bodyText(record.getBodyText())
                .author(record.getAuthor())
                .tagsJson(new JSONArray(record.getTags()).toString())
                .rankScore(record.getRankScore())
                .summary(record.getSummary())
                .category(record.getCategory().label())
                .relevanceScore(record.getRelevanceScore())
                .productOrTool(record.isProductOrTool())
                .productName(record.getProductName())
                .competitorsJson(competitors.toString())
                .competitiveAdvantage(record.getCompetitiveAdvantage())
                .build();
    }

    static ClassifiedRecord fromRow(ArticleRow row) {
        return ClassifiedRecord.builder()
                .identity(row.getId())
                .title(row.getTitle())
                .locator(row.getUrl())
                .sourceName(row.getSource())
                .publishedAt(row.getPublishedAt())
                .bodyText(row.getBodyText())
                .author(row.getAuthor())
                .tags(readTags(row.getTagsJson()))
                .rankScore(row.getRankScore())
                .summary(row.getSummary())
                .category(Category.fromLabel(row.getCategory()).orElse(Category.DEFAULT))
                .relevanceScore(row.getRelevanceScore())
                .productOrTool(row.isProductOrTool())
                .productName(row.getProductName())
                .competitors(readCompetitors(row.getCompetitorsJson()))
                .competitiveAdvantage(row.getCompetitiveAdvantage())
                .build();
    }

    private static List<ClassifiedRecord> fromRows(List<ArticleRow> rows) {
        List<ClassifiedRecord> out = new ArrayList<>();
        if (rows == null) {
            return out;
        }
        for (ArticleRow row : rows) {
            if (row != null) {
                out.add(fromRow(row));
            }
        }
        return out;
    }

    static List<String> readTags(String json) {
        List<String> out = new ArrayList<>();
        try {
            JSONArray array = new JSONArray(json == null || json.isBlank() ? "[]" : json);
            for (int i = 0; i < array.length(); i++) {
                String tag = array.optString(i, "").trim();
                if (!tag.isEmpty()) {
                    out.add(tag);
                }
            }
        } catch (JSONException e) {
            log.warn("unreadable tags_json '{}': {}", json, e.getMessage());
        }
        return out;
    }

    static List<Competitor> readCompetitors(String json) {
        List<Competitor> out = new ArrayList<>();
        try {
            JSONArray array = new JSONArray(json == null || json.isBlank() ? "[]" : json);
            for (int i = 0; i < array.length(); i++) {
                JSONObject obj = array.optJSONObject(i);
                if (obj != null) {
                    out.add(new Competitor(
                            obj.optString("name", ""),
                            obj.optString("description", ""),
                            obj.optString("comparison", "")
                    ));
                }
            }
        } catch (JSONException e) {
            log.warn("unreadable competitors_json '{}': {}", json, e.getMessage());
        }
        return out;
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    static SQLException asSqlException(String message, Exception e) {
        if (e instanceof SQLException) {
            return (SQLException) e;
        }
        Throwable cause = e.getCause();
        if (cause instanceof SQLException) {
            SQLException sql = (SQLException) cause;
            return new SQLException(message + ": " + sql.getMessage(), sql.getSQLState(), sql.getErrorCode(), e);
        }
        return new SQLException(message + ": " + e.getMessage(), e);
    }
}
