package com.aisignal.news;

import org.jsoup.Jsoup;

import java.net.URI;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Text and timestamp helpers shared by the source adapters and the classifier.
 */
public final class TextSupport {
    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

    private TextSupport() {
    }

    /**
     * Strips markup and collapses whitespace, including line breaks.
     */
    public static String plainText(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        return collapse(Jsoup.parse(raw).text());
    }

    public static String collapse(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replace('\u00a0', ' ').replace('\u3000', ' ').replaceAll("\\s+", " ").trim();
    }

    public static String truncate(String raw, int maxChars) {
        String text = raw == null ? "" : raw;
        if (maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars);
    }

    public static String safe(String value) {
        return value == null ? "" : value.trim();
    }

    public static String hostOf(String url) {
        try {
            URI uri = URI.create(safe(url));
            return uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    /**
     * ISO-8601 instant or offset timestamp; {@code fallback} when missing or unparseable.
     */
    public static OffsetDateTime parseIso(String raw, OffsetDateTime fallback) {
        String text = safe(raw);
        if (text.isEmpty()) {
            return fallback;
        }
        try {
            return OffsetDateTime.parse(text);
        } catch (Exception ignored) {
            return fallback;
        }
    }

    /**
     * {@code yyyy-MM-dd HH:mm:ss} read as UTC.
     */
    public static OffsetDateTime parseUtcSpaceSeparated(String raw, OffsetDateTime fallback) {
        String text = safe(raw);
        if (text.isEmpty()) {
            return fallback;
        }
        try {
            return LocalDateTime.parse(text, SPACE_SEPARATED).atOffset(ZoneOffset.UTC);
        } catch (Exception ignored) {
            return fallback;
        }
    }

    public static OffsetDateTime toOffset(ZonedDateTime value, OffsetDateTime fallback) {
        return value == null ? fallback : value.toOffsetDateTime();
    }
}
