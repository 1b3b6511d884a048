package com.aisignal.model;

import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Normalized, pre-classification item produced by a source adapter.
 *
 * <p>Everything except the body text is fixed at construction. The body text may be filled once by
 * content enrichment; a second fill is ignored.</p>
 */
@Getter
public final class IntermediateItem {
    private final String identity;
    private final String title;
    private final String locator;
    private final String sourceName;
    private final OffsetDateTime publishedAt;
    private final String author;
    private final List<String> tags;
    private final long rankScore;
    private volatile String bodyText;
    private volatile boolean enriched;

    @Builder(toBuilder = true)
    public IntermediateItem(
            String identity,
            String title,
            String locator,
            String sourceName,
            OffsetDateTime publishedAt,
            String bodyText,
            String author,
            List<String> tags,
            long rankScore
    ) {
        this.identity = identity == null ? "" : identity;
        this.title = title == null ? "" : title;
        this.locator = locator == null ? "" : locator;
        this.sourceName = sourceName == null ? "" : sourceName;
        this.publishedAt = publishedAt == null ? OffsetDateTime.now(ZoneOffset.UTC) : publishedAt;
        this.bodyText = bodyText == null ? "" : bodyText;
        this.author = author == null ? "" : author;
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        this.rankScore = Math.max(0L, rankScore);
    }

    /**
     * Sets the body text found by enrichment. Returns false when the item was already enriched.
     */
    public synchronized boolean fillBodyText(String text) {
        if (enriched || text == null || text.isBlank()) {
            return false;
        }
        this.bodyText = text;
        this.enriched = true;
        return true;
    }
}
