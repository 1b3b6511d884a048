package com.aisignal.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Fully annotated pipeline output, handed to the record store and to digest delivery.
 *
 * <p>AI-derived fields are never null; a record built from a failed classification carries the
 * deterministic defaults instead.</p>
 */
@Value
public class ClassifiedRecord {
    public static final int DEFAULT_RELEVANCE = 5;

    String identity;
    String title;
    String locator;
    String sourceName;
    OffsetDateTime publishedAt;
    String bodyText;
    String author;
    List<String> tags;
    long rankScore;

    String summary;
    Category category;
    int relevanceScore;
    boolean productOrTool;
    String productName;
    List<Competitor> competitors;
    String competitiveAdvantage;

    @Builder(toBuilder = true)
    public ClassifiedRecord(
            String identity,
            String title,
            String locator,
            String sourceName,
            OffsetDateTime publishedAt,
            String bodyText,
            String author,
            List<String> tags,
            long rankScore,
            String summary,
            Category category,
            int relevanceScore,
            boolean productOrTool,
            String productName,
            List<Competitor> competitors,
            String competitiveAdvantage
    ) {
        this.identity = safe(identity);
        this.title = safe(title);
        this.locator = safe(locator);
        this.sourceName = safe(sourceName);
        this.publishedAt = publishedAt == null ? OffsetDateTime.now(ZoneOffset.UTC) : publishedAt;
        this.bodyText = safe(bodyText);
        this.author = safe(author);
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        this.rankScore = Math.max(0L, rankScore);
        this.summary = safe(summary);
        this.category = category == null ? Category.DEFAULT : category;
        this.relevanceScore = relevanceScore < 1 || relevanceScore > 10 ? DEFAULT_RELEVANCE : relevanceScore;
        this.productOrTool = productOrTool;
        this.productName = productOrTool ? safe(productName) : "";
        this.competitors = productOrTool && competitors != null ? List.copyOf(competitors) : List.of();
        this.competitiveAdvantage = productOrTool ? safe(competitiveAdvantage) : "";
    }

    /**
     * Builder pre-filled with the item's own fields.
     */
    public static ClassifiedRecordBuilder from(IntermediateItem item) {
        return ClassifiedRecord.builder()
                .identity(item.getIdentity())
                .title(item.getTitle())
                .locator(item.getLocator())
                .sourceName(item.getSourceName())
                .publishedAt(item.getPublishedAt())
                .bodyText(item.getBodyText())
                .author(item.getAuthor())
                .tags(item.getTags())
                .rankScore(item.getRankScore());
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
