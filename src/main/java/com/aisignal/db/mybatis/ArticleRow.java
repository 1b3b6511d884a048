package com.aisignal.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * One {@code article} row; list-valued fields travel as JSON text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArticleRow {
    private String id;
    private String title;
    private String url;
    private String source;
    private OffsetDateTime publishedAt;
    private String bodyText;
    private String author;
    private String tagsJson;
    private long rankScore;
    private String summary;
    private String category;
    private int relevanceScore;
    private boolean productOrTool;
    private String productName;
    private String competitorsJson;
    private String competitiveAdvantage;
    private OffsetDateTime fetchedAt;
}
