package com.aisignal.db;

import lombok.Builder;
import lombok.Value;

/**
 * Optional filters for {@link ArticleDao#list(ArticleFilter)}; blank text filters are ignored.
 */
@Value
@Builder
public class ArticleFilter {
    String category;
    String source;
    int minRelevance;
    String search;
    @Builder.Default
    int limit = 20;
    int offset;
}
