package com.aisignal.db;

import lombok.Value;

import java.util.Map;

/**
 * Stored article counts; {@code byCategory} is ordered by count, largest first.
 */
@Value
public class ArticleStats {
    int totalArticles;
    int productArticles;
    Map<String, Integer> byCategory;
}
