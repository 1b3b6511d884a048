package com.aisignal.news;

import com.aisignal.model.Category;
import com.aisignal.model.Competitor;
import lombok.Value;

import java.util.List;

/**
 * Validated model answer for one item. Only {@link ClassificationParser} creates these.
 */
@Value
public class Classification {
    String summary;
    Category category;
    List<String> tags;
    int relevanceScore;
    boolean productOrTool;
    String productName;
    List<Competitor> competitors;
    String competitiveAdvantage;
}
