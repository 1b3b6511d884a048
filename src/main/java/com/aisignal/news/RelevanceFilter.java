package com.aisignal.news;

import com.aisignal.config.Config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive keyword match over title and body text.
 */
public final class RelevanceFilter {
    private final List<String> keywords;

    public RelevanceFilter(List<String> keywords) {
        List<String> out = new ArrayList<>();
        if (keywords != null) {
            for (String raw : keywords) {
                String keyword = TextSupport.safe(raw).toLowerCase(Locale.ROOT);
                if (!keyword.isEmpty()) {
                    out.add(keyword);
                }
            }
        }
        this.keywords = List.copyOf(out);
    }

    public static RelevanceFilter fromConfig(Config config) {
        return new RelevanceFilter(config.getList("news.keywords"));
    }

    /**
     * With an empty vocabulary every item is relevant.
     */
    public boolean matches(String title, String body) {
        if (keywords.isEmpty()) {
            return true;
        }
        String text = (TextSupport.safe(title) + " " + TextSupport.safe(body)).toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public List<String> keywords() {
        return keywords;
    }
}
