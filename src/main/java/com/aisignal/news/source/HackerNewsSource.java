package com.aisignal.news.source;

import com.aisignal.config.Config;
import com.aisignal.core.CancellationSignal;
import com.aisignal.data.http.HttpClientEx;
import com.aisignal.model.IntermediateItem;
import com.aisignal.news.IdentityAssigner;
import com.aisignal.news.RelevanceFilter;
import com.aisignal.news.TextSupport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Hacker News stories from the Algolia search API.
 */
public final class HackerNewsSource implements SourceAdapter {
    private static final Logger log = LogManager.getLogger(HackerNewsSource.class);
    static final String SEARCH_URL = "https://hn.algolia.com/api/v1/search";
    static final String ITEM_URL = "https://news.ycombinator.com/item?id=";

    private final Config config;
    private final HttpClientEx httpClient;
    private final RelevanceFilter relevance;

    public HackerNewsSource(Config config, HttpClientEx httpClient, RelevanceFilter relevance) {
        this.config = config;
        this.httpClient = httpClient;
        this.relevance = relevance;
    }

    @Override
    public String id() {
        return "hackernews";
    }

    @Override
    public String name() {
        return "Hacker News";
    }

    @Override
    public List<IntermediateItem> fetch(CancellationSignal signal) throws Exception {
        String body = httpClient.getText(requestUrl(), config.getInt("news.fetch.timeout_sec", 20));
        List<IntermediateItem> items = parse(body);
        log.info("HN: {} stories", items.size());
        return items;
    }

    String requestUrl() {
        String query = config.getString("news.hackernews.query");
        int minPoints = Math.max(0, config.getInt("news.hackernews.min_points", 10));
        int hits = Math.max(1, config.getInt("news.hackernews.hits_per_page", 30));
        return SEARCH_URL
                + "?query=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&tags=story"
                + "&numericFilters=" + URLEncoder.encode("points>" + minPoints, StandardCharsets.UTF_8)
                + "&hitsPerPage=" + hits;
    }

    List<IntermediateItem> parse(String body) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        JSONArray hits = new JSONObject(body).optJSONArray("hits");
        List<IntermediateItem> out = new ArrayList<>();
        if (hits == null) {
            return out;
        }
        for (int i = 0; i < hits.length(); i++) {
            JSONObject hit = hits.optJSONObject(i);
            if (hit == null) {
                continue;
            }
            String title = TextSupport.collapse(hit.optString("title", ""));
            String storyText = TextSupport.plainText(hit.optString("story_text", ""));
            if (title.isEmpty() || !relevance.matches(title, storyText)) {
                continue;
            }
            String locator = TextSupport.safe(hit.optString("url", ""));
            if (locator.isEmpty()) {
                locator = ITEM_URL + hit.optString("objectID", "");
            }
            out.add(IntermediateItem.builder()
                    .identity(IdentityAssigner.identity(locator))
                    .title(title)
                    .locator(locator)
                    .sourceName(name())
                    .publishedAt(TextSupport.parseIso(hit.optString("created_at", ""), now))
                    .bodyText(storyText)
                    .author(hit.optString("author", ""))
                    .tags(List.of("hacker-news"))
                    .rankScore(hit.optLong("points", 0L))
                    .build());
        }
        return out;
    }
}
