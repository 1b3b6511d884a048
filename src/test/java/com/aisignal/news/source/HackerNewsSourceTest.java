package com.aisignal.news.source;

import com.aisignal.config.Config;
import com.aisignal.core.CancellationSignal;
import com.aisignal.data.http.CannedHttpClient;
import com.aisignal.model.IntermediateItem;
import com.aisignal.news.IdentityAssigner;
import com.aisignal.news.RelevanceFilter;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HackerNewsSourceTest {
    private static final String BODY = "{\"hits\": ["
            + "{\"objectID\": \"101\", \"title\": \"Show HN: an LLM gateway for platform teams\", \"url\": \"https://gw.example.com/\","
            + " \"points\": 250, \"author\": \"alice\", \"created_at\": \"2025-03-01T10:15:00.000Z\"},"
            + "{\"objectID\": \"102\", \"title\": \"Ask HN: favourite machine learning courses?\", \"url\": null,"
            + " \"story_text\": \"<p>Looking for <b>recommendations</b></p>\", \"points\": 40, \"author\": \"bob\","
            + " \"created_at\": \"2025-03-01T09:00:00.000Z\"},"
            + "{\"objectID\": \"103\", \"title\": \"My sourdough starter journal\", \"url\": \"https://bread.example.com/\","
            + " \"points\": 900, \"author\": \"carol\", \"created_at\": \"2025-03-01T08:00:00.000Z\"}"
            + "]}";

    @Test
    void fetch_shouldKeepRelevantStoriesAndFallBackToDiscussionUrl() throws Exception {
        Config config = config(Map.of());
        HackerNewsSource source = new HackerNewsSource(config, null, RelevanceFilter.fromConfig(config));
        CannedHttpClient http = new CannedHttpClient().json(source.requestUrl(), BODY);
        source = new HackerNewsSource(config, http, RelevanceFilter.fromConfig(config));

        List<IntermediateItem> items = source.fetch(CancellationSignal.none());

        assertEquals(2, items.size());
        IntermediateItem gateway = items.get(0);
        assertEquals("https://gw.example.com/", gateway.getLocator());
        assertEquals(IdentityAssigner.identity("https://gw.example.com/"), gateway.getIdentity());
        assertEquals(250, gateway.getRankScore());
        assertEquals("Hacker News", gateway.getSourceName());
        assertEquals(List.of("hacker-news"), gateway.getTags());
        assertEquals(2025, gateway.getPublishedAt().getYear());

        IntermediateItem ask = items.get(1);
        assertEquals("https://news.ycombinator.com/item?id=102", ask.getLocator());
        assertEquals("Looking for recommendations", ask.getBodyText());
    }

    @Test
    void requestUrl_shouldCarryMinimumPointsFilter() {
        Config config = config(Map.of("news.hackernews.min_points", "25"));
        HackerNewsSource source = new HackerNewsSource(config, null, RelevanceFilter.fromConfig(config));

        String url = source.requestUrl();

        assertTrue(url.startsWith(HackerNewsSource.SEARCH_URL));
        assertTrue(url.contains("numericFilters=points%3E25"));
        assertTrue(url.contains("tags=story"));
    }

    @Test
    void fetch_shouldFailOnHttpError() {
        Config config = config(Map.of());
        HackerNewsSource source = new HackerNewsSource(config, new CannedHttpClient(), RelevanceFilter.fromConfig(config));

        assertThrows(Exception.class, () -> source.fetch(CancellationSignal.none()));
    }

    private static Config config(Map<String, ?> overrides) {
        return Config.fromConfigurationProperties(Path.of("."), overrides);
    }
}
