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

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * NewsAPI {@code /v2/everything}. Needs {@code news.newsapi.key}; without it the source is
 * skipped with a warning instead of failing.
 */
public final class NewsApiSource implements SourceAdapter {
    private static final Logger log = LogManager.getLogger(NewsApiSource.class);
    static final String EVERYTHING_URL = "https://newsapi.org/v2/everything";

    private final Config config;
    private final HttpClientEx httpClient;
    private final RelevanceFilter relevance;

    public NewsApiSource(Config config, HttpClientEx httpClient, RelevanceFilter relevance) {
        this.config = config;
        this.httpClient = httpClient;
        this.relevance = relevance;
    }

    @Override
    public String id() {
        return "newsapi";
    }

    @Override
    public String name() {
        return "NewsAPI";
    }

    @Override
    public List<IntermediateItem> fetch(CancellationSignal signal) throws Exception {
        String apiKey = config.getString("news.newsapi.key");
        if (apiKey.isEmpty()) {
            log.warn("NewsAPI key not set, skipping");
            return List.of();
        }
        String body = httpClient.getText(requestUrl(apiKey), config.getInt("news.fetch.timeout_sec", 20));
        List<IntermediateItem> items = parse(body);
        log.info("NewsAPI: {} articles", items.size());
        return items;
    }

    String requestUrl(String apiKey) {
        return EVERYTHING_URL
                + "?q=" + URLEncoder.encode(config.getString("news.newsapi.query"), StandardCharsets.UTF_8)
                + "&language=en"
                + "&sortBy=publishedAt"
                + "&pageSize=" + Math.max(1, config.getInt("news.newsapi.page_size", 20))
                + "&apiKey=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
    }

    List<IntermediateItem> parse(String body) throws IOException {
        JSONObject root = new JSONObject(body);
        if ("error".equalsIgnoreCase(root.optString("status", ""))) {
            throw new IOException("NewsAPI error " + root.optString("code", "") + ": " + root.optString("message", ""));
        }
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        JSONArray articles = root.optJSONArray("articles");
        List<IntermediateItem> out = new ArrayList<>();
        if (articles == null) {
            return out;
        }
        for (int i = 0; i < articles.length(); i++) {
            JSONObject article = articles.optJSONObject(i);
            if (article == null) {
                continue;
            }
            String title = TextSupport.collapse(article.optString("title", ""));
            String description = TextSupport.plainText(article.optString("description", ""));
            String locator = TextSupport.safe(article.optString("url", ""));
            if (title.isEmpty() || locator.isEmpty() || !relevance.matches(title, description)) {
                continue;
            }
            JSONObject source = article.optJSONObject("source");
            String publisher = source == null ? "" : TextSupport.safe(source.optString("name", ""));
            out.add(IntermediateItem.builder()
                    .identity(IdentityAssigner.identity(locator))
                    .title(title)
                    .locator(locator)
                    .sourceName(name() + " / " + (publisher.isEmpty() ? name() : publisher))
                    .publishedAt(TextSupport.parseIso(article.optString("publishedAt", ""), now))
                    .bodyText(description)
                    .author(article.optString("author", ""))
                    .tags(List.of("news"))
                    .build());
        }
        return out;
    }
}
