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
 * Medium tag feeds read through the rss2json proxy. A failing feed is logged and skipped; the
 * source only fails when every feed does.
 */
public final class MediumFeedSource implements SourceAdapter {
    private static final Logger log = LogManager.getLogger(MediumFeedSource.class);
    static final String PROXY_URL = "https://api.rss2json.com/v1/api.json";
    static final String TAG_FEED_URL = "https://medium.com/feed/tag/";
    private static final int MAX_BODY_CHARS = 500;

    private final Config config;
    private final HttpClientEx httpClient;
    private final RelevanceFilter relevance;

    public MediumFeedSource(Config config, HttpClientEx httpClient, RelevanceFilter relevance) {
        this.config = config;
        this.httpClient = httpClient;
        this.relevance = relevance;
    }

    @Override
    public String id() {
        return "medium";
    }

    @Override
    public String name() {
        return "Medium";
    }

    @Override
    public List<IntermediateItem> fetch(CancellationSignal signal) throws Exception {
        List<String> tags = config.getList("news.medium.tags");
        int timeoutSec = Math.max(1, config.getInt("news.medium.timeout_sec", 10));
        List<IntermediateItem> out = new ArrayList<>();
        int failed = 0;
        IOException lastError = null;
        for (String tag : tags) {
            if (signal.isCancelled()) {
                break;
            }
            String feedUrl = TAG_FEED_URL + tag;
            try {
                out.addAll(parse(httpClient.getText(proxyUrl(feedUrl), timeoutSec)));
            } catch (IOException | RuntimeException e) {
                failed++;
                lastError = e instanceof IOException ? (IOException) e : new IOException(e.getMessage(), e);
                log.warn("Medium feed {} error: {}", feedUrl, e.getMessage());
            }
        }
        if (!tags.isEmpty() && failed == tags.size()) {
            throw new IOException("all Medium feeds failed", lastError);
        }
        log.info("Medium: {} articles", out.size());
        return out;
    }

    String proxyUrl(String feedUrl) {
        return PROXY_URL
                + "?rss_url=" + URLEncoder.encode(feedUrl, StandardCharsets.UTF_8)
                + "&count=" + Math.max(1, config.getInt("news.medium.count", 10));
    }

    List<IntermediateItem> parse(String body) throws IOException {
        JSONObject root = new JSONObject(body);
        String status = root.optString("status", "ok");
        if (!"ok".equalsIgnoreCase(status)) {
            throw new IOException("rss2json status=" + status + " message=" + root.optString("message", ""));
        }
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        JSONArray items = root.optJSONArray("items");
        List<IntermediateItem> out = new ArrayList<>();
        if (items == null) {
            return out;
        }
        for (int i = 0; i < items.length(); i++) {
            JSONObject item = items.optJSONObject(i);
            if (item == null) {
                continue;
            }
            String title = TextSupport.collapse(item.optString("title", ""));
            String description = TextSupport.plainText(item.optString("description", ""));
            String locator = TextSupport.safe(item.optString("link", ""));
            if (title.isEmpty() || locator.isEmpty() || !relevance.matches(title, description)) {
                continue;
            }
            out.add(IntermediateItem.builder()
                    .identity(IdentityAssigner.identity(locator))
                    .title(title)
                    .locator(locator)
                    .sourceName(name())
                    .publishedAt(TextSupport.parseUtcSpaceSeparated(item.optString("pubDate", ""), now))
                    .bodyText(TextSupport.truncate(description, MAX_BODY_CHARS))
                    .author(item.optString("author", ""))
                    .tags(List.of("medium"))
                    .build());
        }
        return out;
    }
}
