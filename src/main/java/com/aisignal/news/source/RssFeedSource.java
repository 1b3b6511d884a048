package com.aisignal.news.source;

import com.aisignal.config.Config;
import com.aisignal.core.CancellationSignal;
import com.aisignal.data.feed.FeedEntry;
import com.aisignal.data.feed.FeedParseException;
import com.aisignal.data.feed.FeedParser;
import com.aisignal.data.http.HttpClientEx;
import com.aisignal.model.IntermediateItem;
import com.aisignal.news.IdentityAssigner;
import com.aisignal.news.RelevanceFilter;
import com.aisignal.news.TextSupport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Operator-configured RSS 2.0 feeds from {@code news.rss.feeds}.
 */
public final class RssFeedSource implements SourceAdapter {
    private static final Logger log = LogManager.getLogger(RssFeedSource.class);

    private final Config config;
    private final HttpClientEx httpClient;
    private final RelevanceFilter relevance;

    public RssFeedSource(Config config, HttpClientEx httpClient, RelevanceFilter relevance) {
        this.config = config;
        this.httpClient = httpClient;
        this.relevance = relevance;
    }

    @Override
    public String id() {
        return "rss";
    }

    @Override
    public String name() {
        return "RSS";
    }

    public List<String> feeds() {
        return config.getList("news.rss.feeds");
    }

    @Override
    public List<IntermediateItem> fetch(CancellationSignal signal) throws Exception {
        List<String> feeds = feeds();
        int timeoutSec = config.getInt("news.fetch.timeout_sec", 20);
        List<IntermediateItem> out = new ArrayList<>();
        int failed = 0;
        Exception lastError = null;
        for (String feed : feeds) {
            if (signal.isCancelled()) {
                break;
            }
            try {
                out.addAll(parse(httpClient.getText(feed, timeoutSec)));
            } catch (IOException | FeedParseException | IllegalArgumentException e) {
                failed++;
                lastError = e;
                log.warn("RSS feed {} error: {}", feed, e.getMessage());
            }
        }
        if (!feeds.isEmpty() && failed == feeds.size()) {
            throw new IOException("all RSS feeds failed", lastError);
        }
        log.info("RSS: {} articles from {} feeds", out.size(), feeds.size());
        return out;
    }

    List<IntermediateItem> parse(String xml) throws FeedParseException {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        int limit = Math.max(1, config.getInt("news.rss.max_items", 30));
        List<IntermediateItem> out = new ArrayList<>();
        for (FeedEntry entry : FeedParser.parse(xml, limit)) {
            String title = TextSupport.plainText(entry.getTitle());
            String description = TextSupport.plainText(entry.getDescription());
            String locator = entry.getLink();
            if (title.isEmpty() || locator.isEmpty() || !relevance.matches(title, description)) {
                continue;
            }
            String sourceName = entry.getSource().isEmpty() ? TextSupport.hostOf(locator) : entry.getSource();
            out.add(IntermediateItem.builder()
                    .identity(IdentityAssigner.identity(locator))
                    .title(title)
                    .locator(locator)
                    .sourceName(sourceName.isEmpty() ? name() : sourceName)
                    .publishedAt(TextSupport.toOffset(entry.getPublishedAt(), now))
                    .bodyText(description)
                    .author(entry.getAuthors().isEmpty() ? "" : entry.getAuthors().get(0))
                    .tags(List.of("rss"))
                    .build());
        }
        return out;
    }
}
