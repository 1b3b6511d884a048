package com.aisignal.news.source;

import com.aisignal.config.Config;
import com.aisignal.core.CancellationSignal;
import com.aisignal.data.feed.FeedEntry;
import com.aisignal.data.feed.FeedParser;
import com.aisignal.data.http.HttpClientEx;
import com.aisignal.model.IntermediateItem;
import com.aisignal.news.IdentityAssigner;
import com.aisignal.news.TextSupport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Latest arXiv papers from the Atom query API. Relevance is left to the provider-side query.
 */
public final class ArxivSource implements SourceAdapter {
    private static final Logger log = LogManager.getLogger(ArxivSource.class);
    static final String QUERY_URL = "https://export.arxiv.org/api/query";
    private static final int MAX_AUTHORS = 3;

    private final Config config;
    private final HttpClientEx httpClient;

    public ArxivSource(Config config, HttpClientEx httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public String id() {
        return "arxiv";
    }

    @Override
    public String name() {
        return "arXiv";
    }

    @Override
    public List<IntermediateItem> fetch(CancellationSignal signal) throws Exception {
        String xml = httpClient.getText(requestUrl(), config.getInt("news.fetch.timeout_sec", 20));
        List<IntermediateItem> items = parse(xml);
        log.info("arXiv: {} papers", items.size());
        return items;
    }

    String requestUrl() {
        return QUERY_URL
                + "?search_query=" + URLEncoder.encode(config.getString("news.arxiv.query"), StandardCharsets.UTF_8)
                + "&sortBy=lastUpdatedDate"
                + "&sortOrder=descending"
                + "&max_results=" + Math.max(1, config.getInt("news.arxiv.max_results", 20));
    }

    List<IntermediateItem> parse(String xml) throws Exception {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        int limit = Math.max(1, config.getInt("news.arxiv.max_results", 20));
        List<IntermediateItem> out = new ArrayList<>();
        for (FeedEntry entry : FeedParser.parse(xml, limit)) {
            String locator = entry.getLink();
            if (locator.isEmpty()) {
                continue;
            }
            List<String> authors = entry.getAuthors();
            out.add(IntermediateItem.builder()
                    .identity(IdentityAssigner.identity(locator))
                    .title(TextSupport.collapse(entry.getTitle()))
                    .locator(locator)
                    .sourceName(name())
                    .publishedAt(TextSupport.toOffset(entry.getPublishedAt(), now))
                    .bodyText(TextSupport.collapse(entry.getDescription()))
                    .author(String.join(", ", authors.subList(0, Math.min(MAX_AUTHORS, authors.size()))))
                    .tags(List.of("research", "arxiv"))
                    .build());
        }
        return out;
    }
}
