package com.aisignal.news.source;

import com.aisignal.config.Config;
import com.aisignal.data.http.HttpClientEx;
import com.aisignal.news.RelevanceFilter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the adapters named in {@code news.sources}, in that order.
 */
public final class SourceFactory {
    private static final Logger log = LogManager.getLogger(SourceFactory.class);
    public static final Set<String> SUPPORTED_SOURCES = Set.of("hackernews", "arxiv", "newsapi", "medium", "rss");

    private SourceFactory() {
    }

    /**
     * Unknown ids are logged and dropped, repeated ids count once, and {@code rss} is left out when
     * no feeds are configured.
     */
    public static List<SourceAdapter> enabledSources(Config config, HttpClientEx httpClient) {
        RelevanceFilter relevance = RelevanceFilter.fromConfig(config);
        LinkedHashSet<String> ids = new LinkedHashSet<>();
        for (String raw : config.getList("news.sources")) {
            String id = raw.toLowerCase(Locale.ROOT);
            if (SUPPORTED_SOURCES.contains(id)) {
                ids.add(id);
            } else {
                log.warn("unknown news source '{}' ignored", raw);
            }
        }

        List<SourceAdapter> out = new ArrayList<>();
        for (String id : ids) {
            switch (id) {
                case "hackernews":
                    out.add(new HackerNewsSource(config, httpClient, relevance));
                    break;
                case "arxiv":
                    out.add(new ArxivSource(config, httpClient));
                    break;
                case "newsapi":
                    out.add(new NewsApiSource(config, httpClient, relevance));
                    break;
                case "medium":
                    out.add(new MediumFeedSource(config, httpClient, relevance));
                    break;
                case "rss":
                    RssFeedSource rss = new RssFeedSource(config, httpClient, relevance);
                    if (rss.feeds().isEmpty()) {
                        log.debug("rss source enabled without news.rss.feeds, skipped");
                    } else {
                        out.add(rss);
                    }
                    break;
                default:
                    break;
            }
        }
        return out;
    }
}
