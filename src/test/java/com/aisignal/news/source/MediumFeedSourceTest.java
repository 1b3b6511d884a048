package com.aisignal.news.source;

import com.aisignal.config.Config;
import com.aisignal.core.CancellationSignal;
import com.aisignal.data.http.CannedHttpClient;
import com.aisignal.model.IntermediateItem;
import com.aisignal.news.RelevanceFilter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MediumFeedSourceTest {
    private static final String FEED = "{\"status\": \"ok\", \"items\": ["
            + "{\"title\": \"Fine-tuning small models on a budget\", \"link\": \"https://medium.com/@dev/fine-tuning-1\","
            + " \"pubDate\": \"2025-02-28 17:30:00\", \"author\": \"Dev\","
            + " \"description\": \"<p>Practical <em>fine-tuning</em> tips.</p><img src=\\\"x.png\\\">\"},"
            + "{\"title\": \"Gardening in March\", \"link\": \"https://medium.com/@g/garden\","
            + " \"pubDate\": \"2025-02-28 10:00:00\", \"description\": \"Tomatoes\"}"
            + "]}";

    @Test
    void fetch_shouldSkipFailingFeedAndKeepOthers() throws Exception {
        Config config = config(Map.of("news.medium.tags", "mlops,broken"));
        MediumFeedSource probe = new MediumFeedSource(config, null, RelevanceFilter.fromConfig(config));
        CannedHttpClient http = new CannedHttpClient()
                .json(probe.proxyUrl(MediumFeedSource.TAG_FEED_URL + "mlops"), FEED);
        MediumFeedSource source = new MediumFeedSource(config, http, RelevanceFilter.fromConfig(config));

        List<IntermediateItem> items = source.fetch(CancellationSignal.none());

        assertEquals(1, items.size());
        IntermediateItem item = items.get(0);
        assertEquals("Practical fine-tuning tips.", item.getBodyText());
        assertEquals("Medium", item.getSourceName());
        assertEquals(17, item.getPublishedAt().getHour());
        assertEquals(List.of("medium"), item.getTags());
        assertEquals(2, http.requested().size());
    }

    @Test
    void fetch_shouldFailWhenEveryFeedFails() {
        Config config = config(Map.of("news.medium.tags", "a,b"));
        MediumFeedSource source = new MediumFeedSource(config, new CannedHttpClient(), RelevanceFilter.fromConfig(config));

        assertThrows(IOException.class, () -> source.fetch(CancellationSignal.none()));
    }

    @Test
    void parse_shouldRejectProxyErrorStatus() {
        Config config = config(Map.of());
        MediumFeedSource source = new MediumFeedSource(config, null, RelevanceFilter.fromConfig(config));

        IOException e = assertThrows(IOException.class,
                () -> source.parse("{\"status\": \"error\", \"message\": \"feed not found\"}"));
        assertTrue(e.getMessage().contains("feed not found"));
    }

    private static Config config(Map<String, ?> overrides) {
        return Config.fromConfigurationProperties(Path.of("."), overrides);
    }
}
