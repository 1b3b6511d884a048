package com.aisignal.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @Test
    void load_shouldLayerEnvironmentThenLocalFile(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("config.properties"), "digest.max_articles=7\nai.api_key=from-file\n");

        Config config = Config.load(dir, Map.of(
                "ANTHROPIC_API_KEY", "from-env",
                "NEWS_API_KEY", " news-key ",
                "SEED_SUBSCRIBERS", "a@example.com:A"));

        assertEquals("from-file", config.getString("ai.api_key"));
        assertEquals("override", config.sourceOf("ai.api_key"));
        assertEquals("news-key", config.getString("news.newsapi.key"));
        assertEquals("env", config.sourceOf("news.newsapi.key"));
        assertEquals(7, config.getInt("digest.max_articles"));
        assertEquals("resource", config.sourceOf("digest.time"));
        assertEquals("default", config.sourceOf("enrich.user_agent"));
    }

    @Test
    void load_shouldPreferFirstListedEnvironmentName(@TempDir Path dir) {
        Config config = Config.load(dir, Map.of("AISIGNAL_AI_API_KEY", "primary", "ANTHROPIC_API_KEY", "secondary"));

        assertEquals("primary", config.getString("ai.api_key"));
    }

    @Test
    void fromConfigurationProperties_shouldFlattenNestedMapsAndLists() {
        Config config = Config.fromConfigurationProperties(Path.of("."), Map.of(
                "news", Map.of("sources", List.of("hackernews", "arxiv"), "fetch", Map.of("timeout_sec", 5)),
                "email", Map.of("enabled", "yes")));

        assertEquals(List.of("hackernews", "arxiv"), config.getList("news.sources"));
        assertEquals(5, config.getInt("news.fetch.timeout_sec"));
        assertTrue(config.getBoolean("email.enabled"));
    }

    @Test
    void accessors_shouldFallBackOnBlankOrUnparseableValues() {
        Config config = Config.fromConfigurationProperties(Path.of("/srv/app"), Map.of(
                "enrich.concurrent", "many",
                "news.keywords", " ; ,",
                "outputs.dir", "out/../reports"));

        assertEquals(10, config.getInt("enrich.concurrent", 10));
        assertTrue(config.getList("news.keywords").isEmpty());
        assertEquals(Path.of("/srv/app/reports"), config.getPath("outputs.dir"));
        assertFalse(config.getBoolean("unknown.flag"));
        assertTrue(config.getBoolean("unknown.flag", true));
        assertThrows(IllegalArgumentException.class, () -> config.requireString("unknown.key"));
    }
}
