package com.aisignal.app;

import com.aisignal.config.Config;
import com.aisignal.db.ArticleFilter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AiSignalApplicationOptionsTest {
    private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");

    @Test
    void run_shouldPrintHelpAndExitCleanly() {
        assertEquals(AiSignalApplication.EXIT_OK, new AiSignalApplication().run(new String[]{"--help"}));
    }

    @Test
    void run_shouldRejectUsageErrorsBeforeTouchingTheDatabase() {
        AiSignalApplication app = new AiSignalApplication();

        assertEquals(AiSignalApplication.EXIT_USAGE, app.run(new String[]{"--top", "ten"}));
        assertEquals(AiSignalApplication.EXIT_USAGE, app.run(new String[]{"--list", "--category", "Gossip"}));
        assertEquals(AiSignalApplication.EXIT_USAGE, app.run(new String[]{"--no-such-flag"}));
    }

    @Test
    void validate_shouldAcceptWellFormedOptions() throws Exception {
        assertNull(AiSignalApplication.validate(parse("--list", "--category", "ai model", "--limit", "50", "--offset", "10")));
        assertTrue(AiSignalApplication.validate(parse("--limit", "-1")).contains("must not be negative"));
        assertTrue(AiSignalApplication.validate(parse("--subscribe", "a@example.com", "--categories", "AI Model,Gossip"))
                .contains("Gossip"));
    }

    @Test
    void buildFilter_shouldNormalizeCategoryLabel() throws Exception {
        ArticleFilter filter = AiSignalApplication.buildFilter(parse("--list", "--category", "research paper", "--search", "agents"));

        assertEquals("Research Paper", filter.getCategory());
        assertEquals("agents", filter.getSearch());
        assertEquals(20, filter.getLimit());
        assertEquals(0, filter.getOffset());
    }

    @Test
    void parseCategories_shouldCanonicalizeAndDeduplicate() {
        assertEquals(List.of("AI Model", "Tutorial/Guide"),
                AiSignalApplication.parseCategories("ai model; Tutorial/Guide ,AI MODEL, unknown"));
        assertTrue(AiSignalApplication.parseCategories(null).isEmpty());
    }

    @Test
    void nextRunTime_shouldRollOverToTomorrowOncePassed() {
        ZonedDateTime morning = ZonedDateTime.of(2026, 2, 23, 7, 59, 0, 0, TOKYO);
        ZonedDateTime evening = ZonedDateTime.of(2026, 2, 23, 8, 0, 0, 0, TOKYO);
        LocalTime at = AiSignalApplication.parseTime("8:00");

        assertEquals(ZonedDateTime.of(2026, 2, 23, 8, 0, 0, 0, TOKYO), AiSignalApplication.nextRunTime(morning, at));
        assertEquals(ZonedDateTime.of(2026, 2, 24, 8, 0, 0, 0, TOKYO), AiSignalApplication.nextRunTime(evening, at));
        assertNull(AiSignalApplication.parseTime("25:99"));
    }

    @Test
    void nextRefreshTime_shouldSkipMissedSlots() {
        ZonedDateTime previous = ZonedDateTime.of(2026, 2, 23, 10, 0, 0, 0, TOKYO);
        ZonedDateTime now = previous.plusMinutes(135);

        ZonedDateTime next = AiSignalApplication.nextRefreshTime(previous, Duration.ofMinutes(60), now);

        assertEquals(previous.plusMinutes(180), next);
    }

    @Test
    void statusLines_shouldReportCredentialsWithoutSecrets() {
        Config config = Config.fromConfigurationProperties(Path.of("."), Map.of(
                "ai.api_key", "sk-secret-value",
                "email.smtp_pass", "hunter2",
                "news.sources", "hackernews,rss,newsapi",
                "digest.time", "07:30",
                "db.url", "jdbc:postgresql://db.internal:5432/news?password=topsecret"));

        List<String> lines = AiSignalApplication.statusLines(config);
        String joined = String.join("\n", lines);

        assertTrue(lines.get(0).endsWith("credential=set(override)"), lines.get(0));
        assertEquals("newsapi: key=missing", lines.get(1));
        assertTrue(lines.get(2).contains("user=missing pass=set(override)"), lines.get(2));
        assertEquals("sources: hackernews,newsapi", lines.get(3));
        assertTrue(lines.get(4).contains("digest_at=07:30 UTC"), lines.get(4));
        assertFalse(joined.contains("sk-secret-value"));
        assertFalse(joined.contains("hunter2"));
        assertFalse(joined.contains("topsecret"));
    }

    private static CommandLine parse(String... args) throws Exception {
        return new DefaultParser().parse(AiSignalApplication.buildOptions(), args);
    }
}
