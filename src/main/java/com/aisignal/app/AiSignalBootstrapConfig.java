package com.aisignal.app;

import com.aisignal.app.properties.AiProperties;
import com.aisignal.app.properties.DbProperties;
import com.aisignal.app.properties.DigestProperties;
import com.aisignal.app.properties.EmailProperties;
import com.aisignal.config.Config;
import com.aisignal.data.http.HttpClientEx;
import com.aisignal.db.ArticleDao;
import com.aisignal.db.Database;
import com.aisignal.db.MigrationRunner;
import com.aisignal.db.SubscriberDao;
import com.aisignal.news.ArticleClassifier;
import com.aisignal.news.ContentEnricher;
import com.aisignal.news.NewsAggregator;
import com.aisignal.news.NewsPipeline;
import com.aisignal.news.source.SourceFactory;
import com.aisignal.output.DigestService;
import com.aisignal.output.Mailer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring wiring for embedding the pipeline in another application. The CLI builds the same objects by
 * hand from {@link Config#load(Path)}.
 *
 * <p>Database-backed beans are lazy, so a context without a reachable PostgreSQL still starts.</p>
 */
@Configuration
@EnableConfigurationProperties({DbProperties.class, AiProperties.class, EmailProperties.class, DigestProperties.class})
public class AiSignalBootstrapConfig {

    /**
     * Everything bound under the root, with the typed sections written back in the snake_case keys
     * {@link Config} reads. That way {@code ai.api-key}, {@code ai.apiKey} and {@code AI_API_KEY} all
     * land on {@code ai.api_key}.
     */
    @Bean
    public Config aiSignalConfig(Environment environment, DbProperties db, AiProperties ai,
                                 EmailProperties email, DigestProperties digest) {
        Map<String, Object> bound = new LinkedHashMap<>(Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of));

        Map<String, Object> dbSection = section(bound, "db");
        dbSection.put("url", fromEnv("AISIGNAL_DB_URL", db.getUrl()));
        dbSection.put("user", fromEnv("AISIGNAL_DB_USER", db.getUser()));
        dbSection.put("pass", fromEnv("AISIGNAL_DB_PASS", db.getPass()));
        dbSection.put("schema", db.getSchema());

        Map<String, Object> aiSection = section(bound, "ai");
        aiSection.put("provider", ai.getProvider());
        aiSection.put("model", ai.getModel());
        aiSection.put("api_key", ai.getApiKey());
        aiSection.put("base_url", ai.getBaseUrl());
        aiSection.put("max_tokens", ai.getMaxTokens());
        aiSection.put("timeout_sec", ai.getTimeoutSec());
        aiSection.put("temperature", ai.getTemperature());

        Map<String, Object> emailSection = section(bound, "email");
        emailSection.put("enabled", email.isEnabled());
        emailSection.put("smtp_host", email.getSmtpHost());
        emailSection.put("smtp_port", email.getSmtpPort());
        emailSection.put("smtp_user", email.getSmtpUser());
        emailSection.put("smtp_pass", email.getSmtpPass());
        emailSection.put("from", email.getFrom());
        emailSection.put("subject_prefix", email.getSubjectPrefix());

        Map<String, Object> digestSection = section(bound, "digest");
        digestSection.put("max_articles", digest.getMaxArticles());
        digestSection.put("min_relevance", digest.getMinRelevance());
        digestSection.put("fallback_articles", digest.getFallbackArticles());
        digestSection.put("time", digest.getTime());
        digestSection.put("zone", digest.getZone());
        digestSection.put("app_url", digest.getAppUrl());

        return Config.fromConfigurationProperties(Path.of(".").toAbsolutePath().normalize(), bound);
    }

    @Bean
    @Lazy
    public Database database(Config config) {
        Database database = Database.fromConfig(config);
        try {
            new MigrationRunner().run(database);
        } catch (SQLException e) {
            throw new IllegalStateException("article store migration failed: " + e.getMessage(), e);
        }
        return database;
    }

    @Bean
    @Lazy
    public ArticleDao articleDao(Database database) {
        return new ArticleDao(database);
    }

    @Bean
    @Lazy
    public SubscriberDao subscriberDao(Database database) {
        return new SubscriberDao(database);
    }

    @Bean
    public HttpClientEx httpClient(Config config) {
        return new HttpClientEx(config.getString("enrich.user_agent", HttpClientEx.DEFAULT_USER_AGENT));
    }

    @Bean
    public ArticleClassifier articleClassifier(Config config) {
        return new ArticleClassifier(config);
    }

    @Bean
    @Lazy
    public NewsPipeline newsPipeline(Config config, HttpClientEx httpClient, ArticleClassifier classifier, ArticleDao articleDao) {
        return new NewsPipeline(
                SourceFactory.enabledSources(config, httpClient),
                new NewsAggregator(config),
                new ContentEnricher(config, httpClient),
                classifier,
                articleDao
        );
    }

    @Bean
    @Lazy
    public DigestService digestService(Config config, ArticleDao articleDao, SubscriberDao subscriberDao) {
        return new DigestService(config, articleDao, subscriberDao, new Mailer());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> bound, String name) {
        Object existing = bound.get(name);
        Map<String, Object> section = existing instanceof Map
                ? new LinkedHashMap<>((Map<String, Object>) existing)
                : new LinkedHashMap<>();
        bound.put(name, section);
        return section;
    }

    private static String fromEnv(String name, String fallback) {
        String value = System.getenv(name);
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
