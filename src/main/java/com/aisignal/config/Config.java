package com.aisignal.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Layered, read-only application configuration.
 *
 * <p>Lookup order, last wins: built-in defaults, classpath {@code config.properties},
 * selected environment variables, then {@code config.properties} in the working directory.
 * Instances are immutable once loaded and are shared across worker threads.</p>
 */
public final class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    private static final String FILE_NAME = "config.properties";
    private static final Pattern LIST_SEPARATOR = Pattern.compile("[,;]");
    private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "y");

    private static final Map<String, String> DEFAULTS = buildDefaults();
    private static final Map<String, List<String>> ENV_KEYS = buildEnvKeys();

    /** Explicit layers, lowest priority first. Built-in defaults sit below all of them. */
    private enum Layer {
        RESOURCE("resource"),
        ENV("env"),
        OVERRIDE("override");

        private final String label;

        Layer(String label) {
            this.label = label;
        }
    }

    private final Map<Layer, Properties> layers = new EnumMap<>(Layer.class);
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
        for (Layer layer : Layer.values()) {
            layers.put(layer, new Properties());
        }
    }

    public static Config load(Path workingDir) {
        return load(workingDir, System.getenv());
    }

    static Config load(Path workingDir, Map<String, String> environment) {
        Config config = new Config(workingDir);
        config.readClasspath();
        config.readEnvironment(environment == null ? Map.of() : environment);
        config.readLocalFile(workingDir.resolve(FILE_NAME));
        return config;
    }

    /**
     * Build Config from Spring-bound configuration properties. Bound values take the override layer,
     * nested maps become dotted keys and lists become comma separated values.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        Map<String, String> flat = new LinkedHashMap<>();
        flatten("", rawProperties, flat);
        config.layers.get(Layer.OVERRIDE).putAll(flat);
        return config;
    }

    private void readClasspath() {
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                layers.get(Layer.RESOURCE).load(in);
            }
        } catch (IOException e) {
            log.warn("Packaged {} unreadable, using built-in defaults: {}", FILE_NAME, e.getMessage());
        }
    }

    private void readEnvironment(Map<String, String> environment) {
        Properties env = layers.get(Layer.ENV);
        ENV_KEYS.forEach((key, names) -> names.stream()
                .map(environment::get)
                .map(Config::trimmed)
                .filter(value -> !value.isEmpty())
                .findFirst()
                .ifPresent(value -> env.setProperty(key, value)));
    }

    private void readLocalFile(Path file) {
        if (!Files.isRegularFile(file)) {
            return;
        }
        try (InputStream in = Files.newInputStream(file)) {
            layers.get(Layer.OVERRIDE).load(in);
        } catch (IOException e) {
            log.warn("Ignoring unreadable {}: {}", file.toAbsolutePath(), e.getMessage());
        }
    }

    public Path workingDir() {
        return workingDir;
    }

    /**
     * Trimmed value from the highest layer that sets the key to something non-blank, else the
     * built-in default, else the empty string.
     */
    public String getString(String key) {
        Layer layer = layerOf(key);
        if (layer != null) {
            return trimmed(layers.get(layer).getProperty(key));
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        return value.isEmpty() ? fallback : value;
    }

    /** {@code true}, {@code 1}, {@code yes} and {@code y} are true; anything else is false. */
    public boolean getBoolean(String key) {
        return TRUTHY.contains(getString(key).toLowerCase(Locale.ROOT));
    }

    public boolean getBoolean(String key, boolean fallback) {
        return getString(key).isEmpty() ? fallback : getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public double getDouble(String key, double fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    /**
     * Resolves a configured path against the working directory; an unset key resolves to the working
     * directory itself.
     */
    public Path getPath(String key) {
        String value = getString(key);
        return value.isEmpty() ? workingDir : workingDir.resolve(value).normalize();
    }

    /** Comma or semicolon separated entries, trimmed, blanks dropped. */
    public List<String> getList(String key) {
        return Arrays.stream(LIST_SEPARATOR.split(getString(key)))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toList());
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    /**
     * Names the layer a key was read from: {@code override}, {@code env}, {@code resource} or {@code default}.
     */
    public String sourceOf(String key) {
        Layer layer = layerOf(key);
        return layer == null ? "default" : layer.label;
    }

    private Layer layerOf(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        Layer[] order = Layer.values();
        for (int i = order.length - 1; i >= 0; i--) {
            if (!trimmed(layers.get(order[i]).getProperty(key)).isEmpty()) {
                return order[i];
            }
        }
        return null;
    }

    private static void flatten(String prefix, Object value, Map<String, String> out) {
        if (value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> {
                String name = k == null ? "" : k.toString().trim();
                if (!name.isEmpty()) {
                    flatten(prefix.isEmpty() ? name : prefix + "." + name, v, out);
                }
            });
        } else if (!prefix.isEmpty()) {
            out.put(prefix, joined(value));
        }
    }

    private static String joined(Object value) {
        if (value instanceof Collection<?> items) {
            return items.stream().map(String::valueOf).collect(Collectors.joining(","));
        }
        if (value.getClass().isArray()) {
            List<String> parts = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++) {
                parts.add(String.valueOf(Array.get(value, i)));
            }
            return String.join(",", parts);
        }
        return String.valueOf(value);
    }

    private static String trimmed(String raw) {
        return raw == null ? "" : raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, List<String>> buildEnvKeys() {
        Map<String, List<String>> keys = new LinkedHashMap<>();
        keys.put("ai.api_key", List.of("AISIGNAL_AI_API_KEY", "ANTHROPIC_API_KEY"));
        keys.put("news.newsapi.key", List.of("AISIGNAL_NEWS_API_KEY", "NEWS_API_KEY"));
        keys.put("db.url", List.of("AISIGNAL_DB_URL"));
        keys.put("db.user", List.of("AISIGNAL_DB_USER"));
        keys.put("db.pass", List.of("AISIGNAL_DB_PASS"));
        keys.put("email.smtp_user", List.of("AISIGNAL_SMTP_USER"));
        keys.put("email.smtp_pass", List.of("AISIGNAL_SMTP_PASS"));
        keys.put("email.from", List.of("AISIGNAL_MAIL_FROM", "FROM_EMAIL"));
        keys.put("digest.app_url", List.of("APP_URL"));
        keys.put("subscribers.seed", List.of("SEED_SUBSCRIBERS"));
        return keys;
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("db.url", "jdbc:postgresql://localhost:5432/aisignal");
        defaults.put("db.user", "aisignal");
        defaults.put("db.pass", "aisignal");
        defaults.put("db.schema", "aisignal");

        defaults.put("news.sources", "hackernews,arxiv,newsapi,medium,rss");
        defaults.put("news.keywords", String.join(",",
                "artificial intelligence", "machine learning", "LLM", "large language model",
                "GPT", "Claude", "Gemini", "Llama", "transformer", "neural network",
                "generative AI", "foundation model", "RAG", "vector database",
                "MLOps", "LLMOps", "AI platform", "AI infrastructure", "model deployment",
                "inference", "fine-tuning", "embeddings", "AI agent", "agentic",
                "kubernetes AI", "cloud AI", "AI observability", "AI gateway",
                "openai", "anthropic", "mistral", "cohere", "hugging face",
                "langchain", "llamaindex", "dspy", "crewai", "autogen",
                "platform engineering", "developer platform", "AI tooling", "AI SDK"));
        defaults.put("news.fetch.timeout_sec", "20");
        defaults.put("news.fetch.concurrent", "8");
        defaults.put("news.hackernews.query", "AI machine learning LLM platform engineering");
        defaults.put("news.hackernews.min_points", "10");
        defaults.put("news.hackernews.hits_per_page", "30");
        defaults.put("news.arxiv.query",
                "all:LLM OR all:large language model OR all:AI agent OR all:foundation model");
        defaults.put("news.arxiv.max_results", "20");
        defaults.put("news.newsapi.query",
                "AI OR LLM OR \"machine learning\" OR \"platform engineering\" OR MLOps");
        defaults.put("news.newsapi.page_size", "20");
        defaults.put("news.medium.tags", "artificial-intelligence,machine-learning,platform-engineering,mlops");
        defaults.put("news.medium.count", "10");
        defaults.put("news.medium.timeout_sec", "10");
        defaults.put("news.rss.feeds", "");
        defaults.put("news.rss.max_items", "30");

        defaults.put("enrich.concurrent", "10");
        defaults.put("enrich.timeout_sec", "8");
        defaults.put("enrich.min_body_chars", "80");
        defaults.put("enrich.min_description_chars", "40");
        defaults.put("enrich.max_description_chars", "500");
        defaults.put("enrich.user_agent", "Mozilla/5.0 (compatible; AISignalBot/1.0)");

        defaults.put("ai.provider", "anthropic");
        defaults.put("ai.model", "claude-3-5-haiku-latest");
        defaults.put("ai.max_tokens", "600");
        defaults.put("ai.timeout_sec", "30");
        defaults.put("ai.temperature", "0.2");
        defaults.put("classify.concurrent", "5");
        defaults.put("classify.prompt.max_body_chars", "600");

        defaults.put("digest.max_articles", "10");
        defaults.put("digest.min_relevance", "5");
        defaults.put("digest.time", "08:00");
        defaults.put("digest.zone", "UTC");
        defaults.put("digest.fallback_articles", "5");
        defaults.put("digest.app_url", "http://localhost:3000");
        defaults.put("schedule.refresh_interval_min", "60");

        defaults.put("email.enabled", "true");
        defaults.put("email.smtp_host", "smtp.gmail.com");
        defaults.put("email.smtp_port", "587");
        defaults.put("email.subject_prefix", "[AI Signal]");
        defaults.put("mail.dry_run", "false");
        defaults.put("mail.fail_fast", "false");
        return defaults;
    }
}
