package com.aisignal.app;

import com.aisignal.config.Config;
import com.aisignal.core.CancellationSignal;
import com.aisignal.core.RunTelemetry;
import com.aisignal.data.http.HttpClientEx;
import com.aisignal.db.ArticleDao;
import com.aisignal.db.ArticleFilter;
import com.aisignal.db.ArticleStats;
import com.aisignal.db.Database;
import com.aisignal.db.MigrationRunner;
import com.aisignal.db.SubscriberDao;
import com.aisignal.model.Category;
import com.aisignal.model.ClassifiedRecord;
import com.aisignal.model.Subscriber;
import com.aisignal.news.ArticleClassifier;
import com.aisignal.news.ContentEnricher;
import com.aisignal.news.NewsAggregator;
import com.aisignal.news.NewsPipeline;
import com.aisignal.news.PipelineReport;
import com.aisignal.news.source.SourceFactory;
import com.aisignal.output.DigestReport;
import com.aisignal.output.DigestService;
import com.aisignal.output.Mailer;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command line entry point. Without a command it runs one refresh.
 *
 * <p>Exit codes: {@value #EXIT_OK} on success, {@value #EXIT_FATAL} on a fatal error,
 * {@value #EXIT_USAGE} for a bad command line.</p>
 */
public final class AiSignalApplication {
    private static final Logger log = LogManager.getLogger(AiSignalApplication.class);
    private static final DateTimeFormatter SCHEDULE_TIME_FMT = DateTimeFormatter.ofPattern("H:mm");
    private static final DateTimeFormatter DISPLAY_TS_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INTERRUPTED = 130;

    public static void main(String[] args) {
        int exit = new AiSignalApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("aisignal", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("aisignal", options);
            return EXIT_OK;
        }

        String usageError = validate(cmd);
        if (usageError != null) {
            new HelpFormatter().printHelp("aisignal", options);
            System.err.println("ERROR: " + usageError);
            return EXIT_USAGE;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);

            if (cmd.hasOption("status")) {
                statusLines(config).forEach(System.out::println);
                return EXIT_OK;
            }

            Database database = Database.fromConfig(config);
            log.info("DB url={} schema={}", database.maskedJdbcUrl(), database.schema());
            new MigrationRunner().run(database);

            ArticleDao articleDao = new ArticleDao(database);
            SubscriberDao subscriberDao = new SubscriberDao(database);
            seedSubscribers(config, subscriberDao);

            if (cmd.hasOption("subscribe")) {
                return subscribe(cmd, subscriberDao);
            }
            if (cmd.hasOption("unsubscribe")) {
                String email = cmd.getOptionValue("unsubscribe");
                boolean changed = subscriberDao.deactivate(email);
                System.out.println(changed ? "Unsubscribed " + email : "No active subscriber " + email);
                return EXIT_OK;
            }
            if (cmd.hasOption("subscribers")) {
                printSubscribers(subscriberDao.listAll());
                return EXIT_OK;
            }
            if (cmd.hasOption("top")) {
                int limit = Integer.parseInt(cmd.getOptionValue("top"));
                int minRelevance = intOption(cmd, "min-relevance", config.getInt("digest.min_relevance", 5));
                printRecords(articleDao.queryTop(minRelevance, limit));
                return EXIT_OK;
            }
            if (cmd.hasOption("list")) {
                printRecords(articleDao.list(buildFilter(cmd)));
                return EXIT_OK;
            }
            if (cmd.hasOption("stats")) {
                printStats(articleDao.stats());
                return EXIT_OK;
            }
            if (cmd.hasOption("digest")) {
                return runDigest(config, articleDao, subscriberDao);
            }
            if (cmd.hasOption("schedule")) {
                return runSchedule(config, articleDao, subscriberDao);
            }
            return runRefresh(config, articleDao, CancellationSignal.none());
        } catch (Exception e) {
            log.error("FATAL: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (AiSignalApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("aisignal.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(AiSignalApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                log.info("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (IOException | SecurityException e) {
                log.warn("failed to initialize log4j routing: {}", e.getMessage());
            }
        }
    }

    private void seedSubscribers(Config config, SubscriberDao subscriberDao) throws Exception {
        String seed = config.getString("subscribers.seed", "");
        if (seed.isBlank()) {
            return;
        }
        int seeded = subscriberDao.seed(seed);
        log.info("Seeded {} subscriber(s)", seeded);
    }

    int runRefresh(Config config, ArticleDao articleDao, CancellationSignal signal) throws Exception {
        HttpClientEx httpClient = new HttpClientEx();
        ArticleClassifier classifier = new ArticleClassifier(config);
        NewsPipeline pipeline = new NewsPipeline(
                SourceFactory.enabledSources(config, httpClient),
                new NewsAggregator(config),
                new ContentEnricher(config, httpClient),
                classifier,
                articleDao
        );
        RunTelemetry telemetry = new RunTelemetry("refresh", Instant.now());
        telemetry.setAiUsage(classifier.isModelAvailable(), classifier.unavailableReason());
        try {
            PipelineReport report = pipeline.run(signal, telemetry);
            log.info("News refresh complete. {}", report.oneLine());
            return EXIT_OK;
        } finally {
            telemetry.finish();
            log.info("RUN_SUMMARY\n{}", telemetry.getSummary());
        }
    }

    int runDigest(Config config, ArticleDao articleDao, SubscriberDao subscriberDao) throws Exception {
        RunTelemetry telemetry = new RunTelemetry("digest", Instant.now());
        try {
            DigestReport report = new DigestService(config, articleDao, subscriberDao, new Mailer()).sendDigests(telemetry);
            log.info("Digest complete. {}", report.oneLine());
            return EXIT_OK;
        } finally {
            telemetry.finish();
            log.info("RUN_SUMMARY\n{}", telemetry.getSummary());
        }
    }

    private int runSchedule(Config config, ArticleDao articleDao, SubscriberDao subscriberDao) {
        ZoneId zoneId = ZoneId.of(config.getString("digest.zone", "UTC"));
        LocalTime digestTime = parseTime(config.getString("digest.time", "08:00"));
        if (digestTime == null) {
            System.err.println("ERROR: invalid digest.time, expected H:mm");
            return EXIT_USAGE;
        }
        Duration refreshInterval = Duration.ofMinutes(Math.max(1, config.getInt("schedule.refresh_interval_min", 60)));
        log.info("Schedule mode started. zone={} refresh_every={}m digest_at={}",
                zoneId, refreshInterval.toMinutes(), digestTime);

        ZonedDateTime nextRefresh = ZonedDateTime.now(zoneId);
        ZonedDateTime nextDigest = nextRunTime(nextRefresh, digestTime);
        while (true) {
            boolean refreshFirst = !nextRefresh.isAfter(nextDigest);
            ZonedDateTime next = refreshFirst ? nextRefresh : nextDigest;
            log.info("Next {} at {}", refreshFirst ? "refresh" : "digest", DISPLAY_TS_FMT.format(next));
            if (!sleepUntil(next)) {
                return EXIT_INTERRUPTED;
            }
            if (refreshFirst) {
                try {
                    runRefresh(config, articleDao, CancellationSignal.none());
                } catch (Exception e) {
                    log.error("News refresh failed: {}", e.getMessage(), e);
                }
                nextRefresh = nextRefreshTime(next, refreshInterval, ZonedDateTime.now(zoneId));
            } else {
                try {
                    runDigest(config, articleDao, subscriberDao);
                } catch (Exception e) {
                    log.error("Digest failed: {}", e.getMessage(), e);
                }
                nextDigest = nextRunTime(ZonedDateTime.now(zoneId), digestTime);
            }
        }
    }

    private int subscribe(CommandLine cmd, SubscriberDao subscriberDao) throws Exception {
        String raw = cmd.getOptionValue("subscribe").trim();
        int colon = raw.indexOf(':');
        String name = colon > 0 ? raw.substring(0, colon).trim() : "";
        String email = colon >= 0 ? raw.substring(colon + 1).trim() : raw;
        List<String> categories = parseCategories(cmd.getOptionValue("categories", ""));
        int minRelevance = intOption(cmd, "min-relevance", SubscriberDao.DEFAULT_MIN_RELEVANCE);
        try {
            Subscriber created = subscriberDao.create(name, email, categories, minRelevance);
            System.out.println("Subscribed " + created.getEmail()
                    + " categories=" + (created.getCategories().isEmpty() ? "all" : String.join("|", created.getCategories()))
                    + " min_relevance=" + created.getMinRelevance());
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private void printRecords(List<ClassifiedRecord> records) {
        if (records.isEmpty()) {
            System.out.println("No articles.");
            return;
        }
        for (ClassifiedRecord record : records) {
            System.out.println(String.format(
                    Locale.US,
                    "[%2d] %-24s %-22s %s",
                    record.getRelevanceScore(),
                    record.getCategory().label(),
                    trimForLog(record.getSourceName(), 22),
                    trimForLog(record.getTitle(), 100)
            ));
            System.out.println("     " + record.getLocator());
        }
    }

    private void printStats(ArticleStats stats) {
        System.out.println("total_articles=" + stats.getTotalArticles());
        System.out.println("product_articles=" + stats.getProductArticles());
        for (Map.Entry<String, Integer> entry : stats.getByCategory().entrySet()) {
            System.out.println("category." + entry.getKey() + "=" + entry.getValue());
        }
    }

    private void printSubscribers(List<Subscriber> subscribers) {
        if (subscribers.isEmpty()) {
            System.out.println("No subscribers.");
            return;
        }
        for (Subscriber subscriber : subscribers) {
            System.out.println(String.format(
                    Locale.US,
                    "%-32s %-20s active=%s min_relevance=%d categories=%s",
                    subscriber.getEmail(),
                    subscriber.getName(),
                    subscriber.isActive(),
                    subscriber.getMinRelevance(),
                    subscriber.getCategories().isEmpty() ? "all" : String.join("|", subscriber.getCategories())
            ));
        }
    }

    static ArticleFilter buildFilter(CommandLine cmd) {
        return ArticleFilter.builder()
                .category(Category.fromLabel(cmd.getOptionValue("category", "")).map(Category::label).orElse(""))
                .source(cmd.getOptionValue("source", ""))
                .minRelevance(intOption(cmd, "min-relevance", 0))
                .search(cmd.getOptionValue("search", ""))
                .limit(intOption(cmd, "limit", 20))
                .offset(intOption(cmd, "offset", 0))
                .build();
    }

    /**
     * Which credentials are set (and from which config layer), the enabled sources and the schedule.
     * Secrets are never printed; the database needs no connection.
     */
    static List<String> statusLines(Config config) {
        List<String> lines = new ArrayList<>();
        String provider = config.getString("ai.provider", "anthropic");
        lines.add("ai: provider=" + provider + " model=" + config.getString("ai.model")
                + " credential=" + credential(config, "ollama".equalsIgnoreCase(provider) ? "ai.base_url" : "ai.api_key"));
        lines.add("newsapi: key=" + credential(config, "news.newsapi.key"));
        lines.add("email: enabled=" + config.getBoolean("email.enabled", true)
                + " dry_run=" + config.getBoolean("mail.dry_run", false)
                + " smtp=" + config.getString("email.smtp_host") + ":" + config.getInt("email.smtp_port", 587)
                + " user=" + credential(config, "email.smtp_user")
                + " pass=" + credential(config, "email.smtp_pass"));
        List<String> sources = new ArrayList<>();
        SourceFactory.enabledSources(config, new HttpClientEx()).forEach(source -> sources.add(source.id()));
        lines.add("sources: " + (sources.isEmpty() ? "-" : String.join(",", sources)));
        lines.add("schedule: refresh_every_min=" + config.getInt("schedule.refresh_interval_min", 60)
                + " digest_at=" + config.getString("digest.time", "08:00") + " " + config.getString("digest.zone", "UTC"));
        lines.add("db: " + Database.fromConfig(config).maskedJdbcUrl());
        return lines;
    }

    private static String credential(Config config, String key) {
        return config.getString(key).isEmpty() ? "missing" : "set(" + config.sourceOf(key) + ")";
    }

    /**
     * Catches option mistakes before any database work; returns null when the command line is usable.
     */
    static String validate(CommandLine cmd) {
        for (String name : List.of("top", "min-relevance", "limit", "offset")) {
            if (!cmd.hasOption(name)) {
                continue;
            }
            try {
                int value = Integer.parseInt(cmd.getOptionValue(name).trim());
                if (value < 0) {
                    return "--" + name + " must not be negative";
                }
            } catch (NumberFormatException e) {
                return "--" + name + " expects a number, got '" + cmd.getOptionValue(name) + "'";
            }
        }
        if (cmd.hasOption("category") && Category.fromLabel(cmd.getOptionValue("category")).isEmpty()) {
            return "unknown category '" + cmd.getOptionValue("category") + "', expected one of " + Category.labels();
        }
        if (cmd.hasOption("categories")) {
            for (String label : cmd.getOptionValue("categories").split("[,;]")) {
                if (!label.isBlank() && Category.fromLabel(label).isEmpty()) {
                    return "unknown category '" + label.trim() + "', expected one of " + Category.labels();
                }
            }
        }
        return null;
    }

    static List<String> parseCategories(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String token : raw.split("[,;]")) {
            Category.fromLabel(token).ifPresent(category -> {
                if (!out.contains(category.label())) {
                    out.add(category.label());
                }
            });
        }
        return out;
    }

    private static int intOption(CommandLine cmd, String name, int fallback) {
        if (!cmd.hasOption(name)) {
            return fallback;
        }
        try {
            return Integer.parseInt(cmd.getOptionValue(name).trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("refresh").desc("fetch, enrich, classify and store news once (default)").build());
        options.addOption(Option.builder().longOpt("digest").desc("send the daily digest to every active subscriber now").build());
        options.addOption(Option.builder().longOpt("schedule").desc("run refresh on an interval and the digest daily until interrupted").build());
        options.addOption(Option.builder().longOpt("top").hasArg().argName("n").desc("print the n most relevant stored articles").build());
        options.addOption(Option.builder().longOpt("list").desc("print stored articles matching the filters below").build());
        options.addOption(Option.builder().longOpt("category").hasArg().argName("label").desc("filter by category label").build());
        options.addOption(Option.builder().longOpt("source").hasArg().argName("text").desc("filter by source name (substring)").build());
        options.addOption(Option.builder().longOpt("search").hasArg().argName("text").desc("filter by title or summary (substring)").build());
        options.addOption(Option.builder().longOpt("min-relevance").hasArg().argName("1-10").desc("minimum relevance score").build());
        options.addOption(Option.builder().longOpt("limit").hasArg().argName("n").desc("page size for --list (max 100)").build());
        options.addOption(Option.builder().longOpt("offset").hasArg().argName("n").desc("page offset for --list").build());
        options.addOption(Option.builder().longOpt("stats").desc("print article counts by category").build());
        options.addOption(Option.builder().longOpt("subscribe").hasArg().argName("name:email").desc("add a digest subscriber").build());
        options.addOption(Option.builder().longOpt("categories").hasArg().argName("labels").desc("comma separated category allow-list for --subscribe").build());
        options.addOption(Option.builder().longOpt("unsubscribe").hasArg().argName("email").desc("deactivate a digest subscriber").build());
        options.addOption(Option.builder().longOpt("subscribers").desc("list subscribers").build());
        options.addOption(Option.builder().longOpt("status").desc("print configured credentials, sources and schedule without touching the database").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    private static String trimForLog(String value, int maxLen) {
        String text = value == null ? "" : value;
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLen - 3)) + "...";
    }

    static LocalTime parseTime(String value) {
        try {
            return LocalTime.parse(value == null ? "" : value.trim(), SCHEDULE_TIME_FMT);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    static ZonedDateTime nextRunTime(ZonedDateTime now, LocalTime runTime) {
        ZonedDateTime candidate = now.toLocalDate().atTime(runTime).atZone(now.getZone());
        if (candidate.isAfter(now)) {
            return candidate;
        }
        return now.toLocalDate().plusDays(1).atTime(runTime).atZone(now.getZone());
    }

    /**
     * Next interval slot after {@code previous}; slots missed while a long run was busy are skipped.
     */
    static ZonedDateTime nextRefreshTime(ZonedDateTime previous, Duration interval, ZonedDateTime now) {
        ZonedDateTime next = previous.plus(interval);
        while (!next.isAfter(now)) {
            next = next.plus(interval);
        }
        return next;
    }

    private boolean sleepUntil(ZonedDateTime next) {
        while (true) {
            long millis = Duration.between(ZonedDateTime.now(next.getZone()), next).toMillis();
            if (millis <= 0) {
                return true;
            }
            long chunk = Math.min(30_000L, millis);
            try {
                Thread.sleep(chunk);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
