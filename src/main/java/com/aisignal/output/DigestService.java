package com.aisignal.output;

import com.aisignal.config.Config;
import com.aisignal.core.RunTelemetry;
import com.aisignal.model.ClassifiedRecord;
import com.aisignal.model.Subscriber;
import com.aisignal.news.RecordStore;
import jakarta.mail.MessagingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Sends the daily digest: the store's top records, narrowed per subscriber, one message each.
 */
public final class DigestService {
    private static final Logger log = LogManager.getLogger(DigestService.class);

    static final String STATUS_SENT = "sent";
    static final String STATUS_FAILED = "failed";

    private final RecordStore store;
    private final SubscriberDirectory subscribers;
    private final DigestBuilder builder;
    private final Mailer mailer;
    private final Mailer.Settings mailSettings;
    private final int maxArticles;
    private final int minRelevance;
    private final int fallbackArticles;
    private final ZoneId zone;

    public DigestService(Config config, RecordStore store, SubscriberDirectory subscribers, Mailer mailer) {
        this(config, store, subscribers, mailer,
                new DigestBuilder(new DigestRenderer(), config.getString("digest.app_url", "http://localhost:3000")));
    }

    DigestService(Config config, RecordStore store, SubscriberDirectory subscribers, Mailer mailer, DigestBuilder builder) {
        this.store = store;
        this.subscribers = subscribers;
        this.mailer = mailer;
        this.builder = builder;
        this.mailSettings = mailer.loadSettings(config);
        this.maxArticles = Math.max(1, config.getInt("digest.max_articles", 10));
        this.minRelevance = Math.max(0, config.getInt("digest.min_relevance", 5));
        this.fallbackArticles = Math.max(0, config.getInt("digest.fallback_articles", 5));
        this.zone = parseZone(config.getString("digest.zone", "UTC"));
    }

    /**
     * Mails every active subscriber their share of today's top stories and logs each send.
     *
     * <p>Nothing is sent when no story clears the relevance floor. A subscriber whose filters match
     * nothing gets the first few top stories instead.</p>
     *
     * @throws SQLException when the store or the subscriber list cannot be read
     * @throws MessagingException only with {@code mail.fail_fast}
     */
    public DigestReport sendDigests(RunTelemetry telemetry) throws SQLException, MessagingException {
        return sendDigests(LocalDate.now(zone), telemetry);
    }

    DigestReport sendDigests(LocalDate date, RunTelemetry telemetry) throws SQLException, MessagingException {
        if (telemetry != null) {
            telemetry.startStep(RunTelemetry.STEP_DIGEST);
        }
        List<ClassifiedRecord> top = store.queryTop(minRelevance, maxArticles);
        List<Subscriber> recipients = subscribers.listActive();
        int sent = 0;
        int failed = 0;
        int skipped = 0;
        try {
            if (!mailSettings.enabled) {
                log.info("email.enabled=false, digest skipped for {} subscriber(s)", recipients.size());
                skipped = recipients.size();
                return new DigestReport(top.size(), recipients.size(), 0, 0, skipped);
            }
            if (top.isEmpty()) {
                log.info("No articles to send, {} subscriber(s) skipped", recipients.size());
                skipped = recipients.size();
                return new DigestReport(0, recipients.size(), 0, 0, skipped);
            }
            for (Subscriber subscriber : recipients) {
                List<ClassifiedRecord> selected = selectFor(subscriber, top, fallbackArticles);
                if (selected.isEmpty()) {
                    skipped++;
                    continue;
                }
                String subject = DigestBuilder.subject(mailSettings.subjectPrefix, date, selected.size());
                String html = builder.buildHtml(subscriber.getName(), selected, date);
                String text = builder.buildText(subscriber.getName(), selected, date);
                boolean delivered;
                try {
                    delivered = mailer.send(mailSettings, subscriber.getEmail(), subject, text, html);
                } catch (MessagingException e) {
                    subscribers.logDigest(subscriber.getEmail(), selected.size(), STATUS_FAILED, e.getMessage());
                    throw e;
                }
                if (delivered) {
                    sent++;
                    log.info("Digest sent to {} ({} stories)", Mailer.maskAddress(subscriber.getEmail()), selected.size());
                    subscribers.logDigest(subscriber.getEmail(), selected.size(), STATUS_SENT, null);
                } else {
                    failed++;
                    subscribers.logDigest(subscriber.getEmail(), selected.size(), STATUS_FAILED, "mail not delivered");
                }
            }
            return new DigestReport(top.size(), recipients.size(), sent, failed, skipped);
        } finally {
            if (telemetry != null) {
                telemetry.endStep(RunTelemetry.STEP_DIGEST, recipients.size(), sent, failed);
            }
        }
    }

    /**
     * Records the subscriber accepts, in store order; when none pass, the first {@code fallback}
     * records instead.
     */
    static List<ClassifiedRecord> selectFor(Subscriber subscriber, List<ClassifiedRecord> top, int fallback) {
        List<ClassifiedRecord> out = new ArrayList<>();
        for (ClassifiedRecord record : top) {
            if (subscriber.accepts(record)) {
                out.add(record);
            }
        }
        if (out.isEmpty()) {
            out.addAll(top.subList(0, Math.min(fallback, top.size())));
        }
        return out;
    }

    private static ZoneId parseZone(String raw) {
        try {
            return ZoneId.of(raw);
        } catch (RuntimeException e) {
            log.warn("invalid digest.zone '{}', using UTC", raw);
            return ZoneId.of("UTC");
        }
    }
}
