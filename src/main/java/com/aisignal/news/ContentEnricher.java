package com.aisignal.news;

import com.aisignal.config.Config;
import com.aisignal.core.CancellationSignal;
import com.aisignal.core.diagnostics.CauseCode;
import com.aisignal.core.diagnostics.Outcome;
import com.aisignal.data.http.HttpClientEx;
import com.aisignal.data.http.PageResponse;
import com.aisignal.model.IntermediateItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;

/**
 * Best-effort page description for items that arrive with little or no body text.
 *
 * <p>Fetches run on a fixed pool behind a counting gate of {@code enrich.concurrent} permits.
 * A failed or useless fetch leaves the item as it was.</p>
 */
public final class ContentEnricher {
    private static final Logger log = LogManager.getLogger(ContentEnricher.class);
    static final String DISCUSSION_PREFIX = "https://news.ycombinator.com";
    private static final String[] DESCRIPTION_SELECTORS = {
            "meta[property=og:description], meta[name=og:description]",
            "meta[name=description]",
            "meta[name=twitter:description], meta[property=twitter:description]"
    };

    private final HttpClientEx httpClient;
    private final int concurrency;
    private final int timeoutSec;
    private final int minBodyChars;
    private final int minDescriptionChars;
    private final int maxDescriptionChars;
    private final String userAgent;
    private final Semaphore gate;

    public ContentEnricher(Config config, HttpClientEx httpClient) {
        this.httpClient = httpClient;
        this.concurrency = Math.max(1, config.getInt("enrich.concurrent", 10));
        this.timeoutSec = Math.max(1, config.getInt("enrich.timeout_sec", 8));
        this.minBodyChars = Math.max(0, config.getInt("enrich.min_body_chars", 80));
        this.minDescriptionChars = Math.max(0, config.getInt("enrich.min_description_chars", 40));
        this.maxDescriptionChars = Math.max(1, config.getInt("enrich.max_description_chars", 500));
        this.userAgent = config.getString("enrich.user_agent", HttpClientEx.DEFAULT_USER_AGENT);
        this.gate = new Semaphore(concurrency);
    }

    public EnrichmentResult enrichAll(List<IntermediateItem> items, CancellationSignal signal) {
        CancellationSignal cancel = signal == null ? CancellationSignal.none() : signal;
        if (items == null || items.isEmpty()) {
            return new EnrichmentResult(List.of(), 0, 0, 0, 0, 0, 0);
        }

        int skipped = 0;
        List<Integer> pending = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            if (needsEnrichment(items.get(i))) {
                pending.add(i);
            } else {
                skipped++;
            }
        }

        int filled = 0;
        int missed = 0;
        int failed = 0;
        int cancelled = 0;
        if (!pending.isEmpty()) {
            ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, pending.size()));
            try {
                List<Future<Outcome<Boolean>>> futures = new ArrayList<>(pending.size());
                for (int index : pending) {
                    IntermediateItem item = items.get(index);
                    futures.add(pool.submit(() -> enrich(item, cancel)));
                }
                for (Future<Outcome<Boolean>> future : futures) {
                    Outcome<Boolean> outcome = await(future);
                    if (outcome.success) {
                        if (Boolean.TRUE.equals(outcome.value)) {
                            filled++;
                        } else {
                            missed++;
                        }
                    } else if (outcome.causeCode == CauseCode.CANCELLED) {
                        cancelled++;
                    } else {
                        failed++;
                        log.debug("enrich failed item={} err={}", outcome.owner, outcome.error());
                    }
                }
            } finally {
                pool.shutdownNow();
            }
        }

        log.info("enrich attempted={} filled={} missed={} failed={} skipped={}",
                pending.size(), filled, missed, failed, skipped);
        return new EnrichmentResult(items, pending.size(), filled, skipped, missed, failed, cancelled);
    }

    /**
     * Enriches one item in place. Success carries whether a description was applied.
     */
    Outcome<Boolean> enrich(IntermediateItem item, CancellationSignal cancel) {
        String owner = item.getIdentity();
        if (cancel.isCancelled()) {
            return Outcome.failure(CauseCode.CANCELLED, owner, "cancelled before fetch");
        }
        return Outcome.attempt(owner, CauseCode.ENRICH_FAILED, () -> {
            PageResponse page;
            gate.acquire();
            try {
                page = httpClient.fetch(item.getLocator(), timeoutSec, userAgent);
            } finally {
                gate.release();
            }
            if (page.getStatus() != 200 || !page.isHtml()) {
                return false;
            }
            String description = extractDescription(page.getBody(), maxDescriptionChars, minDescriptionChars);
            return !description.isEmpty() && item.fillBodyText(description);
        });
    }

    boolean needsEnrichment(IntermediateItem item) {
        if (item == null || item.getBodyText().length() > minBodyChars) {
            return false;
        }
        String locator = item.getLocator().trim();
        return !locator.isEmpty() && !locator.startsWith(DISCUSSION_PREFIX);
    }

    /**
     * Description meta tags in priority order; the first one that is still longer than
     * {@code minChars} after trimming and cutting to {@code maxChars} wins.
     */
    static String extractDescription(String html, int maxChars, int minChars) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document doc = Jsoup.parse(html);
        for (String selector : DESCRIPTION_SELECTORS) {
            String content = firstContent(doc, selector);
            if (content.isEmpty()) {
                continue;
            }
            String cut = TextSupport.truncate(content, maxChars).trim();
            if (cut.length() > minChars) {
                return cut;
            }
        }
        return "";
    }

    private static String firstContent(Document doc, String selector) {
        for (Element meta : doc.select(selector)) {
            String content = meta.attr("content").trim();
            if (!content.isEmpty()) {
                return content;
            }
        }
        return "";
    }

    private Outcome<Boolean> await(Future<Outcome<Boolean>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failure(CauseCode.CANCELLED, "enricher", "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return Outcome.failure(CauseCode.ENRICH_FAILED, "enricher", cause.toString());
        }
    }
}
