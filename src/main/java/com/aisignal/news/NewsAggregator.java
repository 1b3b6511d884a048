package com.aisignal.news;

import com.aisignal.config.Config;
import com.aisignal.core.CancellationSignal;
import com.aisignal.core.diagnostics.CauseCode;
import com.aisignal.core.diagnostics.Outcome;
import com.aisignal.model.IntermediateItem;
import com.aisignal.news.source.SourceAdapter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs every source adapter concurrently, merges their items and drops identity duplicates.
 *
 * <p>A failing adapter only loses its own items. Duplicates are resolved first-seen-wins in
 * completion order, and the merged list is sorted by rank score then recency, both descending.</p>
 */
public final class NewsAggregator {
    private static final Logger log = LogManager.getLogger(NewsAggregator.class);

    static final Comparator<IntermediateItem> RANKING = Comparator
            .comparingLong(IntermediateItem::getRankScore)
            .thenComparing(IntermediateItem::getPublishedAt)
            .reversed();

    private final int concurrency;

    public NewsAggregator(Config config) {
        this(config.getInt("news.fetch.concurrent", 8));
    }

    NewsAggregator(int concurrency) {
        this.concurrency = Math.max(1, concurrency);
    }

    /**
     * Fetches every source and merges the results. Never throws; failing and cancelled sources
     * are listed in the result.
     */
    public AggregateResult aggregate(List<SourceAdapter> sources, CancellationSignal signal) {
        CancellationSignal cancel = signal == null ? CancellationSignal.none() : signal;
        if (sources == null || sources.isEmpty()) {
            return new AggregateResult(List.of(), List.of(), List.of(), 0, 0);
        }

        LinkedHashMap<String, IntermediateItem> merged = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();
        List<String> cancelled = new ArrayList<>();
        int raw = 0;
        int duplicates = 0;

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, sources.size()));
        CompletionService<SourceRun> completion = new ExecutorCompletionService<>(pool);
        Map<Future<SourceRun>, String> sourceOf = new HashMap<>();
        try {
            for (SourceAdapter source : sources) {
                if (source == null) {
                    continue;
                }
                sourceOf.put(completion.submit(() -> runSource(source, cancel)), source.id());
            }
            for (int i = 0; i < sourceOf.size(); i++) {
                Future<SourceRun> future = completion.take();
                SourceRun run;
                try {
                    run = future.get();
                } catch (ExecutionException e) {
                    // Outcome.attempt contains exceptions; this is an Error escaping the adapter
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    String sourceId = sourceOf.get(future);
                    failed.add(sourceId);
                    log.warn("source {} failed: {}", sourceId, cause.toString());
                    continue;
                }
                Outcome<List<IntermediateItem>> outcome = run.outcome;
                if (!outcome.success) {
                    if (outcome.causeCode == CauseCode.CANCELLED) {
                        cancelled.add(run.sourceId);
                    } else {
                        failed.add(run.sourceId);
                        log.warn("source {} failed: {}", run.sourceId, outcome.error());
                    }
                    continue;
                }
                for (IntermediateItem item : outcome.valueOr(List.of())) {
                    if (item == null) {
                        continue;
                    }
                    raw++;
                    if (merged.putIfAbsent(item.getIdentity(), item) != null) {
                        duplicates++;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("aggregation interrupted, keeping {} collected items", merged.size());
        } finally {
            pool.shutdownNow();
        }

        List<IntermediateItem> items = new ArrayList<>(merged.values());
        items.sort(RANKING);
        log.info("aggregated unique={} raw={} duplicates={} failed_sources={}", items.size(), raw, duplicates, failed);
        return new AggregateResult(items, failed, cancelled, raw, duplicates);
    }

    private SourceRun runSource(SourceAdapter source, CancellationSignal cancel) {
        if (cancel.isCancelled()) {
            return new SourceRun(source.id(), Outcome.failure(CauseCode.CANCELLED, source.id(), "cancelled before start"));
        }
        Outcome<List<IntermediateItem>> outcome = Outcome.attempt(
                source.id(),
                CauseCode.SOURCE_FAILED,
                () -> source.fetch(cancel)
        );
        return new SourceRun(source.id(), outcome);
    }

    private static final class SourceRun {
        private final String sourceId;
        private final Outcome<List<IntermediateItem>> outcome;

        private SourceRun(String sourceId, Outcome<List<IntermediateItem>> outcome) {
            this.sourceId = sourceId;
            this.outcome = outcome;
        }
    }
}
