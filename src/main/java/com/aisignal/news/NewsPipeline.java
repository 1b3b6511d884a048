package com.aisignal.news;

import com.aisignal.core.CancellationSignal;
import com.aisignal.core.RunTelemetry;
import com.aisignal.core.diagnostics.CauseCode;
import com.aisignal.model.ClassifiedRecord;
import com.aisignal.news.source.SourceAdapter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One refresh: aggregate, enrich, classify, then a single hand-off to the record store.
 *
 * <p>Fetch, enrichment and classification degrade item by item and never throw. The store is
 * called once with the complete batch, and its {@link SQLException} is the only failure that
 * reaches the caller.</p>
 */
public final class NewsPipeline {
    private static final Logger log = LogManager.getLogger(NewsPipeline.class);

    private final List<SourceAdapter> sources;
    private final NewsAggregator aggregator;
    private final ContentEnricher enricher;
    private final ArticleClassifier classifier;
    private final RecordStore store;

    public NewsPipeline(
            List<SourceAdapter> sources,
            NewsAggregator aggregator,
            ContentEnricher enricher,
            ArticleClassifier classifier,
            RecordStore store
    ) {
        this.sources = sources == null ? List.of() : List.copyOf(sources);
        this.aggregator = aggregator;
        this.enricher = enricher;
        this.classifier = classifier;
        this.store = store;
    }

    /**
     * One refresh: fetch, enrich, classify, store, recording each step on {@code telemetry}.
     *
     * <p>Source, enrichment and classification problems degrade the run and show up in the
     * report. The store is not called when there is nothing to write.</p>
     *
     * @throws SQLException when the record store rejects the batch
     */
    public PipelineReport run(CancellationSignal signal, RunTelemetry telemetry) throws SQLException {
        CancellationSignal cancel = signal == null ? CancellationSignal.none() : signal;
        RunTelemetry t = telemetry == null ? new RunTelemetry("manual", null) : telemetry;

        t.startStep(RunTelemetry.STEP_FETCH);
        AggregateResult aggregate = aggregator.aggregate(sources, cancel);
        t.setItemStats(aggregate.getRawCount(), aggregate.getItems().size());
        for (String failed : aggregate.getFailedSources()) {
            t.addFailedSource(failed);
        }
        t.endStep(RunTelemetry.STEP_FETCH, sources.size(), aggregate.getItems().size(),
                aggregate.getFailedSources().size(), "duplicates=" + aggregate.getDuplicatesDropped());

        t.startStep(RunTelemetry.STEP_ENRICH);
        EnrichmentResult enrichment = enricher.enrichAll(aggregate.getItems(), cancel);
        t.endStep(RunTelemetry.STEP_ENRICH, enrichment.getAttempted(), enrichment.getFilled(), enrichment.getFailed());

        t.startStep(RunTelemetry.STEP_CLASSIFY);
        ClassificationBatch batch = classifier.classifyAll(enrichment.getItems(), cancel);
        t.setAiUsage(classifier.isModelAvailable(), classifier.isModelAvailable() ? "" : classifier.unavailableReason());
        t.endStep(RunTelemetry.STEP_CLASSIFY, enrichment.getItems().size(), batch.getRecords().size(),
                batch.degradedTotal(), "model_calls=" + batch.getModelCalls());

        Map<CauseCode, Integer> degraded = new EnumMap<>(CauseCode.class);
        degraded.putAll(batch.getDegraded());
        if (enrichment.getFailed() > 0) {
            degraded.put(CauseCode.ENRICH_FAILED, enrichment.getFailed());
        }
        if (!aggregate.getFailedSources().isEmpty()) {
            degraded.put(CauseCode.SOURCE_FAILED, aggregate.getFailedSources().size());
        }

        List<ClassifiedRecord> records = batch.getRecords();
        int stored = 0;
        if (!records.isEmpty()) {
            t.startStep(RunTelemetry.STEP_STORE);
            try {
                stored = store.upsert(records);
            } catch (SQLException e) {
                t.endStep(RunTelemetry.STEP_STORE, records.size(), 0, 1, e.getMessage());
                log.error("record store rejected batch of {} records: {}", records.size(), e.getMessage());
                throw e;
            }
            t.endStep(RunTelemetry.STEP_STORE, records.size(), stored, 0);
        } else {
            log.info("no records this run, store not called");
        }

        PipelineReport report = new PipelineReport(
                records,
                aggregate.getRawCount(),
                aggregate.getDuplicatesDropped(),
                aggregate.getFailedSources(),
                aggregate.getCancelledSources(),
                enrichment.getAttempted(),
                enrichment.getFilled(),
                enrichment.getFailed(),
                degraded,
                stored
        );
        log.info("pipeline done {}", report.oneLine());
        return report;
    }
}
