package com.aisignal.news;

import com.aisignal.config.Config;
import com.aisignal.core.CancellationSignal;
import com.aisignal.core.RunTelemetry;
import com.aisignal.core.diagnostics.CauseCode;
import com.aisignal.data.http.CannedHttpClient;
import com.aisignal.model.ClassifiedRecord;
import com.aisignal.news.source.SourceAdapter;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NewsPipelineTest {

    @Test
    void run_shouldProduceOneRecordPerDistinctIdentity() throws Exception {
        SourceAdapter a = NewsAggregatorTest.source("a",
                NewsAggregatorTest.item("X", 3, 0), NewsAggregatorTest.item("Y", 2, 0));
        SourceAdapter b = NewsAggregatorTest.source("b",
                NewsAggregatorTest.item("Y", 2, 0), NewsAggregatorTest.item("Z", 1, 0));
        InMemoryRecordStore store = new InMemoryRecordStore();

        PipelineReport report = pipeline(List.of(a, b), store).run(CancellationSignal.none(), null);

        assertEquals(3, report.itemsProduced());
        assertEquals(1, report.getDuplicatesDropped());
        assertEquals(3, report.getStored());
        assertEquals(List.of("X", "Y", "Z"),
                store.all().stream().map(ClassifiedRecord::getTitle).sorted().collect(Collectors.toList()));
        assertEquals(3, report.degradedCount(CauseCode.CLASSIFY_NO_CREDENTIAL));
    }

    @Test
    void run_shouldPropagateStoreFailure() {
        SourceAdapter a = NewsAggregatorTest.source("a", NewsAggregatorTest.item("X", 3, 0));
        InMemoryRecordStore store = new InMemoryRecordStore(true);
        RunTelemetry telemetry = new RunTelemetry("test", Instant.now());

        assertThrows(SQLException.class, () -> pipeline(List.of(a), store).run(CancellationSignal.none(), telemetry));
        assertTrue(telemetry.getSummary().contains("STORE"));
    }

    @Test
    void run_shouldSkipStoreWhenNothingWasFetched() throws Exception {
        InMemoryRecordStore store = new InMemoryRecordStore(true);

        PipelineReport report = pipeline(List.of(NewsAggregatorTest.failing("a")), store)
                .run(CancellationSignal.none(), null);

        assertEquals(0, report.itemsProduced());
        assertEquals(0, store.upsertCalls());
        assertEquals(List.of("a"), report.getFailedSources());
        assertEquals(1, report.degradedCount(CauseCode.SOURCE_FAILED));
    }

    @Test
    void run_shouldRecordStepsInTelemetry() throws Exception {
        RunTelemetry telemetry = new RunTelemetry("test", Instant.now());
        SourceAdapter a = NewsAggregatorTest.source("a", NewsAggregatorTest.item("X", 3, 0));

        pipeline(List.of(a), new InMemoryRecordStore()).run(CancellationSignal.none(), telemetry);
        telemetry.finish();

        List<String> steps = telemetry.stepRecords().stream().map(RunTelemetry.StepRecord::name).collect(Collectors.toList());
        assertEquals(List.of(RunTelemetry.STEP_FETCH, RunTelemetry.STEP_ENRICH, RunTelemetry.STEP_CLASSIFY, RunTelemetry.STEP_STORE), steps);
    }

    private static NewsPipeline pipeline(List<SourceAdapter> sources, RecordStore store) {
        Config config = Config.fromConfigurationProperties(Path.of("."), Map.of());
        return new NewsPipeline(
                sources,
                new NewsAggregator(4),
                new ContentEnricher(config, new CannedHttpClient()),
                new ArticleClassifier(config, null, "ai.api_key not set"),
                store
        );
    }
}
