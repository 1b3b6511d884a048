package com.aisignal.news;

import com.aisignal.core.CancellationSignal;
import com.aisignal.model.IntermediateItem;
import com.aisignal.news.source.SourceAdapter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NewsAggregatorTest {
    private static final OffsetDateTime BASE = OffsetDateTime.of(2025, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    @Test
    void aggregate_shouldDropDuplicateIdentitiesAcrossSources() {
        SourceAdapter a = source("a", item("X", 5, 0), item("Y", 4, 0));
        SourceAdapter b = source("b", item("Y", 4, 0), item("Z", 3, 0));

        AggregateResult result = new NewsAggregator(4).aggregate(List.of(a, b), CancellationSignal.none());

        assertEquals(List.of("X", "Y", "Z"), titles(result.getItems()));
        assertEquals(4, result.getRawCount());
        assertEquals(1, result.getDuplicatesDropped());
        assertTrue(result.getFailedSources().isEmpty());
    }

    @Test
    void aggregate_shouldReturnEmptyWhenEverySourceFails() {
        AggregateResult result = new NewsAggregator(4).aggregate(
                List.of(failing("a"), failing("b"), failing("c")),
                CancellationSignal.none()
        );

        assertTrue(result.getItems().isEmpty());
        assertEquals(List.of("a", "b", "c"), result.getFailedSources().stream().sorted().collect(Collectors.toList()));
    }

    @Test
    void aggregate_shouldKeepItemsOfHealthySourcesWhenOneFails() {
        AggregateResult result = new NewsAggregator(2).aggregate(
                List.of(failing("broken"), source("ok", item("Only", 1, 0))),
                CancellationSignal.none()
        );

        assertEquals(List.of("Only"), titles(result.getItems()));
        assertEquals(List.of("broken"), result.getFailedSources());
    }

    @Test
    void aggregate_shouldSortByRankThenRecencyDescending() {
        SourceAdapter a = source("a", item("three", 3, 0), item("ten", 10, 0));
        SourceAdapter b = source("b", item("seven-old", 7, 0), item("seven-new", 7, 60));

        AggregateResult result = new NewsAggregator(2).aggregate(List.of(a, b), CancellationSignal.none());

        assertEquals(List.of("ten", "seven-new", "seven-old", "three"), titles(result.getItems()));
    }

    @Test
    void aggregate_shouldNotStartSourcesAfterCancellation() {
        AtomicInteger calls = new AtomicInteger();
        SourceAdapter counting = new SourceAdapter() {
            @Override
            public String id() {
                return "counting";
            }

            @Override
            public String name() {
                return "Counting";
            }

            @Override
            public List<IntermediateItem> fetch(CancellationSignal signal) {
                calls.incrementAndGet();
                return List.of(item("late", 1, 0));
            }
        };
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();

        AggregateResult result = new NewsAggregator(2).aggregate(List.of(counting), signal);

        assertEquals(0, calls.get());
        assertTrue(result.getItems().isEmpty());
        assertEquals(List.of("counting"), result.getCancelledSources());
        assertTrue(result.getFailedSources().isEmpty());
    }

    @Test
    void aggregate_shouldReportSourceWhoseAdapterThrowsError() {
        SourceAdapter broken = new SourceAdapter() {
            @Override
            public String id() {
                return "broken";
            }

            @Override
            public String name() {
                return "Broken";
            }

            @Override
            public List<IntermediateItem> fetch(CancellationSignal signal) {
                throw new LinkageError("adapter class missing a dependency");
            }
        };

        AggregateResult result = new NewsAggregator(2)
                .aggregate(List.of(broken, source("ok", item("kept", 1, 0))), CancellationSignal.none());

        assertEquals(List.of("broken"), result.getFailedSources());
        assertEquals(List.of("kept"), titles(result.getItems()));
    }

    static IntermediateItem item(String title, long rank, int minutesAfterBase) {
        String locator = "https://example.com/" + title;
        return IntermediateItem.builder()
                .identity(IdentityAssigner.identity(locator))
                .title(title)
                .locator(locator)
                .sourceName("Test")
                .publishedAt(BASE.plusMinutes(minutesAfterBase))
                .rankScore(rank)
                .build();
    }

    static SourceAdapter source(String id, IntermediateItem... items) {
        return new SourceAdapter() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public String name() {
                return id;
            }

            @Override
            public List<IntermediateItem> fetch(CancellationSignal signal) {
                return List.of(items);
            }
        };
    }

    static SourceAdapter failing(String id) {
        return new SourceAdapter() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public String name() {
                return id;
            }

            @Override
            public List<IntermediateItem> fetch(CancellationSignal signal) throws IOException {
                throw new IOException("upstream unavailable");
            }
        };
    }

    private static List<String> titles(List<IntermediateItem> items) {
        return items.stream().map(IntermediateItem::getTitle).collect(Collectors.toList());
    }
}
