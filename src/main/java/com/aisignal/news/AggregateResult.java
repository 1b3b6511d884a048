package com.aisignal.news;

import com.aisignal.model.IntermediateItem;
import lombok.Value;

import java.util.List;

/**
 * Merged, deduplicated and ranked items of one fetch, plus the sources that failed or were
 * cancelled.
 */
@Value
public class AggregateResult {
    List<IntermediateItem> items;
    List<String> failedSources;
    List<String> cancelledSources;
    int rawCount;
    int duplicatesDropped;

    public AggregateResult(
            List<IntermediateItem> items,
            List<String> failedSources,
            List<String> cancelledSources,
            int rawCount,
            int duplicatesDropped
    ) {
        this.items = items == null ? List.of() : List.copyOf(items);
        this.failedSources = failedSources == null ? List.of() : List.copyOf(failedSources);
        this.cancelledSources = cancelledSources == null ? List.of() : List.copyOf(cancelledSources);
        this.rawCount = Math.max(0, rawCount);
        this.duplicatesDropped = Math.max(0, duplicatesDropped);
    }
}
