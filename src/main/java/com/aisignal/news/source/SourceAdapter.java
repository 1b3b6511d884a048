package com.aisignal.news.source;

import com.aisignal.core.CancellationSignal;
import com.aisignal.model.IntermediateItem;

import java.util.List;

/**
 * One external provider of candidate items.
 *
 * <p>Implementations fetch, keep only relevant entries and normalize them. Any exception thrown
 * from {@link #fetch(CancellationSignal)} fails this source only; the aggregator records it and
 * carries on with the other sources.</p>
 */
public interface SourceAdapter {

    /**
     * Stable short id used in config and failure reports, for example {@code hackernews}.
     */
    String id();

    /**
     * Display name written to {@code sourceName} of the items.
     */
    String name();

    List<IntermediateItem> fetch(CancellationSignal signal) throws Exception;
}
