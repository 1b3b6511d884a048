package com.aisignal.news;

import com.aisignal.model.IntermediateItem;
import lombok.Value;

import java.util.List;

/**
 * Items in input order plus what happened to them. {@code skipped} counts items that had enough
 * text or no fetchable page; {@code missed} counts fetches that found no usable description.
 */
@Value
public class EnrichmentResult {
    List<IntermediateItem> items;
    int attempted;
    int filled;
    int skipped;
    int missed;
    int failed;
    int cancelled;
}
