package com.aisignal.news;

import com.aisignal.core.diagnostics.CauseCode;
import com.aisignal.model.ClassifiedRecord;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * What one refresh produced and where it had to degrade.
 */
@Value
public class PipelineReport {
    List<ClassifiedRecord> records;
    int rawCount;
    int duplicatesDropped;
    List<String> failedSources;
    List<String> cancelledSources;
    int enrichAttempted;
    int enrichFilled;
    int enrichFailed;
    Map<CauseCode, Integer> degraded;
    int stored;

    /** Classified records handed to the store. */
    public int itemsProduced() {
        return records.size();
    }

    /** Zero when the cause never occurred. */
    public int degradedCount(CauseCode code) {
        return degraded.getOrDefault(code, 0);
    }

    /**
     * Compact {@code key=value} summary for the log.
     */
    public String oneLine() {
        return String.format(
                Locale.US,
                "items=%d raw=%d duplicates=%d failed_sources=%s enrich=%d/%d enrich_failed=%d degraded=%s stored=%d",
                records.size(),
                rawCount,
                duplicatesDropped,
                failedSources.isEmpty() ? "-" : String.join(",", failedSources),
                enrichFilled,
                enrichAttempted,
                enrichFailed,
                degraded.isEmpty() ? "-" : degraded.toString(),
                stored
        );
    }
}
