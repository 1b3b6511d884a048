package com.aisignal.news;

import com.aisignal.core.diagnostics.CauseCode;
import com.aisignal.model.ClassifiedRecord;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Records in input order plus how many of them fell back to defaults, per cause.
 */
@Value
public class ClassificationBatch {
    List<ClassifiedRecord> records;
    Map<CauseCode, Integer> degraded;
    int modelCalls;

    public int degradedTotal() {
        int total = 0;
        for (int count : degraded.values()) {
            total += count;
        }
        return total;
    }
}
