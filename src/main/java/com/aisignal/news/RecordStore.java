package com.aisignal.news;

import com.aisignal.model.ClassifiedRecord;

import java.sql.SQLException;
import java.util.List;

/**
 * Persistence collaborator of the pipeline. The only failure allowed to abort a batch.
 */
public interface RecordStore {

    /**
     * Inserts or replaces by identity; the AI-derived fields of the newer record win.
     *
     * @return number of rows written
     */
    int upsert(List<ClassifiedRecord> records) throws SQLException;

    /**
     * Records with relevance at least {@code minRelevance}, most relevant and most recent first.
     */
    List<ClassifiedRecord> queryTop(int minRelevance, int limit) throws SQLException;
}
