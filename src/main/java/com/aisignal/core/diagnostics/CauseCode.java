package com.aisignal.core.diagnostics;

/**
 * Failure classes a pipeline stage can degrade on. Only store failures leave the batch, and they
 * travel as {@link java.sql.SQLException}, never as a cause code.
 */
public enum CauseCode {
    NONE,
    SOURCE_FAILED,
    SOURCE_DISABLED,
    ENRICH_FAILED,
    CLASSIFY_NO_CREDENTIAL,
    CLASSIFY_TRANSPORT_FAILED,
    CLASSIFY_SCHEMA_INVALID,
    CANCELLED,
    RUNTIME_ERROR
}
