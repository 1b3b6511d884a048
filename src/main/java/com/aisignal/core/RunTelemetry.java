package com.aisignal.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Per-run bookkeeping for a refresh or digest: how long each stage took, how many items went in and
 * came out, which sources were lost, and whether the chat model was used.
 *
 * <p>A stage recorded twice in one run adds to the same line.</p>
 */
public final class RunTelemetry {
    public static final String STEP_FETCH = "FETCH";
    public static final String STEP_ENRICH = "ENRICH";
    public static final String STEP_CLASSIFY = "CLASSIFY";
    public static final String STEP_STORE = "STORE";
    public static final String STEP_DIGEST = "DIGEST";

    private final String trigger;
    private final Instant startedAt;
    private Instant finishedAt;

    private boolean aiUsed;
    private String aiReason = "unknown";
    private int itemsRaw;
    private int itemsDedup;
    private long errorsTotal;
    private final Set<String> failedSources = new LinkedHashSet<>();

    private final Map<String, Stage> stages = new LinkedHashMap<>();
    private final Map<String, Long> openedAtNanos = new HashMap<>();

    public RunTelemetry(String trigger, Instant startedAt) {
        this.trigger = trigger == null || trigger.isBlank() ? "manual" : trigger.trim();
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public synchronized String trigger() {
        return trigger;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized void startStep(String name) {
        String key = stepKey(name);
        stages.computeIfAbsent(key, Stage::new);
        openedAtNanos.put(key, System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, null);
    }

    /**
     * Closes a stage opened by {@link #startStep}; closing one that was never opened records counts
     * with zero elapsed time.
     */
    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount, String note) {
        String key = stepKey(name);
        Stage stage = stages.computeIfAbsent(key, Stage::new);
        Long opened = openedAtNanos.remove(key);
        if (opened != null) {
            stage.elapsedMs += Math.max(0L, (System.nanoTime() - opened) / 1_000_000L);
        }
        stage.itemsIn += Math.max(0L, itemsIn);
        stage.itemsOut += Math.max(0L, itemsOut);
        long errors = Math.max(0L, errorCount);
        stage.errorCount += errors;
        errorsTotal += errors;
        if (note != null && !note.isBlank() && !stage.notes.contains(note.trim())) {
            stage.notes.add(note.trim());
        }
    }

    public synchronized void setAiUsage(boolean used, String reason) {
        this.aiUsed = used;
        if (reason != null && !reason.isBlank()) {
            this.aiReason = reason.trim();
        } else {
            this.aiReason = used ? "used" : "unknown";
        }
    }

    public synchronized void setItemStats(int raw, int dedup) {
        this.itemsRaw = Math.max(0, raw);
        this.itemsDedup = Math.max(0, dedup);
    }

    public synchronized void addFailedSource(String sourceId) {
        if (sourceId != null && !sourceId.isBlank()) {
            failedSources.add(sourceId.trim());
        }
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized long totalElapsedMs() {
        return Duration.between(startedAt, finishedAt == null ? Instant.now() : finishedAt).toMillis();
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>(stages.size());
        for (Stage stage : stages.values()) {
            out.add(stage.toRecord());
        }
        return out;
    }

    /**
     * Multi-line {@code key=value} block logged as RUN_SUMMARY after every run.
     */
    public synchronized String getSummary() {
        List<String> lines = new ArrayList<>();
        lines.add("trigger=" + trigger);
        lines.add("started_at=" + DateTimeFormatter.ISO_INSTANT.format(startedAt));
        lines.add("total_elapsed_ms=" + Math.max(0L, totalElapsedMs()));
        lines.add("ai_used=" + aiUsed + " ai_reason=" + aiReason);
        lines.add("items_raw=" + itemsRaw);
        lines.add("items_dedup=" + itemsDedup);
        lines.add("failed_sources=" + (failedSources.isEmpty() ? "-" : String.join(",", failedSources)));
        lines.add("errors_total=" + errorsTotal);
        lines.add("steps:");
        for (Stage stage : stages.values()) {
            lines.add("  " + stage.describe());
        }
        return String.join("\n", lines);
    }

    private static String stepKey(String name) {
        return name == null || name.isBlank() ? "UNKNOWN_STEP" : name.trim().toUpperCase(Locale.ROOT);
    }

    private static final class Stage {
        private final String name;
        private final List<String> notes = new ArrayList<>();
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;

        private Stage(String name) {
            this.name = name;
        }

        private StepRecord toRecord() {
            return new StepRecord(name, elapsedMs, itemsIn, itemsOut, errorCount, String.join("; ", notes));
        }

        private String describe() {
            String line = String.format(Locale.US, "%s elapsed_ms=%d in=%d out=%d err=%d",
                    name, elapsedMs, itemsIn, itemsOut, errorCount);
            return notes.isEmpty() ? line : line + " note=" + String.join("; ", notes);
        }
    }

    public record StepRecord(String name, long elapsedMs, long itemsIn, long itemsOut, long errorCount, String note) {
    }
}
