package com.aisignal.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunTelemetryTest {

    @Test
    void summaryShouldContainRequiredFields() {
        RunTelemetry telemetry = new RunTelemetry("schedule", Instant.parse("2026-02-23T00:00:00Z"));
        telemetry.startStep(RunTelemetry.STEP_FETCH);
        telemetry.endStep(RunTelemetry.STEP_FETCH, 4, 3, 1, "failed=medium");
        telemetry.startStep(RunTelemetry.STEP_CLASSIFY);
        telemetry.endStep(RunTelemetry.STEP_CLASSIFY, 3, 3, 0);
        telemetry.setItemStats(40, 31);
        telemetry.addFailedSource("medium");
        telemetry.setAiUsage(false, "no_credential");
        telemetry.finish();

        String summary = telemetry.getSummary();

        assertTrue(summary.contains("trigger=schedule"));
        assertTrue(summary.contains("items_raw=40"));
        assertTrue(summary.contains("items_dedup=31"));
        assertTrue(summary.contains("failed_sources=medium"));
        assertTrue(summary.contains("ai_used=false ai_reason=no_credential"));
        assertTrue(summary.contains("errors_total=1"));
        assertTrue(summary.contains("FETCH elapsed_ms="));
        assertTrue(summary.contains("note=failed=medium"));
    }

    @Test
    void stepRecords_shouldKeepOrderAndAccumulateRepeatedSteps() {
        RunTelemetry telemetry = new RunTelemetry(" ", null);
        telemetry.startStep("fetch");
        telemetry.endStep("fetch", 2, 2, 0);
        telemetry.startStep(RunTelemetry.STEP_STORE);
        telemetry.endStep(RunTelemetry.STEP_STORE, 2, 2, 0);
        telemetry.startStep(RunTelemetry.STEP_FETCH);
        telemetry.endStep(RunTelemetry.STEP_FETCH, 3, 1, 2);

        List<RunTelemetry.StepRecord> records = telemetry.stepRecords();

        assertEquals("manual", telemetry.trigger());
        assertEquals(2, records.size());
        assertEquals("FETCH", records.get(0).name());
        assertEquals(5, records.get(0).itemsIn());
        assertEquals(3, records.get(0).itemsOut());
        assertEquals(2, records.get(0).errorCount());
        assertEquals("STORE", records.get(1).name());
    }
}
