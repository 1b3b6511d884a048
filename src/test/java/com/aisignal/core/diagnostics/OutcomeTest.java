package com.aisignal.core.diagnostics;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutcomeTest {

    @Test
    void attempt_shouldTagThrownExceptionWithCause() {
        Outcome<String> outcome = Outcome.attempt("medium", CauseCode.SOURCE_FAILED, () -> {
            throw new IOException("HTTP 503");
        });

        assertFalse(outcome.success);
        assertEquals(CauseCode.SOURCE_FAILED, outcome.causeCode);
        assertEquals("medium", outcome.owner);
        assertEquals("IOException: HTTP 503", outcome.error());
        assertEquals("fallback", outcome.valueOr("fallback"));
    }

    @Test
    void attempt_shouldReportInterruptAsCancelled() {
        Outcome<String> outcome = Outcome.attempt("hackernews", CauseCode.SOURCE_FAILED, () -> {
            throw new InterruptedException();
        });

        assertEquals(CauseCode.CANCELLED, outcome.causeCode);
        assertTrue(Thread.interrupted());
    }

    @Test
    void flatMap_shouldChainSuccessAndPassFailureThrough() {
        Outcome<Integer> length = Outcome.success("abcd", "parse").flatMap(s -> Outcome.success(s.length(), "parse"));
        Outcome<Integer> failed = Outcome.<String>failure(CauseCode.CLASSIFY_SCHEMA_INVALID, "parse", "bad json")
                .flatMap(s -> Outcome.success(s.length(), "parse"));

        assertEquals(4, length.valueOr(0));
        assertFalse(failed.success);
        assertEquals(CauseCode.CLASSIFY_SCHEMA_INVALID, failed.causeCode);
        assertEquals("bad json", failed.error());
    }
}
