package com.aisignal.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag shared by one pipeline run. Raising it stops new outbound calls; calls
 * already in flight are left to finish.
 */
public final class CancellationSignal {
    private static final CancellationSignal NEVER = new CancellationSignal();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** A signal nobody holds, so it never fires. */
    public static CancellationSignal none() {
        return NEVER;
    }

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /** Idempotent. */
    public void cancel() {
        if (this == NEVER) {
            return;
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
