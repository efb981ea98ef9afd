package br.edu.ifba.deduper.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scan-wide cancellation flag, checked between buckets and between scoring batches.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
