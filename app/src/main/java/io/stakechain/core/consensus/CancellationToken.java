package io.stakechain.core.consensus;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative stop signal checked between PoW batches. */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
