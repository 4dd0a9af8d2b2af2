package com.airline.warehouse.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A {@link CancellationSignal} that can be raised from another thread.
 */
public class CancellationToken implements CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }
}
