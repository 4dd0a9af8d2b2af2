package com.airline.warehouse.pipeline;

/**
 * Polled by the pipeline between records. Records already in flight always finish.
 */
@FunctionalInterface
public interface CancellationSignal {

    boolean isCancelled();

    static CancellationSignal never() {
        return () -> false;
    }
}
