package com.airline.warehouse.exception;

import com.airline.warehouse.pipeline.LoadSummary;
import lombok.Getter;

/**
 * A fatal error stopped the batch. Carries what had been done up to that point.
 */
@Getter
public class BatchAbortedException extends WarehouseLoadException {

    private final transient LoadSummary partialSummary;

    public BatchAbortedException(LoadSummary partialSummary, Throwable cause) {
        super("Batch " + partialSummary.getRunId() + " aborted: " + cause.getMessage(), cause);
        this.partialSummary = partialSummary;
    }
}
