package com.airline.warehouse.fact;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of loading a list of flights.
 */
@Value
public class FactLoadReport {

    int inserted;
    int updated;
    int unchanged;

    /** Flight fact key to failure message. */
    Map<String, String> failures;

    public int getFailed() {
        return failures.size();
    }

    public int getProcessed() {
        return inserted + updated + unchanged + failures.size();
    }

    public List<String> failedKeys() {
        return List.copyOf(failures.keySet());
    }
}
