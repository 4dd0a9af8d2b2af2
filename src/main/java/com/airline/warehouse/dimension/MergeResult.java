package com.airline.warehouse.dimension;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What a merge did, and the surrogate key of the version that is current afterwards.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MergeResult {

    MergeOutcome outcome;
    long surrogateKey;

    public static MergeResult noChange(long currentKey) {
        return new MergeResult(MergeOutcome.NO_CHANGE, currentKey);
    }

    public static MergeResult newVersion(long surrogateKey) {
        return new MergeResult(MergeOutcome.NEW_VERSION, surrogateKey);
    }

    public static MergeResult newEntity(long surrogateKey) {
        return new MergeResult(MergeOutcome.NEW_ENTITY, surrogateKey);
    }
}
