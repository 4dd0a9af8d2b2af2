package com.airline.warehouse.dimension;

public enum MergeOutcome {
    /** Tracked attributes match the current version; nothing written. */
    NO_CHANGE,
    /** The current version was expired and a new one inserted. */
    NEW_VERSION,
    /** First sighting of the business key. */
    NEW_ENTITY
}
