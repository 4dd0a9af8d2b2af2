package com.airline.warehouse.fact;

/**
 * What a fact upsert did.
 */
public enum UpsertResult {

    INSERTED,
    UPDATED,

    /** A replay carrying the same revisable measures; nothing was written. */
    UNCHANGED
}
