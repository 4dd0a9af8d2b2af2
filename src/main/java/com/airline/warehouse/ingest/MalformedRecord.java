package com.airline.warehouse.ingest;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Stand-in for an ingest line that could not be parsed. It flows through validation
 * like any other record and is rejected there.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class MalformedRecord extends SourceRecord {

    int lineNumber;
    String error;

    @Override
    public RecordKind getKind() {
        return RecordKind.MALFORMED;
    }

    @Override
    public String getRecordKey() {
        return null;
    }
}
