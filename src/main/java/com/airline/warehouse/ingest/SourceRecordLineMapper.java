package com.airline.warehouse.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.file.LineMapper;
import org.springframework.stereotype.Component;

/**
 * Maps one JSONL line to a typed {@link SourceRecord}. Lines that are not valid JSON,
 * carry an unknown {@code type}, or hold values of the wrong type become a
 * {@link MalformedRecord} instead of failing the read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceRecordLineMapper implements LineMapper<SourceRecord> {

    private final ObjectMapper objectMapper;

    @Override
    public SourceRecord mapLine(String line, int lineNumber) {
        try {
            SourceRecord record = objectMapper.readValue(line, SourceRecord.class);
            return record != null ? record : new MalformedRecord(lineNumber, "empty record");
        } catch (JsonProcessingException e) {
            log.debug("Line {} is not a valid record: {}", lineNumber, e.getOriginalMessage());
            return new MalformedRecord(lineNumber, e.getOriginalMessage());
        }
    }
}
