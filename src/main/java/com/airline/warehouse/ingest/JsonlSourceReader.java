package com.airline.warehouse.ingest;

import com.airline.warehouse.exception.WarehouseLoadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads an ingest file, one JSON object per line. Blank lines and lines starting with
 * {@code #} are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonlSourceReader {

    private final SourceRecordLineMapper lineMapper;

    public List<SourceRecord> readAll(Resource resource) {
        List<SourceRecord> records = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank() || line.stripLeading().startsWith("#")) {
                    continue;
                }
                records.add(lineMapper.mapLine(line, lineNumber));
            }
        } catch (IOException e) {
            throw new WarehouseLoadException("Failed to read ingest file " + resource.getDescription(), e);
        }
        log.info("Read {} records from {}", records.size(), resource.getDescription());
        return records;
    }
}
