package com.mapsheet.collection.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mapsheet.collection.core.model.WorkUnitIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the work-unit listing from JSON.
 *
 * <p>Expected format, in submission-sheet order:</p>
 * <pre>
 * [
 *   {"identifier": "MAHROUS", "teamNumber": "12", "aliases": ["Mahrous", "MAHROOS"]},
 *   {"identifier": "Team_317", "teamNumber": "317"}
 * ]
 * </pre>
 */
public class JsonWorkUnitRegistryReader {
    private static final Logger log = LoggerFactory.getLogger(JsonWorkUnitRegistryReader.class);

    private final ObjectMapper objectMapper;

    public JsonWorkUnitRegistryReader() {
        this(new ObjectMapper());
    }

    public JsonWorkUnitRegistryReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public WorkUnitRegistry read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            WorkUnitRegistry registry = read(in);
            log.info("registry.loaded path={} workUnits={}", path, registry.size());
            return registry;
        } catch (IOException e) {
            throw new ReferenceDataException("Cannot read work unit listing " + path, e);
        }
    }

    public WorkUnitRegistry read(InputStream in) {
        List<WorkUnitEntry> entries;
        try {
            entries = objectMapper.readValue(in, new TypeReference<List<WorkUnitEntry>>() {});
        } catch (IOException e) {
            throw new ReferenceDataException("Malformed work unit listing: " + e.getMessage(), e);
        }
        if (entries == null) {
            throw new ReferenceDataException("Work unit listing is empty");
        }

        List<WorkUnitIdentity> units = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            WorkUnitEntry entry = entries.get(i);
            if (entry == null || entry.identifier() == null || entry.identifier().isBlank()) {
                throw new ReferenceDataException("Work unit entry " + i + " has no identifier");
            }
            units.add(new WorkUnitIdentity(entry.identifier().trim(), entry.teamNumber(), entry.aliases()));
        }
        try {
            return new WorkUnitRegistry(units);
        } catch (IllegalArgumentException e) {
            throw new ReferenceDataException(e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record WorkUnitEntry(
            String identifier,
            String teamNumber,
            List<String> aliases
    ) {}
}
