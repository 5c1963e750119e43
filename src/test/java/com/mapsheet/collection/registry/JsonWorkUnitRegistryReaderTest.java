package com.mapsheet.collection.registry;

import com.mapsheet.collection.core.model.WorkUnitIdentity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Work unit registry Tests")
class JsonWorkUnitRegistryReaderTest {

    private final JsonWorkUnitRegistryReader reader = new JsonWorkUnitRegistryReader();

    private static InputStream json(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("JSON reader")
    class ReaderTests {

        @Test
        @DisplayName("Reads work units in listing order")
        void readsListing() {
            WorkUnitRegistry registry = reader.read(json("""
                    [
                      {"identifier": "MAHROUS", "teamNumber": "12", "aliases": ["MAHROOS"], "region": "north"},
                      {"identifier": " Team_317 ", "teamNumber": "317"}
                    ]
                    """));

            assertEquals(2, registry.size());
            assertEquals(List.of("MAHROUS", "Team_317"),
                    registry.all().stream().map(WorkUnitIdentity::identifier).toList());
            assertEquals(List.of("MAHROOS"), registry.all().get(0).aliases());
            assertEquals(List.of(), registry.all().get(1).aliases());
            assertEquals("317", registry.all().get(1).teamNumber());
        }

        @Test
        @DisplayName("Reads from a file")
        void readsFile(@TempDir Path dir) throws IOException {
            Path file = Files.writeString(dir.resolve("work-units.json"), "[{\"identifier\": \"ALTAIRAT\"}]");

            assertTrue(reader.read(file).find("altairat").isPresent());
        }

        @Test
        @DisplayName("Missing file is a reference data error")
        void missingFile(@TempDir Path dir) {
            assertThrows(ReferenceDataException.class, () -> reader.read(dir.resolve("none.json")));
        }

        @ParameterizedTest
        @DisplayName("Invalid listings are reference data errors")
        @ValueSource(strings = {
                "{not json",
                "{\"identifier\": \"MAHROUS\"}",
                "[{\"teamNumber\": \"12\"}]",
                "[{\"identifier\": \"  \"}]",
                "[{\"identifier\": \"MAHROUS\"}, {\"identifier\": \"mahrous\"}]",
                "null"
        })
        void invalidListing(String content) {
            assertThrows(ReferenceDataException.class, () -> reader.read(json(content)));
        }
    }

    @Nested
    @DisplayName("Registry")
    class RegistryTests {

        @Test
        @DisplayName("Finds units ignoring case")
        void find() {
            WorkUnitRegistry registry = WorkUnitRegistry.of(WorkUnitIdentity.of("Team_317"));
            assertTrue(registry.find("TEAM_317").isPresent());
            assertTrue(registry.find("Team_318").isEmpty());
            assertTrue(registry.find(null).isEmpty());
        }

        @Test
        @DisplayName("Empty registry is allowed")
        void empty() {
            assertTrue(WorkUnitRegistry.empty().isEmpty());
        }

        @Test
        @DisplayName("Duplicate identifiers are rejected")
        void duplicates() {
            assertThrows(IllegalArgumentException.class, () -> WorkUnitRegistry.of(
                    WorkUnitIdentity.of("MAHROUS"), WorkUnitIdentity.of("Mahrous")));
        }
    }
}
