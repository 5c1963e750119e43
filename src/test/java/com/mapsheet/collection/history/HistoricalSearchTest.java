package com.mapsheet.collection.history;

import com.mapsheet.collection.core.model.FileCategory;
import com.mapsheet.collection.core.model.WorkUnitIdentity;
import com.mapsheet.collection.metrics.MetricsService;
import com.mapsheet.collection.registry.WorkUnitRegistry;
import com.mapsheet.collection.resolve.CategoryVocabulary;
import com.mapsheet.collection.resolve.CollectionPeriod;
import com.mapsheet.collection.resolve.IdentityResolver;
import com.mapsheet.collection.resolve.ResolverOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("HistoricalSearch Tests")
class HistoricalSearchTest {

    private static final LocalDate UP_TO = LocalDate.of(2025, 9, 10);
    private static final WorkUnitIdentity MAHROUS = WorkUnitIdentity.of("MAHROUS");
    private static final WorkUnitIdentity ALTAIRAT = WorkUnitIdentity.of("ALTAIRAT");
    private static final WorkUnitIdentity TEAM_317 = new WorkUnitIdentity("Team_317", "317", List.of());

    @TempDir
    Path archiveRoot;

    private ArchiveLayout layout;
    private IdentityResolver resolver;
    private HistoricalSearch search;

    @BeforeEach
    void setUp() {
        layout = new ArchiveLayout(archiveRoot);
        resolver = new IdentityResolver(WorkUnitRegistry.of(MAHROUS, ALTAIRAT, TEAM_317),
                CategoryVocabulary.defaults(), ResolverOptions.defaults(), CollectionPeriod.daily(UP_TO));
        search = new HistoricalSearch(layout, resolver);
    }

    @AfterEach
    void tearDown() {
        search.close();
    }

    private Path place(Path folder, String fileName) throws IOException {
        Files.createDirectories(folder);
        return Files.writeString(folder.resolve(fileName), "kmz");
    }

    @Nested
    @DisplayName("Archive layout")
    class LayoutTests {

        @Test
        @DisplayName("Builds month, day and category folders")
        void folders() {
            LocalDate date = LocalDate.of(2025, 8, 30);
            assertEquals(archiveRoot.resolve("202508"), layout.monthFolder(date));
            assertEquals(archiveRoot.resolve("202508").resolve("20250830"), layout.dayFolder(date));
            assertEquals(archiveRoot.resolve("202508").resolve("20250830").resolve("Planned routes"),
                    layout.categoryFolder(date, FileCategory.PLANNED_ROUTES));
        }

        @Test
        @DisplayName("Canonical file name joins identifier, category token and date")
        void canonicalName() {
            assertEquals("MAHROUS_finished_points_and_tracks_20250830.kmz",
                    layout.canonicalFileName(MAHROUS, FileCategory.FINISHED_OBSERVATIONS, LocalDate.of(2025, 8, 30)));
            assertEquals("Team_317_plan_routes_20250831.kmz",
                    layout.canonicalFileName(TEAM_317, FileCategory.PLANNED_ROUTES, LocalDate.of(2025, 8, 31)));
        }

        @Test
        @DisplayName("Archive extension check ignores case")
        void extension() {
            assertTrue(layout.hasArchiveExtension(Path.of("a.KMZ")));
            assertFalse(layout.hasArchiveExtension(Path.of("a.kml")));
            assertEquals("kmz", new ArchiveLayout(archiveRoot, ".KMZ").getExtension());
        }
    }

    @Nested
    @DisplayName("Exact pass")
    class ExactTests {

        @Test
        @DisplayName("Finds the canonical file in its category folder")
        void categoryFolder() throws IOException {
            LocalDate date = LocalDate.of(2025, 9, 8);
            Path expected = place(layout.categoryFolder(date, FileCategory.FINISHED_OBSERVATIONS),
                    "MAHROUS_finished_points_and_tracks_20250908.kmz");

            HistoricalLookupResult result = search.findLastSatisfying(MAHROUS, FileCategory.FINISHED_OBSERVATIONS, UP_TO);

            assertEquals(LookupStrategy.EXACT, result.strategy());
            assertEquals(expected, result.path());
            assertEquals(date, result.effectiveDate());
        }

        @Test
        @DisplayName("Finds the canonical file directly in the day folder")
        void dayFolder() throws IOException {
            LocalDate date = LocalDate.of(2025, 9, 2);
            Path expected = place(layout.dayFolder(date), "ALTAIRAT_plan_routes_20250902.kmz");

            HistoricalLookupResult result = search.findLastSatisfying(ALTAIRAT, FileCategory.PLANNED_ROUTES, UP_TO);

            assertEquals(LookupStrategy.EXACT, result.strategy());
            assertEquals(expected, result.path());
        }

        @Test
        @DisplayName("Exact hit wins over a more recent misspelled file")
        void exactBeforeFuzzy() throws IOException {
            Path exact = place(layout.categoryFolder(LocalDate.of(2025, 9, 8), FileCategory.FINISHED_OBSERVATIONS),
                    "MAHROUS_finished_points_and_tracks_20250908.kmz");
            place(layout.dayFolder(LocalDate.of(2025, 9, 9)), "mahros_finished_points_20250909.kmz");

            HistoricalLookupResult result = search.findLastSatisfying(MAHROUS, FileCategory.FINISHED_OBSERVATIONS, UP_TO);

            assertEquals(LookupStrategy.EXACT, result.strategy());
            assertEquals(exact, result.path());
        }

        @Test
        @DisplayName("Finds the canonical file filed under a later day folder")
        void laterFolder() throws IOException {
            Path expected = place(layout.categoryFolder(UP_TO, FileCategory.FINISHED_OBSERVATIONS),
                    "Team_317_finished_points_and_tracks_20250905.kmz");

            HistoricalLookupResult result = search.findLastSatisfying(TEAM_317, FileCategory.FINISHED_OBSERVATIONS, UP_TO);

            assertEquals(LookupStrategy.EXACT, result.strategy());
            assertEquals(expected, result.path());
            assertEquals(LocalDate.of(2025, 9, 5), result.effectiveDate());
        }

        @Test
        @DisplayName("Finds planned routes filed under the day before their date")
        void earlierFolder() throws IOException {
            Path expected = place(layout.dayFolder(LocalDate.of(2025, 9, 8)), "MAHROUS_plan_routes_20250909.kmz");

            HistoricalLookupResult result = search.findLastSatisfying(MAHROUS, FileCategory.PLANNED_ROUTES, UP_TO);

            assertEquals(LookupStrategy.EXACT, result.strategy());
            assertEquals(expected, result.path());
            assertEquals(LocalDate.of(2025, 9, 9), result.effectiveDate());
        }

        @Test
        @DisplayName("The reference date itself is searched")
        void includesUpTo() throws IOException {
            place(layout.categoryFolder(UP_TO, FileCategory.FINISHED_OBSERVATIONS),
                    "MAHROUS_finished_points_and_tracks_20250910.kmz");

            assertEquals(UP_TO, search.findLastSatisfying(MAHROUS, FileCategory.FINISHED_OBSERVATIONS, UP_TO)
                    .effectiveDate());
        }
    }

    @Nested
    @DisplayName("Fuzzy pass")
    class FuzzyTests {

        @Test
        @DisplayName("Effective date comes from the file name, not the folder")
        void dateFromFileName() throws IOException {
            Path stored = place(layout.categoryFolder(UP_TO, FileCategory.FINISHED_OBSERVATIONS),
                    "Team_317_finished_points_20250821.kmz");

            HistoricalLookupResult result = search.findLastSatisfying(TEAM_317, FileCategory.FINISHED_OBSERVATIONS, UP_TO);

            assertEquals(LookupStrategy.FUZZY, result.strategy());
            assertEquals(stored, result.path());
            assertEquals(LocalDate.of(2025, 8, 21), result.effectiveDate());
            assertTrue(result.explanation().contains("2025-08-21"));
        }

        @Test
        @DisplayName("Misspelled names are recognized")
        void misspelled() throws IOException {
            Path stored = place(layout.dayFolder(LocalDate.of(2025, 9, 5)), "mahros_finished_points_20250905.kmz");

            HistoricalLookupResult result = search.findLastSatisfying(MAHROUS, FileCategory.FINISHED_OBSERVATIONS, UP_TO);

            assertEquals(LookupStrategy.FUZZY, result.strategy());
            assertEquals(stored, result.path());
        }

        @Test
        @DisplayName("Most recent file-name date wins across folders")
        void mostRecent() throws IOException {
            place(layout.dayFolder(LocalDate.of(2025, 9, 9)), "Team_317_finished_points_20250901.kmz");
            Path newest = place(layout.dayFolder(LocalDate.of(2025, 9, 3)), "Team_317_finished_points_20250903.kmz");

            HistoricalLookupResult result = search.findLastSatisfying(TEAM_317, FileCategory.FINISHED_OBSERVATIONS, UP_TO);

            assertEquals(newest, result.path());
        }

        @Test
        @DisplayName("Equal dates go to the lexically later file name")
        void tieBreak() throws IOException {
            place(layout.dayFolder(LocalDate.of(2025, 9, 1)), "Team_317_finished_points_20250821_a.kmz");
            Path later = place(layout.dayFolder(LocalDate.of(2025, 8, 25)), "Team_317_finished_points_20250821_b.kmz");

            HistoricalLookupResult result = search.findLastSatisfying(TEAM_317, FileCategory.FINISHED_OBSERVATIONS, UP_TO);

            assertEquals(later, result.path());
        }

        @Test
        @DisplayName("A newer file of an unregistered team is not taken for the requested team")
        void otherTeamNumber() throws IOException {
            Path own = place(layout.dayFolder(LocalDate.of(2025, 9, 5)), "Team_317_finished_points_20250905.kmz");
            place(layout.categoryFolder(LocalDate.of(2025, 9, 9), FileCategory.FINISHED_OBSERVATIONS),
                    "Team_319_finished_points_and_tracks_20250909.kmz");

            HistoricalLookupResult result = search.findLastSatisfying(TEAM_317, FileCategory.FINISHED_OBSERVATIONS, UP_TO);

            assertEquals(LookupStrategy.FUZZY, result.strategy());
            assertEquals(own, result.path());
        }

        @Test
        @DisplayName("Files of other work units, other categories or other extensions are ignored")
        void ignoresOthers() throws IOException {
            Path day = layout.dayFolder(LocalDate.of(2025, 9, 4));
            place(day, "ALTAIRAT_finished_points_20250904.kmz");
            place(day, "Team_317_plan_routes_20250905.kmz");
            place(day, "Team_317_finished_points_20250904.txt");

            HistoricalLookupResult result = search.findLastSatisfying(TEAM_317, FileCategory.FINISHED_OBSERVATIONS, UP_TO);

            assertEquals(LookupStrategy.NONE, result.strategy());
            assertFalse(result.isFound());
        }
    }

    @Nested
    @DisplayName("Unreadable folders")
    class UnreadableFolderTests {

        @Test
        @DisplayName("A folder that cannot be listed is skipped")
        void unlistableFolder() throws IOException {
            assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
            Path found = place(layout.dayFolder(LocalDate.of(2025, 9, 5)), "Team_317_finished_points_20250905.kmz");
            Path locked = layout.dayFolder(LocalDate.of(2025, 9, 8));
            place(locked, "Team_317_finished_points_20250908.kmz");
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
            try {
                assumeFalse(Files.isReadable(locked), "permissions are not enforced for this user");

                HistoricalLookupResult result = assertDoesNotThrow(
                        () -> search.findLastSatisfying(TEAM_317, FileCategory.FINISHED_OBSERVATIONS, UP_TO));

                assertEquals(LookupStrategy.FUZZY, result.strategy());
                assertEquals(found, result.path());
            } finally {
                Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
            }
        }

        @Test
        @DisplayName("A folder whose scan fails is skipped")
        void failingScan() throws IOException {
            Path found = place(layout.dayFolder(LocalDate.of(2025, 9, 5)), "Team_317_finished_points_20250905.kmz");
            place(layout.dayFolder(LocalDate.of(2025, 9, 8)), "Team_317_finished_points_20250908_broken.kmz");
            IdentityResolver failing = mock(IdentityResolver.class);
            when(failing.identify(anyString())).thenAnswer(invocation -> {
                String fileName = invocation.getArgument(0);
                if (fileName.contains("broken")) {
                    throw new UncheckedIOException(new IOException("archive entry unreadable"));
                }
                return resolver.identify(fileName);
            });

            try (HistoricalSearch scanning = new HistoricalSearch(layout, failing)) {
                HistoricalLookupResult result = assertDoesNotThrow(
                        () -> scanning.findLastSatisfying(TEAM_317, FileCategory.FINISHED_OBSERVATIONS, UP_TO));

                assertEquals(LookupStrategy.FUZZY, result.strategy());
                assertEquals(found, result.path());
            }
        }

        @Test
        @DisplayName("A scan failing with an unexpected error is skipped")
        void unexpectedError() throws IOException {
            Path found = place(layout.dayFolder(LocalDate.of(2025, 9, 5)), "Team_317_finished_points_20250905.kmz");
            place(layout.dayFolder(LocalDate.of(2025, 9, 8)), "Team_317_finished_points_20250908_broken.kmz");
            IdentityResolver failing = mock(IdentityResolver.class);
            when(failing.identify(anyString())).thenAnswer(invocation -> {
                String fileName = invocation.getArgument(0);
                if (fileName.contains("broken")) {
                    throw new IllegalStateException("unexpected");
                }
                return resolver.identify(fileName);
            });

            try (HistoricalSearch scanning = new HistoricalSearch(layout, failing)) {
                HistoricalLookupResult result = scanning.findLastSatisfying(TEAM_317, FileCategory.FINISHED_OBSERVATIONS, UP_TO);
                assertEquals(found, result.path());
            }
        }
    }

    @Nested
    @DisplayName("Search window")
    class WindowTests {

        @Test
        @DisplayName("Folders older than the lookback window are not scanned")
        void outsideWindow() throws IOException {
            place(layout.dayFolder(LocalDate.of(2025, 8, 1)), "Team_317_finished_points_20250801.kmz");

            HistoricalLookupResult result = search.findLastSatisfying(TEAM_317, FileCategory.FINISHED_OBSERVATIONS, UP_TO);

            assertEquals(LookupStrategy.NONE, result.strategy());
            assertNull(result.path());
            assertTrue(result.explanation().contains("Team_317"));
        }

        @Test
        @DisplayName("A longer lookback reaches older folders")
        void longerLookback() throws IOException {
            place(layout.dayFolder(LocalDate.of(2025, 8, 1)), "Team_317_finished_points_20250801.kmz");
            HistoricalSearchOptions options = HistoricalSearchOptions.builder().lookbackDays(40).parallelism(2).build();

            try (HistoricalSearch wide = new HistoricalSearch(layout, options, resolver, null)) {
                HistoricalLookupResult result = wide.findLastSatisfying(TEAM_317, FileCategory.FINISHED_OBSERVATIONS, UP_TO);
                assertEquals(LookupStrategy.FUZZY, result.strategy());
                assertEquals(LocalDate.of(2025, 8, 1), result.effectiveDate());
            }
        }

        @Test
        @DisplayName("Empty archive yields no result")
        void emptyArchive() {
            HistoricalLookupResult result = search.findLastSatisfying(MAHROUS, FileCategory.PLANNED_ROUTES, UP_TO);
            assertEquals(LookupStrategy.NONE, result.strategy());
            assertTrue(result.foundPath().isEmpty());
        }

        @Test
        @DisplayName("Invalid options are rejected")
        void invalidOptions() {
            assertThrows(IllegalArgumentException.class, () -> HistoricalSearchOptions.builder().lookbackDays(-1));
            assertThrows(IllegalArgumentException.class, () -> HistoricalSearchOptions.builder().parallelism(0));
        }
    }

    @Test
    @DisplayName("Records lookup duration per strategy")
    void recordsMetrics() throws IOException {
        MetricsService metricsService = mock(MetricsService.class);
        place(layout.dayFolder(LocalDate.of(2025, 9, 5)), "Team_317_finished_points_20250905.kmz");

        try (HistoricalSearch instrumented = new HistoricalSearch(layout, HistoricalSearchOptions.defaults(),
                resolver, metricsService)) {
            instrumented.findLastSatisfying(TEAM_317, FileCategory.FINISHED_OBSERVATIONS, UP_TO);
            instrumented.findLastSatisfying(MAHROUS, FileCategory.FINISHED_OBSERVATIONS, UP_TO);
        }

        verify(metricsService).recordHistoricalSearchDuration(eq(LookupStrategy.FUZZY), any());
        verify(metricsService).recordHistoricalSearchDuration(eq(LookupStrategy.NONE), any());
    }
}
