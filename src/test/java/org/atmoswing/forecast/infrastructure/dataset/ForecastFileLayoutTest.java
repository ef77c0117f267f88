package org.atmoswing.forecast.infrastructure.dataset;

import org.atmoswing.forecast.core.exception.ForecastNotFoundException;
import org.atmoswing.forecast.core.model.ForecastDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ForecastFileLayoutTest {

    @TempDir
    Path dataDir;

    private Path region;

    @BeforeEach
    void setUp() throws IOException {
        region = Files.createDirectories(dataDir.resolve("alpes"));
        touch("2024/10/04/2024-10-04_12.4Zo.A.nc");
        touch("2024/10/05/2024-10-05_00.4Zo.A.nc");
        touch("2024/10/05/2024-10-05_00.4Zo.B.nc");
        touch("2024/10/05/2024-10-05_00.2Z.A.nc");
        touch("2024/10/05/2024-10-05_12.4Zo.A.nc");
        Files.createDirectories(dataDir.resolve(".prebuilt_cache"));
    }

    private Path touch(String relative) throws IOException {
        Path file = region.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.createFile(file);
    }

    @Test
    void testRegionPath() {
        assertEquals(region, ForecastFileLayout.regionPath(dataDir, "alpes"));
        assertThrows(ForecastNotFoundException.class, () -> ForecastFileLayout.regionPath(dataDir, "jura"));
        assertThrows(ForecastNotFoundException.class, () -> ForecastFileLayout.regionPath(dataDir, "../etc"));
    }

    @Test
    void testListFilesOfForecast() {
        List<Path> files = ForecastFileLayout.listFiles(region, ForecastDate.parse("2024-10-05T00"));

        assertEquals(3, files.size());
        assertEquals("2024-10-05_00.2Z.A.nc", files.get(0).getFileName().toString());
    }

    @Test
    void testListFilesOfMethod() {
        List<Path> files = ForecastFileLayout.listFiles(region, ForecastDate.parse("2024-10-05T00"), "4Zo");

        assertEquals(2, files.size());
        assertEquals("2024-10-05_00.4Zo.A.nc", files.get(0).getFileName().toString());
        assertEquals("2024-10-05_00.4Zo.B.nc", files.get(1).getFileName().toString());
    }

    @Test
    void testMissingDateDirectory() {
        assertThrows(ForecastNotFoundException.class,
                () -> ForecastFileLayout.listFiles(region, ForecastDate.parse("2023-01-01T00")));
    }

    @Test
    void testFilePath() {
        Path path = ForecastFileLayout.filePath(region, ForecastDate.parse("2024-10-05T00"), "4Zo", "A");
        assertEquals(region.resolve("2024/10/05/2024-10-05_00.4Zo.A.nc"), path);
        assertThrows(ForecastNotFoundException.class,
                () -> ForecastFileLayout.filePath(region, ForecastDate.parse("2024-10-05T00"), "4Zo", "../A"));
    }

    @Test
    void testLastForecastDate() {
        assertEquals(ForecastDate.parse("2024-10-05T12"), ForecastFileLayout.lastForecastDate(region));
    }

    @Test
    void testResolveLatest() {
        assertEquals(ForecastDate.parse("2024-10-05T12"), ForecastFileLayout.resolveForecastDate(region, "latest"));
        assertEquals(ForecastDate.parse("2024-10-04T12"),
                ForecastFileLayout.resolveForecastDate(region, "2024-10-04T12"));
    }

    @Test
    void testLatestModified() throws IOException {
        ForecastDate date = ForecastDate.parse("2024-10-05T00");
        Path newer = region.resolve("2024/10/05/2024-10-05_00.4Zo.B.nc");
        FileTime mtime = FileTime.from(Instant.parse("2030-01-01T00:00:00Z"));
        Files.setLastModifiedTime(newer, mtime);

        assertEquals(Optional.of(mtime), ForecastFileLayout.latestModified(region, date));
        assertTrue(ForecastFileLayout.latestModified(region, ForecastDate.parse("2020-01-01T00")).isEmpty());
    }

    @Test
    void testRecentForecastDates() throws IOException {
        Instant old = Instant.parse("2020-01-01T00:00:00Z");
        Files.setLastModifiedTime(region.resolve("2024/10/04/2024-10-04_12.4Zo.A.nc"), FileTime.from(old));

        assertEquals(List.of(ForecastDate.parse("2024-10-05T00"), ForecastDate.parse("2024-10-05T12")),
                List.copyOf(ForecastFileLayout.recentForecastDates(region, Instant.parse("2021-01-01T00:00:00Z"))));
    }

    @Test
    void testVanishedSourceFileSkipped() throws IOException {
        ForecastDate date = ForecastDate.parse("2024-10-05T00");
        Path dir = region.resolve("2024/10/05");
        FileTime mtime = FileTime.from(Instant.parse("2024-10-05T01:00:00Z"));
        Files.setLastModifiedTime(dir.resolve("2024-10-05_00.4Zo.A.nc"), mtime);
        Files.setLastModifiedTime(dir.resolve("2024-10-05_00.4Zo.B.nc"), mtime);
        Files.setLastModifiedTime(dir.resolve("2024-10-05_00.2Z.A.nc"), mtime);
        Files.createSymbolicLink(dir.resolve("2024-10-05_00.4Zo.C.nc"), dir.resolve("deleted.nc"));

        assertEquals(Optional.of(mtime), ForecastFileLayout.latestModified(region, date));
        assertTrue(ForecastFileLayout.recentForecastDates(region, Instant.parse("2021-01-01T00:00:00Z"))
                .contains(date));
    }

    @Test
    void testGlobCharactersRejected() {
        ForecastDate date = ForecastDate.parse("2024-10-05T00");
        for (String method : List.of("*", "4Z?", "[24]Zo", "{2Z,4Zo}")) {
            assertThrows(ForecastNotFoundException.class, () -> ForecastFileLayout.listFiles(region, date, method));
        }
        assertThrows(ForecastNotFoundException.class, () -> ForecastFileLayout.regionPath(dataDir, "a*"));
        assertEquals(2, ForecastFileLayout.listFiles(region, date, "4Zo").size());
    }

    @Test
    void testListRegionsSkipsHidden() {
        assertEquals(List.of("alpes"), ForecastFileLayout.listRegions(dataDir));
    }
}
