package org.atmoswing.forecast.infrastructure.dataset;

import org.atmoswing.forecast.core.exception.ForecastNotFoundException;
import org.atmoswing.forecast.core.model.ForecastDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Layout of the forecast data directory:
 * {@code <data-dir>/<region>/YYYY/MM/DD/YYYY-MM-DD_HH.<method>.<configuration>.nc}.
 */
public final class ForecastFileLayout {

    public static final String EXTENSION = ".nc";
    public static final String LATEST = "latest";

    private static final Logger log = LoggerFactory.getLogger(ForecastFileLayout.class);
    private static final String UNSAFE_CHARS = "/\\*?[]{}";

    private ForecastFileLayout() {
    }

    public static Path regionPath(Path dataDir, String region) {
        validatePathSafe(region);
        Path regionPath = dataDir.resolve(region);
        if (!Files.isDirectory(regionPath)) {
            throw new ForecastNotFoundException("Region directory not found: " + region);
        }
        return regionPath;
    }

    public static Path dateDirectory(Path regionPath, ForecastDate forecastDate) {
        Path dir = forecastDate.dateDirectory(regionPath);
        if (!Files.isDirectory(dir)) {
            throw new ForecastNotFoundException("Date directory not found: " + dir);
        }
        return dir;
    }

    /**
     * All method/configuration files of one forecast, sorted by name.
     */
    public static List<Path> listFiles(Path regionPath, ForecastDate forecastDate) {
        return glob(dateDirectory(regionPath, forecastDate), forecastDate.filePrefix() + ".*.*" + EXTENSION);
    }

    /**
     * All configuration files of one method for one forecast, sorted by name.
     */
    public static List<Path> listFiles(Path regionPath, ForecastDate forecastDate, String method) {
        validatePathSafe(method);
        return glob(dateDirectory(regionPath, forecastDate),
                forecastDate.filePrefix() + "." + method + ".*" + EXTENSION);
    }

    public static Path filePath(Path regionPath, ForecastDate forecastDate, String method, String configuration) {
        validatePathSafe(method);
        validatePathSafe(configuration);
        return dateDirectory(regionPath, forecastDate)
                .resolve(forecastDate.filePrefix() + "." + method + "." + configuration + EXTENSION);
    }

    /**
     * Most recent forecast of a region, from the latest year/month/day directory and the
     * latest file name in it.
     */
    public static ForecastDate lastForecastDate(Path regionPath) {
        String year = latestEntry(regionPath, true);
        String month = latestEntry(regionPath.resolve(year), true);
        String day = latestEntry(regionPath.resolve(year).resolve(month), true);
        String lastFile = latestEntry(regionPath.resolve(year).resolve(month).resolve(day), false);

        String[] parts = lastFile.split("_");
        if (parts.length < 2) {
            throw new IllegalArgumentException("Invalid file format (" + lastFile + ")");
        }
        String hour = parts[1].split("\\.")[0];
        return ForecastDate.parse(year + "-" + month + "-" + day + "T" + hour);
    }

    /**
     * Parses a forecast date from a request; {@code latest} resolves to {@link #lastForecastDate(Path)}.
     */
    public static ForecastDate resolveForecastDate(Path regionPath, String forecastDate) {
        if (LATEST.equalsIgnoreCase(forecastDate)) {
            return lastForecastDate(regionPath);
        }
        return ForecastDate.parse(forecastDate);
    }

    /**
     * Latest modification time among the source files of one forecast, or empty when it has none.
     */
    public static Optional<FileTime> latestModified(Path regionPath, ForecastDate forecastDate) {
        Path dir = forecastDate.dateDirectory(regionPath);
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        FileTime latest = null;
        for (Path file : glob(dir, forecastDate.filePrefix() + ".*" + EXTENSION)) {
            Optional<FileTime> mtime = lastModified(file);
            if (mtime.isPresent() && (latest == null || mtime.get().compareTo(latest) > 0)) {
                latest = mtime.get();
            }
        }
        return Optional.ofNullable(latest);
    }

    /**
     * Forecast dates of the files of a region modified at or after {@code since}.
     */
    public static SortedSet<ForecastDate> recentForecastDates(Path regionPath, Instant since) {
        SortedSet<ForecastDate> dates = new TreeSet<>();
        try (Stream<Path> paths = Files.walk(regionPath)) {
            paths.filter(p -> p.getFileName().toString().toLowerCase().endsWith(EXTENSION))
                    .filter(Files::isRegularFile)
                    .filter(p -> lastModified(p).map(t -> !t.toInstant().isBefore(since)).orElse(false))
                    .forEach(p -> ForecastDate.fromFileName(p.getFileName().toString()).ifPresent(dates::add));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + regionPath, e);
        }
        return dates;
    }

    /**
     * Region directories of the data directory; hidden directories are skipped.
     */
    public static List<String> listRegions(Path dataDir) {
        try (Stream<Path> paths = Files.list(dataDir)) {
            return paths.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> !name.startsWith("."))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list regions in " + dataDir, e);
        }
    }

    private static List<Path> glob(Path dir, String pattern) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, pattern)) {
            for (Path p : stream) {
                files.add(p);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + pattern + " in " + dir, e);
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return files;
    }

    private static String latestEntry(Path dir, boolean directories) {
        try (Stream<Path> paths = Files.list(dir)) {
            return paths.filter(p -> directories ? Files.isDirectory(p) : Files.isRegularFile(p))
                    .map(p -> p.getFileName().toString())
                    .max(Comparator.naturalOrder())
                    .orElseThrow(() -> new IllegalStateException(
                            (directories ? "No subdirectories found in " : "No files found in ") + dir));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }

    /**
     * Modification time of a source file, or empty when it vanished or cannot be read.
     */
    private static Optional<FileTime> lastModified(Path file) {
        try {
            return Optional.of(Files.getLastModifiedTime(file));
        } catch (IOException e) {
            log.debug("[Dataset] Skipping {}: cannot stat ({})", file, e.toString());
            return Optional.empty();
        }
    }

    /**
     * Path segments coming from requests must not escape the data directory nor act as glob patterns.
     */
    public static void validatePathSafe(String segment) {
        if (segment == null || segment.isBlank() || segment.contains("..")
                || segment.chars().anyMatch(c -> UNSAFE_CHARS.indexOf(c) >= 0)) {
            throw new ForecastNotFoundException("Invalid path segment: " + segment);
        }
    }
}
