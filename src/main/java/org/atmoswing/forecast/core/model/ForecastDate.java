package org.atmoswing.forecast.core.model;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Issue time of a forecast, at hour resolution.
 * Canonical text form is {@code YYYY-MM-DDThh}; files of the forecast are named
 * {@code YYYY-MM-DD_hh.<method>.<configuration>.nc} under {@code YYYY/MM/DD}.
 */
public record ForecastDate(LocalDateTime value) implements Comparable<ForecastDate> {

    private static final DateTimeFormatter CANONICAL = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH");
    private static final DateTimeFormatter FILE_PREFIX = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH");
    private static final Pattern HOUR_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}$");
    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern FILE_NAME = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})_(\\d{2})\\..*");

    public ForecastDate {
        value = value.truncatedTo(ChronoUnit.HOURS);
    }

    /**
     * Parses {@code YYYY-MM-DDThh}, a plain {@code YYYY-MM-DD} (midnight) or an ISO
     * date-time truncated to the hour.
     */
    public static ForecastDate parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Invalid datetime format (" + text + ")");
        }
        String s = text.trim();
        try {
            if (HOUR_ONLY.matcher(s).matches()) {
                return atHour(s.substring(0, 10), s.substring(11, 13));
            }
            if (DATE_ONLY.matcher(s).matches()) {
                return new ForecastDate(LocalDate.parse(s).atStartOfDay());
            }
            return new ForecastDate(LocalDateTime.parse(s));
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid datetime format (" + text + ")", e);
        }
    }

    /**
     * Extracts the forecast date from a file name such as {@code 2024-10-05_00.4Zo-CEP.Alpes_Nord.nc}.
     */
    public static Optional<ForecastDate> fromFileName(String fileName) {
        Matcher m = FILE_NAME.matcher(fileName);
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(atHour(m.group(1), m.group(2)));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static ForecastDate atHour(String date, String hour) {
        return new ForecastDate(LocalDate.parse(date).atTime(Integer.parseInt(hour), 0));
    }

    public String format() {
        return CANONICAL.format(value);
    }

    /**
     * File name prefix shared by all method/configuration files of this forecast, without the dot.
     */
    public String filePrefix() {
        return FILE_PREFIX.format(value);
    }

    public Path dateDirectory(Path regionPath) {
        return regionPath
                .resolve(String.format("%04d", value.getYear()))
                .resolve(String.format("%02d", value.getMonthValue()))
                .resolve(String.format("%02d", value.getDayOfMonth()));
    }

    public LocalDateTime plusHours(long hours) {
        return value.plusHours(hours);
    }

    @Override
    public int compareTo(ForecastDate other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return format();
    }
}
