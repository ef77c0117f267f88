package org.atmoswing.forecast.core.model;

import java.time.LocalDateTime;
import java.util.regex.Pattern;

/**
 * Resolves the target date of a query, given either as a lead time in hours or as a date.
 */
public final class TargetDates {

    private static final Pattern LEAD_TIME = Pattern.compile("^-?\\d+$");

    private TargetDates() {
    }

    public static LocalDateTime resolve(ForecastDate forecastDate, String leadTimeOrDate) {
        if (leadTimeOrDate == null) {
            throw new IllegalArgumentException("Missing lead time or target date");
        }
        String s = leadTimeOrDate.trim();
        if (LEAD_TIME.matcher(s).matches()) {
            return forecastDate.plusHours(Long.parseLong(s));
        }
        return ForecastDate.parse(s).value();
    }
}
