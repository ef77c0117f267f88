package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Best analog values per lead time; the inner lists follow {@code target_dates}.
 */
public record SeriesBestAnalogsResponse(
        @JsonProperty("parameters") Parameters parameters,
        @JsonProperty("target_dates") List<LocalDateTime> targetDates,
        @JsonProperty("series_values") List<List<Double>> seriesValues) {
}
