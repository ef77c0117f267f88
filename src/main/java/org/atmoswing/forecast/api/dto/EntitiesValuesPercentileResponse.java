package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Percentile per entity; {@code values[i]} belongs to {@code entity_ids[i]} and is null for
 * entities no configuration covers.
 */
public record EntitiesValuesPercentileResponse(
        @JsonProperty("parameters") Parameters parameters,
        @JsonProperty("entity_ids") List<Integer> entityIds,
        @JsonProperty("values") List<Double> values) {
}
