package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Reference values of one entity, e.g. precipitation per return period.
 */
public record ReferenceValuesResponse(
        @JsonProperty("parameters") Parameters parameters,
        @JsonProperty("axis") List<Double> axis,
        @JsonProperty("values") List<Double> values) {
}
