package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AnalogValuesPercentilesResponse(
        @JsonProperty("parameters") Parameters parameters,
        @JsonProperty("percentiles") List<Integer> percentiles,
        @JsonProperty("values") List<Double> values) {
}
