package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AnalogValuesResponse(
        @JsonProperty("parameters") Parameters parameters,
        @JsonProperty("values") List<Double> values) {
}
