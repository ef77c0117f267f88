package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AnalogCriteriaResponse(
        @JsonProperty("parameters") Parameters parameters,
        @JsonProperty("criteria") List<Double> criteria) {
}
