package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AnalogsResponse(
        @JsonProperty("parameters") Parameters parameters,
        @JsonProperty("analogs") List<Analog> analogs) {
}
