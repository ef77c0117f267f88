package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LastForecastDateResponse(
        @JsonProperty("parameters") Parameters parameters,
        @JsonProperty("last_forecast_date") String lastForecastDate) {
}
