package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MethodConfigsListResponse(
        @JsonProperty("parameters") Parameters parameters,
        @JsonProperty("methods") List<MethodConfigs> methods) {
}
