package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MethodsListResponse(
        @JsonProperty("parameters") Parameters parameters,
        @JsonProperty("methods") List<MethodInfo> methods) {
}
