package org.atmoswing.forecast.application.warmup;

import org.atmoswing.forecast.application.Operations;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operations the warmup can prebuild.
 */
public enum WarmupOperation {

    SERIES_SYNTHESIS_PER_METHOD(Operations.SERIES_SYNTHESIS_PER_METHOD),
    SERIES_SYNTHESIS_TOTAL(Operations.SERIES_SYNTHESIS_TOTAL),
    LIST_METHODS(Operations.LIST_METHODS),
    LIST_METHODS_AND_CONFIGS(Operations.LIST_METHODS_AND_CONFIGS),
    ENTITIES_ANALOG_VALUES_PERCENTILE(Operations.ENTITIES_ANALOG_VALUES_PERCENTILE);

    private final String operationName;

    WarmupOperation(String operationName) {
        this.operationName = operationName;
    }

    public String operationName() {
        return operationName;
    }

    public static Optional<WarmupOperation> fromName(String name) {
        return Arrays.stream(values())
                .filter(op -> op.operationName.equals(name))
                .findFirst();
    }
}
