package org.atmoswing.forecast.core.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Largest percentile value per lead time for one method, over all its configurations.
 */
public record MethodSeries(String methodId, List<LocalDateTime> targetDates, double[] values) {

    public MethodSeries {
        targetDates = List.copyOf(targetDates);
    }
}
