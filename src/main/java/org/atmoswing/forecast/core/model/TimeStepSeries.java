package org.atmoswing.forecast.core.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Largest values over all methods sharing the same time step (hours between target dates).
 */
public record TimeStepSeries(int timeStep, List<LocalDateTime> targetDates, double[] values) {

    public TimeStepSeries {
        targetDates = List.copyOf(targetDates);
    }
}
