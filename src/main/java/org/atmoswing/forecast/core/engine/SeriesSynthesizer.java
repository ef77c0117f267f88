package org.atmoswing.forecast.core.engine;

import org.atmoswing.forecast.core.exception.InconsistentForecastException;
import org.atmoswing.forecast.core.model.MethodSeries;
import org.atmoswing.forecast.core.model.TimeStepSeries;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges per-method series into one series per time step.
 * <p>
 * Series sharing a time step are combined index-wise by maximum. When a series runs further
 * than what was merged so far, the merged series takes its target dates and is extended with
 * zeros first. Overlapping target dates must match exactly.
 */
public final class SeriesSynthesizer {

    private SeriesSynthesizer() {
    }

    public static List<TimeStepSeries> mergeByTimeStep(List<MethodSeries> perMethod) {
        Map<Integer, Merged> merged = new LinkedHashMap<>();

        for (MethodSeries method : perMethod) {
            int timeStep = timeStepHours(method.targetDates());
            Merged current = merged.get(timeStep);
            if (current == null) {
                merged.put(timeStep, new Merged(method.targetDates(), method.values().clone()));
                continue;
            }

            List<LocalDateTime> newDates = method.targetDates();
            int common = Math.min(newDates.size(), current.targetDates.size());
            for (int i = 0; i < common; i++) {
                if (!newDates.get(i).equals(current.targetDates.get(i))) {
                    throw new InconsistentForecastException("Target dates are not consistent for time step "
                            + timeStep + " (method " + method.methodId() + ", index " + i + ")");
                }
            }

            if (newDates.size() > current.targetDates.size()) {
                current.targetDates = newDates;
                current.values = Arrays.copyOf(current.values, newDates.size());
            }

            double[] values = method.values();
            for (int i = 0; i < values.length; i++) {
                current.values[i] = Math.max(current.values[i], values[i]);
            }
        }

        List<TimeStepSeries> out = new ArrayList<>(merged.size());
        merged.forEach((step, m) -> out.add(new TimeStepSeries(step, m.targetDates, m.values)));
        return out;
    }

    /**
     * Hours between the first two target dates; 0 when the series has fewer than two.
     */
    static int timeStepHours(List<LocalDateTime> targetDates) {
        if (targetDates.size() < 2) {
            return 0;
        }
        return (int) Duration.between(targetDates.get(0), targetDates.get(1)).toHours();
    }

    private static final class Merged {
        private List<LocalDateTime> targetDates;
        private double[] values;

        private Merged(List<LocalDateTime> targetDates, double[] values) {
            this.targetDates = targetDates;
            this.values = values;
        }
    }
}
