package org.atmoswing.forecast.core.engine;

import org.atmoswing.forecast.core.exception.InconsistentForecastException;
import org.atmoswing.forecast.core.model.AnalogLayout;
import org.atmoswing.forecast.core.model.MethodSeries;
import org.atmoswing.forecast.infrastructure.dataset.ForecastDataset;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Largest percentile per lead time and per method.
 * <p>
 * For every lead time of a file, the percentile of each predictand entity is computed and the
 * largest one is kept. Files of the same method are merged by running maximum, starting from
 * zero. Methods keep the order in which they were first seen.
 */
public final class MethodSeriesAccumulator {

    private final double percentile;
    private final Integer normalize;
    private final Map<String, Running> series = new LinkedHashMap<>();

    public MethodSeriesAccumulator(double percentile, Integer normalize) {
        Percentiles.fraction(percentile);
        this.percentile = percentile;
        this.normalize = normalize;
    }

    public void accept(ForecastDataset ds) {
        AnalogLayout layout = ds.layout();
        Running running = series.computeIfAbsent(ds.methodId(),
                id -> new Running(ds.targetDates(), new double[layout.leadTimes()]));
        if (running.values.length != layout.leadTimes()) {
            throw new InconsistentForecastException("Method " + ds.methodId() + " has "
                    + running.values.length + " lead times but " + ds.configurationId() + " has "
                    + layout.leadTimes());
        }

        int[] relevant = ds.relevantStationIndices();
        double[] divisors = Normalization.divisors(ds, relevant, normalize);

        for (int lt = 0; lt < layout.leadTimes(); lt++) {
            int start = layout.start(lt);
            int end = layout.end(lt);
            double largest = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < relevant.length; i++) {
                double value = Percentiles.of(ds.analogValues(relevant[i], start, end), percentile);
                value = Normalization.apply(value, divisors, i);
                if (value > largest) {
                    largest = value;
                }
            }
            if (largest > running.values[lt]) {
                running.values[lt] = largest;
            }
        }
    }

    public List<MethodSeries> result() {
        List<MethodSeries> out = new ArrayList<>(series.size());
        series.forEach((methodId, running) ->
                out.add(new MethodSeries(methodId, running.targetDates, running.values.clone())));
        return out;
    }

    private static final class Running {
        private final List<LocalDateTime> targetDates;
        private final double[] values;

        private Running(List<LocalDateTime> targetDates, double[] values) {
            this.targetDates = targetDates;
            this.values = values;
        }
    }
}
