package org.atmoswing.forecast.core.engine;

import org.atmoswing.forecast.core.exception.ForecastNotFoundException;
import org.atmoswing.forecast.core.exception.InconsistentForecastException;
import org.atmoswing.forecast.core.model.AnalogLayout;
import org.atmoswing.forecast.core.model.EntityValues;
import org.atmoswing.forecast.infrastructure.dataset.ForecastDataset;

import java.time.LocalDateTime;
import java.util.Arrays;

/**
 * Percentile of every entity for one target date, over all configuration files of a method.
 * <p>
 * Each file contributes the entities of its predictand subset. The station list of the first
 * file is authoritative and every other file must report the same one. An entity covered by
 * several configurations keeps the value of the configuration with the greatest id, so the
 * result does not depend on the order files are supplied in. Entities covered by no file stay NaN.
 */
public final class EntitiesPercentileAccumulator {

    private final LocalDateTime targetDate;
    private final double percentile;
    private final Integer normalize;

    private int[] stationIds;
    private double[] values;
    private String[] owners;

    public EntitiesPercentileAccumulator(LocalDateTime targetDate, double percentile, Integer normalize) {
        Percentiles.fraction(percentile);
        this.targetDate = targetDate;
        this.percentile = percentile;
        this.normalize = normalize;
    }

    public void accept(ForecastDataset ds) {
        int[] ids = ds.stationIds();
        if (stationIds == null) {
            stationIds = ids.clone();
            values = new double[ids.length];
            Arrays.fill(values, Double.NaN);
            owners = new String[ids.length];
        } else if (!Arrays.equals(stationIds, ids)) {
            throw new InconsistentForecastException("Station ids of " + ds.methodId() + "/"
                    + ds.configurationId() + " differ from the first file of the method");
        }

        int[] relevant = ds.relevantStationIndices();
        AnalogLayout layout = ds.layout();
        int leadTimeIdx = ds.targetDateIndex(targetDate);
        int start = layout.start(leadTimeIdx);
        int end = layout.end(leadTimeIdx);
        double[] divisors = Normalization.divisors(ds, relevant, normalize);
        String configuration = ds.configurationId();

        for (int i = 0; i < relevant.length; i++) {
            int entityIdx = relevant[i];
            if (owners[entityIdx] != null && owners[entityIdx].compareTo(configuration) > 0) {
                continue;
            }
            double value = Percentiles.of(ds.analogValues(entityIdx, start, end), percentile);
            values[entityIdx] = Normalization.apply(value, divisors, i);
            owners[entityIdx] = configuration;
        }
    }

    public EntityValues result() {
        if (stationIds == null) {
            throw new ForecastNotFoundException("No forecast file was read for target date " + targetDate);
        }
        return new EntityValues(stationIds.clone(), values.clone());
    }
}
