package org.atmoswing.forecast.core.engine;

import org.atmoswing.forecast.core.exception.ForecastNotFoundException;
import org.atmoswing.forecast.infrastructure.dataset.ForecastDataset;

/**
 * Divisors used to express percentiles relative to a reference value of each entity,
 * e.g. the 10-year return period precipitation.
 */
final class Normalization {

    private static final double AXIS_TOLERANCE = 1e-6;

    private Normalization() {
    }

    /**
     * Reference value of every listed entity at {@code returnPeriod}, or null when no
     * normalization is requested.
     */
    static double[] divisors(ForecastDataset ds, int[] entityIndices, Integer returnPeriod) {
        if (returnPeriod == null) {
            return null;
        }
        int axisIdx = axisIndex(ds.referenceAxis(), returnPeriod, ds);
        double[] divisors = new double[entityIndices.length];
        for (int i = 0; i < entityIndices.length; i++) {
            divisors[i] = ds.referenceValues(entityIndices[i])[axisIdx];
        }
        return divisors;
    }

    static double apply(double value, double[] divisors, int i) {
        return divisors == null ? value : value / divisors[i];
    }

    private static int axisIndex(double[] axis, int returnPeriod, ForecastDataset ds) {
        for (int i = 0; i < axis.length; i++) {
            if (Math.abs(axis[i] - returnPeriod) < AXIS_TOLERANCE) {
                return i;
            }
        }
        throw new ForecastNotFoundException("Reference value for return period " + returnPeriod
                + " not found in " + ds.methodId() + "/" + ds.configurationId());
    }
}
