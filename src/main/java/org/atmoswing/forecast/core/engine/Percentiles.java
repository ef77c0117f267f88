package org.atmoswing.forecast.core.engine;

import java.util.Arrays;

/**
 * Percentiles of an analog ensemble, interpolated over Gringorten plotting positions.
 */
public final class Percentiles {

    private Percentiles() {
    }

    /**
     * Value at {@code percentile} (0-100) of an unsorted ensemble. The input is not modified.
     *
     * @return NaN for an empty ensemble
     */
    public static double of(double[] values, double percentile) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return ofSorted(sorted, percentile);
    }

    /**
     * Same as {@link #of(double[], double)} for an ensemble already sorted in ascending order.
     */
    public static double ofSorted(double[] sorted, double percentile) {
        double fraction = fraction(percentile);
        if (sorted.length == 0) {
            return Double.NaN;
        }
        return interpolate(fraction, CumulativeFrequency.gringorten(sorted.length), sorted);
    }

    /**
     * Converts a percentile to the interpolation abscissa in [0, 1].
     */
    public static double fraction(double percentile) {
        if (Double.isNaN(percentile) || percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("Percentile must be between 0 and 100, got: " + percentile);
        }
        return percentile / 100.0;
    }

    /**
     * Piecewise-linear interpolation of {@code (xp, fp)} at {@code x}. Below the first and above
     * the last abscissa the first and last ordinates are returned. {@code xp} must be increasing.
     */
    public static double interpolate(double x, double[] xp, double[] fp) {
        if (xp.length != fp.length || xp.length == 0) {
            throw new IllegalArgumentException("Interpolation arrays must be non-empty and of equal length");
        }
        int last = xp.length - 1;
        if (x <= xp[0]) {
            return fp[0];
        }
        if (x >= xp[last]) {
            return fp[last];
        }
        int hi = Arrays.binarySearch(xp, x);
        if (hi >= 0) {
            return fp[hi];
        }
        hi = -hi - 1;
        int lo = hi - 1;
        double slope = (fp[hi] - fp[lo]) / (xp[hi] - xp[lo]);
        return fp[lo] + slope * (x - xp[lo]);
    }
}
