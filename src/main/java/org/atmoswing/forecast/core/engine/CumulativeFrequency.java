package org.atmoswing.forecast.core.engine;

/**
 * Plotting positions used as the x-axis when interpolating percentiles over a sorted ensemble.
 * <p>
 * Gringorten parameters (a=0.44, b=0.12), following Cunnane, C., 1978, Unbiased plotting
 * positions, a review: Journal of Hydrology, v. 37, p. 205-222.
 */
public final class CumulativeFrequency {

    static final double A = 0.44;
    static final double B = 0.12;

    private CumulativeFrequency() {
    }

    /**
     * {@code f[i] = (i + 1 - a) / (n + b)} for {@code i = 0..n-1}.
     */
    public static double[] gringorten(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Negative distribution size: " + size);
        }
        double divisor = 1.0 / (size + B);
        double[] f = new double[size];
        for (int i = 0; i < size; i++) {
            f[i] = (i + 1.0 - A) * divisor;
        }
        return f;
    }
}
