package org.atmoswing.forecast.core.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Rounding applied when results leave the engine. Missing values (NaN, infinite) become null.
 */
public final class Rounding {

    public static final int VALUES = 2;
    public static final int CRITERIA = 3;
    public static final int AXIS = 1;

    private Rounding() {
    }

    public static Double round(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
    }

    public static List<Double> round(double[] values, int decimals) {
        List<Double> out = new ArrayList<>(values.length);
        for (double v : values) {
            out.add(round(v, decimals));
        }
        return out;
    }
}
