package org.atmoswing.forecast.core.model;

import java.util.Arrays;

/**
 * Row layout of the analog arrays: the analogs of all lead times are stored one after the
 * other, lead time {@code i} owning {@code analogsNb[i]} contiguous rows.
 */
public final class AnalogLayout {

    private final int[] analogsNb;
    private final int[] offsets;

    public AnalogLayout(int[] analogsNb) {
        this.analogsNb = analogsNb.clone();
        this.offsets = new int[analogsNb.length + 1];
        for (int i = 0; i < analogsNb.length; i++) {
            if (analogsNb[i] < 0) {
                throw new IllegalArgumentException("Negative analogs number at lead time " + i);
            }
            offsets[i + 1] = offsets[i] + analogsNb[i];
        }
    }

    public int leadTimes() {
        return analogsNb.length;
    }

    public int analogs(int leadTimeIdx) {
        return analogsNb[leadTimeIdx];
    }

    /** First row of the lead time, inclusive. */
    public int start(int leadTimeIdx) {
        checkIndex(leadTimeIdx);
        return offsets[leadTimeIdx];
    }

    /** Last row of the lead time, exclusive. */
    public int end(int leadTimeIdx) {
        checkIndex(leadTimeIdx);
        return offsets[leadTimeIdx + 1];
    }

    public int totalRows() {
        return offsets[analogsNb.length];
    }

    private void checkIndex(int leadTimeIdx) {
        if (leadTimeIdx < 0 || leadTimeIdx >= analogsNb.length) {
            throw new IndexOutOfBoundsException("Lead time index " + leadTimeIdx + " out of " + analogsNb.length);
        }
    }

    @Override
    public String toString() {
        return "AnalogLayout" + Arrays.toString(analogsNb);
    }
}
