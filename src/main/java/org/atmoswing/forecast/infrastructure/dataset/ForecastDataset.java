package org.atmoswing.forecast.infrastructure.dataset;

import org.atmoswing.forecast.core.exception.ForecastNotFoundException;
import org.atmoswing.forecast.core.exception.InconsistentForecastException;
import org.atmoswing.forecast.core.model.AnalogLayout;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-only view of one forecast file (one method and one configuration).
 * <p>
 * Analog rows are laid out lead time after lead time, see {@link AnalogLayout}.
 * Row ranges are half-open: {@code [startRow, endRow)}.
 */
public interface ForecastDataset extends AutoCloseable {

    String methodId();

    String methodName();

    String configurationId();

    String configurationName();

    /** Ids of all stations stored in the file, in file order. */
    int[] stationIds();

    /** Ids of the stations this configuration is relevant for. */
    int[] predictandStationIds();

    int[] analogsNb();

    List<LocalDateTime> targetDates();

    double[] analogValues(int entityIdx, int startRow, int endRow);

    List<LocalDateTime> analogDates(int startRow, int endRow);

    double[] analogCriteria(int startRow, int endRow);

    double[] referenceAxis();

    double[] referenceValues(int entityIdx);

    @Override
    void close();

    default AnalogLayout layout() {
        return new AnalogLayout(analogsNb());
    }

    default int entityIndex(int entityId) {
        int[] ids = stationIds();
        for (int i = 0; i < ids.length; i++) {
            if (ids[i] == entityId) {
                return i;
            }
        }
        throw new ForecastNotFoundException("Entity not found: " + entityId);
    }

    default int targetDateIndex(LocalDateTime targetDate) {
        List<LocalDateTime> dates = targetDates();
        int idx = dates.indexOf(targetDate);
        if (idx < 0) {
            throw new ForecastNotFoundException("Target date not found: " + targetDate);
        }
        return idx;
    }

    /**
     * Indices, in {@link #stationIds()}, of the predictand stations.
     */
    default int[] relevantStationIndices() {
        int[] relevant = predictandStationIds();
        int[] indices = new int[relevant.length];
        int[] ids = stationIds();
        for (int r = 0; r < relevant.length; r++) {
            int found = -1;
            for (int i = 0; i < ids.length; i++) {
                if (ids[i] == relevant[r]) {
                    found = i;
                    break;
                }
            }
            if (found < 0) {
                throw new InconsistentForecastException("Predictand station " + relevant[r]
                        + " is not part of the station list of " + methodId() + "/" + configurationId());
            }
            indices[r] = found;
        }
        return indices;
    }
}
