package org.atmoswing.forecast.testing;

import org.atmoswing.forecast.infrastructure.dataset.ForecastDataset;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Forecast file held in memory. Values are given per entity, all lead times concatenated.
 */
public class InMemoryForecastDataset implements ForecastDataset {

    private static final LocalDateTime FIRST_ANALOG = LocalDateTime.of(2000, 1, 1, 0, 0);

    private final String methodId;
    private final String configurationId;
    private String methodName;
    private String configurationName;
    private int[] stationIds = {1};
    private int[] predictandStationIds;
    private int[] analogsNb = {};
    private List<LocalDateTime> targetDates = List.of();
    private double[][] values = {};
    private double[] referenceAxis = {2, 5, 10, 20, 50, 100};
    private double[][] referenceValues;
    private boolean closed;

    public InMemoryForecastDataset(String methodId, String configurationId) {
        this.methodId = methodId;
        this.configurationId = configurationId;
        this.methodName = methodId + " name";
        this.configurationName = configurationId + " name";
    }

    public InMemoryForecastDataset names(String methodName, String configurationName) {
        this.methodName = methodName;
        this.configurationName = configurationName;
        return this;
    }

    public InMemoryForecastDataset stations(int... ids) {
        this.stationIds = ids.clone();
        return this;
    }

    public InMemoryForecastDataset predictands(int... ids) {
        this.predictandStationIds = ids.clone();
        return this;
    }

    /**
     * Target dates every {@code stepHours} from {@code first}, each with {@code analogs} rows.
     */
    public InMemoryForecastDataset leadTimes(LocalDateTime first, int stepHours, int... analogs) {
        List<LocalDateTime> dates = new ArrayList<>();
        for (int i = 0; i < analogs.length; i++) {
            dates.add(first.plusHours((long) i * stepHours));
        }
        this.targetDates = List.copyOf(dates);
        this.analogsNb = analogs.clone();
        return this;
    }

    /** Rows of every station, indexed like {@link #stationIds()}. */
    public InMemoryForecastDataset values(double[]... rowsPerStation) {
        this.values = rowsPerStation;
        return this;
    }

    public InMemoryForecastDataset reference(double[] axis, double[]... valuesPerStation) {
        this.referenceAxis = axis.clone();
        this.referenceValues = valuesPerStation;
        return this;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String methodId() {
        return methodId;
    }

    @Override
    public String methodName() {
        return methodName;
    }

    @Override
    public String configurationId() {
        return configurationId;
    }

    @Override
    public String configurationName() {
        return configurationName;
    }

    @Override
    public int[] stationIds() {
        return stationIds.clone();
    }

    @Override
    public int[] predictandStationIds() {
        return predictandStationIds == null ? stationIds.clone() : predictandStationIds.clone();
    }

    @Override
    public int[] analogsNb() {
        return analogsNb.clone();
    }

    @Override
    public List<LocalDateTime> targetDates() {
        return targetDates;
    }

    @Override
    public double[] analogValues(int entityIdx, int startRow, int endRow) {
        return Arrays.copyOfRange(values[entityIdx], startRow, endRow);
    }

    /** Analog {@code r} is dated {@code r} days after 2000-01-01. */
    @Override
    public List<LocalDateTime> analogDates(int startRow, int endRow) {
        List<LocalDateTime> dates = new ArrayList<>();
        for (int r = startRow; r < endRow; r++) {
            dates.add(FIRST_ANALOG.plusDays(r));
        }
        return dates;
    }

    /** Criteria grow with the rank inside each lead time: {@code 0.1234 * (rank)}. */
    @Override
    public double[] analogCriteria(int startRow, int endRow) {
        double[] criteria = new double[endRow - startRow];
        for (int i = 0; i < criteria.length; i++) {
            criteria[i] = 0.1234 * (i + 1);
        }
        return criteria;
    }

    @Override
    public double[] referenceAxis() {
        return referenceAxis.clone();
    }

    @Override
    public double[] referenceValues(int entityIdx) {
        if (referenceValues == null) {
            double[] ones = new double[referenceAxis.length];
            Arrays.fill(ones, 1.0);
            return ones;
        }
        return referenceValues[entityIdx].clone();
    }

    @Override
    public void close() {
        closed = true;
    }
}
