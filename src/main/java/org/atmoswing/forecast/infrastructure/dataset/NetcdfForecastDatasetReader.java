package org.atmoswing.forecast.infrastructure.dataset;

import org.atmoswing.forecast.core.exception.ForecastException;
import org.atmoswing.forecast.core.exception.ForecastNotFoundException;
import org.atmoswing.forecast.core.exception.InconsistentForecastException;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ucar.ma2.Array;
import ucar.ma2.InvalidRangeException;
import ucar.nc2.Attribute;
import ucar.nc2.NetcdfFile;
import ucar.nc2.Variable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads AtmoSwing forecast files (netCDF) with netCDF-Java.
 * <p>
 * Small arrays (station ids, analogs numbers, target dates) are read when the file is opened,
 * analog rows are read on demand.
 */
@ApplicationScoped
public class NetcdfForecastDatasetReader implements ForecastDatasetReader {

    private static final Logger log = LoggerFactory.getLogger(NetcdfForecastDatasetReader.class);

    /** Modified Julian Date origin, the default time reference of AtmoSwing files. */
    private static final LocalDateTime MJD_ORIGIN = LocalDateTime.of(1858, 11, 17, 0, 0);

    @Override
    public ForecastDataset open(Path file) {
        if (!Files.exists(file)) {
            throw new ForecastNotFoundException("File not found: " + file);
        }
        NetcdfFile nc = null;
        try {
            nc = NetcdfFile.open(file.toString());
            return new NetcdfForecastDataset(file, nc);
        } catch (IOException e) {
            closeQuietly(nc, file);
            throw new ForecastException("Failed to read forecast file " + file, e);
        } catch (RuntimeException e) {
            closeQuietly(nc, file);
            throw e;
        }
    }

    private static void closeQuietly(NetcdfFile nc, Path file) {
        if (nc == null) {
            return;
        }
        try {
            nc.close();
        } catch (IOException e) {
            log.warn("[Dataset] Failed to close {}: {}", file, e.getMessage());
        }
    }

    static final class NetcdfForecastDataset implements ForecastDataset {

        private final Path file;
        private final NetcdfFile nc;
        private final int[] stationIds;
        private final int[] predictandStationIds;
        private final int[] analogsNb;
        private final List<LocalDateTime> targetDates;

        NetcdfForecastDataset(Path file, NetcdfFile nc) throws IOException {
            this.file = file;
            this.nc = nc;
            this.stationIds = readInts("station_ids");
            this.analogsNb = readInts("analogs_nb");
            this.targetDates = readDates(variable("target_dates"), 0, -1);
            this.predictandStationIds = parsePredictandIds();
            checkConsistency();
        }

        @Override
        public String methodId() {
            return globalString("method_id");
        }

        @Override
        public String methodName() {
            return globalString("method_id_display");
        }

        @Override
        public String configurationId() {
            return globalString("specific_tag");
        }

        @Override
        public String configurationName() {
            return globalString("specific_tag_display");
        }

        @Override
        public int[] stationIds() {
            return stationIds.clone();
        }

        @Override
        public int[] predictandStationIds() {
            return predictandStationIds.clone();
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
            if (endRow <= startRow) {
                return new double[0];
            }
            return toDoubles(readSection(variable("analog_values_raw"),
                    new int[]{entityIdx, startRow}, new int[]{1, endRow - startRow}));
        }

        @Override
        public List<LocalDateTime> analogDates(int startRow, int endRow) {
            if (endRow <= startRow) {
                return List.of();
            }
            return readDates(variable("analog_dates"), startRow, endRow);
        }

        @Override
        public double[] analogCriteria(int startRow, int endRow) {
            if (endRow <= startRow) {
                return new double[0];
            }
            return toDoubles(readSection(variable("analog_criteria"),
                    new int[]{startRow}, new int[]{endRow - startRow}));
        }

        @Override
        public double[] referenceAxis() {
            try {
                return toDoubles(variable("reference_axis").read());
            } catch (IOException e) {
                throw new ForecastException("Failed to read reference_axis from " + file, e);
            }
        }

        @Override
        public double[] referenceValues(int entityIdx) {
            Variable v = variable("reference_values");
            int axisLength = v.getShape()[1];
            return toDoubles(readSection(v, new int[]{entityIdx, 0}, new int[]{1, axisLength}));
        }

        @Override
        public void close() {
            closeQuietly(nc, file);
        }

        private void checkConsistency() {
            int totalRows = variable("analog_values_raw").getShape()[1];
            int expected = Arrays.stream(analogsNb).sum();
            if (totalRows != expected) {
                throw new InconsistentForecastException("Sum of analogs_nb (" + expected
                        + ") does not match the analog rows (" + totalRows + ") of " + file);
            }
            if (targetDates.size() != analogsNb.length) {
                throw new InconsistentForecastException("target_dates and analogs_nb lengths differ in " + file);
            }
            for (int i = 1; i < targetDates.size(); i++) {
                if (!targetDates.get(i).isAfter(targetDates.get(i - 1))) {
                    throw new InconsistentForecastException("target_dates are not strictly increasing in " + file);
                }
            }
        }

        private Variable variable(String name) {
            Variable v = nc.getRootGroup().findVariable(name);
            if (v == null) {
                throw new InconsistentForecastException("Variable " + name + " missing in " + file);
            }
            return v;
        }

        private String globalString(String name) {
            Attribute attr = nc.findGlobalAttribute(name);
            if (attr == null) {
                throw new InconsistentForecastException("Attribute " + name + " missing in " + file);
            }
            return attr.isString() ? attr.getStringValue() : String.valueOf(attr.getNumericValue());
        }

        private int[] parsePredictandIds() {
            Attribute attr = nc.findGlobalAttribute("predictand_station_ids");
            if (attr == null) {
                return stationIds.clone();
            }
            if (!attr.isString()) {
                int[] ids = new int[attr.getLength()];
                for (int i = 0; i < ids.length; i++) {
                    ids[i] = attr.getNumericValue(i).intValue();
                }
                return ids;
            }
            return Arrays.stream(attr.getStringValue().split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .mapToInt(Integer::parseInt)
                    .toArray();
        }

        private int[] readInts(String name) throws IOException {
            Array array = variable(name).read();
            int[] out = new int[(int) array.getSize()];
            for (int i = 0; i < out.length; i++) {
                out[i] = array.getInt(i);
            }
            return out;
        }

        private Array readSection(Variable v, int[] origin, int[] shape) {
            try {
                return v.read(origin, shape);
            } catch (IOException | InvalidRangeException e) {
                throw new ForecastException("Failed to read " + v.getShortName() + " from " + file, e);
            }
        }

        private List<LocalDateTime> readDates(Variable v, int startRow, int endRow) {
            Array array = endRow < 0
                    ? readAll(v)
                    : readSection(v, new int[]{startRow}, new int[]{endRow - startRow});
            TimeUnits units = TimeUnits.of(v);
            List<LocalDateTime> dates = new ArrayList<>((int) array.getSize());
            for (int i = 0; i < array.getSize(); i++) {
                dates.add(units.toDateTime(array.getDouble(i)));
            }
            return List.copyOf(dates);
        }

        private Array readAll(Variable v) {
            try {
                return v.read();
            } catch (IOException e) {
                throw new ForecastException("Failed to read " + v.getShortName() + " from " + file, e);
            }
        }

        private static double[] toDoubles(Array array) {
            double[] out = new double[(int) array.getSize()];
            for (int i = 0; i < out.length; i++) {
                out[i] = array.getDouble(i);
            }
            return out;
        }
    }

    /**
     * CF-style {@code <unit> since <origin>} time encoding. Without a units attribute the values
     * are Modified Julian Dates.
     */
    record TimeUnits(double secondsPerUnit, LocalDateTime origin) {

        static TimeUnits of(Variable v) {
            Attribute attr = v.findAttribute("units");
            if (attr == null || !attr.isString()) {
                return new TimeUnits(86400, MJD_ORIGIN);
            }
            return parse(attr.getStringValue());
        }

        static TimeUnits parse(String units) {
            String[] parts = units.trim().split("\\s+since\\s+", 2);
            if (parts.length != 2) {
                return new TimeUnits(86400, MJD_ORIGIN);
            }
            double seconds;
            switch (parts[0].toLowerCase()) {
                case "days":
                case "day":
                    seconds = 86400;
                    break;
                case "hours":
                case "hour":
                    seconds = 3600;
                    break;
                case "minutes":
                case "minute":
                    seconds = 60;
                    break;
                case "seconds":
                case "second":
                    seconds = 1;
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported time units: " + units);
            }
            String[] origin = parts[1].trim().split("[ T]", 2);
            LocalDate date = LocalDate.parse(origin[0]);
            LocalTime time = LocalTime.MIDNIGHT;
            if (origin.length > 1 && !origin[1].isBlank()) {
                String t = origin[1].trim();
                int dot = t.indexOf('.');
                time = LocalTime.parse(dot >= 0 ? t.substring(0, dot) : t);
            }
            return new TimeUnits(seconds, date.atTime(time));
        }

        LocalDateTime toDateTime(double value) {
            long seconds = Math.round(value * secondsPerUnit);
            return origin.plusSeconds(seconds);
        }
    }
}
