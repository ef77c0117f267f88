package org.atmoswing.forecast.application.warmup;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command line of the warmup:
 * <pre>
 * warmup [--data-dir D] [--days N] [--functions f1 f2 ...] [--regions r1 r2 ...]
 *        [--percentile P] [--normalize R] [--methods m1 m2 ...] [--lead-times 0,24,48,72] [--dry-run]
 * </pre>
 */
public final class WarmupOptions {

    public static final int DEFAULT_DAYS = 10;
    public static final int DEFAULT_PERCENTILE = 90;
    public static final List<String> DEFAULT_FUNCTIONS = List.of(
            WarmupOperation.SERIES_SYNTHESIS_PER_METHOD.operationName(),
            WarmupOperation.SERIES_SYNTHESIS_TOTAL.operationName());
    public static final List<Integer> DEFAULT_LEAD_TIMES = List.of(0, 24, 48, 72);

    public static final String USAGE = "Usage: warmup [--data-dir D] [--days N] [--functions f1 f2 ...]"
            + " [--regions r1 r2 ...] [--percentile P] [--normalize R] [--methods m1 m2 ...]"
            + " [--lead-times 0,24,48,72] [--dry-run]";

    private String dataDir;
    private int days = DEFAULT_DAYS;
    private List<String> functions = DEFAULT_FUNCTIONS;
    private List<String> regions;
    private int percentile = DEFAULT_PERCENTILE;
    private Integer normalize;
    private List<String> methods;
    private List<Integer> leadTimes = DEFAULT_LEAD_TIMES;
    private boolean dryRun;

    /**
     * @throws IllegalArgumentException on an unknown flag or a missing/invalid value
     */
    public static WarmupOptions parse(String... args) {
        WarmupOptions options = new WarmupOptions();
        int i = 0;
        while (i < args.length) {
            String flag = args[i++];
            switch (flag) {
                case "--data-dir":
                    options.dataDir = single(flag, args, i++);
                    break;
                case "--days":
                    options.days = integer(flag, single(flag, args, i++));
                    break;
                case "--percentile":
                    options.percentile = integer(flag, single(flag, args, i++));
                    break;
                case "--normalize":
                    options.normalize = integer(flag, single(flag, args, i++));
                    break;
                case "--lead-times":
                    options.leadTimes = leadTimes(single(flag, args, i++));
                    break;
                case "--dry-run":
                    options.dryRun = true;
                    break;
                case "--functions":
                case "--regions":
                case "--methods": {
                    List<String> values = new ArrayList<>();
                    while (i < args.length && !args[i].startsWith("--")) {
                        values.add(args[i++]);
                    }
                    if (flag.equals("--functions")) {
                        if (values.isEmpty()) {
                            throw new IllegalArgumentException("--functions requires at least one value");
                        }
                        options.functions = List.copyOf(values);
                    } else if (flag.equals("--regions")) {
                        options.regions = values.isEmpty() ? null : List.copyOf(values);
                    } else {
                        options.methods = values.isEmpty() ? null : List.copyOf(values);
                    }
                    break;
                }
                default:
                    throw new IllegalArgumentException("Unknown option: " + flag);
            }
        }
        return options;
    }

    private static String single(String flag, String[] args, int idx) {
        if (idx >= args.length || args[idx].startsWith("--")) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[idx];
    }

    private static int integer(String flag, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects an integer, got: " + value, e);
        }
    }

    /**
     * Comma separated hours; entries that are not plain numbers are ignored.
     */
    static List<Integer> leadTimes(String value) {
        List<Integer> out = new ArrayList<>();
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty() && s.chars().allMatch(Character::isDigit))
                .forEach(s -> out.add(Integer.parseInt(s)));
        return List.copyOf(out);
    }

    /** Null when the configured data directory applies. */
    public String getDataDir() {
        return dataDir;
    }

    public int getDays() {
        return days;
    }

    public List<String> getFunctions() {
        return functions;
    }

    /** Null for all regions. */
    public List<String> getRegions() {
        return regions;
    }

    public int getPercentile() {
        return percentile;
    }

    /** Null when values are not normalized, as for a request without {@code normalize}. */
    public Integer getNormalize() {
        return normalize;
    }

    /** Null for every method of each forecast. */
    public List<String> getMethods() {
        return methods;
    }

    public List<Integer> getLeadTimes() {
        return leadTimes;
    }

    public boolean isDryRun() {
        return dryRun;
    }
}
