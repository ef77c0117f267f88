package org.atmoswing.forecast.application.warmup;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class WarmupOptionsTest {

    @Test
    public void testDefaults() {
        WarmupOptions options = WarmupOptions.parse();

        assertNull(options.getDataDir());
        assertEquals(10, options.getDays());
        assertEquals(List.of("series_synthesis_per_method", "series_synthesis_total"), options.getFunctions());
        assertNull(options.getRegions());
        assertEquals(90, options.getPercentile());
        assertNull(options.getNormalize());
        assertNull(options.getMethods());
        assertEquals(List.of(0, 24, 48, 72), options.getLeadTimes());
        assertFalse(options.isDryRun());
    }

    @Test
    public void testAllFlags() {
        WarmupOptions options = WarmupOptions.parse(
                "--data-dir", "/srv/forecasts",
                "--days", "3",
                "--functions", "list_methods", "entities_analog_values_percentile",
                "--regions", "alpes", "jura",
                "--percentile", "60",
                "--normalize", "2",
                "--methods", "4Zo",
                "--lead-times", "0,12",
                "--dry-run");

        assertEquals("/srv/forecasts", options.getDataDir());
        assertEquals(3, options.getDays());
        assertEquals(List.of("list_methods", "entities_analog_values_percentile"), options.getFunctions());
        assertEquals(List.of("alpes", "jura"), options.getRegions());
        assertEquals(60, options.getPercentile());
        assertEquals(Integer.valueOf(2), options.getNormalize());
        assertEquals(List.of("4Zo"), options.getMethods());
        assertEquals(List.of(0, 12), options.getLeadTimes());
        assertTrue(options.isDryRun());
    }

    @Test
    public void testInvalidLeadTimesIgnored() {
        assertEquals(List.of(0, 48), WarmupOptions.leadTimes("0, x,,48,-6"));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> WarmupOptions.parse("--verbose"));
        assertThrows(IllegalArgumentException.class, () -> WarmupOptions.parse("--days"));
        assertThrows(IllegalArgumentException.class, () -> WarmupOptions.parse("--days", "ten"));
        assertThrows(IllegalArgumentException.class, () -> WarmupOptions.parse("--functions", "--dry-run"));
    }

    @Test
    public void testOperationNames() {
        assertEquals(WarmupOperation.SERIES_SYNTHESIS_TOTAL, WarmupOperation.fromName("series_synthesis_total").get());
        assertTrue(WarmupOperation.fromName("analog_dates").isEmpty());
    }
}
