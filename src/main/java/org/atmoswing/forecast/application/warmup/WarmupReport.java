package org.atmoswing.forecast.application.warmup;

/**
 * Outcome counts of one warmup sweep.
 */
public class WarmupReport {

    private int built;
    private int upToDate;
    private int planned;
    private int skipped;
    private int failed;

    void recordBuilt() {
        built++;
    }

    void recordUpToDate() {
        upToDate++;
    }

    void recordPlanned() {
        planned++;
    }

    void recordSkipped() {
        skipped++;
    }

    void recordFailed() {
        failed++;
    }

    public int getBuilt() {
        return built;
    }

    public int getUpToDate() {
        return upToDate;
    }

    /** Entries a dry run would have written. */
    public int getPlanned() {
        return planned;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getFailed() {
        return failed;
    }

    @Override
    public String toString() {
        return String.format("built=%d, up-to-date=%d, planned=%d, skipped=%d, failed=%d",
                built, upToDate, planned, skipped, failed);
    }
}
