package org.indexbench.benchmarks;

import java.util.Locale;
import java.util.Objects;

/**
 * Construction cost of one index: kind label, build time and size on disk.
 */
public final class IndexCostRecord {
    public final String kindLabel;
    public final long buildTimeNanos;
    public final String size;

    public IndexCostRecord(String kindLabel, long buildTimeNanos, String size) {
        this.kindLabel = Objects.requireNonNull(kindLabel, "kindLabel");
        this.buildTimeNanos = buildTimeNanos;
        this.size = Objects.requireNonNull(size, "size");
    }

    public double buildTimeMillis() {
        return buildTimeNanos / 1_000_000.0;
    }

    /**
     * Build time in milliseconds with a fixed number of decimals, independent of locale.
     */
    public String formattedBuildTime() {
        return String.format(Locale.ROOT, "%.3f", buildTimeMillis());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexCostRecord)) {
            return false;
        }
        IndexCostRecord that = (IndexCostRecord) o;
        return buildTimeNanos == that.buildTimeNanos
                && kindLabel.equals(that.kindLabel)
                && size.equals(that.size);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kindLabel, buildTimeNanos, size);
    }

    @Override
    public String toString() {
        return kindLabel + "[" + formattedBuildTime() + " ms, " + size + "]";
    }
}
