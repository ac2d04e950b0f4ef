package io.teleops.stats;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Percentile computation by linear interpolation between order statistics.
 * <p>
 * Used for the adaptive noise threshold of the incident selector and for latency summaries.
 */
public final class PercentileEstimator {

    /** Returned for an empty sample; callers treat it as "no threshold". */
    public static final double EMPTY_SAMPLE = 0.0;

    private PercentileEstimator() {}

    /**
     * Compute the {@code pct}-th percentile of the given values.
     *
     * @param values sample, not modified
     * @param pct percentile in [0, 100]; values outside are clamped to min/max
     * @return interpolated percentile, {@link #EMPTY_SAMPLE} for an empty sample
     */
    public static double percentile(Collection<? extends Number> values, double pct) {
        if (values == null || values.isEmpty()) {
            return EMPTY_SAMPLE;
        }

        List<Double> sorted = new ArrayList<>(values.size());
        for (Number value : values) {
            sorted.add(value.doubleValue());
        }
        Collections.sort(sorted);

        return percentileOfSorted(sorted, pct);
    }

    /**
     * Same as {@link #percentile(Collection, double)} for input already sorted ascending.
     */
    public static double percentileOfSorted(List<Double> sorted, double pct) {
        if (sorted.isEmpty()) {
            return EMPTY_SAMPLE;
        }
        int n = sorted.size();
        if (n == 1) {
            return sorted.get(0);
        }
        if (pct <= 0) {
            return sorted.get(0);
        }
        if (pct >= 100) {
            return sorted.get(n - 1);
        }

        double k = (n - 1) * (pct / 100.0);
        int floor = (int) Math.floor(k);
        int ceil = (int) Math.ceil(k);
        if (floor == ceil) {
            return sorted.get(floor);
        }
        return sorted.get(floor) * (ceil - k) + sorted.get(ceil) * (k - floor);
    }
}
