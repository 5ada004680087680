package org.gambitpairing.comparison;

import org.gambitpairing.exception.InsufficientSamplesException;

/**
 * Streaming mean and variance (Welford's algorithm), stable over many samples.
 * Not thread-safe.
 */
public class RunningStatistics {

    private long count;
    private double mean;
    private double m2;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    public void add(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
        min = Math.min(min, value);
        max = Math.max(max, value);
    }

    public long count() {
        return count;
    }

    /**
     * @throws InsufficientSamplesException if nothing was added
     */
    public MetricSummary summary() {
        if (count == 0) {
            throw new InsufficientSamplesException("mean", 0, 1);
        }
        if (count < 2) {
            return MetricSummary.of(count, mean, min, max);
        }
        return MetricSummary.of(count, mean, min, max, m2 / (count - 1));
    }
}
