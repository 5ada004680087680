package org.gambitpairing.comparison;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.gambitpairing.exception.InsufficientSamplesException;

import java.util.OptionalDouble;

/**
 * Summary of one metric over a set of samples. Variance and the confidence interval
 * are undefined, not zero, below two samples.
 *
 * @param variance            sample variance with the n-1 denominator
 * @param confidenceHalfWidth half-width of the 95% normal confidence interval of the mean
 */
public record MetricSummary(
    @JsonProperty("count") long count,
    @JsonProperty("mean") double mean,
    @JsonProperty("min") double min,
    @JsonProperty("max") double max,
    @JsonProperty("variance") OptionalDouble variance,
    @JsonProperty("confidenceHalfWidth") OptionalDouble confidenceHalfWidth
) {
    static final double Z_95 = 1.959963984540054;

    static MetricSummary of(long count, double mean, double min, double max) {
        return new MetricSummary(count, mean, min, max, OptionalDouble.empty(), OptionalDouble.empty());
    }

    static MetricSummary of(long count, double mean, double min, double max, double variance) {
        return new MetricSummary(count, mean, min, max, OptionalDouble.of(variance),
            OptionalDouble.of(Z_95 * Math.sqrt(variance / count)));
    }

    /**
     * @throws InsufficientSamplesException below two samples
     */
    public double requireVariance() {
        if (variance.isEmpty()) {
            throw new InsufficientSamplesException("variance", count, 2);
        }
        return variance.getAsDouble();
    }

    public OptionalDouble standardDeviation() {
        return variance.isPresent() ? OptionalDouble.of(Math.sqrt(variance.getAsDouble())) : OptionalDouble.empty();
    }
}
