/* (C)2026 */
package com.ammann.connectorstats.service;

import com.ammann.connectorstats.model.DataPoint;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Building blocks for {@link BucketReducer} implementations.
 *
 * <p>A missing point or a {@code null} field propagates as a {@code null} result, which
 * renders as "no data" rather than zero.
 */
public final class RateCalculator {

    private RateCalculator() {}

    /**
     * Per-second rate of change of a cumulative counter between two points.
     *
     * <p>Counters should never decrease, but they do reset; a negative rate is reported as
     * {@code 0}. Points with identical timestamps also yield {@code 0}.
     *
     * @param end   later point
     * @param start earlier point
     * @param field extracts the counter from the payload
     * @return value per second, or {@code null} when either point or value is missing
     */
    public static <T> Double ratePerSecond(
            Optional<DataPoint<T>> end, Optional<DataPoint<T>> start, Function<T, ? extends Number> field) {
        if (end.isEmpty() || start.isEmpty()) {
            return null;
        }
        return ratePerSecond(end.get(), start.get(), field);
    }

    /**
     * @see #ratePerSecond(Optional, Optional, Function)
     */
    public static <T> Double ratePerSecond(
            DataPoint<T> end, DataPoint<T> start, Function<T, ? extends Number> field) {
        if (end == null || start == null) {
            return null;
        }
        Number endValue = valueOf(end, field);
        Number startValue = valueOf(start, field);
        if (endValue == null || startValue == null) {
            return null;
        }

        double elapsedMs = end.timestamp() - start.timestamp();
        double rate = (endValue.doubleValue() - startValue.doubleValue()) / elapsedMs * 1000;
        if (Double.isNaN(rate) || Double.isInfinite(rate) || rate < 0) {
            return 0.0;
        }
        return rate;
    }

    /**
     * Largest non-null value of a gauge field over a bucket.
     *
     * @return the maximum as a double, or {@code null} if no point carries a value
     */
    public static <T> Double max(List<DataPoint<T>> points, Function<T, ? extends Number> field) {
        return points.stream()
                .map(point -> valueOf(point, field))
                .filter(Objects::nonNull)
                .mapToDouble(Number::doubleValue)
                .boxed()
                .max(Double::compare)
                .orElse(null);
    }

    private static <T> Number valueOf(DataPoint<T> point, Function<T, ? extends Number> field) {
        return point.data() == null ? null : field.apply(point.data());
    }
}
