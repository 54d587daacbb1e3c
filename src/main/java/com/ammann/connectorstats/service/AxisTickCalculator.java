/* (C)2026 */
package com.ammann.connectorstats.service;

import com.ammann.connectorstats.exception.ValidationException;
import com.ammann.connectorstats.model.AxisTicks;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;
import org.jboss.logging.Logger;

/**
 * Computes evenly spaced, aligned ticks for a numeric graph axis.
 *
 * <p>The smallest step that covers the domain in {@code tickCount - 1} steps is used as the
 * alignment grid: the domain bounds are widened to multiples of it, and the final step size
 * is rounded up to it so the last tick never falls short of the maximum.
 */
@ApplicationScoped
public class AxisTickCalculator {

    private static final Logger LOG = Logger.getLogger(AxisTickCalculator.class);

    /**
     * Calculates axis ticks for {@code [min, max]}.
     *
     * @param min       domain minimum
     * @param max       domain maximum
     * @param tickCount desired number of ticks
     * @return aligned bounds, step size and distinct ticks; a single tick for a flat domain
     * @throws ValidationException if the bounds are not finite, inverted, or tickCount is below 1
     */
    public AxisTicks calculate(double min, double max, int tickCount) {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw ValidationException.invalidParameter("min/max", min + "/" + max, "finite numbers");
        }
        if (min > max) {
            throw ValidationException.invalidParameter("min", min, "value less than or equal to max");
        }
        if (tickCount < 1) {
            throw ValidationException.invalidParameter("tickCount", tickCount, "positive integer");
        }

        if (min == max) {
            // A flat domain still renders one reference line.
            return new AxisTicks(min, max, 0.0, List.of(min));
        }

        int steps = tickCount > 1 ? tickCount - 1 : 1;
        double minStepSize = (max - min) / steps;
        double alignedMin = align(min, minStepSize, Math::floor);
        double alignedMax = align(max, minStepSize, Math::ceil);
        double stepSize = align((alignedMax - alignedMin) / steps, minStepSize, Math::ceil);

        // Ticks collide when the domain is very small.
        Set<Double> ticks = new LinkedHashSet<>();
        for (int i = 0; i < tickCount; i++) {
            ticks.add(alignedMin + i * stepSize);
        }

        LOG.debugf(
                "Axis ticks for [%f, %f]: aligned [%f, %f], step %f, %d ticks",
                min, max, alignedMin, alignedMax, stepSize, ticks.size());
        return new AxisTicks(alignedMin, alignedMax, stepSize, new ArrayList<>(ticks));
    }

    /**
     * Rounds {@code value} to a multiple of {@code step} using the given rounding function.
     */
    static double align(double value, double step, DoubleUnaryOperator rounding) {
        double effectiveStep = step == 0 ? 1.0 : step;
        double inverse = 1.0 / effectiveStep;
        return rounding.applyAsDouble(value * inverse) / inverse;
    }
}
