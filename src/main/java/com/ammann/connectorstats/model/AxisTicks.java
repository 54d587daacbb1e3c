/* (C)2026 */
package com.ammann.connectorstats.model;

import java.util.List;

/**
 * Evenly spaced axis ticks computed for a numeric domain.
 *
 * @param alignedMin domain minimum aligned down to the minimum step size
 * @param alignedMax domain maximum aligned up to the minimum step size
 * @param stepSize   distance between consecutive ticks, {@code 0} for a flat domain
 * @param ticks      distinct tick values in ascending order
 */
public record AxisTicks(double alignedMin, double alignedMax, double stepSize, List<Double> ticks) {

    public AxisTicks {
        ticks = List.copyOf(ticks);
    }
}
