/* (C)2026 */
package com.ammann.connectorstats.dto;

import com.ammann.connectorstats.model.AxisTicks;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Aligned axis bounds and tick values")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AxisTicksDTO(
        @Schema(description = "Minimum aligned down to the step grid") Double alignedMin,
        @Schema(description = "Maximum aligned up to the step grid") Double alignedMax,
        @Schema(description = "Distance between ticks, 0 for a flat domain") Double stepSize,
        @Schema(description = "Distinct tick values in ascending order") List<Double> ticks) {

    public static AxisTicksDTO from(AxisTicks ticks) {
        return new AxisTicksDTO(ticks.alignedMin(), ticks.alignedMax(), ticks.stepSize(), ticks.ticks());
    }
}
