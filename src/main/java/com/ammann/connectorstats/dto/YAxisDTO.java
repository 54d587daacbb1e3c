/* (C)2026 */
package com.ammann.connectorstats.dto;

import com.ammann.connectorstats.enumeration.ByteUnit;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Y-axis of one statistics chart.
 *
 * <p>The domain always includes zero. {@code unit} is only set for byte-valued charts and
 * names the largest unit not exceeding the maximum plotted value.
 *
 * @param name  chart name, such as {@code bytes}
 * @param lines graph point fields plotted on this axis
 * @param ticks aligned bounds and tick values
 * @param unit  display unit for byte-valued charts
 */
@Schema(description = "Y-axis of a statistics chart")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record YAxisDTO(
        @Schema(description = "Chart name") String name,
        @Schema(description = "Fields plotted on this axis") List<String> lines,
        @Schema(description = "Axis bounds and ticks") AxisTicksDTO ticks,
        @Schema(description = "Byte unit for byte-valued charts") ByteUnit unit) {}
