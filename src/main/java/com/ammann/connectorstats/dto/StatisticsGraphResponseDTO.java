/* (C)2026 */
package com.ammann.connectorstats.dto;

import com.ammann.connectorstats.enumeration.ConnectorType;
import com.ammann.connectorstats.model.GraphPoint;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Bucketed, rate-annotated statistics series ready for rendering.
 *
 * <p>{@code points} holds one entry per visible bucket in time order. An empty list means
 * the statistics are still loading.
 *
 * @param connectorType source or sink
 * @param window        graph window and bucket size
 * @param points        per-bucket values, timestamped with the bucket end
 * @param axes          one y-axis per chart
 * @param <R> per-bucket value type
 */
@Schema(description = "Connector statistics graph")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatisticsGraphResponseDTO<R>(
        @Schema(description = "Connector type") ConnectorType connectorType,
        @Schema(description = "Graph window") GraphWindowDTO window,
        @Schema(description = "Per-bucket values") List<GraphPoint<R>> points,
        @Schema(description = "Y-axes, one per chart") List<YAxisDTO> axes) {}
