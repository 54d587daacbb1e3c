/* (C)2026 */
package com.ammann.connectorstats.service;

import com.ammann.connectorstats.dto.SourceStatisticsRatesDTO;
import com.ammann.connectorstats.model.DataPoint;
import com.ammann.connectorstats.model.SourceStatistics;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.Optional;

/**
 * Reduces a source statistics bucket to ingestion rates and the peak offset lag.
 *
 * <p>Rates run from the baseline point to the bucket's last point. The offset lag is a
 * gauge, so the bucket reports its maximum instead of a rate.
 */
@ApplicationScoped
public class SourceStatisticsReducer
        implements BucketReducer<SourceStatistics, SourceStatisticsRatesDTO> {

    @Override
    public SourceStatisticsRatesDTO reduce(
            Optional<DataPoint<SourceStatistics>> start, List<DataPoint<SourceStatistics>> points) {
        Optional<DataPoint<SourceStatistics>> end =
                points.isEmpty() ? Optional.empty() : Optional.of(points.get(points.size() - 1));
        return new SourceStatisticsRatesDTO(
                RateCalculator.ratePerSecond(end, start, SourceStatistics::messagesReceived),
                RateCalculator.ratePerSecond(end, start, SourceStatistics::bytesReceived),
                RateCalculator.ratePerSecond(end, start, SourceStatistics::updatesStaged),
                RateCalculator.ratePerSecond(end, start, SourceStatistics::updatesCommitted),
                RateCalculator.max(points, SourceStatistics::offsetDelta));
    }
}
