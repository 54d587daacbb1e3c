/* (C)2026 */
package com.ammann.connectorstats.service;

import com.ammann.connectorstats.dto.SinkStatisticsRatesDTO;
import com.ammann.connectorstats.model.DataPoint;
import com.ammann.connectorstats.model.SinkStatistics;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.Optional;

/**
 * Reduces a sink statistics bucket to staged and committed throughput.
 */
@ApplicationScoped
public class SinkStatisticsReducer implements BucketReducer<SinkStatistics, SinkStatisticsRatesDTO> {

    @Override
    public SinkStatisticsRatesDTO reduce(
            Optional<DataPoint<SinkStatistics>> start, List<DataPoint<SinkStatistics>> points) {
        Optional<DataPoint<SinkStatistics>> end =
                points.isEmpty() ? Optional.empty() : Optional.of(points.get(points.size() - 1));
        return new SinkStatisticsRatesDTO(
                RateCalculator.ratePerSecond(end, start, SinkStatistics::messagesStaged),
                RateCalculator.ratePerSecond(end, start, SinkStatistics::messagesCommitted),
                RateCalculator.ratePerSecond(end, start, SinkStatistics::bytesStaged),
                RateCalculator.ratePerSecond(end, start, SinkStatistics::bytesCommitted));
    }
}
