/* (C)2026 */
package com.ammann.connectorstats.health;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/**
 * Readiness check for the statistics pipeline configuration.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: collection interval, variance margin and tick count are usable</li>
 *   <li>DOWN: a graph built with this configuration would be meaningless</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class StatisticsPipelineHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(StatisticsPipelineHealthCheck.class);

    @ConfigProperty(name = "connector.statistics.collection-interval-ms", defaultValue = "60000")
    long collectionIntervalMs = 60_000L;

    @ConfigProperty(name = "connector.statistics.variance-margin", defaultValue = "0.1")
    double varianceMargin = 0.1;

    @ConfigProperty(name = "connector.statistics.y-tick-count", defaultValue = "4")
    int yTickCount = 4;

    @Override
    public HealthCheckResponse call() {
        boolean intervalValid = collectionIntervalMs > 0;
        boolean marginValid = varianceMargin >= 0.0 && varianceMargin < 1.0;
        boolean tickCountValid = yTickCount >= 2;
        boolean ready = intervalValid && marginValid && tickCountValid;

        if (!ready) {
            LOG.warnf(
                    "Statistics pipeline misconfigured: interval=%d ms, margin=%.3f, tickCount=%d",
                    collectionIntervalMs, varianceMargin, yTickCount);
        }

        return HealthCheckResponse.named("statistics-pipeline")
                .status(ready)
                .withData("collection-interval-ms", collectionIntervalMs)
                .withData("variance-margin", String.valueOf(varianceMargin))
                .withData("y-tick-count", yTickCount)
                .build();
    }
}
