/* (C)2026 */
package com.ammann.connectorstats.health;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness check for the graph service.
 *
 * <p>Graphs are computed per request from the posted rows and nothing external is held open,
 * so answering at all is enough to be considered alive.
 */
@Liveness
public class LivenessCheck implements HealthCheck {

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("alive")
                .up()
                .withData("stateless", true)
                .build();
    }
}
