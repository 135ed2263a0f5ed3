package com.phillippitts.poseidon.service.health;

import com.phillippitts.poseidon.service.extraction.ExtractionBackend;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for the extraction backends.
 *
 * <p>Reports configuration readiness (enabled and credentials present), not reachability:
 * <ul>
 *   <li>UP: every backend is ready</li>
 *   <li>DEGRADED: at least one backend is ready</li>
 *   <li>DOWN: no backend is ready; every reconciliation will return synthetic data</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ExtractionBackendHealthIndicator implements HealthIndicator {

    private final List<ExtractionBackend> backends;

    public ExtractionBackendHealthIndicator(List<ExtractionBackend> backends) {
        this.backends = List.copyOf(backends);
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        long ready = 0;
        for (ExtractionBackend backend : backends) {
            boolean available = backend.isAvailable();
            if (available) {
                ready++;
            }
            builder.withDetail(backend.name(), available ? "ready" : "unavailable");
        }

        if (!backends.isEmpty() && ready == backends.size()) {
            builder.up().withDetail("status", "All backends configured");
        } else if (ready > 0) {
            builder.status("DEGRADED").withDetail("status", "Partial backend availability");
        } else {
            builder.down().withDetail("status", "No backend available, synthetic fallback only");
        }
        return builder.build();
    }
}
