package com.phillippitts.poseidon.service.metrics;

import com.phillippitts.poseidon.domain.Provenance;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for forecast reconciliation.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Extraction latency and success/failure counts per backend</li>
 *   <li>Reconciliation outcome by provenance (single source, merged, synthetic)</li>
 *   <li>Score distribution of the winning candidate</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer (actuator {@code /actuator/metrics}).
 */
@Component
public class ReconciliationMetrics {

    private static final String METRIC_PREFIX = "poseidon.reconciliation";

    private final MeterRegistry registry;

    public ReconciliationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records extraction latency for one backend.
     *
     * @param backendName backend name (vision, ocr, direct-api)
     * @param durationMs  duration in milliseconds
     */
    public void recordLatency(String backendName, long durationMs) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by an extraction backend")
                .tag("backend", backendName)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void incrementSuccess(String backendName) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of candidates produced")
                .tag("backend", backendName)
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter for one backend.
     *
     * @param backendName backend name
     * @param reason      failure kind (timeout, malformed_output, backend_unavailable)
     */
    public void incrementFailure(String backendName, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed extractions")
                .tag("backend", backendName)
                .tag("reason", reason.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Records which path produced the final dataset.
     */
    public void recordOutcome(Provenance provenance, int winningScore) {
        Counter.builder(METRIC_PREFIX + ".outcome")
                .description("Number of reconciliations by final provenance")
                .tag("provenance", provenance.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
        DistributionSummary.builder(METRIC_PREFIX + ".score")
                .description("Score of the base candidate")
                .register(registry)
                .record(winningScore);
    }
}
