package com.phillippitts.poseidon.service.metrics;

import com.phillippitts.poseidon.domain.Provenance;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ReconciliationMetricsTest {

    private SimpleMeterRegistry registry;
    private ReconciliationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ReconciliationMetrics(registry);
    }

    @Test
    void recordsLatencyPerBackend() {
        metrics.recordLatency("vision", 1200);
        metrics.recordLatency("vision", 800);

        var timer = registry.find("poseidon.reconciliation.latency").tag("backend", "vision").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(2000.0);
    }

    @Test
    void countsFailuresByReason() {
        metrics.incrementFailure("ocr", "MALFORMED_OUTPUT");
        metrics.incrementFailure("ocr", "MALFORMED_OUTPUT");

        assertThat(registry.find("poseidon.reconciliation.failure")
                .tags("backend", "ocr", "reason", "malformed_output").counter().count()).isEqualTo(2.0);
    }

    @Test
    void recordsOutcomeAndScore() {
        metrics.incrementSuccess("direct-api");
        metrics.recordOutcome(Provenance.MERGED, 80);
        metrics.recordOutcome(Provenance.SYNTHETIC, 0);

        assertThat(registry.find("poseidon.reconciliation.success").tag("backend", "direct-api")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.find("poseidon.reconciliation.outcome").tag("provenance", "merged")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.find("poseidon.reconciliation.score").summary().count()).isEqualTo(2);
    }
}
