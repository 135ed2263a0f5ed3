package com.phillippitts.poseidon.service.events;

import com.phillippitts.poseidon.service.extraction.event.BackendFailureEvent;
import com.phillippitts.poseidon.service.metrics.ReconciliationMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts every backend failure and logs a throttled operator hint per backend and kind.
 * Credentials missing for a backend would otherwise log on every request.
 */
@Component
class BackendFailureListener {
    private static final Logger LOG = LogManager.getLogger(BackendFailureListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final ReconciliationMetrics metrics;
    private final Clock clock;

    BackendFailureListener(ReconciliationMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    @EventListener
    void onBackendFailure(BackendFailureEvent e) {
        metrics.incrementFailure(e.backend(), e.kind().name());
        String key = e.backend() + '-' + e.kind();
        if (shouldLog(key)) {
            LOG.warn("Extraction backend {} failing with {}: {}. Check poseidon.backend.* settings.",
                    e.backend(), e.kind(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
