package com.phillippitts.poseidon.service.extraction.util;

import com.phillippitts.poseidon.domain.FailureKind;
import com.phillippitts.poseidon.service.extraction.event.BackendFailureEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Utility class for publishing extraction backend failure events.
 *
 * <p>Centralizes the null-check on the publisher so backends work without event publishing
 * in unit tests.
 *
 * @since 1.0
 */
public final class BackendEventPublisher {

    private BackendEventPublisher() {
        // Utility class - prevent instantiation
    }

    /**
     * Publishes a backend failure event if a publisher is available.
     *
     * @param publisher   the Spring event publisher (may be null)
     * @param backendName the name of the failing backend
     * @param kind        failure classification
     * @param message     a human-readable description of the failure
     * @param cause       the exception that caused the failure (may be null)
     * @param context     additional context as key-value pairs (may be null or empty)
     */
    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String backendName,
                                      FailureKind kind,
                                      String message,
                                      Throwable cause,
                                      Map<String, String> context) {
        if (publisher != null) {
            publisher.publishEvent(new BackendFailureEvent(
                    backendName,
                    kind,
                    Instant.now(),
                    message,
                    cause,
                    context
            ));
        }
    }

    /**
     * Publishes a backend failure event with no additional context.
     */
    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String backendName,
                                      FailureKind kind,
                                      String message,
                                      Throwable cause) {
        publishFailure(publisher, backendName, kind, message, cause, null);
    }
}
