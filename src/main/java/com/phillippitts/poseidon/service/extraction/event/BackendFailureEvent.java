package com.phillippitts.poseidon.service.extraction.event;

import com.phillippitts.poseidon.domain.FailureKind;

import java.time.Instant;
import java.util.Map;

/**
 * Published when an extraction backend fails to produce a candidate (timeout, malformed
 * reply, unreachable service, missing credentials).
 *
 * <p>Privacy note: do not put image bytes or captions in the context. Restrict it to technical
 * diagnostics.
 */
public record BackendFailureEvent(
        String backend,
        FailureKind kind,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public BackendFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
