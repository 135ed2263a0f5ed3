package com.phillippitts.poseidon.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single extraction backend invocation: either a candidate sample or a typed failure.
 *
 * <p>Exactly one of {@code sample} and {@code failure} is non-null.
 *
 * @param source     provenance of the backend that produced this result
 * @param sample     candidate dataset (null on failure)
 * @param failure    failure kind (null on success)
 * @param message    diagnostic message for failures, empty on success
 * @param durationMs wall-clock time the backend took
 */
public record CandidateResult(
        Provenance source,
        ForecastSample sample,
        FailureKind failure,
        String message,
        long durationMs
) {

    public CandidateResult {
        Objects.requireNonNull(source, "source");
        if ((sample == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of sample and failure must be set");
        }
        message = message == null ? "" : message;
    }

    public static CandidateResult success(ForecastSample sample, long durationMs) {
        Objects.requireNonNull(sample, "sample");
        return new CandidateResult(sample.provenance(), sample, null, "", durationMs);
    }

    public static CandidateResult failure(Provenance source, FailureKind kind, String message, long durationMs) {
        Objects.requireNonNull(kind, "kind");
        return new CandidateResult(source, null, kind, message, durationMs);
    }

    public boolean isSuccess() {
        return sample != null;
    }

    public Optional<ForecastSample> sampleIfPresent() {
        return Optional.ofNullable(sample);
    }
}
