package com.phillippitts.poseidon.service.extraction;

import com.phillippitts.poseidon.domain.CandidateResult;
import com.phillippitts.poseidon.domain.Provenance;
import com.phillippitts.poseidon.util.TimeUtils;

import java.time.Duration;

/**
 * Contract for a source of candidate forecast data.
 *
 * <p>Three adapters implement this interface behind one contract so that the reconciliation
 * fan-out, scoring and merge are written once:
 * <ul>
 *   <li>{@link com.phillippitts.poseidon.service.extraction.vision.VisionModelBackend} - reads the screenshot with a
 *       vision-capable generative model</li>
 *   <li>{@link com.phillippitts.poseidon.service.extraction.ocr.OpticalTextBackend} - OCR plus positional regexes</li>
 *   <li>{@link com.phillippitts.poseidon.service.extraction.direct.DirectApiBackend} - numeric forecast and tide API</li>
 * </ul>
 *
 * <p><b>Failure contract:</b> {@link #extract(ExtractionRequest)} never throws. Every failure
 * (missing credentials, unreachable service, unparseable reply) is returned as a failed
 * {@link CandidateResult} so the caller can continue past it.
 *
 * <p><b>Thread Safety:</b> Implementations must be thread-safe; many conversations may
 * reconcile at once.
 *
 * @see AbstractExtractionBackend
 */
public interface ExtractionBackend {

    /** Deadline used when a backend reports no usable timeout. */
    long DEFAULT_TIMEOUT_MS = 30_000L;

    /**
     * Extracts a candidate dataset.
     *
     * @param request image and/or coordinates plus date
     * @return candidate sample tagged with {@link #source()}, or a typed failure; never null
     */
    CandidateResult extract(ExtractionRequest request);

    /**
     * @return provenance tag this backend stamps on its samples
     */
    Provenance source();

    /**
     * @return backend identifier for logging and metrics (see {@link BackendNames})
     */
    String name();

    /**
     * Returns the backend's own time budget. The fan-out converts a late answer into a
     * {@link com.phillippitts.poseidon.domain.FailureKind#TIMEOUT} failure.
     *
     * @return per-call timeout
     */
    Duration timeout();

    /**
     * @return {@link #timeout()} in milliseconds, or {@link #DEFAULT_TIMEOUT_MS} if it is unusable
     */
    default long timeoutMillis() {
        return TimeUtils.positiveMillis(timeout(), DEFAULT_TIMEOUT_MS);
    }

    /**
     * Checks whether the backend is configured and enabled (for example, has its credentials).
     *
     * @return false if every call would fail with {@code BACKEND_UNAVAILABLE}
     */
    boolean isAvailable();

    /**
     * Checks whether the backend can work with this request's inputs.
     *
     * <p>Default implementation accepts every request.
     *
     * @param request request to check
     * @return true if the request carries what this backend needs
     */
    default boolean supports(ExtractionRequest request) {
        return true;
    }
}
