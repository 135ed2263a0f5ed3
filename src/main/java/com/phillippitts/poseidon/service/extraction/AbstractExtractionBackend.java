package com.phillippitts.poseidon.service.extraction;

import com.phillippitts.poseidon.domain.CandidateResult;
import com.phillippitts.poseidon.domain.FailureKind;
import com.phillippitts.poseidon.domain.ForecastSample;
import com.phillippitts.poseidon.exception.ExtractionException;
import com.phillippitts.poseidon.service.extraction.util.BackendEventPublisher;
import com.phillippitts.poseidon.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Map;

/**
 * Abstract base class for extraction backends providing the "never throws" failure contract.
 *
 * <p>This class implements the Template Method pattern: {@link #extract(ExtractionRequest)} is
 * final and wraps the subclass hook {@link #doExtract(ExtractionRequest)} so that
 * <ul>
 *   <li>an unavailable backend (disabled or without credentials) fails fast with
 *       {@link FailureKind#BACKEND_UNAVAILABLE} without touching the network</li>
 *   <li>an {@link ExtractionException} becomes a failure of the same {@link FailureKind}</li>
 *   <li>any other runtime exception or linkage error becomes {@link FailureKind#BACKEND_UNAVAILABLE}</li>
 *   <li>every failure within the deadline publishes a
 *       {@link com.phillippitts.poseidon.service.extraction.event.BackendFailureEvent}; a failure
 *       at or past {@link #timeoutMillis()} is only logged, the fan-out has already reported it
 *       as a timeout</li>
 * </ul>
 *
 * <p><b>Subclass Responsibilities:</b>
 * <ul>
 *   <li>{@link #doExtract(ExtractionRequest)} - call the external service and parse its reply,
 *       throwing {@link ExtractionException} with the right kind on failure</li>
 *   <li>{@link #source()}, {@link #name()}, {@link #timeout()}, {@link #isAvailable()}</li>
 * </ul>
 *
 * @since 1.0
 * @see com.phillippitts.poseidon.service.extraction.vision.VisionModelBackend
 * @see com.phillippitts.poseidon.service.extraction.ocr.OpticalTextBackend
 * @see com.phillippitts.poseidon.service.extraction.direct.DirectApiBackend
 */
public abstract class AbstractExtractionBackend implements ExtractionBackend {

    private static final Logger LOG = LogManager.getLogger(AbstractExtractionBackend.class);

    private final ApplicationEventPublisher publisher;

    /**
     * @param publisher Spring event publisher for failure events (may be null in tests)
     */
    protected AbstractExtractionBackend(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public final CandidateResult extract(ExtractionRequest request) {
        long t0 = System.nanoTime();
        if (!isAvailable()) {
            return fail(FailureKind.BACKEND_UNAVAILABLE, name() + " is disabled or has no credentials", null, t0);
        }
        if (request == null || !supports(request)) {
            return fail(FailureKind.BACKEND_UNAVAILABLE, name() + " cannot handle this request", null, t0);
        }
        try {
            ForecastSample sample = doExtract(request);
            if (sample == null || sample.isEmpty()) {
                return fail(FailureKind.MALFORMED_OUTPUT, name() + " recovered no forecast fields", null, t0);
            }
            long ms = TimeUtils.elapsedMillis(t0);
            LOG.debug("{} produced a candidate in {} ms", name(), ms);
            return CandidateResult.success(sample.withProvenance(source()), ms);
        } catch (ExtractionException e) {
            return fail(e.getKind(), e.getMessage(), e, t0);
        } catch (RuntimeException | LinkageError e) {
            LOG.error("{} unexpected error", name(), e);
            return fail(FailureKind.BACKEND_UNAVAILABLE, name() + " failed: " + e.getMessage(), e, t0);
        }
    }

    /**
     * Backend-specific extraction.
     *
     * <p><b>Contract:</b>
     * <ul>
     *   <li>Only called when {@link #isAvailable()} and {@link #supports(ExtractionRequest)} hold</li>
     *   <li>Throws {@link ExtractionException} with a {@link FailureKind} on failure</li>
     *   <li>May return a sample with implausible values; sanitizing happens during reconciliation</li>
     * </ul>
     *
     * @param request image and/or coordinates plus date
     * @return parsed sample (provenance is overwritten with {@link #source()})
     */
    protected abstract ForecastSample doExtract(ExtractionRequest request);

    private CandidateResult fail(FailureKind kind, String message, Throwable cause, long t0) {
        long ms = TimeUtils.elapsedMillis(t0);
        if (ms >= timeoutMillis()) {
            LOG.debug("{} failed after its deadline ({} ms, {}): {}", name(), ms, kind, message);
            return CandidateResult.failure(source(), kind, message, ms);
        }
        LOG.warn("{} failed after {} ms ({}): {}", name(), ms, kind, message);
        BackendEventPublisher.publishFailure(
                publisher,
                name(),
                kind,
                message,
                cause,
                Map.of("durationMs", String.valueOf(ms))
        );
        return CandidateResult.failure(source(), kind, message, ms);
    }
}
