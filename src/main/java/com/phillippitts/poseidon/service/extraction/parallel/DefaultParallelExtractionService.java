package com.phillippitts.poseidon.service.extraction.parallel;

import com.phillippitts.poseidon.config.properties.ReconciliationProperties;
import com.phillippitts.poseidon.config.properties.ReconciliationProperties.OcrMode;
import com.phillippitts.poseidon.domain.CandidateResult;
import com.phillippitts.poseidon.domain.FailureKind;
import com.phillippitts.poseidon.domain.Provenance;
import com.phillippitts.poseidon.service.extraction.ExtractionBackend;
import com.phillippitts.poseidon.service.extraction.ExtractionRequest;
import com.phillippitts.poseidon.service.extraction.util.BackendEventPublisher;
import com.phillippitts.poseidon.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of the parallel extraction fan-out.
 *
 * <p>Key features:
 * <ul>
 *   <li><b>Parallel Execution:</b> every applicable backend runs on {@code extractionExecutor}</li>
 *   <li><b>Per-backend Timeout:</b> each future is completed with a
 *       {@link FailureKind#TIMEOUT} failure at that backend's own deadline, so total latency
 *       is bounded by the largest timeout rather than the sum</li>
 *   <li><b>Isolation:</b> a failing backend never affects another backend's result</li>
 *   <li><b>OCR Selection:</b> the optical text backend runs only when the vision backend cannot
 *       ({@link OcrMode#FALLBACK}) unless configured to always run</li>
 * </ul>
 *
 * <p><b>Thread Model:</b> the calling thread blocks until all futures resolve but never runs a
 * backend itself. Each deadline is armed before the task is submitted; when the executor is
 * saturated the backend fails with {@link FailureKind#BACKEND_UNAVAILABLE} instead of queueing
 * behind the others. A backend that overruns its deadline keeps its worker thread until its
 * own HTTP timeout fires; its late answer is discarded and only the TIMEOUT failure is reported.
 *
 * @see ParallelExtractionService
 * @see com.phillippitts.poseidon.service.reconcile.ReconciliationEngine
 */
@Service
public class DefaultParallelExtractionService implements ParallelExtractionService {
    private static final Logger LOG = LogManager.getLogger(DefaultParallelExtractionService.class);

    private final List<ExtractionBackend> backends;
    private final Executor executor;
    private final ReconciliationProperties properties;
    private final ApplicationEventPublisher publisher;

    /**
     * @param backends   all extraction backends in the context
     * @param executor   bounded thread pool for the fan-out (qualified as "extractionExecutor")
     * @param properties reconciliation settings (OCR mode)
     * @param publisher  event publisher for timeout failures (may be null in tests)
     */
    public DefaultParallelExtractionService(List<ExtractionBackend> backends,
                                            @Qualifier("extractionExecutor") Executor executor,
                                            ReconciliationProperties properties,
                                            ApplicationEventPublisher publisher) {
        this.backends = List.copyOf(Objects.requireNonNull(backends, "backends"));
        this.executor = Objects.requireNonNull(executor, "executor");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.publisher = publisher;
    }

    @Override
    public List<CandidateResult> extractAll(ExtractionRequest request) {
        Objects.requireNonNull(request, "request");
        List<ExtractionBackend> selected = select(request);
        if (selected.isEmpty()) {
            LOG.warn("No extraction backend applies to this request (image={}, coordinates={})",
                    request.hasImage(), request.hasCoordinates());
            return List.of();
        }

        long t0 = System.nanoTime();
        List<CompletableFuture<CandidateResult>> futures = new ArrayList<>(selected.size());
        for (ExtractionBackend backend : selected) {
            futures.add(launch(backend, request));
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        List<CandidateResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<CandidateResult> f : futures) {
            results.add(f.join());
        }
        LOG.info("Fan-out to {} backend(s) resolved in {} ms ({} succeeded)",
                selected.size(), TimeUtils.elapsedMillis(t0),
                results.stream().filter(CandidateResult::isSuccess).count());
        return results;
    }

    /**
     * Chooses the backends for this request.
     */
    List<ExtractionBackend> select(ExtractionRequest request) {
        boolean visionUsable = backends.stream()
                .anyMatch(b -> b.source() == Provenance.VISION_MODEL && b.isAvailable() && b.supports(request));
        List<ExtractionBackend> selected = new ArrayList<>();
        for (ExtractionBackend backend : backends) {
            if (!backend.supports(request)) {
                continue;
            }
            if (backend.source() == Provenance.OPTICAL_TEXT
                    && properties.getOcrMode() == OcrMode.FALLBACK
                    && visionUsable) {
                continue;
            }
            selected.add(backend);
        }
        return selected;
    }

    private CompletableFuture<CandidateResult> launch(ExtractionBackend backend, ExtractionRequest request) {
        long timeoutMs = backend.timeoutMillis();
        long t0 = System.nanoTime();
        CompletableFuture<CandidateResult> answer = new CompletableFuture<>();
        CompletableFuture<CandidateResult> bounded = answer
                .completeOnTimeout(null, timeoutMs, TimeUnit.MILLISECONDS)
                .thenApply(result -> result != null ? result : timedOut(backend, timeoutMs));
        try {
            executor.execute(() -> answer.complete(run(backend, request, timeoutMs, t0)));
        } catch (RejectedExecutionException e) {
            answer.complete(rejected(backend, TimeUtils.elapsedMillis(t0)));
        }
        return bounded;
    }

    // null means "late": the deadline path reports it as TIMEOUT exactly once
    private CandidateResult run(ExtractionBackend backend, ExtractionRequest request, long timeoutMs, long t0) {
        CandidateResult result;
        try {
            result = backend.extract(request);
        } catch (RuntimeException | LinkageError ex) {
            LOG.error("{} escaped its failure contract", backend.name(), ex);
            result = CandidateResult.failure(backend.source(), FailureKind.BACKEND_UNAVAILABLE,
                    String.valueOf(ex.getMessage()), TimeUtils.elapsedMillis(t0));
        }
        return TimeUtils.elapsedMillis(t0) >= timeoutMs ? null : result;
    }

    private CandidateResult rejected(ExtractionBackend backend, long elapsedMs) {
        String message = backend.name() + " not started, extraction pool saturated";
        LOG.warn(message);
        BackendEventPublisher.publishFailure(publisher, backend.name(), FailureKind.BACKEND_UNAVAILABLE,
                message, null);
        return CandidateResult.failure(backend.source(), FailureKind.BACKEND_UNAVAILABLE, message, elapsedMs);
    }

    private CandidateResult timedOut(ExtractionBackend backend, long timeoutMs) {
        String message = backend.name() + " did not answer within " + timeoutMs + " ms";
        LOG.warn(message);
        BackendEventPublisher.publishFailure(publisher, backend.name(), FailureKind.TIMEOUT, message, null);
        return CandidateResult.failure(backend.source(), FailureKind.TIMEOUT, message, timeoutMs);
    }
}
