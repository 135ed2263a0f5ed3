package com.phillippitts.poseidon.service.reconcile;

import com.phillippitts.poseidon.domain.CandidateResult;
import com.phillippitts.poseidon.domain.Coordinates;
import com.phillippitts.poseidon.domain.FieldKind;
import com.phillippitts.poseidon.domain.ForecastSample;
import com.phillippitts.poseidon.domain.Provenance;
import com.phillippitts.poseidon.service.extraction.BackendNames;
import com.phillippitts.poseidon.service.extraction.ExtractionRequest;
import com.phillippitts.poseidon.service.extraction.parallel.ParallelExtractionService;
import com.phillippitts.poseidon.service.metrics.ReconciliationMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default implementation of {@link ReconciliationEngine}.
 *
 * <p><b>Reconciliation Process:</b>
 * <ol>
 *   <li>Run every applicable backend in parallel via {@link ParallelExtractionService} and wait
 *       until all have resolved</li>
 *   <li>Discard failures; sanitize each surviving candidate field by field</li>
 *   <li>Score survivors with {@link QualityScorer}; ties go to the higher-priority backend</li>
 *   <li>Take the best as base and gap-fill each empty field from the next candidate, in ranked
 *       order, that has it</li>
 *   <li>Without any survivor, return a {@link SyntheticProfiles} sample</li>
 * </ol>
 *
 * @since 1.0
 */
public final class DefaultReconciliationEngine implements ReconciliationEngine {

    private static final Logger LOG = LogManager.getLogger(DefaultReconciliationEngine.class);

    private final ParallelExtractionService parallel;
    private final CandidateSanitizer sanitizer;
    private final QualityScorer scorer;
    private final SyntheticProfiles synthetic;
    private final ReconciliationMetrics metrics;

    /**
     * @param parallel  fan-out over the extraction backends
     * @param sanitizer per-field plausibility filter
     * @param scorer    candidate quality score
     * @param synthetic fallback profiles
     * @param metrics   metrics sink (may be null in tests)
     */
    public DefaultReconciliationEngine(ParallelExtractionService parallel,
                                       CandidateSanitizer sanitizer,
                                       QualityScorer scorer,
                                       SyntheticProfiles synthetic,
                                       ReconciliationMetrics metrics) {
        this.parallel = Objects.requireNonNull(parallel, "parallel must not be null");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.synthetic = Objects.requireNonNull(synthetic, "synthetic must not be null");
        this.metrics = metrics;
    }

    @Override
    public ForecastSample reconcile(byte[] image, Coordinates spot, LocalDate date) {
        List<CandidateResult> results;
        try {
            results = parallel.extractAll(new ExtractionRequest(image, spot, date));
        } catch (RuntimeException e) {
            // Fan-out is itself failure-isolated; anything escaping it still must not reach the caller
            LOG.error("Extraction fan-out failed, falling back to synthetic data", e);
            results = List.of();
        }
        return merge(results);
    }

    /**
     * Merges already collected backend results. Steps 2 to 5 of the process above.
     *
     * @param results one result per backend (failures included)
     * @return reconciled sample; never null
     */
    public ForecastSample merge(List<CandidateResult> results) {
        List<ScoredCandidate> ranked = rank(results);
        if (ranked.isEmpty()) {
            ForecastSample fallback = synthetic.next();
            LOG.warn("No usable candidate from {} backend result(s); returning synthetic profile", results.size());
            record(fallback.provenance(), 0);
            return fallback;
        }

        ScoredCandidate base = ranked.get(0);
        ForecastSample merged = base.sample();
        boolean filled = false;
        for (FieldKind field : FieldKind.values()) {
            if (merged.has(field)) {
                continue;
            }
            for (int i = 1; i < ranked.size(); i++) {
                ForecastSample donor = ranked.get(i).sample();
                if (donor.has(field)) {
                    LOG.debug("Gap-filling {} from {}", field, donor.provenance());
                    merged = merged.withFieldFrom(field, donor);
                    filled = true;
                    break;
                }
            }
        }
        if (filled) {
            merged = merged.withProvenance(Provenance.MERGED);
        }
        LOG.info("Reconciled from {} candidate(s): base={} score={} provenance={}",
                ranked.size(), base.sample().provenance(), base.score(), merged.provenance());
        record(merged.provenance(), base.score());
        return merged;
    }

    /**
     * Sanitizes and scores the successful results, best first.
     */
    List<ScoredCandidate> rank(List<CandidateResult> results) {
        List<ScoredCandidate> ranked = new ArrayList<>();
        for (CandidateResult result : results) {
            if (result == null) {
                continue;
            }
            if (metrics != null) {
                metrics.recordLatency(BackendNames.of(result.source()), result.durationMs());
            }
            if (!result.isSuccess()) {
                continue;
            }
            if (metrics != null) {
                metrics.incrementSuccess(BackendNames.of(result.source()));
            }
            ForecastSample clean = sanitizer.sanitize(result.sample());
            if (clean.isEmpty()) {
                LOG.debug("{} candidate had no plausible field", result.source());
                continue;
            }
            int score = scorer.score(clean);
            LOG.debug("{} candidate scored {}", clean.provenance(), score);
            ranked.add(new ScoredCandidate(clean, score));
        }
        ranked.sort(ScoredCandidate.BEST_FIRST);
        return ranked;
    }

    private void record(Provenance provenance, int score) {
        if (metrics != null) {
            metrics.recordOutcome(provenance, score);
        }
    }
}
