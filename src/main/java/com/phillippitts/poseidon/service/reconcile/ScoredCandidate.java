package com.phillippitts.poseidon.service.reconcile;

import com.phillippitts.poseidon.domain.ForecastSample;
import com.phillippitts.poseidon.domain.Provenance;

import java.util.Comparator;

/**
 * A sanitized candidate with its quality score.
 *
 * @param sample sanitized candidate
 * @param score  0..100
 */
public record ScoredCandidate(ForecastSample sample, int score) {

    /**
     * Best first: higher score, then backend priority vision model, direct API, optical text.
     */
    public static final Comparator<ScoredCandidate> BEST_FIRST =
            Comparator.comparingInt(ScoredCandidate::score).reversed()
                    .thenComparingInt(c -> priority(c.sample().provenance()));

    static int priority(Provenance provenance) {
        return switch (provenance) {
            case VISION_MODEL -> 0;
            case DIRECT_API -> 1;
            case OPTICAL_TEXT -> 2;
            case MERGED, SYNTHETIC -> 3;
        };
    }
}
