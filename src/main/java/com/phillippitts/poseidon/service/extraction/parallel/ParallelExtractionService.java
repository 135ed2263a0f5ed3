package com.phillippitts.poseidon.service.extraction.parallel;

import com.phillippitts.poseidon.domain.CandidateResult;
import com.phillippitts.poseidon.service.extraction.ExtractionRequest;

import java.util.List;

/**
 * Runs every applicable extraction backend in parallel and returns all their results.
 * Implementations must be hermetic-test friendly.
 */
public interface ParallelExtractionService {

    /**
     * Invokes the applicable backends concurrently, each bounded by its own timeout, and
     * returns once every one of them has resolved.
     *
     * @param request image and/or coordinates plus date
     * @return one result per invoked backend (a late backend yields a TIMEOUT failure); never null
     */
    List<CandidateResult> extractAll(ExtractionRequest request);
}
