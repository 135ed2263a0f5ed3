package com.phillippitts.poseidon.config.reconcile;

import com.phillippitts.poseidon.config.properties.PlausibilityProperties;
import com.phillippitts.poseidon.service.extraction.parallel.ParallelExtractionService;
import com.phillippitts.poseidon.service.metrics.ReconciliationMetrics;
import com.phillippitts.poseidon.service.reconcile.CandidateSanitizer;
import com.phillippitts.poseidon.service.reconcile.DefaultReconciliationEngine;
import com.phillippitts.poseidon.service.reconcile.QualityScorer;
import com.phillippitts.poseidon.service.reconcile.ReconciliationEngine;
import com.phillippitts.poseidon.service.reconcile.SyntheticProfiles;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.random.RandomGenerator;

@Configuration
public class ReconciliationConfig {

    @Bean
    public RandomGenerator syntheticRandom() {
        return RandomGenerator.getDefault();
    }

    @Bean
    public SyntheticProfiles syntheticProfiles(RandomGenerator syntheticRandom, PlausibilityProperties ranges) {
        return new SyntheticProfiles(syntheticRandom, ranges);
    }

    @Bean
    public ReconciliationEngine reconciliationEngine(ParallelExtractionService parallel,
                                                     CandidateSanitizer sanitizer,
                                                     QualityScorer scorer,
                                                     SyntheticProfiles syntheticProfiles,
                                                     ReconciliationMetrics metrics) {
        return new DefaultReconciliationEngine(parallel, sanitizer, scorer, syntheticProfiles, metrics);
    }
}
