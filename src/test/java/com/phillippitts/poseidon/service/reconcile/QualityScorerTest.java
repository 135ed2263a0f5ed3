package com.phillippitts.poseidon.service.reconcile;

import com.phillippitts.poseidon.config.properties.ReconciliationProperties;
import com.phillippitts.poseidon.domain.ForecastSample;
import com.phillippitts.poseidon.domain.Provenance;
import com.phillippitts.poseidon.domain.TideExtreme;
import com.phillippitts.poseidon.testutil.Samples;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QualityScorerTest {

    private final QualityScorer scorer = new QualityScorer(ReconciliationProperties.defaults());

    @Test
    void completeTypicalSampleScoresHundred() {
        assertThat(scorer.score(Samples.complete(Provenance.VISION_MODEL))).isEqualTo(100);
    }

    @Test
    void emptySampleScoresZero() {
        assertThat(scorer.score(ForecastSample.empty(Provenance.OPTICAL_TEXT))).isZero();
    }

    @Test
    void wavePowerDoesNotScore() {
        ForecastSample s = ForecastSample.builder(Provenance.OPTICAL_TEXT).wavePowers(300.0).build();

        assertThat(scorer.score(s)).isZero();
    }

    @Test
    void typicalBonusOnlyBelowThreshold() {
        ForecastSample typical = ForecastSample.builder(Provenance.VISION_MODEL).waveHeights(1.0, 5.0).build();
        ForecastSample big = ForecastSample.builder(Provenance.VISION_MODEL).waveHeights(1.0, 5.5).build();

        assertThat(scorer.score(typical)).isEqualTo(30);
        assertThat(scorer.score(big)).isEqualTo(20);
    }

    @Test
    void tidesNeedBothKinds() {
        ForecastSample onlyHighs = ForecastSample.builder(Provenance.DIRECT_API)
                .tide(TideExtreme.high(LocalTime.of(3, 0), 2.0))
                .tide(TideExtreme.high(LocalTime.of(15, 20), 2.1))
                .build();
        ForecastSample both = ForecastSample.builder(Provenance.DIRECT_API)
                .tide(TideExtreme.high(LocalTime.of(3, 0), 2.0))
                .tide(TideExtreme.low(LocalTime.of(9, 10), 0.2))
                .build();

        assertThat(scorer.score(onlyHighs)).isZero();
        assertThat(scorer.score(both)).isEqualTo(20);
        assertThat(QualityScorer.hasHighAndLow(List.of())).isFalse();
    }

    @Test
    void weightsAreConfigurable() {
        QualityScorer custom = new QualityScorer(
                new ReconciliationProperties(5, 50, 0, null, null, null));
        ForecastSample s = ForecastSample.builder(Provenance.VISION_MODEL)
                .waveHeights(1.0)
                .tide(TideExtreme.high(LocalTime.of(3, 0), 2.0))
                .tide(TideExtreme.low(LocalTime.of(9, 10), 0.2))
                .build();

        assertThat(custom.score(s)).isEqualTo(55);
    }
}
