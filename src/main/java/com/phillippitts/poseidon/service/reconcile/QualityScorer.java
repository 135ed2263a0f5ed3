package com.phillippitts.poseidon.service.reconcile;

import com.phillippitts.poseidon.config.properties.ReconciliationProperties;
import com.phillippitts.poseidon.domain.FieldKind;
import com.phillippitts.poseidon.domain.ForecastSample;
import com.phillippitts.poseidon.domain.TideExtreme;
import com.phillippitts.poseidon.domain.TideKind;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Scores a sanitized candidate by completeness and typicality.
 *
 * <p>With default weights:
 * <ul>
 *   <li>+20 each for populated wave heights, wave periods and wind speeds</li>
 *   <li>+20 if the tide extremes contain at least one high and one low</li>
 *   <li>+10 if the largest wave height is at most 5.0 m</li>
 *   <li>+10 if the largest wave period is at most 20 s</li>
 * </ul>
 * The maximum is 100. Wave power does not score; it is only gap-filled.
 *
 * <p>Input must already be sanitized: populated means valid here.
 */
@Component
public class QualityScorer {

    private static final List<FieldKind> SCORED_FIELDS =
            List.of(FieldKind.WAVE_HEIGHT, FieldKind.WAVE_PERIOD, FieldKind.WIND_SPEED);

    private final ReconciliationProperties props;

    public QualityScorer(ReconciliationProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    public int score(ForecastSample sample) {
        int score = 0;
        for (FieldKind field : SCORED_FIELDS) {
            if (sample.has(field)) {
                score += props.getFieldWeight();
            }
        }
        if (hasHighAndLow(sample.tideExtremes())) {
            score += props.getTideWeight();
        }
        if (sample.has(FieldKind.WAVE_HEIGHT)
                && Collections.max(sample.waveHeights()) <= props.getTypicalMaxWaveHeight()) {
            score += props.getTypicalBonus();
        }
        if (sample.has(FieldKind.WAVE_PERIOD)
                && Collections.max(sample.wavePeriods()) <= props.getTypicalMaxWavePeriod()) {
            score += props.getTypicalBonus();
        }
        return score;
    }

    static boolean hasHighAndLow(List<TideExtreme> tides) {
        boolean high = false;
        boolean low = false;
        for (TideExtreme t : tides) {
            high |= t.kind() == TideKind.HIGH;
            low |= t.kind() == TideKind.LOW;
        }
        return high && low;
    }
}
