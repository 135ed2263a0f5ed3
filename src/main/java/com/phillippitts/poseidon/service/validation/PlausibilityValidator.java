package com.phillippitts.poseidon.service.validation;

import com.phillippitts.poseidon.config.properties.PlausibilityProperties;
import com.phillippitts.poseidon.domain.FieldKind;
import com.phillippitts.poseidon.domain.TideExtreme;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Checks extracted forecast fields against domain-plausible ranges.
 *
 * <p>An empty field is "absent", which is not the same as invalid: callers use
 * {@link #validate(FieldKind, List)} only to decide whether a <em>populated</em> field may be kept.
 * A single out-of-range value disqualifies the whole field.
 *
 * <p>Tide extremes are checked only for internal consistency: non-negative heights and distinct
 * times of day.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class PlausibilityValidator {

    private final PlausibilityProperties props;

    public PlausibilityValidator(PlausibilityProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Validates a numeric series.
     *
     * @param field numeric field kind (not {@link FieldKind#TIDE_EXTREMES})
     * @param values values to check (may be null)
     * @return true only if the series is non-empty and every value lies within the field's inclusive range
     * @throws IllegalArgumentException for {@link FieldKind#TIDE_EXTREMES}
     */
    public boolean validate(FieldKind field, List<Double> values) {
        PlausibilityProperties.Range range = props.rangeFor(field);
        if (values == null || values.isEmpty()) {
            return false;
        }
        for (Double value : values) {
            if (value == null || !range.contains(value)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true if the value lies within the field's inclusive range
     */
    public boolean isWithinRange(FieldKind field, double value) {
        return props.rangeFor(field).contains(value);
    }

    /**
     * Validates tide extremes for internal consistency.
     *
     * @param extremes tide extremes (may be null)
     * @return true only if non-empty, every height is finite and &gt;= 0, and no time of day repeats
     */
    public boolean validateTides(List<TideExtreme> extremes) {
        if (extremes == null || extremes.isEmpty()) {
            return false;
        }
        Set<LocalTime> seen = new HashSet<>();
        for (TideExtreme extreme : extremes) {
            if (!Double.isFinite(extreme.height()) || extreme.height() < 0.0) {
                return false;
            }
            if (!seen.add(extreme.time())) {
                return false;
            }
        }
        return true;
    }
}
