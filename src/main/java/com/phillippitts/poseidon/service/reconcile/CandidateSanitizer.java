package com.phillippitts.poseidon.service.reconcile;

import com.phillippitts.poseidon.domain.FieldKind;
import com.phillippitts.poseidon.domain.ForecastSample;
import com.phillippitts.poseidon.service.validation.PlausibilityValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Clears implausible fields from a candidate, one field at a time.
 *
 * <p>A single out-of-range value disqualifies its whole field in that candidate; the other
 * fields of the candidate are kept.
 */
@Component
public class CandidateSanitizer {

    private static final Logger LOG = LogManager.getLogger(CandidateSanitizer.class);

    private final PlausibilityValidator validator;

    public CandidateSanitizer(PlausibilityValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * @param candidate raw candidate from a backend
     * @return copy whose populated fields all pass validation
     */
    public ForecastSample sanitize(ForecastSample candidate) {
        ForecastSample out = candidate;
        for (FieldKind field : FieldKind.values()) {
            if (!out.has(field)) {
                continue;
            }
            boolean valid = field.isNumericSeries()
                    ? validator.validate(field, out.series(field))
                    : validator.validateTides(out.tideExtremes());
            if (!valid) {
                LOG.debug("Clearing implausible {} from {} candidate", field, candidate.provenance());
                out = out.without(field);
            }
        }
        return out;
    }
}
