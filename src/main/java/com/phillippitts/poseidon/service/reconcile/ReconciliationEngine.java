package com.phillippitts.poseidon.service.reconcile;

import com.phillippitts.poseidon.domain.Coordinates;
import com.phillippitts.poseidon.domain.ForecastSample;

import java.time.LocalDate;

/**
 * Combines the candidates of every extraction backend into one plausibility-checked dataset.
 *
 * <p><b>Contract:</b> never throws and never returns null. When every backend fails or
 * produces only implausible data, a {@link com.phillippitts.poseidon.domain.Provenance#SYNTHETIC}
 * sample is returned instead.
 *
 * <p><b>Thread Safety:</b> Implementations must be stateless and thread-safe; many
 * conversations reconcile concurrently.
 *
 * @see DefaultReconciliationEngine
 */
public interface ReconciliationEngine {

    /**
     * @param image forecast screenshot (may be null)
     * @param spot  spot coordinates (may be null)
     * @param date  forecast date
     * @return reconciled sample; every populated field passes plausibility validation
     */
    ForecastSample reconcile(byte[] image, Coordinates spot, LocalDate date);
}
