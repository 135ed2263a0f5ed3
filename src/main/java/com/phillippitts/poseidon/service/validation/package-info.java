/**
 * Plausibility validation for extracted forecast data.
 *
 * <p>{@link com.phillippitts.poseidon.service.validation.PlausibilityValidator} rejects garbled
 * extraction output field by field. Ranges come from
 * {@link com.phillippitts.poseidon.config.properties.PlausibilityProperties}
 * ({@code poseidon.plausibility.*}).
 *
 * @since 1.0
 */
package com.phillippitts.poseidon.service.validation;
