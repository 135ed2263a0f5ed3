/**
 * Extraction backends: independent, individually unreliable sources of forecast data.
 *
 * <p>Every backend implements {@link com.phillippitts.poseidon.service.extraction.ExtractionBackend}
 * and, through {@link com.phillippitts.poseidon.service.extraction.AbstractExtractionBackend},
 * returns failures as values instead of throwing.
 *
 * @since 1.0
 */
package com.phillippitts.poseidon.service.extraction;
