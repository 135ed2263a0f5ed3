package com.phillippitts.poseidon.domain;

/**
 * Records which source (or combination of sources) produced a {@link ForecastSample}.
 */
public enum Provenance {
    VISION_MODEL,
    OPTICAL_TEXT,
    DIRECT_API,
    SYNTHETIC,
    MERGED
}
