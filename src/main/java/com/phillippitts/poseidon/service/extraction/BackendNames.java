package com.phillippitts.poseidon.service.extraction;

import com.phillippitts.poseidon.domain.Provenance;

/**
 * Centralized constants for extraction backend identifiers used in logs, metrics and events.
 *
 * @since 1.0
 */
public final class BackendNames {

    /** Vision-capable generative model reading the forecast screenshot. */
    public static final String VISION = "vision";

    /** Tesseract OCR over an enhanced copy of the screenshot. */
    public static final String OCR = "ocr";

    /** Numeric marine forecast API queried by spot coordinates. */
    public static final String DIRECT_API = "direct-api";

    /** Name used for reconciled output in metrics. */
    public static final String RECONCILED = "reconciled";

    private BackendNames() {
        // Utility class - prevent instantiation
    }

    /**
     * Maps a provenance to the backend name used in logs and metrics.
     */
    public static String of(Provenance provenance) {
        return switch (provenance) {
            case VISION_MODEL -> VISION;
            case OPTICAL_TEXT -> OCR;
            case DIRECT_API -> DIRECT_API;
            case SYNTHETIC -> "synthetic";
            case MERGED -> RECONCILED;
        };
    }
}
