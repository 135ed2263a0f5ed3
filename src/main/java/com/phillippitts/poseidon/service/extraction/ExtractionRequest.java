package com.phillippitts.poseidon.service.extraction;

import com.phillippitts.poseidon.domain.Coordinates;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Input for one extraction backend call.
 *
 * @param image       forecast screenshot bytes (may be null when only the API can be queried)
 * @param coordinates spot coordinates (may be null when only the image is known)
 * @param date        forecast date
 */
public record ExtractionRequest(byte[] image, Coordinates coordinates, LocalDate date) {

    public ExtractionRequest {
        Objects.requireNonNull(date, "date");
    }

    public boolean hasImage() {
        return image != null && image.length > 0;
    }

    public boolean hasCoordinates() {
        return coordinates != null;
    }
}
