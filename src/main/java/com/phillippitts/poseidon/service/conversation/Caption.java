package com.phillippitts.poseidon.service.conversation;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Parsed image caption.
 *
 * @param spotName first caption token, empty if the caption was blank
 * @param date     second caption token as a date, or today
 */
public record Caption(String spotName, LocalDate date) {

    public Caption {
        spotName = spotName == null ? "" : spotName;
        Objects.requireNonNull(date, "date");
    }
}
