package com.phillippitts.poseidon.service.conversation;

import com.phillippitts.poseidon.domain.ForecastSample;

import java.time.LocalDate;

/**
 * Presentation collaborator: turns a finished dataset into user-facing text.
 */
public interface ReportConsumer {

    /**
     * @param sample   reconciled dataset; any sequence may be empty or shorter than ten slots
     * @param spotName spot as the user wrote it
     * @param date     forecast date
     * @return text to send to the user
     */
    String present(ForecastSample sample, String spotName, LocalDate date);
}
