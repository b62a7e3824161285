package com.gt.flashcards.model;

import java.time.Instant;
import java.time.LocalDate;

// Fields written back to the store after a review. Question, answer and creation time are never part of an update.
public record CardReviewUpdate(int interval,
                               double easeFactor,
                               LocalDate nextReviewDate,
                               Instant lastReviewDate) {

    public static CardReviewUpdate fromScheduledState(ScheduledState scheduledState, Instant reviewInstant) {
        return new CardReviewUpdate(scheduledState.interval(), scheduledState.easeFactor(), scheduledState.nextReviewDate(), reviewInstant);
    }
}
