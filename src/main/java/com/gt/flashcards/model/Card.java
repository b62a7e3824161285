package com.gt.flashcards.model;

import java.time.Instant;
import java.time.LocalDate;

public record Card(String id,
                   String owner,
                   String question,
                   String answer,
                   int interval,
                   double easeFactor,
                   Instant lastReviewDate,
                   LocalDate nextReviewDate,
                   Instant createdAt) {

    public SchedulingState schedulingState() {
        return new SchedulingState(interval, easeFactor);
    }
}
