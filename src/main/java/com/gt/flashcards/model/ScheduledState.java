package com.gt.flashcards.model;

import java.time.LocalDate;

public record ScheduledState(int interval, double easeFactor, LocalDate nextReviewDate) { }
