package com.gt.flashcards.model;

public record SchedulingState(int interval, double easeFactor) { }
