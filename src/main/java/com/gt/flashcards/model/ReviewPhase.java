package com.gt.flashcards.model;

public enum ReviewPhase {
    Idle,
    Presenting,
    AwaitingRating,
    Complete
}
