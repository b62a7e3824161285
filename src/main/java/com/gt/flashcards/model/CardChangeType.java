package com.gt.flashcards.model;

public enum CardChangeType {
    Created,
    Updated,
    Deleted
}
