package com.gt.flashcards.model;

public record CardChange(String cardId, CardChangeType changeType) { }
