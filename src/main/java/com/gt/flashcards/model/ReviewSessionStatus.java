package com.gt.flashcards.model;

import java.util.List;

public record ReviewSessionStatus(String sessionId,
                                  ReviewPhase phase,
                                  int position,
                                  int totalCards,
                                  int reviewedCount,
                                  String cardId,
                                  String question,
                                  String answer,
                                  List<ReviewRating> ratings) { }
