package com.gt.flashcards.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.flashcards.serialization.ReviewRatingSerializer;

import java.util.List;

// The recall ratings offered after an answer is revealed. Any quality in 0..5 is accepted when rating a card;
// 1 and 3 are valid but have no named button.
@JsonSerialize(using = ReviewRatingSerializer.class, as = Integer.class)
public enum ReviewRating {
    Again(0),
    Hard(2),
    Good(4),
    Easy(5);

    public static final List<ReviewRating> ALL_RATINGS = List.of(values());

    private final int quality;

    ReviewRating(int quality) {
        this.quality = quality;
    }

    public int getQuality() {
        return quality;
    }
}
