package com.gt.flashcards.review;

import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.CardReviewUpdate;

// Writes a review result to the card store, returning only once the store has accepted or rejected it.
@FunctionalInterface
public interface CardReviewPersister {

    void persist(Card card, CardReviewUpdate cardReviewUpdate);
}
