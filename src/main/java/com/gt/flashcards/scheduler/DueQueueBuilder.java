package com.gt.flashcards.scheduler;

import com.gt.flashcards.model.Card;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

// Builds the review queue from a snapshot of cards. Never modifies the cards it is given.
public final class DueQueueBuilder {

    private static final Comparator<Card> DUE_ORDER = Comparator
            .comparing(Card::nextReviewDate)
            .thenComparing(Card::id);

    private DueQueueBuilder() { }

    public static List<Card> buildDueQueue(Collection<Card> allCards, LocalDate asOf) {
        return allCards.stream()
                .filter(card -> isDue(card, asOf))
                .sorted(DUE_ORDER)
                .toList();
    }

    public static int countDue(Collection<Card> allCards, LocalDate asOf) {
        return (int) allCards.stream().filter(card -> isDue(card, asOf)).count();
    }

    public static boolean isDue(Card card, LocalDate asOf) {
        return !card.nextReviewDate().isAfter(asOf);
    }
}
