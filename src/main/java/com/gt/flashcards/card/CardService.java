package com.gt.flashcards.card;

import com.gt.flashcards.exception.CardNotFoundException;
import com.gt.flashcards.exception.InvalidInputException;
import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.CardChange;
import com.gt.flashcards.model.CardChangeType;
import com.gt.flashcards.model.CardReviewUpdate;
import com.gt.flashcards.model.SchedulingState;
import com.gt.flashcards.scheduler.CardScheduler;
import com.gt.flashcards.scheduler.DueQueueBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

@Component
public class CardService {

    private static final Logger log = LoggerFactory.getLogger(CardService.class);

    private final CardDao cardDao;
    private final CardChangeNotifier cardChangeNotifier;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock scheduleClock;

    @Autowired
    public CardService(CardDao cardDao,
                       CardChangeNotifier cardChangeNotifier,
                       ApplicationEventPublisher eventPublisher,
                       Clock scheduleClock) {
        this.cardDao = cardDao;
        this.cardChangeNotifier = cardChangeNotifier;
        this.eventPublisher = eventPublisher;
        this.scheduleClock = scheduleClock;
    }

    public Card createCard(String owner, String question, String answer) {
        if (question == null || question.isBlank() || answer == null || answer.isBlank()) {
            throw new InvalidInputException("Question and answer cannot be empty");
        }

        SchedulingState initialState = CardScheduler.initialState();
        Card card = new Card(
                UUID.randomUUID().toString(),
                owner,
                question,
                answer,
                initialState.interval(),
                initialState.easeFactor(),
                null,
                LocalDate.now(scheduleClock),
                Instant.now(scheduleClock));

        cardDao.createCard(card);
        log.info("Created card {} for {}", card.id(), owner);

        publishChange(owner, card.id(), CardChangeType.Created);
        return card;
    }

    public Card getCard(String owner, String cardId) {
        Card card = cardDao.loadCard(cardId, owner);
        if (card == null) {
            throw new CardNotFoundException("Card " + cardId + " does not exist");
        }

        return card;
    }

    public List<Card> loadAllCards(String owner) {
        return cardDao.loadAllCards(owner);
    }

    public List<Card> getDueCards(String owner) {
        return DueQueueBuilder.buildDueQueue(loadAllCards(owner), LocalDate.now(scheduleClock));
    }

    public int countDueCards(String owner) {
        return DueQueueBuilder.countDue(loadAllCards(owner), LocalDate.now(scheduleClock));
    }

    public void updateCardReview(String owner, String cardId, CardReviewUpdate cardReviewUpdate) {
        if (cardDao.updateCardReview(cardId, owner, cardReviewUpdate) == 0) {
            throw new CardNotFoundException("Card " + cardId + " does not exist");
        }

        publishChange(owner, cardId, CardChangeType.Updated);
    }

    public void deleteCard(String owner, String cardId) {
        if (cardDao.deleteCard(cardId, owner) == 0) {
            throw new CardNotFoundException("Card " + cardId + " does not exist");
        }
        log.info("Deleted card {} for {}", cardId, owner);

        publishChange(owner, cardId, CardChangeType.Deleted);
    }

    // Returns a handle that cancels the subscription.
    public Runnable subscribe(String owner, Consumer<CardChange> listener) {
        return cardChangeNotifier.subscribe(owner, listener);
    }

    private void publishChange(String owner, String cardId, CardChangeType changeType) {
        eventPublisher.publishEvent(new CardChangedEvent(this, owner, new CardChange(cardId, changeType)));
    }
}
