package com.gt.flashcards.review;

import com.gt.flashcards.exception.CardNotFoundException;
import com.gt.flashcards.exception.IllegalSessionStateException;
import com.gt.flashcards.exception.InvalidQualityException;
import com.gt.flashcards.exception.PersistenceException;
import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.CardReviewUpdate;
import com.gt.flashcards.model.ReviewPhase;
import com.gt.flashcards.model.ReviewRating;
import com.gt.flashcards.model.ReviewSessionStatus;
import com.gt.flashcards.model.ScheduledState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Fail.fail;
import static org.junit.jupiter.api.Assertions.*;

public class ReviewSessionTests {

    private static final String TEST_USERNAME = "testUser";
    private static final Instant NOW = Instant.parse("2026-10-19T15:30:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);

    private static final Card CARD_1 = buildCard("card-1", 0, 2.5);
    private static final Card CARD_2 = buildCard("card-2", 1, 2.5);
    private static final Card CARD_3 = buildCard("card-3", 6, 2.5);

    private final List<CardReviewUpdate> persistedUpdates = new ArrayList<>();
    private final List<String> persistedCardIds = new ArrayList<>();
    private final CardReviewPersister recordingPersister = (card, cardReviewUpdate) -> {
        persistedCardIds.add(card.id());
        persistedUpdates.add(cardReviewUpdate);
    };

    private ReviewSession session;

    @BeforeEach
    public void setup() {
        persistedUpdates.clear();
        persistedCardIds.clear();

        session = new ReviewSession("session-1", TEST_USERNAME, NOW);
    }

    @Test
    public void testFullSession() {
        session.start(List.of(CARD_1, CARD_2, CARD_3), NOW);
        assertEquals(ReviewPhase.Presenting, session.getPhase());

        ScheduledState firstState = revealAndRate(ReviewRating.Good.getQuality());
        assertEquals(1, firstState.interval());
        assertEquals(TODAY.plusDays(1), firstState.nextReviewDate());
        assertEquals(ReviewPhase.Presenting, session.getPhase());
        assertEquals(1, session.getPosition());
        assertEquals(2, session.getRemainingCount());

        ScheduledState secondState = revealAndRate(ReviewRating.Good.getQuality());
        assertEquals(6, secondState.interval());

        ScheduledState thirdState = revealAndRate(ReviewRating.Again.getQuality());
        assertEquals(0, thirdState.interval());
        assertEquals(2.3, thirdState.easeFactor(), 1e-9);

        assertEquals(ReviewPhase.Complete, session.getPhase());
        assertEquals(3, session.getReviewedCount());
        assertEquals(0, session.getRemainingCount());
        assertNull(session.getCurrentCard());
        assertEquals(List.of("card-1", "card-2", "card-3"), persistedCardIds);
        assertEquals(6, persistedUpdates.get(1).interval());
        assertEquals(2.5, persistedUpdates.get(1).easeFactor(), 1e-9);
        assertEquals(TODAY.plusDays(6), persistedUpdates.get(1).nextReviewDate());
        assertEquals(NOW, persistedUpdates.get(0).lastReviewDate());
    }

    @Test
    public void testStart_EmptyQueue() {
        session.start(List.of(), NOW);

        assertEquals(ReviewPhase.Complete, session.getPhase());
        assertEquals(0, session.getStatus().totalCards());
        assertNull(session.getStatus().cardId());
    }

    @Test
    public void testStatus_AnswerHiddenUntilRevealed() {
        session.start(List.of(CARD_1), NOW);

        ReviewSessionStatus presentingStatus = session.getStatus();
        assertEquals("card-1", presentingStatus.cardId());
        assertEquals("question card-1", presentingStatus.question());
        assertNull(presentingStatus.answer());
        assertTrue(presentingStatus.ratings().isEmpty());

        session.revealAnswer(NOW);

        ReviewSessionStatus awaitingStatus = session.getStatus();
        assertEquals(ReviewPhase.AwaitingRating, awaitingStatus.phase());
        assertEquals("answer card-1", awaitingStatus.answer());
        assertEquals(ReviewRating.ALL_RATINGS, awaitingStatus.ratings());
    }

    @Test
    public void testSubmitRating_PersistFailure() {
        session.start(List.of(CARD_1, CARD_2), NOW);
        session.revealAnswer(NOW);

        assertThrows(PersistenceException.class, () -> session.submitRating(4,
                (card, cardReviewUpdate) -> { throw new PersistenceException("store unavailable"); }, TODAY, NOW));

        assertEquals(ReviewPhase.AwaitingRating, session.getPhase());
        assertEquals(0, session.getPosition());
        assertEquals(0, session.getReviewedCount());

        session.submitRating(4, recordingPersister, TODAY, NOW);
        assertEquals(ReviewPhase.Presenting, session.getPhase());
        assertEquals(1, session.getPosition());
    }

    @Test
    public void testSubmitRating_CardDeletedDuringSession() {
        session.start(List.of(CARD_1), NOW);
        session.revealAnswer(NOW);

        assertThrows(CardNotFoundException.class, () -> session.submitRating(4,
                (card, cardReviewUpdate) -> { throw new CardNotFoundException("Card " + card.id() + " does not exist"); }, TODAY, NOW));
        assertEquals(ReviewPhase.AwaitingRating, session.getPhase());

        session.abort();
        assertEquals(ReviewPhase.Idle, session.getPhase());
    }

    @Test
    public void testSubmitRating_InvalidQuality() {
        session.start(List.of(CARD_1), NOW);
        session.revealAnswer(NOW);

        assertThrows(InvalidQualityException.class, () -> session.submitRating(6, recordingPersister, TODAY, NOW));
        assertThrows(InvalidQualityException.class, () -> session.submitRating(-1, recordingPersister, TODAY, NOW));

        assertEquals(ReviewPhase.AwaitingRating, session.getPhase());
        assertTrue(persistedUpdates.isEmpty());
    }

    @Test
    public void testIllegalTransitions() {
        assertThrows(IllegalSessionStateException.class, () -> session.revealAnswer(NOW));
        assertThrows(IllegalSessionStateException.class, () -> session.submitRating(4, recordingPersister, TODAY, NOW));

        session.start(List.of(CARD_1), NOW);
        assertThrows(IllegalSessionStateException.class, () -> session.start(List.of(CARD_2), NOW));
        assertThrows(IllegalSessionStateException.class, () -> session.submitRating(4, recordingPersister, TODAY, NOW));

        session.revealAnswer(NOW);
        assertThrows(IllegalSessionStateException.class, () -> session.revealAnswer(NOW));

        session.submitRating(4, recordingPersister, TODAY, NOW);
        assertEquals(ReviewPhase.Complete, session.getPhase());
        assertThrows(IllegalSessionStateException.class, () -> session.revealAnswer(NOW));
        assertThrows(IllegalSessionStateException.class, () -> session.submitRating(4, recordingPersister, TODAY, NOW));

        assertEquals(1, persistedUpdates.size());
    }

    @Test
    public void testAbort() {
        session.start(List.of(CARD_1, CARD_2), NOW);
        session.revealAnswer(NOW);
        session.abort();

        assertEquals(ReviewPhase.Idle, session.getPhase());
        assertTrue(session.getQueue().isEmpty());
        assertNull(session.getCurrentCard());
        assertTrue(persistedUpdates.isEmpty());

        session.start(List.of(CARD_3), NOW);
        assertEquals("card-3", session.getCurrentCard().id());
    }

    @Test
    public void testQueueIsSnapshot() {
        List<Card> dueQueue = new ArrayList<>(List.of(CARD_1, CARD_2));
        session.start(dueQueue, NOW);

        dueQueue.add(CARD_3);
        dueQueue.remove(CARD_1);

        assertEquals(List.of(CARD_1, CARD_2), session.getQueue());
        try {
            session.getQueue().add(CARD_3);
            fail("Session queue should not be modifiable");
        } catch (UnsupportedOperationException ex) {
            // expected
        }
    }

    @Test
    public void testAbortIfInactiveSince() {
        session.start(List.of(CARD_1, CARD_2), NOW);
        session.revealAnswer(NOW.plusSeconds(60));

        assertFalse(session.abortIfInactiveSince(NOW.plusSeconds(60)));
        assertEquals(ReviewPhase.AwaitingRating, session.getPhase());

        session.submitRating(4, recordingPersister, TODAY, NOW.plusSeconds(120));
        assertFalse(session.abortIfInactiveSince(NOW.plusSeconds(90)));
        assertEquals(ReviewPhase.Presenting, session.getPhase());

        assertTrue(session.abortIfInactiveSince(NOW.plusSeconds(121)));
        assertEquals(ReviewPhase.Idle, session.getPhase());
        assertTrue(session.getQueue().isEmpty());
    }

    @Test
    public void testLastActivity() {
        Instant later = NOW.plusSeconds(90);

        session.start(List.of(CARD_1), NOW);
        session.revealAnswer(later);

        assertEquals(later, session.getLastActivity());
    }

    private ScheduledState revealAndRate(int quality) {
        session.revealAnswer(NOW);
        return session.submitRating(quality, recordingPersister, TODAY, NOW);
    }

    private static Card buildCard(String id, int interval, double easeFactor) {
        return new Card(id, TEST_USERNAME, "question " + id, "answer " + id, interval, easeFactor, null, TODAY, Instant.EPOCH);
    }
}
