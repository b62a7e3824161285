package com.gt.flashcards.review;

import com.gt.flashcards.exception.IllegalSessionStateException;
import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.CardReviewUpdate;
import com.gt.flashcards.model.ReviewPhase;
import com.gt.flashcards.model.ReviewRating;
import com.gt.flashcards.model.ReviewSessionStatus;
import com.gt.flashcards.model.ScheduledState;
import com.gt.flashcards.scheduler.CardScheduler;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A single pass over a due queue.
 * <p>
 * Phases move {@code Idle -> Presenting(p) -> AwaitingRating(p) -> Presenting(p + 1) ... -> Complete}. The queue is
 * copied when the session starts, so cards created, reviewed or deleted elsewhere do not change the current pass.
 * A rating only advances the session after the store has accepted the new schedule; if persisting fails the session
 * stays on the same card so the rating can be resubmitted. {@link #abort()} is allowed in every phase.
 * <p>
 * Methods are synchronized so that a session shared between request threads still sees one transition at a time.
 */
public class ReviewSession {

    private final String id;
    private final String owner;

    private ReviewPhase phase = ReviewPhase.Idle;
    private List<Card> queue = List.of();
    private int position;
    private int reviewedCount;
    private Instant lastActivity;

    public ReviewSession(String id, String owner, Instant createInstant) {
        this.id = id;
        this.owner = owner;
        this.lastActivity = createInstant;
    }

    public String getId() {
        return id;
    }

    public String getOwner() {
        return owner;
    }

    public synchronized ReviewPhase getPhase() {
        return phase;
    }

    public synchronized int getPosition() {
        return position;
    }

    public synchronized int getReviewedCount() {
        return reviewedCount;
    }

    public synchronized int getRemainingCount() {
        return queue.size() - reviewedCount;
    }

    public synchronized List<Card> getQueue() {
        return queue;
    }

    public synchronized Instant getLastActivity() {
        return lastActivity;
    }

    public synchronized Card getCurrentCard() {
        if (phase != ReviewPhase.Presenting && phase != ReviewPhase.AwaitingRating) {
            return null;
        }

        return queue.get(position);
    }

    public synchronized void start(List<Card> dueQueue, Instant now) {
        requirePhase(ReviewPhase.Idle, "start");

        queue = List.copyOf(dueQueue);
        position = 0;
        reviewedCount = 0;
        phase = queue.isEmpty() ? ReviewPhase.Complete : ReviewPhase.Presenting;
        lastActivity = now;
    }

    public synchronized void revealAnswer(Instant now) {
        requirePhase(ReviewPhase.Presenting, "reveal the answer");

        phase = ReviewPhase.AwaitingRating;
        lastActivity = now;
    }

    public synchronized ScheduledState submitRating(int quality, CardReviewPersister persister, LocalDate today, Instant now) {
        requirePhase(ReviewPhase.AwaitingRating, "submit a rating");

        Card card = queue.get(position);
        ScheduledState scheduledState = CardScheduler.computeNextState(card.schedulingState(), quality, today);

        lastActivity = now;
        persister.persist(card, CardReviewUpdate.fromScheduledState(scheduledState, now));

        reviewedCount++;
        if (position + 1 < queue.size()) {
            position++;
            phase = ReviewPhase.Presenting;
        } else {
            phase = ReviewPhase.Complete;
        }

        return scheduledState;
    }

    public synchronized void abort() {
        queue = List.of();
        position = 0;
        phase = ReviewPhase.Idle;
    }

    public synchronized boolean abortIfInactiveSince(Instant cutoff) {
        if (!lastActivity.isBefore(cutoff)) {
            return false;
        }

        abort();
        return true;
    }

    public synchronized ReviewSessionStatus getStatus() {
        Card currentCard = getCurrentCard();
        boolean answerRevealed = phase == ReviewPhase.AwaitingRating;

        return new ReviewSessionStatus(
                id,
                phase,
                position,
                queue.size(),
                reviewedCount,
                currentCard == null ? null : currentCard.id(),
                currentCard == null ? null : currentCard.question(),
                answerRevealed ? currentCard.answer() : null,
                answerRevealed ? ReviewRating.ALL_RATINGS : List.of());
    }

    private void requirePhase(ReviewPhase requiredPhase, String operation) {
        if (phase != requiredPhase) {
            throw new IllegalSessionStateException("Cannot " + operation + " in review session " + id + " while " + phase);
        }
    }
}
